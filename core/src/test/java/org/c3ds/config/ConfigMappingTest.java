/**
 * Copyright (c) 2026 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.c3ds.config;

import static com.google.common.truth.Truth.assertThat;

import org.c3ds.test.ConfigMappingSupport;
import org.junit.jupiter.api.Test;

/**
 * Tests verifying the mapping of YAML properties to configuration classes.
 *
 */
class ConfigMappingTest {

    /**
     * Verifies that properties from a YAML file are bound to a
     * {@link ServerOptions} instance.
     */
    @Test
    public void testServerOptionsBinding() {

        final HttpServiceConfigProperties props = new HttpServiceConfigProperties(
                ConfigMappingSupport.getConfigMapping(
                        ServerOptions.class,
                        this.getClass().getResource("/server-options.yaml")));

        assertThat(props.getBindAddress()).isEqualTo("10.2.0.1");
        assertThat(props.getPort(8080)).isEqualTo(11000);
        assertThat(props.getKeyPath()).isEqualTo("/etc/c3ds/server-key.pem");
        assertThat(props.getCertPath()).isEqualTo("/etc/c3ds/server-cert.pem");
        assertThat(props.isTlsEnabled()).isTrue();
        assertThat(props.getMaxPayloadSize()).isEqualTo(4096);
        assertThat(props.getIdleTimeout()).isEqualTo(30);
    }

    /**
     * Verifies that default values are used for properties not contained in the YAML file.
     */
    @Test
    public void testServerOptionsDefaults() {

        final HttpServiceConfigProperties props = new HttpServiceConfigProperties(
                ConfigMappingSupport.getConfigMapping(
                        ServerOptions.class,
                        this.getClass().getResource("/empty-options.yaml")));

        assertThat(props.getBindAddress()).isEqualTo("0.0.0.0");
        assertThat(props.getPort(5000)).isEqualTo(8080);
        assertThat(props.isTlsEnabled()).isFalse();
        assertThat(props.getMaxPayloadSize()).isEqualTo(65536);
    }
}
