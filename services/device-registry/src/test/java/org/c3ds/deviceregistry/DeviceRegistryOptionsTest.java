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

package org.c3ds.deviceregistry;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.c3ds.test.ConfigMappingSupport;
import org.junit.jupiter.api.Test;

/**
 * Tests verifying the mapping of the registry's configuration options to properties.
 *
 */
public class DeviceRegistryOptionsTest {

    /**
     * Verifies that all options are mapped from YAML.
     */
    @Test
    public void testOptionsAreMapped() {
        final DeviceRegistryConfigProperties registry = new DeviceRegistryConfigProperties(
                ConfigMappingSupport.getConfigMapping(
                        DeviceRegistryOptions.class,
                        this.getClass().getResource("/device-registry-options.yaml")));
        assertThat(registry.getFilename()).isEqualTo("/var/lib/c3ds/devices.json");
        assertThat(registry.isSaveToFile()).isFalse();
        assertThat(registry.getMessageLogFilename()).isEqualTo("/var/lib/c3ds/messages.jsonl");

        final CertificateManagementConfigProperties certificates = new CertificateManagementConfigProperties(
                ConfigMappingSupport.getConfigMapping(
                        CertificateManagementOptions.class,
                        this.getClass().getResource("/device-registry-options.yaml")));
        assertThat(certificates.getDownloadWindow()).isEqualTo(Duration.ofHours(2));
        assertThat(certificates.isPurgeExpiredPrivateKeys()).isFalse();
        assertThat(certificates.getIssuanceAttempts()).isEqualTo(5);
    }

    /**
     * Verifies that defaults are used for options that are not set.
     */
    @Test
    public void testDefaultsAreApplied() {
        final DeviceRegistryConfigProperties registry = new DeviceRegistryConfigProperties(
                ConfigMappingSupport.getConfigMapping(
                        DeviceRegistryOptions.class,
                        this.getClass().getResource("/empty-options.yaml")));
        assertThat(registry.getFilename()).isNull();
        assertThat(registry.isSaveToFile()).isTrue();
        assertThat(registry.getMessageLogFilename()).isNull();

        final CertificateManagementConfigProperties certificates = new CertificateManagementConfigProperties(
                ConfigMappingSupport.getConfigMapping(
                        CertificateManagementOptions.class,
                        this.getClass().getResource("/empty-options.yaml")));
        assertThat(certificates.getDownloadWindow()).isEqualTo(CertificateManagementConfigProperties.DEFAULT_DOWNLOAD_WINDOW);
        assertThat(certificates.isPurgeExpiredPrivateKeys()).isTrue();
        assertThat(certificates.getIssuanceAttempts()).isEqualTo(3);
    }

    /**
     * Verifies that invalid values are rejected.
     */
    @Test
    public void testInvalidValuesAreRejected() {
        final CertificateManagementConfigProperties certificates = new CertificateManagementConfigProperties();
        assertThrows(IllegalArgumentException.class, () -> certificates.setDownloadWindow(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> certificates.setIssuanceAttempts(0));
    }
}
