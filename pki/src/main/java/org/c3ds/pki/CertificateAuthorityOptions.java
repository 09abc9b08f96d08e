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

package org.c3ds.pki;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Options for locating the material of the certificate authority.
 *
 */
@ConfigMapping(prefix = "c3ds.ca", namingStrategy = ConfigMapping.NamingStrategy.VERBATIM)
public interface CertificateAuthorityOptions {

    /**
     * Gets the path to the PEM file containing the CA's private key.
     *
     * @return The path.
     */
    @WithDefault("ca/ca.key")
    String keyPath();

    /**
     * Gets the path to the PEM file containing the CA's self-signed certificate.
     *
     * @return The path.
     */
    @WithDefault("ca/ca.crt")
    String certPath();
}
