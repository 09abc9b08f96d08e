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

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.ConfigMapping.NamingStrategy;
import io.smallrye.config.WithDefault;

/**
 * Configuration options for issuing device certificates and offering them for download.
 *
 */
@ConfigMapping(prefix = "c3ds.certificates", namingStrategy = NamingStrategy.VERBATIM)
public interface CertificateManagementOptions {

    /**
     * Gets the period after the generation of a certificate during which
     * the certificate and the device's private key can be downloaded.
     *
     * @return The period.
     */
    @WithDefault("PT24H")
    Duration downloadWindow();

    /**
     * Checks if a device's private key is deleted once it has been requested
     * after the download window has closed.
     *
     * @return {@code true} if keys are purged.
     */
    @WithDefault("true")
    boolean purgeExpiredPrivateKeys();

    /**
     * Gets the number of attempts made to issue a certificate with a unique serial number.
     *
     * @return The number of attempts.
     */
    @WithDefault("3")
    int issuanceAttempts();
}
