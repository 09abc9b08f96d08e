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
import java.util.Objects;

/**
 * Configuration properties for issuing device certificates and offering them for download.
 *
 */
public final class CertificateManagementConfigProperties {

    /**
     * The default length of the download window.
     */
    public static final Duration DEFAULT_DOWNLOAD_WINDOW = Duration.ofHours(24);
    /**
     * The default number of issuance attempts.
     */
    public static final int DEFAULT_ISSUANCE_ATTEMPTS = 3;

    private Duration downloadWindow = DEFAULT_DOWNLOAD_WINDOW;
    private boolean purgeExpiredPrivateKeys = true;
    private int issuanceAttempts = DEFAULT_ISSUANCE_ATTEMPTS;

    /**
     * Creates new properties using default values.
     */
    public CertificateManagementConfigProperties() {
        super();
    }

    /**
     * Creates new properties from existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options are {@code null}.
     * @throws IllegalArgumentException if any of the options has an invalid value.
     */
    public CertificateManagementConfigProperties(final CertificateManagementOptions options) {
        Objects.requireNonNull(options);
        setDownloadWindow(options.downloadWindow());
        setPurgeExpiredPrivateKeys(options.purgeExpiredPrivateKeys());
        setIssuanceAttempts(options.issuanceAttempts());
    }

    public Duration getDownloadWindow() {
        return downloadWindow;
    }

    /**
     * Sets the period after the generation of a certificate during which
     * the certificate and the device's private key can be downloaded.
     *
     * @param downloadWindow The period.
     * @throws NullPointerException if period is {@code null}.
     * @throws IllegalArgumentException if the period is negative.
     */
    public void setDownloadWindow(final Duration downloadWindow) {
        Objects.requireNonNull(downloadWindow);
        if (downloadWindow.isNegative()) {
            throw new IllegalArgumentException("download window must not be negative");
        }
        this.downloadWindow = downloadWindow;
    }

    public boolean isPurgeExpiredPrivateKeys() {
        return purgeExpiredPrivateKeys;
    }

    /**
     * Sets whether a device's private key is deleted once it has been requested
     * after the download window has closed.
     *
     * @param purgeExpiredPrivateKeys {@code true} if keys should be purged.
     */
    public void setPurgeExpiredPrivateKeys(final boolean purgeExpiredPrivateKeys) {
        this.purgeExpiredPrivateKeys = purgeExpiredPrivateKeys;
    }

    public int getIssuanceAttempts() {
        return issuanceAttempts;
    }

    /**
     * Sets the number of attempts made to issue a certificate with a unique serial number.
     *
     * @param issuanceAttempts The number of attempts.
     * @throws IllegalArgumentException if the number is &lt; 1.
     */
    public void setIssuanceAttempts(final int issuanceAttempts) {
        if (issuanceAttempts < 1) {
            throw new IllegalArgumentException("at least one issuance attempt is required");
        }
        this.issuanceAttempts = issuanceAttempts;
    }
}
