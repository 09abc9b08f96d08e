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
import java.time.Instant;
import java.util.Objects;

import org.c3ds.pki.IssuedCertificate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The certificate that has been issued to a device most recently.
 * <p>
 * The device's private key is kept only for the download window following
 * the generation of the certificate.
 */
@JsonInclude(value = Include.NON_NULL)
public class DeviceCertificate {

    @JsonProperty("serial")
    private String serial;
    @JsonProperty("certificate_pem")
    private String certificatePem;
    @JsonProperty("private_key_pem")
    private String privateKeyPem;
    @JsonProperty("not_after")
    private Instant notAfter;
    @JsonProperty("generated_at")
    private Instant generatedAt;

    /**
     * Creates a new empty certificate record.
     */
    public DeviceCertificate() {
    }

    /**
     * Creates a new instance cloned from an existing instance.
     *
     * @param other The certificate to copy from.
     * @throws NullPointerException if other is {@code null}.
     */
    public DeviceCertificate(final DeviceCertificate other) {
        Objects.requireNonNull(other);
        this.serial = other.serial;
        this.certificatePem = other.certificatePem;
        this.privateKeyPem = other.privateKeyPem;
        this.notAfter = other.notAfter;
        this.generatedAt = other.generatedAt;
    }

    /**
     * Creates a record for a newly issued certificate.
     *
     * @param issued The issued certificate.
     * @param generatedAt The point in time at which the certificate has been generated.
     * @return The record.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static DeviceCertificate from(final IssuedCertificate issued, final Instant generatedAt) {
        Objects.requireNonNull(issued);
        Objects.requireNonNull(generatedAt);
        return new DeviceCertificate()
                .setSerial(issued.getSerialNumber())
                .setCertificatePem(issued.getCertificatePem())
                .setPrivateKeyPem(issued.getPrivateKeyPem())
                .setNotAfter(issued.getNotAfter())
                .setGeneratedAt(generatedAt);
    }

    public String getSerial() {
        return serial;
    }

    /**
     * Sets the certificate's serial number.
     *
     * @param serial The serial number as lower case hex string.
     * @return A reference to this for fluent use.
     */
    public DeviceCertificate setSerial(final String serial) {
        this.serial = serial;
        return this;
    }

    public String getCertificatePem() {
        return certificatePem;
    }

    /**
     * Sets the PEM encoding of the certificate.
     *
     * @param certificatePem The PEM.
     * @return A reference to this for fluent use.
     */
    public DeviceCertificate setCertificatePem(final String certificatePem) {
        this.certificatePem = certificatePem;
        return this;
    }

    public String getPrivateKeyPem() {
        return privateKeyPem;
    }

    /**
     * Sets the PEM encoding of the device's private key.
     *
     * @param privateKeyPem The PEM or {@code null} if the key has been purged.
     * @return A reference to this for fluent use.
     */
    public DeviceCertificate setPrivateKeyPem(final String privateKeyPem) {
        this.privateKeyPem = privateKeyPem;
        return this;
    }

    public Instant getNotAfter() {
        return notAfter;
    }

    /**
     * Sets the end of the certificate's validity period.
     *
     * @param notAfter The instant.
     * @return A reference to this for fluent use.
     */
    public DeviceCertificate setNotAfter(final Instant notAfter) {
        this.notAfter = notAfter;
        return this;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    /**
     * Sets the point in time at which the certificate has been generated.
     *
     * @param generatedAt The instant.
     * @return A reference to this for fluent use.
     */
    public DeviceCertificate setGeneratedAt(final Instant generatedAt) {
        this.generatedAt = generatedAt;
        return this;
    }

    /**
     * Gets the end of the download window.
     *
     * @param window The length of the download window.
     * @return The instant after which certificate and key can no longer be downloaded
     *         or {@code null} if the generation time is unknown.
     * @throws NullPointerException if window is {@code null}.
     */
    @JsonIgnore
    public Instant getDownloadExpiresAt(final Duration window) {
        Objects.requireNonNull(window);
        return generatedAt == null ? null : generatedAt.plus(window);
    }

    /**
     * Checks if the certificate may still be downloaded.
     *
     * @param now The current time.
     * @param window The length of the download window.
     * @return {@code true} if the certificate has a generation time and
     *         {@code now} is not after the end of the download window.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    @JsonIgnore
    public boolean isDownloadWindowOpen(final Instant now, final Duration window) {
        Objects.requireNonNull(now);
        final Instant expiresAt = getDownloadExpiresAt(window);
        return expiresAt != null && !now.isAfter(expiresAt);
    }
}
