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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * The outcome of issuing a device certificate.
 * <p>
 * Instances are not persisted by the issuer. Callers are responsible for storing
 * the material and for enforcing uniqueness of the serial number.
 */
public final class IssuedCertificate {

    private final UUID deviceId;
    private final CertificateAlgorithm algorithm;
    private final String certificatePem;
    private final String privateKeyPem;
    private final String serialNumber;
    private final Instant notBefore;
    private final Instant notAfter;

    IssuedCertificate(
            final UUID deviceId,
            final CertificateAlgorithm algorithm,
            final String certificatePem,
            final String privateKeyPem,
            final String serialNumber,
            final Instant notBefore,
            final Instant notAfter) {

        this.deviceId = Objects.requireNonNull(deviceId);
        this.algorithm = Objects.requireNonNull(algorithm);
        this.certificatePem = Objects.requireNonNull(certificatePem);
        this.privateKeyPem = Objects.requireNonNull(privateKeyPem);
        this.serialNumber = Objects.requireNonNull(serialNumber);
        this.notBefore = Objects.requireNonNull(notBefore);
        this.notAfter = Objects.requireNonNull(notAfter);
    }

    /**
     * @return The identifier of the device that the certificate has been issued for.
     */
    public UUID getDeviceId() {
        return deviceId;
    }

    /**
     * @return The algorithm of the device's key pair.
     */
    public CertificateAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * @return The PEM encoded certificate.
     */
    public String getCertificatePem() {
        return certificatePem;
    }

    /**
     * @return The PEM encoded private key of the device.
     */
    public String getPrivateKeyPem() {
        return privateKeyPem;
    }

    /**
     * @return The certificate's serial number as hex digits without prefix.
     */
    public String getSerialNumber() {
        return serialNumber;
    }

    /**
     * @return The start of the certificate's validity period.
     */
    public Instant getNotBefore() {
        return notBefore;
    }

    /**
     * @return The end of the certificate's validity period.
     */
    public Instant getNotAfter() {
        return notAfter;
    }

    @Override
    public String toString() {
        return String.format("IssuedCertificate[device-id: %s, algorithm: %s, serial: %s, not-after: %s]",
                deviceId, algorithm, serialNumber, notAfter);
    }
}
