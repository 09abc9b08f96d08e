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

import java.util.Locale;
import java.util.Objects;

/**
 * The key types that device certificates can be issued for.
 * <p>
 * Each algorithm determines the type and size of the device's key pair
 * and the hash used by the CA when signing the device's certificate.
 */
public enum CertificateAlgorithm {

    /**
     * RSA with a 2048 bit key, certificate signed using SHA-256.
     */
    RSA_2048("RSA-2048", "RSA", 2048, null, "SHA256withRSA"),
    /**
     * RSA with a 4096 bit key, certificate signed using SHA-256.
     */
    RSA_4096("RSA-4096", "RSA", 4096, null, "SHA256withRSA"),
    /**
     * ECDSA on curve P-256, certificate signed using SHA-256.
     */
    ECDSA_P256("ECDSA P-256 (secp256r1)", "EC", 256, "secp256r1", "SHA256withRSA"),
    /**
     * ECDSA on curve P-384, certificate signed using SHA-384.
     */
    ECDSA_P384("ECDSA P-384 (secp384r1)", "EC", 384, "secp384r1", "SHA384withRSA");

    /**
     * The algorithm used for devices that have not been configured explicitly.
     */
    public static final CertificateAlgorithm DEFAULT = ECDSA_P384;

    private final String displayName;
    private final String keyType;
    private final int keySize;
    private final String curveName;
    private final String certificateSignatureAlgorithm;

    CertificateAlgorithm(
            final String displayName,
            final String keyType,
            final int keySize,
            final String curveName,
            final String certificateSignatureAlgorithm) {
        this.displayName = displayName;
        this.keyType = keyType;
        this.keySize = keySize;
        this.curveName = curveName;
        this.certificateSignatureAlgorithm = certificateSignatureAlgorithm;
    }

    /**
     * Gets a human readable name.
     *
     * @return The name.
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Gets the JCA name of the key type.
     *
     * @return Either <em>RSA</em> or <em>EC</em>.
     */
    public String getKeyType() {
        return keyType;
    }

    /**
     * Gets the key size in bits.
     *
     * @return The size.
     */
    public int getKeySize() {
        return keySize;
    }

    /**
     * Gets the standard name of the elliptic curve.
     *
     * @return The name or {@code null} for RSA.
     */
    public String getCurveName() {
        return curveName;
    }

    /**
     * Checks if this is an elliptic curve algorithm.
     *
     * @return {@code true} if keys of this type are EC keys.
     */
    public boolean isEllipticCurve() {
        return curveName != null;
    }

    /**
     * Gets the JCA name of the algorithm that the CA's (RSA) key uses for signing
     * device certificates of this type.
     *
     * @return The signature algorithm name.
     */
    public String getCertificateSignatureAlgorithm() {
        return certificateSignatureAlgorithm;
    }

    /**
     * Gets the algorithm for a name.
     * <p>
     * The name is matched case insensitively against the enum constants. Hyphens are
     * accepted instead of underscores, so <em>ECDSA-P256</em> and <em>ecdsa_p256</em>
     * both denote {@link #ECDSA_P256}.
     *
     * @param name The name of the algorithm.
     * @return The algorithm.
     * @throws NullPointerException if name is {@code null}.
     * @throws UnsupportedAlgorithmException if the name does not denote a supported algorithm.
     */
    public static CertificateAlgorithm from(final String name) throws UnsupportedAlgorithmException {
        Objects.requireNonNull(name);
        final String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (final CertificateAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new UnsupportedAlgorithmException(String.format("unsupported certificate algorithm [%s]", name));
    }
}
