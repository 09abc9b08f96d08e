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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Objects;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;

/**
 * Helper methods for encoding and decoding PEM and DER structures.
 *
 */
public final class PemSupport {

    /**
     * The number of hex digits used for representing certificate serial numbers.
     * <p>
     * Serial numbers are at most 20 octets long.
     */
    public static final int SERIAL_HEX_LENGTH = 40;

    private PemSupport() {
        // prevent instantiation
    }

    /**
     * Encodes a certificate or key as PEM.
     * <p>
     * Private keys are written in their traditional OpenSSL form, i.e. using
     * <em>RSA PRIVATE KEY</em> or <em>EC PRIVATE KEY</em> blocks.
     *
     * @param object The object to encode.
     * @return The PEM text.
     * @throws NullPointerException if object is {@code null}.
     * @throws IOException if the object cannot be encoded.
     */
    public static String toPem(final Object object) throws IOException {
        Objects.requireNonNull(object);
        final StringWriter writer = new StringWriter();
        try (JcaPEMWriter pemWriter = new JcaPEMWriter(writer)) {
            pemWriter.writeObject(object);
        }
        return writer.toString();
    }

    /**
     * Parses an X.509 certificate.
     *
     * @param encoded The PEM or DER encoding of the certificate.
     * @return The certificate.
     * @throws NullPointerException if encoding is {@code null}.
     * @throws CertificateException if the bytes do not contain a valid certificate.
     */
    public static X509Certificate readCertificate(final byte[] encoded) throws CertificateException {
        Objects.requireNonNull(encoded);
        if (encoded.length == 0) {
            throw new CertificateException("no certificate data");
        }
        final CertificateFactory factory = CertificateFactory.getInstance("X.509");
        return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(encoded));
    }

    /**
     * Parses a PEM encoded private key.
     * <p>
     * Both the traditional OpenSSL and the PKCS#8 representations are supported.
     *
     * @param pem The PEM text.
     * @return The key.
     * @throws NullPointerException if PEM is {@code null}.
     * @throws IOException if the text does not contain a private key.
     */
    public static PrivateKey readPrivateKey(final String pem) throws IOException {
        Objects.requireNonNull(pem);
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            final Object object = parser.readObject();
            final JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
            if (object instanceof PEMKeyPair keyPair) {
                return converter.getPrivateKey(keyPair.getPrivateKeyInfo());
            } else if (object instanceof PrivateKeyInfo keyInfo) {
                return converter.getPrivateKey(keyInfo);
            } else {
                throw new IOException("PEM data does not contain a private key");
            }
        }
    }

    /**
     * Gets the hex representation of a certificate's serial number.
     *
     * @param certificate The certificate.
     * @return The serial number as lower case hex digits without prefix, left-padded
     *         with zeros to {@value #SERIAL_HEX_LENGTH} digits.
     * @throws NullPointerException if certificate is {@code null}.
     */
    public static String serialNumberHex(final X509Certificate certificate) {
        Objects.requireNonNull(certificate);
        return toHex(certificate.getSerialNumber());
    }

    /**
     * Gets the hex representation of a serial number.
     *
     * @param serial The serial number.
     * @return The serial number as lower case hex digits without prefix, left-padded
     *         with zeros to {@value #SERIAL_HEX_LENGTH} digits.
     * @throws NullPointerException if serial is {@code null}.
     */
    public static String toHex(final BigInteger serial) {
        Objects.requireNonNull(serial);
        final String hex = serial.toString(16);
        if (hex.length() >= SERIAL_HEX_LENGTH) {
            return hex;
        }
        return "0".repeat(SERIAL_HEX_LENGTH - hex.length()) + hex;
    }
}
