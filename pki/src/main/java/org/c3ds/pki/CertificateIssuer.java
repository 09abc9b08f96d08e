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

import java.io.IOException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;
import java.util.UUID;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues X.509 certificates for devices.
 * <p>
 * For each certificate a fresh key pair is generated. The certificate's subject
 * common name is the device identifier, its issuer is the CA's subject.
 * <p>
 * Key generation is CPU intensive, in particular for RSA keys. This class
 * performs all work on the invoking thread, so it should not be used on a
 * vert.x event loop thread.
 */
public class CertificateIssuer {

    /**
     * The validity period of device certificates.
     */
    public static final Duration DEVICE_CERTIFICATE_VALIDITY = Duration.ofDays(365);
    /**
     * The country name of device certificate subjects.
     */
    public static final String DEVICE_SUBJECT_COUNTRY = "EU";
    /**
     * The organization name of device certificate subjects.
     */
    public static final String DEVICE_SUBJECT_ORGANIZATION = "C3DS Network";

    private static final Logger LOG = LoggerFactory.getLogger(CertificateIssuer.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final CertificateAuthorityProvider caProvider;
    private final Clock clock;

    /**
     * Creates a new issuer.
     *
     * @param caProvider The source of the CA material used for signing certificates.
     * @throws NullPointerException if provider is {@code null}.
     */
    public CertificateIssuer(final CertificateAuthorityProvider caProvider) {
        this(caProvider, Clock.systemUTC());
    }

    /**
     * Creates a new issuer.
     *
     * @param caProvider The source of the CA material used for signing certificates.
     * @param clock The clock to use for determining the validity period of certificates.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    public CertificateIssuer(final CertificateAuthorityProvider caProvider, final Clock clock) {
        this.caProvider = Objects.requireNonNull(caProvider);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Creates a random, positive serial number of 159 bits.
     *
     * @return The serial number.
     */
    static BigInteger newSerialNumber() {
        BigInteger serial;
        do {
            serial = new BigInteger(159, RANDOM);
        } while (serial.signum() == 0);
        return serial;
    }

    /**
     * Issues a certificate for a device.
     * <p>
     * The certificate is valid for {@link #DEVICE_CERTIFICATE_VALIDITY} starting now and
     * carries a random serial number. This method does not check if the serial number
     * is already in use, the caller needs to enforce uniqueness when storing the certificate.
     *
     * @param deviceId The device identifier to use as the certificate's common name.
     * @param algorithm The type of key pair to create for the device.
     * @return The certificate along with the device's private key.
     * @throws NullPointerException if device ID is {@code null}.
     * @throws UnsupportedAlgorithmException if algorithm is {@code null}.
     * @throws CertificateAuthorityException if the CA material is not available.
     * @throws GeneralSecurityException if the certificate cannot be created.
     */
    public IssuedCertificate issue(final UUID deviceId, final CertificateAlgorithm algorithm)
            throws GeneralSecurityException {

        Objects.requireNonNull(deviceId);
        if (algorithm == null) {
            throw new UnsupportedAlgorithmException("no certificate algorithm given");
        }

        final CertificateAuthority ca = caProvider.getCertificateAuthority();
        final KeyPair keyPair = newKeyPair(algorithm);

        // X.509 dates have second precision
        final Instant notBefore = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        final Instant notAfter = notBefore.plus(DEVICE_CERTIFICATE_VALIDITY);
        final BigInteger serial = newSerialNumber();

        try {
            final X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                    ca.rootCertificate(),
                    serial,
                    Date.from(notBefore),
                    Date.from(notAfter),
                    subjectFor(deviceId),
                    keyPair.getPublic());
            final JcaX509ExtensionUtils extensionUtils = new JcaX509ExtensionUtils();
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
            builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature));
            builder.addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(KeyPurposeId.id_kp_clientAuth));
            builder.addExtension(Extension.authorityKeyIdentifier, false,
                    extensionUtils.createAuthorityKeyIdentifier(ca.rootCertificate()));

            final ContentSigner signer = new JcaContentSignerBuilder(algorithm.getCertificateSignatureAlgorithm())
                    .build(ca.privateKey());
            final X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(builder.build(signer));

            final IssuedCertificate result = new IssuedCertificate(
                    deviceId,
                    algorithm,
                    PemSupport.toPem(certificate),
                    PemSupport.toPem(keyPair.getPrivate()),
                    PemSupport.toHex(serial),
                    notBefore,
                    notAfter);
            LOG.debug("issued {}", result);
            return result;
        } catch (final OperatorCreationException | IOException e) {
            throw new GeneralSecurityException("cannot create device certificate", e);
        }
    }

    private static X500Name subjectFor(final UUID deviceId) {
        return new X500NameBuilder(BCStyle.INSTANCE)
                .addRDN(BCStyle.C, DEVICE_SUBJECT_COUNTRY)
                .addRDN(BCStyle.O, DEVICE_SUBJECT_ORGANIZATION)
                .addRDN(BCStyle.CN, deviceId.toString())
                .build();
    }

    private static KeyPair newKeyPair(final CertificateAlgorithm algorithm) throws GeneralSecurityException {
        final KeyPairGenerator generator = KeyPairGenerator.getInstance(algorithm.getKeyType());
        switch (algorithm) {
        case RSA_2048:
        case RSA_4096:
            generator.initialize(algorithm.getKeySize(), RANDOM);
            break;
        case ECDSA_P256:
        case ECDSA_P384:
            generator.initialize(new ECGenParameterSpec(algorithm.getCurveName()), RANDOM);
            break;
        default:
            throw new UnsupportedAlgorithmException(String.format("unsupported certificate algorithm [%s]", algorithm));
        }
        return generator.generateKeyPair();
    }
}
