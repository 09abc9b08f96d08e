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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.Set;

import javax.security.auth.x500.X500Principal;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
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
 * The root of trust for device certificates.
 * <p>
 * An instance holds the CA's private key and its self-signed certificate. Instances are
 * immutable and are meant to be created once, either by loading the material from the
 * file system or from in-memory material, and then be shared by the components that
 * issue and verify device certificates.
 */
public final class CertificateAuthority {

    /**
     * The subject (and issuer) DN of the root certificate.
     */
    public static final String ROOT_SUBJECT = "C=EU,ST=Europe,O=C3DS Prototype,CN=C3DS Root CA";
    /**
     * The size of the CA's RSA key in bits.
     */
    public static final int ROOT_KEY_SIZE = 4096;
    /**
     * The validity period of the root certificate.
     */
    public static final Duration ROOT_VALIDITY = Duration.ofDays(5 * 365);

    private static final Logger LOG = LoggerFactory.getLogger(CertificateAuthority.class);
    private static final Set<PosixFilePermission> KEY_FILE_PERMISSIONS = Set.of(
            PosixFilePermission.OWNER_READ,
            PosixFilePermission.OWNER_WRITE);

    private final PrivateKey privateKey;
    private final X509Certificate certificate;

    private CertificateAuthority(final PrivateKey privateKey, final X509Certificate certificate) {
        this.privateKey = privateKey;
        this.certificate = certificate;
    }

    /**
     * Creates a certificate authority from existing material.
     *
     * @param privateKey The CA's RSA private key.
     * @param certificate The CA's certificate.
     * @return The certificate authority.
     * @throws NullPointerException if any of the parameters are {@code null}.
     * @throws CertificateAuthorityException if the certificate is not a CA certificate
     *                                       or does not match the private key.
     */
    public static CertificateAuthority of(final PrivateKey privateKey, final X509Certificate certificate)
            throws CertificateAuthorityException {

        Objects.requireNonNull(privateKey);
        Objects.requireNonNull(certificate);

        if (!"RSA".equals(privateKey.getAlgorithm())) {
            throw new CertificateAuthorityException("CA key must be an RSA key");
        }
        if (certificate.getBasicConstraints() < 0) {
            throw new CertificateAuthorityException("certificate is not a CA certificate");
        }
        if (!keyMatchesCertificate(privateKey, certificate.getPublicKey())) {
            throw new CertificateAuthorityException("CA key does not match CA certificate");
        }
        return new CertificateAuthority(privateKey, certificate);
    }

    /**
     * Loads the certificate authority's material from the file system.
     *
     * @param options The options indicating the location of the files.
     * @return The certificate authority.
     * @throws NullPointerException if options are {@code null}.
     * @throws CertificateAuthorityException if the files cannot be read or do not contain
     *                                       matching key and certificate.
     */
    public static CertificateAuthority load(final CertificateAuthorityOptions options)
            throws CertificateAuthorityException {
        Objects.requireNonNull(options);
        return load(Path.of(options.keyPath()), Path.of(options.certPath()));
    }

    /**
     * Loads the certificate authority's material from the file system.
     *
     * @param keyPath The path to the PEM file containing the private key.
     * @param certPath The path to the PEM file containing the certificate.
     * @return The certificate authority.
     * @throws NullPointerException if any of the paths are {@code null}.
     * @throws CertificateAuthorityException if the files cannot be read or do not contain
     *                                       matching key and certificate.
     */
    public static CertificateAuthority load(final Path keyPath, final Path certPath)
            throws CertificateAuthorityException {

        Objects.requireNonNull(keyPath);
        Objects.requireNonNull(certPath);

        try {
            final PrivateKey key = PemSupport.readPrivateKey(Files.readString(keyPath, StandardCharsets.US_ASCII));
            final X509Certificate cert = PemSupport.readCertificate(Files.readAllBytes(certPath));
            LOG.debug("loaded CA material [key: {}, certificate: {}]", keyPath, certPath);
            return of(key, cert);
        } catch (final IOException | GeneralSecurityException e) {
            throw new CertificateAuthorityException(
                    String.format("cannot read CA material [key: %s, certificate: %s]", keyPath, certPath), e);
        }
    }

    /**
     * Creates new CA material in memory.
     *
     * @param clock The clock to use for determining the validity period.
     * @param keySize The size of the RSA key in bits.
     * @return The certificate authority.
     * @throws NullPointerException if clock is {@code null}.
     * @throws CertificateAuthorityException if the material cannot be created.
     */
    public static CertificateAuthority create(final Clock clock, final int keySize)
            throws CertificateAuthorityException {

        Objects.requireNonNull(clock);

        try {
            final KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(keySize, new SecureRandom());
            final KeyPair keyPair = generator.generateKeyPair();

            final Instant notBefore = clock.instant();
            final X500Name subject = new X500Name(ROOT_SUBJECT);
            final X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                    subject,
                    CertificateIssuer.newSerialNumber(),
                    Date.from(notBefore),
                    Date.from(notBefore.plus(ROOT_VALIDITY)),
                    subject,
                    keyPair.getPublic());
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(0));
            builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign));
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                    new JcaX509ExtensionUtils().createSubjectKeyIdentifier(keyPair.getPublic()));

            final ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA").build(keyPair.getPrivate());
            final X509Certificate cert = new JcaX509CertificateConverter().getCertificate(builder.build(signer));
            return new CertificateAuthority(keyPair.getPrivate(), cert);
        } catch (final GeneralSecurityException | OperatorCreationException | IOException e) {
            throw new CertificateAuthorityException("cannot create CA material", e);
        }
    }

    /**
     * Creates the certificate authority's material on the file system unless it already exists.
     *
     * @param options The options indicating the location of the files.
     * @return {@code true} if new material has been created, {@code false} if both files already existed.
     * @throws NullPointerException if options are {@code null}.
     * @throws CertificateAuthorityException if the material cannot be created or written.
     */
    public static boolean bootstrap(final CertificateAuthorityOptions options) throws CertificateAuthorityException {
        Objects.requireNonNull(options);
        return bootstrap(Path.of(options.keyPath()), Path.of(options.certPath()), Clock.systemUTC());
    }

    /**
     * Creates the certificate authority's material on the file system unless it already exists.
     * <p>
     * If both files exist, this method does nothing. Otherwise a new RSA key pair and a
     * self-signed certificate are created and written to the given locations, replacing a
     * file that might exist at one of them. The key file's permissions are then restricted
     * to the owner. Failure to do so is logged but does not fail the bootstrap.
     *
     * @param keyPath The path to write the PEM encoded private key to.
     * @param certPath The path to write the PEM encoded certificate to.
     * @param clock The clock to use for determining the validity period.
     * @return {@code true} if new material has been created, {@code false} if both files already existed.
     * @throws NullPointerException if any of the parameters are {@code null}.
     * @throws CertificateAuthorityException if the material cannot be created or written.
     */
    public static boolean bootstrap(final Path keyPath, final Path certPath, final Clock clock)
            throws CertificateAuthorityException {

        Objects.requireNonNull(keyPath);
        Objects.requireNonNull(certPath);
        Objects.requireNonNull(clock);

        final boolean keyExists = Files.exists(keyPath);
        final boolean certExists = Files.exists(certPath);
        if (keyExists && certExists) {
            LOG.info("CA material already exists [key: {}, certificate: {}], skipping creation", keyPath, certPath);
            return false;
        } else if (keyExists || certExists) {
            LOG.warn("incomplete CA material found [key exists: {}, certificate exists: {}], creating new material",
                    keyExists, certExists);
        }

        final CertificateAuthority ca = create(clock, ROOT_KEY_SIZE);
        try {
            createParentDirectories(keyPath);
            createParentDirectories(certPath);
            writeKeyFile(keyPath, PemSupport.toPem(ca.privateKey));
            Files.writeString(certPath, PemSupport.toPem(ca.certificate), StandardCharsets.US_ASCII,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (final IOException e) {
            throw new CertificateAuthorityException("cannot write CA material", e);
        }
        LOG.info("created CA material [subject: {}, serial: {}, not after: {}, key: {}, certificate: {}]",
                ca.getSubject().getName(), PemSupport.serialNumberHex(ca.certificate),
                ca.certificate.getNotAfter().toInstant(), keyPath, certPath);
        return true;
    }

    private static void createParentDirectories(final Path path) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Writes the CA key to a file that only the owner can read.
     * <p>
     * On file systems supporting POSIX permissions the file is created with
     * these permissions so that the key is never readable by others.
     * Any existing file is replaced.
     */
    private static void writeKeyFile(final Path keyPath, final String pem) throws IOException {
        if (keyPath.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.deleteIfExists(keyPath);
            Files.createFile(keyPath, PosixFilePermissions.asFileAttribute(KEY_FILE_PERMISSIONS));
            Files.writeString(keyPath, pem, StandardCharsets.US_ASCII,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } else {
            Files.writeString(keyPath, pem, StandardCharsets.US_ASCII,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            LOG.warn("could not restrict permissions of CA key file [{}], please make sure that only the owner can read it",
                    keyPath);
        }
    }

    private static boolean keyMatchesCertificate(final PrivateKey privateKey, final PublicKey publicKey) {
        try {
            final byte[] challenge = new BigInteger(128, new SecureRandom()).toByteArray();
            final Signature signer = Signature.getInstance("SHA256withRSA");
            signer.initSign(privateKey);
            signer.update(challenge);
            final byte[] signature = signer.sign();
            final Signature verifier = Signature.getInstance("SHA256withRSA");
            verifier.initVerify(publicKey);
            verifier.update(challenge);
            return verifier.verify(signature);
        } catch (final GeneralSecurityException e) {
            LOG.debug("cannot check if CA key matches certificate", e);
            return false;
        }
    }

    /**
     * Gets the CA's public key.
     *
     * @return The key.
     */
    public PublicKey publicKey() {
        return certificate.getPublicKey();
    }

    /**
     * Gets the CA's self-signed certificate.
     *
     * @return The certificate.
     */
    public X509Certificate rootCertificate() {
        return certificate;
    }

    /**
     * Gets the CA's subject DN.
     *
     * @return The subject.
     */
    public X500Principal getSubject() {
        return certificate.getSubjectX500Principal();
    }

    PrivateKey privateKey() {
        return privateKey;
    }

    @Override
    public String toString() {
        return String.format("CertificateAuthority[subject: %s, serial: %s]",
                certificate.getSubjectX500Principal().getName(), PemSupport.serialNumberHex(certificate));
    }
}
