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

package org.c3ds.adapter.http;

import java.net.HttpURLConnection;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.cert.CertificateException;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.Base64;
import java.util.Date;
import java.util.Objects;
import java.util.UUID;

import javax.security.auth.x500.X500Principal;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.c3ds.client.ServiceInvocationException;
import org.c3ds.deviceregistry.Device;
import org.c3ds.deviceregistry.DeviceRegistry;
import org.c3ds.deviceregistry.DeviceStatus;
import org.c3ds.pki.CertificateAuthority;
import org.c3ds.pki.CertificateAuthorityException;
import org.c3ds.pki.CertificateAuthorityProvider;
import org.c3ds.pki.PemSupport;
import org.c3ds.tracing.TracingHelper;
import org.c3ds.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.Span;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;

/**
 * Authenticates messages that devices send along with their X.509 certificate
 * and a signature over the message body.
 * <p>
 * Authentication is performed in the following order. The first failing step
 * determines the outcome:
 * <ol>
 * <li>both the certificate and the signature header must be present</li>
 * <li>both headers must be Base64 encoded and the certificate must be a
 * PEM or DER encoded X.509 certificate</li>
 * <li>the certificate must have been signed by the CA</li>
 * <li>the certificate must be valid at the current point in time</li>
 * <li>the certificate's subject must have a single common name which is a device identifier</li>
 * <li>the device must exist</li>
 * <li>the device must not have been revoked and the certificate must be the device's current one</li>
 * <li>the body must not be empty</li>
 * <li>the signature must have been created over the raw body using the certificate's key</li>
 * <li>the body must be a JSON object</li>
 * </ol>
 * A failure never results in a failed future. It is reported as an {@link AuthenticationResult}
 * instead.
 */
public class DeviceAuthenticator {

    private static final Logger LOG = LoggerFactory.getLogger(DeviceAuthenticator.class);

    private static final String SIGNATURE_ALGORITHM_RSA = "SHA256withRSA";
    private static final String SIGNATURE_ALGORITHM_EC = "SHA256withECDSA";

    private final DeviceRegistry registry;
    private final CertificateAuthorityProvider caProvider;
    private final Clock clock;

    /**
     * Creates a new authenticator.
     *
     * @param registry The registry to look up devices in.
     * @param caProvider The source of the CA that device certificates need to be signed by.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public DeviceAuthenticator(final DeviceRegistry registry, final CertificateAuthorityProvider caProvider) {
        this(registry, caProvider, Clock.systemUTC());
    }

    /**
     * Creates a new authenticator.
     *
     * @param registry The registry to look up devices in.
     * @param caProvider The source of the CA that device certificates need to be signed by.
     * @param clock The clock to use for checking the validity period of certificates.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public DeviceAuthenticator(
            final DeviceRegistry registry,
            final CertificateAuthorityProvider caProvider,
            final Clock clock) {
        this.registry = Objects.requireNonNull(registry);
        this.caProvider = Objects.requireNonNull(caProvider);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Authenticates a message.
     *
     * @param certificateHeader The Base64 encoding of the device's PEM or DER encoded certificate
     *                          or {@code null} if the device has not presented a certificate.
     * @param signatureHeader The Base64 encoding of the signature over the body
     *                        or {@code null} if the device has not presented a signature.
     * @param body The raw message body or {@code null} if the message has no body.
     * @param span The <em>OpenTracing</em> span to log the steps of the authentication to.
     * @return A future that will be completed with the outcome of the authentication.
     *         The future will never be failed.
     * @throws NullPointerException if span is {@code null}.
     */
    public Future<AuthenticationResult> authenticate(
            final String certificateHeader,
            final String signatureHeader,
            final Buffer body,
            final Span span) {

        Objects.requireNonNull(span);

        if (Strings.isNullOrEmpty(certificateHeader) || Strings.isNullOrEmpty(signatureHeader)) {
            return failed(span, AuthenticationFailure.MISSING_CREDENTIALS, "certificate or signature header is missing");
        }

        final X509Certificate certificate;
        try {
            certificate = PemSupport.readCertificate(decodeBase64(certificateHeader));
        } catch (final IllegalArgumentException | CertificateException e) {
            return failed(span, AuthenticationFailure.MALFORMED_CERTIFICATE, e.getMessage());
        }

        final byte[] signature;
        try {
            signature = decodeBase64(signatureHeader);
        } catch (final IllegalArgumentException e) {
            return failed(span, AuthenticationFailure.MALFORMED_SIGNATURE, e.getMessage());
        }
        if (signature.length == 0) {
            return failed(span, AuthenticationFailure.MALFORMED_SIGNATURE, "signature is empty");
        }

        final String subjectDn = certificate.getSubjectX500Principal().getName(X500Principal.RFC2253);
        TracingHelper.TAG_SUBJECT_DN.set(span, subjectDn);

        final CertificateAuthority ca;
        try {
            ca = caProvider.getCertificateAuthority();
        } catch (final CertificateAuthorityException e) {
            LOG.error("cannot verify device certificate, CA is not available", e);
            TracingHelper.logError(span, "CA is not available", e, true);
            return Future.succeededFuture(AuthenticationResult.failed(
                    AuthenticationFailure.SERVER_CONFIGURATION_ERROR, e.getMessage()));
        }

        try {
            certificate.verify(ca.publicKey());
        } catch (final GeneralSecurityException e) {
            return failed(span, AuthenticationFailure.UNTRUSTED_CERTIFICATE,
                    String.format("certificate [subject: %s] has not been signed by CA", subjectDn));
        }

        try {
            certificate.checkValidity(Date.from(clock.instant()));
        } catch (final CertificateExpiredException | CertificateNotYetValidException e) {
            return failed(span, AuthenticationFailure.CERTIFICATE_EXPIRED_OR_NOT_YET_VALID, e.getMessage());
        }

        final UUID deviceId = getDeviceId(certificate);
        if (deviceId == null) {
            return failed(span, AuthenticationFailure.INVALID_CERTIFICATE_IDENTITY,
                    String.format("subject [%s] does not contain a device identifier", subjectDn));
        }
        TracingHelper.TAG_DEVICE_ID.set(span, deviceId.toString());

        final String serial = PemSupport.serialNumberHex(certificate);
        TracingHelper.TAG_CERTIFICATE_SERIAL.set(span, serial);
        span.log("certificate has been verified");

        return registry.findDevice(deviceId)
                .transform(lookup -> {
                    if (lookup.succeeded()) {
                        return Future.succeededFuture(authenticate(lookup.result(), certificate, serial, signature, body, span));
                    }
                    final Throwable cause = lookup.cause();
                    if (ServiceInvocationException.extractStatusCode(cause) == HttpURLConnection.HTTP_NOT_FOUND) {
                        return failed(span, AuthenticationFailure.DEVICE_NOT_FOUND,
                                String.format("no such device [%s]", deviceId));
                    }
                    LOG.warn("cannot look up device [{}]", deviceId, cause);
                    return failed(span, AuthenticationFailure.REGISTRY_UNAVAILABLE, cause.getMessage());
                });
    }

    private AuthenticationResult authenticate(
            final Device device,
            final X509Certificate certificate,
            final String serial,
            final byte[] signature,
            final Buffer body,
            final Span span) {

        if (device.getStatus() == DeviceStatus.REVOKED) {
            return failure(span, AuthenticationFailure.DEVICE_REVOKED,
                    String.format("device [%s] has been revoked", device.getId()));
        }
        if (!serial.equals(device.getCertificateSerial())) {
            return failure(span, AuthenticationFailure.CERTIFICATE_SUPERSEDED,
                    String.format("certificate [serial: %s] is not the current certificate of device [%s]",
                            serial, device.getId()));
        }
        if (body == null || body.length() == 0) {
            return failure(span, AuthenticationFailure.EMPTY_PAYLOAD, "message has no body");
        }

        final String signatureAlgorithm = getSignatureAlgorithm(certificate.getPublicKey());
        if (signatureAlgorithm == null) {
            return failure(span, AuthenticationFailure.UNSUPPORTED_KEY_ALGORITHM,
                    String.format("unsupported key type [%s]", certificate.getPublicKey().getAlgorithm()));
        }
        if (!isValidSignature(signatureAlgorithm, certificate.getPublicKey(), body.getBytes(), signature)) {
            return failure(span, AuthenticationFailure.INVALID_SIGNATURE,
                    String.format("signature does not match body [algorithm: %s]", signatureAlgorithm));
        }

        final Object payload;
        try {
            payload = Json.decodeValue(body);
        } catch (final DecodeException e) {
            return failure(span, AuthenticationFailure.INVALID_PAYLOAD_ENCODING, e.getMessage());
        }
        if (!(payload instanceof JsonObject)) {
            return failure(span, AuthenticationFailure.INVALID_PAYLOAD_ENCODING, "body is not a JSON object");
        }

        LOG.debug("authenticated message of device [{}] using certificate [serial: {}]", device.getId(), serial);
        TracingHelper.TAG_AUTHENTICATED.set(span, true);
        return AuthenticationResult.authenticated(device, serial, (JsonObject) payload);
    }

    private static byte[] decodeBase64(final String value) {
        return Base64.getDecoder().decode(value.replaceAll("\\s", ""));
    }

    /**
     * Gets the device identifier from the common name of a certificate's subject.
     *
     * @param certificate The certificate.
     * @return The identifier or {@code null} if the subject does not contain exactly one
     *         common name or if the common name is not the string representation of a UUID.
     */
    static UUID getDeviceId(final X509Certificate certificate) {

        final RDN[] commonNames = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded())
                .getRDNs(BCStyle.CN);
        if (commonNames.length != 1 || commonNames[0].isMultiValued()) {
            return null;
        }
        final ASN1Encodable value = commonNames[0].getFirst().getValue();
        if (!(value instanceof ASN1String)) {
            return null;
        }
        final String commonName = ((ASN1String) value).getString();
        try {
            final UUID deviceId = UUID.fromString(commonName);
            // UUID.fromString also accepts abbreviated groups
            return deviceId.toString().equalsIgnoreCase(commonName) ? deviceId : null;
        } catch (final IllegalArgumentException e) {
            return null;
        }
    }

    private static String getSignatureAlgorithm(final PublicKey key) {
        switch (key.getAlgorithm()) {
        case "RSA":
            return SIGNATURE_ALGORITHM_RSA;
        case "EC":
            return SIGNATURE_ALGORITHM_EC;
        default:
            return null;
        }
    }

    private static boolean isValidSignature(
            final String algorithm,
            final PublicKey key,
            final byte[] data,
            final byte[] signature) {

        try {
            final Signature verifier = Signature.getInstance(algorithm);
            verifier.initVerify(key);
            verifier.update(data);
            return verifier.verify(signature);
        } catch (final GeneralSecurityException e) {
            // signature is not even structurally valid
            LOG.debug("cannot verify signature: {}", e.getMessage());
            return false;
        }
    }

    private static AuthenticationResult failure(
            final Span span,
            final AuthenticationFailure failure,
            final String detail) {

        LOG.debug("authentication failed [reason: {}]: {}", failure, detail);
        TracingHelper.TAG_AUTHENTICATED.set(span, false);
        span.log(String.format("authentication failed [reason: %s]: %s", failure, detail));
        return AuthenticationResult.failed(failure, detail);
    }

    private static Future<AuthenticationResult> failed(
            final Span span,
            final AuthenticationFailure failure,
            final String detail) {
        return Future.succeededFuture(failure(span, failure, detail));
    }
}
