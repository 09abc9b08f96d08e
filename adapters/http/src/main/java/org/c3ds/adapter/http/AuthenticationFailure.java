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
import java.util.Locale;

import io.micrometer.core.instrument.Tag;

/**
 * The reasons for which the authentication of a device message may fail.
 * <p>
 * Each reason carries the HTTP status code and the error message that is
 * reported back to the device.
 * <p>
 * The immutable enum check is disabled because the offending field's (tag) type
 * is in fact immutable but has no corresponding annotation.
 */
@SuppressWarnings("ImmutableEnumChecker")
public enum AuthenticationFailure {

    /**
     * The certificate or signature header is missing.
     */
    MISSING_CREDENTIALS(HttpURLConnection.HTTP_UNAUTHORIZED, "Missing required headers."),
    /**
     * The certificate header cannot be decoded into an X.509 certificate.
     */
    MALFORMED_CERTIFICATE(HttpURLConnection.HTTP_BAD_REQUEST, "Invalid certificate format"),
    /**
     * The signature header is not valid Base64.
     */
    MALFORMED_SIGNATURE(HttpURLConnection.HTTP_BAD_REQUEST, "Invalid signature format"),
    /**
     * The CA material is not available.
     */
    SERVER_CONFIGURATION_ERROR(HttpURLConnection.HTTP_INTERNAL_ERROR, "Server configuration error"),
    /**
     * The certificate has not been signed by the CA.
     */
    UNTRUSTED_CERTIFICATE(HttpURLConnection.HTTP_UNAUTHORIZED, "Invalid device certificate."),
    CERTIFICATE_EXPIRED_OR_NOT_YET_VALID(HttpURLConnection.HTTP_UNAUTHORIZED, "Certificate expired or not yet valid"),
    /**
     * The certificate's subject does not contain a single common name that is a device identifier.
     */
    INVALID_CERTIFICATE_IDENTITY(HttpURLConnection.HTTP_BAD_REQUEST, "Invalid certificate"),
    DEVICE_NOT_FOUND(HttpURLConnection.HTTP_NOT_FOUND, "Device not found"),
    DEVICE_REVOKED(HttpURLConnection.HTTP_FORBIDDEN, "Device certificate has been revoked"),
    /**
     * A new certificate has been issued for the device since the presented one was created.
     */
    CERTIFICATE_SUPERSEDED(HttpURLConnection.HTTP_UNAUTHORIZED, "Certificate has been superseded"),
    EMPTY_PAYLOAD(HttpURLConnection.HTTP_BAD_REQUEST, "Empty message body"),
    /**
     * The certificate's public key is neither an RSA nor an EC key.
     */
    UNSUPPORTED_KEY_ALGORITHM(HttpURLConnection.HTTP_BAD_REQUEST, "Unsupported certificate algorithm"),
    INVALID_SIGNATURE(HttpURLConnection.HTTP_UNAUTHORIZED, "Invalid message signature"),
    /**
     * The signed body is not a JSON object.
     */
    INVALID_PAYLOAD_ENCODING(HttpURLConnection.HTTP_BAD_REQUEST, "Invalid JSON in message body"),
    REGISTRY_UNAVAILABLE(HttpURLConnection.HTTP_UNAVAILABLE, "Device registry unavailable");

    static final String TAG_NAME = "outcome";

    private final int status;
    private final String message;
    private final Tag tag;

    AuthenticationFailure(final int status, final String message) {
        this.status = status;
        this.message = message;
        this.tag = Tag.of(TAG_NAME, name().toLowerCase(Locale.ROOT).replace('_', '-'));
    }

    /**
     * Gets the HTTP status code to report to the device.
     *
     * @return The status code.
     */
    public int getStatus() {
        return status;
    }

    /**
     * Gets the error message to report to the device.
     *
     * @return The message.
     */
    public String getMessage() {
        return message;
    }

    /**
     * Gets a <em>Micrometer</em> tag for this failure.
     *
     * @return The tag.
     */
    public Tag asTag() {
        return tag;
    }
}
