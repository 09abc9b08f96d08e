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

import java.util.Objects;

import org.c3ds.deviceregistry.Device;

import io.vertx.core.json.JsonObject;

/**
 * The outcome of authenticating a message sent by a device.
 * <p>
 * A result either contains the authenticated device along with the verified
 * payload or the reason why authentication has failed.
 */
public final class AuthenticationResult {

    private final Device device;
    private final String certificateSerial;
    private final JsonObject payload;
    private final AuthenticationFailure failure;
    private final String detail;

    private AuthenticationResult(
            final Device device,
            final String certificateSerial,
            final JsonObject payload,
            final AuthenticationFailure failure,
            final String detail) {
        this.device = device;
        this.certificateSerial = certificateSerial;
        this.payload = payload;
        this.failure = failure;
        this.detail = detail;
    }

    /**
     * Creates a result for a successfully authenticated message.
     *
     * @param device The device that has sent the message.
     * @param certificateSerial The serial number of the certificate that the device has presented.
     * @param payload The verified message payload.
     * @return The result.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static AuthenticationResult authenticated(
            final Device device,
            final String certificateSerial,
            final JsonObject payload) {
        Objects.requireNonNull(device);
        Objects.requireNonNull(certificateSerial);
        Objects.requireNonNull(payload);
        return new AuthenticationResult(device, certificateSerial, payload, null, null);
    }

    /**
     * Creates a result for a message that could not be authenticated.
     *
     * @param failure The reason.
     * @param detail Diagnostic information for logging (may be {@code null}).
     *               It is never reported to the device.
     * @return The result.
     * @throws NullPointerException if failure is {@code null}.
     */
    public static AuthenticationResult failed(final AuthenticationFailure failure, final String detail) {
        Objects.requireNonNull(failure);
        return new AuthenticationResult(null, null, null, failure, detail);
    }

    /**
     * Checks if the device has been authenticated.
     *
     * @return {@code true} if this result contains the device and its verified payload.
     */
    public boolean isAuthenticated() {
        return failure == null;
    }

    /**
     * Gets the authenticated device.
     *
     * @return The device or {@code null} if authentication has failed.
     */
    public Device getDevice() {
        return device;
    }

    /**
     * Gets the serial number of the certificate used for authentication.
     *
     * @return The serial as lower case hex digits or {@code null} if authentication has failed.
     */
    public String getCertificateSerial() {
        return certificateSerial;
    }

    /**
     * Gets the verified payload.
     *
     * @return A copy of the payload or {@code null} if authentication has failed.
     */
    public JsonObject getPayload() {
        return payload == null ? null : payload.copy();
    }

    /**
     * Gets the reason why authentication has failed.
     *
     * @return The reason or {@code null} if the device has been authenticated.
     */
    public AuthenticationFailure getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        if (isAuthenticated()) {
            return String.format("AuthenticationResult [authenticated, device: %s, serial: %s]",
                    device.getId(), certificateSerial);
        }
        return String.format("AuthenticationResult [failure: %s, detail: %s]", failure, detail);
    }
}
