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

import java.util.Locale;
import java.util.Optional;

import org.c3ds.util.Constants;
import org.c3ds.util.Strings;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;

/**
 * Helper methods for determining the IP address that a device has sent a request from.
 */
public final class ClientIpAddressHelper {

    static final String HEADER_FORWARDED = "Forwarded";

    private ClientIpAddressHelper() {
        // utility class
    }

    /**
     * Gets the client IP address of an HTTP request.
     * <p>
     * The first entry of the <em>X-Forwarded-For</em> header is used if present.
     * Otherwise the <em>for</em> parameter of the first element of the <em>Forwarded</em>
     * header is used. If neither header is present, the request's remote address is used.
     *
     * @param request The HTTP request.
     * @return The client IP address or an empty optional if it cannot be determined.
     */
    public static Optional<String> getClientIp(final HttpServerRequest request) {
        if (request == null) {
            return Optional.empty();
        }
        return fromXForwardedFor(request.getHeader(Constants.HEADER_X_FORWARDED_FOR))
                .or(() -> fromForwarded(request.getHeader(HEADER_FORWARDED)))
                .or(() -> fromRemoteAddress(request.remoteAddress()));
    }

    /**
     * Gets the host of a socket address.
     *
     * @param remoteAddress The address.
     * @return The host or an empty optional if the address is {@code null}.
     */
    static Optional<String> fromRemoteAddress(final SocketAddress remoteAddress) {
        if (remoteAddress == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(Strings.trimToNull(remoteAddress.host()));
    }

    static Optional<String> fromXForwardedFor(final String header) {
        if (Strings.isNullOrEmpty(header)) {
            return Optional.empty();
        }
        return normalize(header.split(",", 2)[0]);
    }

    static Optional<String> fromForwarded(final String header) {
        if (Strings.isNullOrEmpty(header)) {
            return Optional.empty();
        }
        final String firstElement = header.split(",", 2)[0];
        for (final String pair : firstElement.split(";")) {
            final String token = pair.trim();
            if (token.toLowerCase(Locale.ROOT).startsWith("for=")) {
                return normalize(token.substring(4));
            }
        }
        return Optional.empty();
    }

    /**
     * Removes quotes, brackets and port numbers from a node identifier.
     */
    private static Optional<String> normalize(final String node) {
        String value = Strings.trimToNull(node);
        if (value == null) {
            return Optional.empty();
        }
        if (value.length() > 1 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        if ("unknown".equalsIgnoreCase(value) || value.startsWith("_")) {
            // obfuscated identifiers as defined by RFC 7239
            return Optional.empty();
        }
        if (value.startsWith("[")) {
            final int closingBracket = value.indexOf(']');
            return closingBracket > 1 ? Optional.of(value.substring(1, closingBracket)) : Optional.empty();
        }
        final int colon = value.indexOf(':');
        if (colon > 0 && colon == value.lastIndexOf(':')) {
            // IPv4 address with port
            value = value.substring(0, colon);
        }
        return Optional.ofNullable(Strings.trimToNull(value));
    }
}
