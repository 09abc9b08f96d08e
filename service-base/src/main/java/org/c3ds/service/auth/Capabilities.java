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

package org.c3ds.service.auth;

import java.net.HttpURLConnection;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import org.c3ds.client.ClientErrorException;
import org.c3ds.service.http.HttpUtils;

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;

/**
 * Route handlers for checking a management user's capabilities.
 *
 */
public final class Capabilities {

    private Capabilities() {
        // prevent instantiation
    }

    /**
     * Creates a handler that lets a request pass only if the authenticated user
     * has at least one of the given roles.
     * <p>
     * The handler fails the request with a 401 if no user has been authenticated
     * and with a 403 if the user has none of the roles.
     *
     * @param roles The roles.
     * @return The handler.
     * @throws NullPointerException if roles is {@code null}.
     * @throws IllegalArgumentException if no roles are given.
     */
    public static Handler<RoutingContext> requireAnyRole(final Role... roles) {
        Objects.requireNonNull(roles);
        if (roles.length == 0) {
            throw new IllegalArgumentException("at least one role is required");
        }
        final Set<Role> required = EnumSet.copyOf(Arrays.asList(roles));
        return ctx -> {
            final ManagementUser user = ManagementUser.fromContext(ctx);
            if (user == null) {
                HttpUtils.fail(ctx, new ClientErrorException(HttpURLConnection.HTTP_UNAUTHORIZED, "Authentication required"));
            } else if (required.stream().noneMatch(user::hasRole)) {
                HttpUtils.fail(ctx, new ClientErrorException(HttpURLConnection.HTTP_FORBIDDEN, "Insufficient permissions"));
            } else {
                ctx.next();
            }
        };
    }

    /**
     * Verifies that a user may manage a device.
     *
     * @param user The user.
     * @param owner The name of the user that created the device.
     * @throws ClientErrorException with status 403 if the user may not manage the device.
     * @throws NullPointerException if user is {@code null}.
     */
    public static void checkMayManage(final ManagementUser user, final String owner) {
        Objects.requireNonNull(user);
        if (!user.mayManage(owner)) {
            throw new ClientErrorException(HttpURLConnection.HTTP_FORBIDDEN, "Not permitted to manage device");
        }
    }
}
