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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.auth.User;
import io.vertx.ext.web.RoutingContext;

/**
 * An authenticated user of the management endpoints.
 * <p>
 * Instances are created from the principal of the Vert.x {@code User}
 * that the {@link ConfiguredUsersAuthProvider} has established.
 */
public final class ManagementUser {

    static final String FIELD_USERNAME = "username";
    static final String FIELD_ROLES = "roles";

    private final String username;
    private final Set<Role> roles;

    /**
     * Creates a new user.
     *
     * @param username The user name.
     * @param roles The roles of the user.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public ManagementUser(final String username, final Set<Role> roles) {
        this.username = Objects.requireNonNull(username);
        Objects.requireNonNull(roles);
        this.roles = roles.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    /**
     * Gets the user that has been authenticated for a request.
     *
     * @param ctx The routing context of the request.
     * @return The user or {@code null} if the request has not been authenticated.
     * @throws NullPointerException if context is {@code null}.
     */
    public static ManagementUser fromContext(final RoutingContext ctx) {
        Objects.requireNonNull(ctx);
        return fromUser(ctx.user());
    }

    /**
     * Gets the management user represented by a Vert.x user.
     *
     * @param user The Vert.x user (may be {@code null}).
     * @return The user or {@code null} if the Vert.x user's principal does not contain a user name.
     */
    public static ManagementUser fromUser(final User user) {
        if (user == null || user.principal() == null) {
            return null;
        }
        final JsonObject principal = user.principal();
        final String name = principal.getString(FIELD_USERNAME);
        if (name == null) {
            return null;
        }
        final Set<Role> roles = EnumSet.noneOf(Role.class);
        principal.getJsonArray(FIELD_ROLES, new JsonArray()).forEach(r -> {
            if (r instanceof String s) {
                roles.add(Role.from(s));
            }
        });
        return new ManagementUser(name, roles);
    }

    /**
     * Creates a Vert.x user for this management user.
     *
     * @return The user.
     */
    public User toUser() {
        final JsonArray roleNames = new JsonArray();
        roles.forEach(r -> roleNames.add(r.name()));
        return User.create(new JsonObject()
                .put(FIELD_USERNAME, username)
                .put(FIELD_ROLES, roleNames));
    }

    public String getUsername() {
        return username;
    }

    public Set<Role> getRoles() {
        return roles;
    }

    /**
     * Checks if this user has a given role.
     *
     * @param role The role.
     * @return {@code true} if the user has the role.
     */
    public boolean hasRole(final Role role) {
        return roles.contains(role);
    }

    /**
     * Checks if this user may manage a device.
     * <p>
     * Administrators may manage all devices, other users only the devices
     * that they have created.
     *
     * @param owner The name of the user that created the device (may be {@code null}).
     * @return {@code true} if the user may manage the device.
     */
    public boolean mayManage(final String owner) {
        return hasRole(Role.ADMIN) || (hasRole(Role.PARTICIPANT) && username.equals(owner));
    }

    @Override
    public String toString() {
        return String.format("ManagementUser [username: %s, roles: %s]", username, roles);
    }
}
