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
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.c3ds.client.ClientErrorException;
import org.c3ds.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.auth.User;
import io.vertx.ext.auth.authentication.AuthenticationProvider;

/**
 * An authentication provider that verifies user name and password against
 * a static list of users.
 * <p>
 * Passwords are expected to be BCrypt hashes. Matching is done on a worker
 * thread because BCrypt is deliberately slow.
 */
public final class ConfiguredUsersAuthProvider implements AuthenticationProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfiguredUsersAuthProvider.class);
    private static final String FIELD_PASSWORD = "password";

    private final Vertx vertx;
    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder();
    private final Map<String, Account> accounts = new HashMap<>();

    /**
     * Creates a provider for configured users.
     *
     * @param vertx The vert.x instance to run password matching on.
     * @param options The configured users.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if a user has an unknown role.
     */
    public ConfiguredUsersAuthProvider(final Vertx vertx, final ManagementUserOptions options) {
        this(vertx, options.users().orElse(Collections.emptyList()));
    }

    /**
     * Creates a provider for a list of users.
     *
     * @param vertx The vert.x instance to run password matching on.
     * @param users The users.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if a user has an unknown role.
     */
    public ConfiguredUsersAuthProvider(final Vertx vertx, final List<ManagementUserOptions.UserEntry> users) {
        this.vertx = Objects.requireNonNull(vertx);
        Objects.requireNonNull(users);
        users.forEach(entry -> addUser(entry.username(), entry.password(), entry.roles()));
        if (accounts.isEmpty()) {
            LOG.warn("no management users configured, management endpoints will reject all requests");
        }
    }

    private void addUser(final String username, final String passwordHash, final List<String> roleNames) {
        final Set<Role> roles = EnumSet.noneOf(Role.class);
        roleNames.forEach(name -> roles.add(Role.from(name)));
        if (accounts.put(username, new Account(passwordHash, new ManagementUser(username, roles))) != null) {
            LOG.warn("duplicate definition of management user [{}], using last one", username);
        } else {
            LOG.debug("added management user [{}] with roles {}", username, roles);
        }
    }

    /**
     * {@inheritDoc}
     * <p>
     * The credentials are expected to contain <em>username</em> and <em>password</em>
     * properties. The returned future is failed with a {@link ClientErrorException}
     * with status 401 if the credentials do not match a configured user.
     */
    @Override
    public void authenticate(final JsonObject credentials, final Handler<AsyncResult<User>> resultHandler) {

        Objects.requireNonNull(credentials);
        Objects.requireNonNull(resultHandler);

        final String username = credentials.getString(ManagementUser.FIELD_USERNAME);
        final String password = credentials.getString(FIELD_PASSWORD);

        if (Strings.isNullOrEmpty(username) || password == null) {
            resultHandler.handle(Future.failedFuture(badCredentials()));
            return;
        }
        final Account account = accounts.get(username);
        if (account == null) {
            LOG.debug("unknown management user [{}]", username);
            resultHandler.handle(Future.failedFuture(badCredentials()));
            return;
        }
        vertx.executeBlocking(() -> passwordEncoder.matches(password, account.passwordHash), false)
            .<User> compose(matches -> {
                if (matches) {
                    LOG.debug("authenticated management user [{}]", username);
                    return Future.succeededFuture(account.user.toUser());
                } else {
                    LOG.debug("password mismatch for management user [{}]", username);
                    return Future.failedFuture(badCredentials());
                }
            })
            .onComplete(resultHandler);
    }

    private static ClientErrorException badCredentials() {
        return new ClientErrorException(HttpURLConnection.HTTP_UNAUTHORIZED, "Bad credentials");
    }

    private static final class Account {

        private final String passwordHash;
        private final ManagementUser user;

        private Account(final String passwordHash, final ManagementUser user) {
            this.passwordHash = Objects.requireNonNull(passwordHash);
            this.user = user;
        }
    }
}
