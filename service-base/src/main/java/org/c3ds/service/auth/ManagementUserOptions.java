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

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.ConfigMapping.NamingStrategy;
import io.smallrye.config.WithDefault;

/**
 * Options for the users that may access the management endpoints.
 *
 */
@ConfigMapping(prefix = "c3ds.management", namingStrategy = NamingStrategy.VERBATIM)
public interface ManagementUserOptions {

    /**
     * Gets the configured users.
     *
     * @return The users.
     */
    Optional<List<UserEntry>> users();

    /**
     * A single management user.
     */
    interface UserEntry {

        /**
         * Gets the user name.
         *
         * @return The name.
         */
        String username();

        /**
         * Gets the BCrypt hash of the user's password.
         *
         * @return The hash.
         */
        String password();

        /**
         * Gets the names of the user's roles.
         *
         * @return The role names.
         */
        @WithDefault("PARTICIPANT")
        List<String> roles();
    }
}
