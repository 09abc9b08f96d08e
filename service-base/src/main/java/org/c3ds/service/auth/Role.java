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

import java.util.Locale;

/**
 * The roles a management user may have.
 */
public enum Role {
    /**
     * A user that manages the devices it has created.
     */
    PARTICIPANT,
    /**
     * A user that may manage all devices.
     */
    ADMIN;

    /**
     * Gets the role for a name.
     *
     * @param name The name, case is ignored.
     * @return The role.
     * @throws IllegalArgumentException if the name does not match any role.
     * @throws NullPointerException if name is {@code null}.
     */
    public static Role from(final String name) {
        return Role.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
