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

package org.c3ds.deviceregistry;

/**
 * The life cycle states of a device.
 * <p>
 * A device starts out as {@link #PENDING} and becomes {@link #ACTIVE} with the first
 * authenticated message. {@link #REVOKED} is terminal. {@link #EXPIRED} is never
 * set automatically.
 */
public enum DeviceStatus {

    /**
     * The device is active and operational.
     */
    ACTIVE("Active"),
    /**
     * The device is pending activation.
     */
    PENDING("Pending"),
    /**
     * The device has been revoked and is no longer valid.
     */
    REVOKED("Revoked"),
    /**
     * The device's validity period has expired.
     */
    EXPIRED("Expired"),
    /**
     * The device is allowed but not currently in use.
     */
    INACTIVE("Inactive");

    private final String displayName;

    DeviceStatus(final String displayName) {
        this.displayName = displayName;
    }

    /**
     * Gets a human readable name.
     *
     * @return The name.
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Checks if a device in this state becomes {@link #ACTIVE} when
     * it sends an authenticated message.
     *
     * @return {@code true} for {@link #PENDING} and {@link #INACTIVE}.
     */
    public boolean activatesOnAuthenticatedMessage() {
        return this == PENDING || this == INACTIVE;
    }

    /**
     * Checks if a device in this state may be revoked.
     *
     * @return {@code true} for {@link #PENDING}, {@link #ACTIVE} and {@link #INACTIVE}.
     */
    public boolean isRevocable() {
        return this == PENDING || this == ACTIVE || this == INACTIVE;
    }

    /**
     * Checks if this state can not be left anymore.
     *
     * @return {@code true} for {@link #REVOKED}.
     */
    public boolean isTerminal() {
        return this == REVOKED;
    }
}
