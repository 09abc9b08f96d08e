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

import java.util.List;
import java.util.UUID;

import org.c3ds.util.Lifecycle;

import io.vertx.core.Future;

/**
 * An append-only store for messages that devices have sent.
 *
 */
public interface MessageLog extends Lifecycle {

    /**
     * Appends a message.
     *
     * @param message The message.
     * @return A future indicating the outcome of the operation.
     *         The future will be failed with a {@code ServerErrorException} if the message
     *         could not be stored.
     * @throws NullPointerException if message is {@code null}.
     */
    Future<DeviceMessage> append(DeviceMessage message);

    /**
     * Counts the messages that a device has sent.
     *
     * @param deviceId The device.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if device ID is {@code null}.
     */
    Future<Long> countMessages(UUID deviceId);

    /**
     * Gets the most recent messages of a device, ordered by their timestamp with the newest first.
     *
     * @param deviceId The device.
     * @param limit The maximum number of messages to return.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if device ID is {@code null}.
     * @throws IllegalArgumentException if limit is negative.
     */
    Future<List<DeviceMessage>> findRecentMessages(UUID deviceId, int limit);
}
