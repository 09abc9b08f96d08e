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

package org.c3ds.test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A clock that can be moved forward and backward in tests.
 *
 */
public final class MutableClock extends Clock {

    private volatile Instant now;

    /**
     * Creates a clock showing a given instant.
     *
     * @param now The instant.
     * @throws NullPointerException if instant is {@code null}.
     */
    public MutableClock(final Instant now) {
        this.now = Objects.requireNonNull(now);
    }

    /**
     * Moves the clock.
     *
     * @param amount The amount to move the clock by. May be negative.
     */
    public void advance(final Duration amount) {
        now = now.plus(amount);
    }

    /**
     * Sets the clock to an instant.
     *
     * @param instant The instant.
     */
    public void set(final Instant instant) {
        now = Objects.requireNonNull(instant);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return now;
    }
}
