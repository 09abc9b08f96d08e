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

import io.micrometer.core.instrument.Timer.Sample;

/**
 * Metrics reported by the device message endpoint.
 *
 */
public interface HttpAdapterMetrics {

    /**
     * A metrics implementation that does not report anything.
     */
    HttpAdapterMetrics NOOP = new HttpAdapterMetrics() {

        @Override
        public Sample startTimer() {
            return null;
        }

        @Override
        public void reportAcceptedMessage(final boolean stored, final int payloadSize, final Sample timer) {
            // nothing to report
        }

        @Override
        public void reportRejectedMessage(final AuthenticationFailure reason, final Sample timer) {
            // nothing to report
        }
    };

    /**
     * Starts a new timer.
     *
     * @return The newly created timer sample.
     */
    Sample startTimer();

    /**
     * Reports a message that has been authenticated successfully.
     *
     * @param stored {@code true} if the message has been written to the message log.
     * @param payloadSize The size of the message body in bytes.
     * @param timer The timer started when the message has been received.
     */
    void reportAcceptedMessage(boolean stored, int payloadSize, Sample timer);

    /**
     * Reports a message that has been rejected.
     *
     * @param reason The reason why the message could not be authenticated.
     * @param timer The timer started when the message has been received.
     * @throws NullPointerException if reason is {@code null}.
     */
    void reportRejectedMessage(AuthenticationFailure reason, Sample timer);
}
