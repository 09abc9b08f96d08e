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

import java.util.Objects;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer based metrics for the device message endpoint.
 */
public class MicrometerBasedHttpAdapterMetrics implements HttpAdapterMetrics {

    /**
     * The name of the meter for messages received from devices. The outcome is
     * signaled by the accordingly named tag.
     */
    public static final String METER_MESSAGES_RECEIVED = "c3ds.messages.received";
    /**
     * The name of the meter for tracking the processing duration of messages.
     */
    public static final String METER_MESSAGES_PROCESSING_DURATION = "c3ds.messages.processing.duration";
    /**
     * The name of the meter for recording the payload size of accepted messages.
     */
    public static final String METER_MESSAGES_PAYLOAD = "c3ds.messages.payload";

    static final Tag OUTCOME_ACCEPTED = Tag.of(AuthenticationFailure.TAG_NAME, "accepted");
    static final String TAG_STORED = "stored";

    private final MeterRegistry registry;

    /**
     * Creates a new metrics instance.
     *
     * @param registry The meter registry to use.
     * @throws NullPointerException if registry is {@code null}.
     */
    public MicrometerBasedHttpAdapterMetrics(final MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    @Override
    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    @Override
    public void reportAcceptedMessage(final boolean stored, final int payloadSize, final Timer.Sample timer) {

        final Tags tags = Tags.of(OUTCOME_ACCEPTED).and(TAG_STORED, String.valueOf(stored));
        Counter.builder(METER_MESSAGES_RECEIVED)
            .tags(tags)
            .register(registry)
            .increment();
        DistributionSummary.builder(METER_MESSAGES_PAYLOAD)
            .baseUnit("bytes")
            .minimumExpectedValue(0.0)
            .register(registry)
            .record(payloadSize);
        stopTimer(timer, Tags.of(OUTCOME_ACCEPTED));
    }

    @Override
    public void reportRejectedMessage(final AuthenticationFailure reason, final Timer.Sample timer) {

        Objects.requireNonNull(reason);
        // all counters of the same name need to carry the same tag keys
        Counter.builder(METER_MESSAGES_RECEIVED)
            .tags(Tags.of(reason.asTag()).and(TAG_STORED, Boolean.FALSE.toString()))
            .register(registry)
            .increment();
        stopTimer(timer, Tags.of(reason.asTag()));
    }

    private void stopTimer(final Timer.Sample timer, final Tags tags) {
        if (timer != null) {
            timer.stop(Timer.builder(METER_MESSAGES_PROCESSING_DURATION).tags(tags).register(registry));
        }
    }
}
