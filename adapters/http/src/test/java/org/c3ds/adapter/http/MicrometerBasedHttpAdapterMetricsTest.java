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

import static com.google.common.truth.Truth.assertThat;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests verifying behavior of {@link MicrometerBasedHttpAdapterMetrics}.
 *
 */
public class MicrometerBasedHttpAdapterMetricsTest {

    private MeterRegistry registry;
    private MicrometerBasedHttpAdapterMetrics metrics;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerBasedHttpAdapterMetrics(registry);
    }

    /**
     * Verifies that accepted messages are counted separately depending on whether
     * they have been stored and that their payload size and processing time are recorded.
     */
    @Test
    public void testReportAcceptedMessage() {
        metrics.reportAcceptedMessage(true, 120, metrics.startTimer());
        metrics.reportAcceptedMessage(true, 80, metrics.startTimer());
        metrics.reportAcceptedMessage(false, 100, null);

        final Counter stored = registry.find(MicrometerBasedHttpAdapterMetrics.METER_MESSAGES_RECEIVED)
                .tags("outcome", "accepted", MicrometerBasedHttpAdapterMetrics.TAG_STORED, "true")
                .counter();
        final Counter notStored = registry.find(MicrometerBasedHttpAdapterMetrics.METER_MESSAGES_RECEIVED)
                .tags("outcome", "accepted", MicrometerBasedHttpAdapterMetrics.TAG_STORED, "false")
                .counter();
        assertThat(stored.count()).isEqualTo(2.0);
        assertThat(notStored.count()).isEqualTo(1.0);

        final DistributionSummary payload = registry.get(MicrometerBasedHttpAdapterMetrics.METER_MESSAGES_PAYLOAD)
                .summary();
        assertThat(payload.count()).isEqualTo(3L);
        assertThat(payload.totalAmount()).isEqualTo(300.0);

        final Timer timer = registry.get(MicrometerBasedHttpAdapterMetrics.METER_MESSAGES_PROCESSING_DURATION)
                .tags("outcome", "accepted")
                .timer();
        assertThat(timer.count()).isEqualTo(2L);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isAtLeast(0.0);
    }

    /**
     * Verifies that rejected messages are counted per reason.
     */
    @Test
    public void testReportRejectedMessage() {
        metrics.reportRejectedMessage(AuthenticationFailure.INVALID_SIGNATURE, metrics.startTimer());
        metrics.reportRejectedMessage(AuthenticationFailure.INVALID_SIGNATURE, metrics.startTimer());
        metrics.reportRejectedMessage(AuthenticationFailure.DEVICE_REVOKED, metrics.startTimer());

        assertThat(registry.get(MicrometerBasedHttpAdapterMetrics.METER_MESSAGES_RECEIVED)
                .tags("outcome", "invalid-signature")
                .counter()
                .count()).isEqualTo(2.0);
        assertThat(registry.get(MicrometerBasedHttpAdapterMetrics.METER_MESSAGES_RECEIVED)
                .tags("outcome", "device-revoked")
                .counter()
                .count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerBasedHttpAdapterMetrics.METER_MESSAGES_PROCESSING_DURATION)
                .tags("outcome", "device-revoked")
                .timer()
                .count()).isEqualTo(1L);
        assertThat(registry.find(MicrometerBasedHttpAdapterMetrics.METER_MESSAGES_PAYLOAD).summary()).isNull();
    }

    /**
     * Verifies that the no-op instance can be used without a timer.
     */
    @Test
    public void testNoopMetricsAcceptNullTimer() {
        HttpAdapterMetrics.NOOP.reportAcceptedMessage(true, 10, HttpAdapterMetrics.NOOP.startTimer());
        HttpAdapterMetrics.NOOP.reportRejectedMessage(AuthenticationFailure.EMPTY_PAYLOAD, null);
    }
}
