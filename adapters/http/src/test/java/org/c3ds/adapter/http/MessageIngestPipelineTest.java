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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.HttpURLConnection;
import java.time.Instant;
import java.util.UUID;

import org.c3ds.client.ClientErrorException;
import org.c3ds.client.ServerErrorException;
import org.c3ds.deviceregistry.Device;
import org.c3ds.deviceregistry.DeviceMessage;
import org.c3ds.deviceregistry.DeviceRegistry;
import org.c3ds.deviceregistry.DeviceStatus;
import org.c3ds.deviceregistry.MessageLog;
import org.c3ds.test.MutableClock;
import org.c3ds.util.Constants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;

import io.opentracing.noop.NoopSpan;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Tests verifying behavior of {@link MessageIngestPipeline}.
 *
 */
public class MessageIngestPipelineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SERIAL = "00000000000000000000000000000000000000c3";

    private DeviceRegistry registry;
    private MessageLog messageLog;
    private MessageIngestPipeline pipeline;
    private Device device;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        registry = mock(DeviceRegistry.class);
        messageLog = mock(MessageLog.class);
        when(messageLog.append(any(DeviceMessage.class)))
            .thenAnswer(invocation -> Future.succeededFuture(invocation.getArgument(0)));
        when(registry.updateStatus(any(UUID.class), any(DeviceStatus.class)))
            .thenAnswer(invocation -> Future.succeededFuture(new Device(device).setStatus(invocation.getArgument(1))));
        pipeline = new MessageIngestPipeline(registry, messageLog, new MutableClock(NOW));
        device = new Device().setId(UUID.randomUUID()).setName("Sensor-Vilnius-001").setStatus(DeviceStatus.PENDING);
    }

    private JsonObject process(final JsonObject payload) {
        final Future<JsonObject> result = pipeline.process(
                AuthenticationResult.authenticated(device, SERIAL, payload),
                "192.0.2.10",
                NoopSpan.INSTANCE);
        assertThat(result.succeeded()).isTrue();
        return result.result();
    }

    private DeviceMessage storedMessage() {
        final ArgumentCaptor<DeviceMessage> message = ArgumentCaptor.forClass(DeviceMessage.class);
        verify(messageLog).append(message.capture());
        return message.getValue();
    }

    /**
     * Verifies that an authenticated message is stored with all of its properties and
     * that the response reports success.
     */
    @Test
    public void testProcessStoresMessage() {
        final JsonObject response = process(new JsonObject()
                .put("message_type", "heartbeat")
                .put("timestamp", "2024-12-13T10:30:00Z")
                .put("data", new JsonObject().put("status", "online")));

        final DeviceMessage message = storedMessage();
        assertThat(message.getDeviceId()).isEqualTo(device.getId());
        assertThat(message.getMessageType()).isEqualTo("heartbeat");
        assertThat(message.getTimestamp()).isEqualTo(Instant.parse("2024-12-13T10:30:00Z"));
        assertThat(message.getData()).isEqualTo(new JsonObject().put("status", "online"));
        assertThat(message.getReceivedAt()).isEqualTo(NOW);
        assertThat(message.getIpAddress()).isEqualTo("192.0.2.10");
        assertThat(message.getCertificateSerial()).isEqualTo(SERIAL);

        assertThat(response.getString(Constants.FIELD_STATUS)).isEqualTo(Constants.STATUS_SUCCESS);
        assertThat(response.getBoolean(MessageIngestPipeline.FIELD_SAVED)).isTrue();
        assertThat(response.getString(Constants.FIELD_DEVICE_ID)).isEqualTo(device.getId().toString());
        assertThat(response.getInstant(Constants.FIELD_TIMESTAMP)).isEqualTo(NOW);
        assertThat(response.getString(Constants.FIELD_MESSAGE)).isEqualTo(MessageIngestPipeline.MESSAGE_STORED);
    }

    /**
     * Verifies that defaults are used for properties that the payload does not contain.
     */
    @Test
    public void testProcessUsesDefaultsForMissingProperties() {
        process(new JsonObject());

        final DeviceMessage message = storedMessage();
        assertThat(message.getMessageType()).isEqualTo(MessageIngestPipeline.DEFAULT_MESSAGE_TYPE);
        assertThat(message.getTimestamp()).isEqualTo(NOW);
        assertThat(message.getData()).isEqualTo(new JsonObject());
    }

    /**
     * Verifies that data which is not a JSON object is wrapped and that
     * non-string message types are converted.
     */
    @Test
    public void testProcessWrapsNonObjectData() {
        process(new JsonObject()
                .put("message_type", 42)
                .put("data", new JsonArray().add(21.5).add(22.0)));

        final DeviceMessage message = storedMessage();
        assertThat(message.getMessageType()).isEqualTo("42");
        assertThat(message.getData()).isEqualTo(new JsonObject()
                .put(MessageIngestPipeline.FIELD_VALUE, new JsonArray().add(21.5).add(22.0)));
    }

    /**
     * Verifies the supported timestamp formats.
     *
     * @param timestamp The timestamp contained in the payload.
     * @param expected The expected instant.
     */
    @ParameterizedTest
    @CsvSource({
        "2024-12-13T10:30:00Z,2024-12-13T10:30:00Z",
        "2024-12-13T12:30:00+02:00,2024-12-13T10:30:00Z",
        "2024-12-13T10:30:00.250Z,2024-12-13T10:30:00.250Z",
        "2024-12-13T10:30:00,2024-12-13T10:30:00Z",
        "2024-12-13,2024-12-13T00:00:00Z",
        "yesterday,2026-03-01T10:00:00Z",
        "'',2026-03-01T10:00:00Z"
    })
    public void testGetTimestamp(final String timestamp, final String expected) {
        final Instant result = MessageIngestPipeline.getTimestamp(
                new JsonObject().put("timestamp", timestamp), NOW);
        assertThat(result).isEqualTo(Instant.parse(expected));
    }

    /**
     * Verifies that a timestamp which is not a string is ignored.
     */
    @Test
    public void testGetTimestampIgnoresNonStringValues() {
        assertThat(MessageIngestPipeline.getTimestamp(new JsonObject().put("timestamp", 1734085800), NOW))
            .isEqualTo(NOW);
    }

    /**
     * Verifies that a failure to store the message is reported in the response
     * but does not prevent the device from being activated.
     */
    @Test
    public void testProcessReportsFailureToStoreMessage() {
        when(messageLog.append(any(DeviceMessage.class)))
            .thenReturn(Future.failedFuture(new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE)));

        final JsonObject response = process(new JsonObject().put("message_type", "heartbeat"));

        assertThat(response.getString(Constants.FIELD_STATUS)).isEqualTo(Constants.STATUS_SUCCESS);
        assertThat(response.getBoolean(MessageIngestPipeline.FIELD_SAVED)).isFalse();
        assertThat(response.getString(Constants.FIELD_MESSAGE)).isEqualTo(MessageIngestPipeline.MESSAGE_NOT_STORED);
        verify(registry).updateStatus(device.getId(), DeviceStatus.ACTIVE);
    }

    /**
     * Verifies that pending and inactive devices are activated while active devices
     * are left alone.
     */
    @Test
    public void testProcessActivatesDevice() {
        process(new JsonObject());
        verify(registry).updateStatus(device.getId(), DeviceStatus.ACTIVE);

        device.setStatus(DeviceStatus.INACTIVE);
        process(new JsonObject());

        device.setStatus(DeviceStatus.ACTIVE);
        process(new JsonObject());

        verify(registry, times(2)).updateStatus(device.getId(), DeviceStatus.ACTIVE);
    }

    /**
     * Verifies that a device which has been revoked concurrently is not reactivated and
     * that the message is still acknowledged.
     */
    @Test
    public void testProcessSucceedsIfActivationFails() {
        when(registry.updateStatus(any(UUID.class), any(DeviceStatus.class)))
            .thenReturn(Future.failedFuture(new ClientErrorException(HttpURLConnection.HTTP_CONFLICT, "device is revoked")));

        final JsonObject response = process(new JsonObject());

        assertThat(response.getString(Constants.FIELD_STATUS)).isEqualTo(Constants.STATUS_SUCCESS);
        assertThat(response.getBoolean(MessageIngestPipeline.FIELD_SAVED)).isTrue();
    }

    /**
     * Verifies that messages that have not been authenticated are not processed.
     */
    @Test
    public void testProcessRejectsUnauthenticatedMessage() {
        final AuthenticationResult failed = AuthenticationResult.failed(AuthenticationFailure.INVALID_SIGNATURE, "bad");
        assertThrows(
                IllegalArgumentException.class,
                () -> pipeline.process(failed, null, NoopSpan.INSTANCE));
        verify(messageLog, never()).append(any(DeviceMessage.class));
    }
}
