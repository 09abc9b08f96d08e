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

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import org.c3ds.deviceregistry.Device;
import org.c3ds.deviceregistry.DeviceMessage;
import org.c3ds.deviceregistry.DeviceRegistry;
import org.c3ds.deviceregistry.DeviceStatus;
import org.c3ds.deviceregistry.MessageLog;
import org.c3ds.tracing.TracingHelper;
import org.c3ds.util.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.Span;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

/**
 * Stores authenticated device messages and activates the devices that have sent them.
 * <p>
 * A failure to store a message does not fail the processing of the message. It is
 * reported to the device in the response instead.
 */
public class MessageIngestPipeline {

    /**
     * The name of the payload property containing the application defined message type.
     */
    public static final String FIELD_MESSAGE_TYPE = "message_type";
    /**
     * The name of the payload property containing the application data.
     */
    public static final String FIELD_DATA = "data";
    /**
     * The name of the response property indicating whether the message has been stored.
     */
    public static final String FIELD_SAVED = "saved";
    /**
     * The message type used if the payload does not contain one.
     */
    public static final String DEFAULT_MESSAGE_TYPE = "unknown";

    static final String FIELD_VALUE = "value";
    static final String MESSAGE_STORED = "Message stored successfully.";
    static final String MESSAGE_NOT_STORED = "Failed to store message.";

    private static final Logger LOG = LoggerFactory.getLogger(MessageIngestPipeline.class);

    private final DeviceRegistry registry;
    private final MessageLog messageLog;
    private final Clock clock;

    /**
     * Creates a new pipeline.
     *
     * @param registry The registry to update device status in.
     * @param messageLog The log to append messages to.
     * @param clock The clock to use for determining the time of receipt.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public MessageIngestPipeline(final DeviceRegistry registry, final MessageLog messageLog, final Clock clock) {
        this.registry = Objects.requireNonNull(registry);
        this.messageLog = Objects.requireNonNull(messageLog);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Processes an authenticated message.
     *
     * @param authenticated The outcome of the message's authentication.
     * @param clientIp The IP address the message has been sent from (may be {@code null}).
     * @param span The <em>OpenTracing</em> span to log the processing to.
     * @return A future that will be completed with the response to send to the device.
     *         The future will never be failed.
     * @throws NullPointerException if result or span are {@code null}.
     * @throws IllegalArgumentException if the result does not represent a successful authentication.
     */
    public Future<JsonObject> process(
            final AuthenticationResult authenticated,
            final String clientIp,
            final Span span) {

        Objects.requireNonNull(authenticated);
        Objects.requireNonNull(span);
        if (!authenticated.isAuthenticated()) {
            throw new IllegalArgumentException("message has not been authenticated");
        }

        final Device device = authenticated.getDevice();
        final JsonObject payload = authenticated.getPayload();
        final Instant receivedAt = Instant.now(clock);

        final DeviceMessage message = DeviceMessage.builder(device.getId())
                .messageType(getMessageType(payload))
                .timestamp(getTimestamp(payload, receivedAt))
                .data(getData(payload))
                .receivedAt(receivedAt)
                .ipAddress(clientIp)
                .certificateSerial(authenticated.getCertificateSerial())
                .build();

        final Future<Boolean> stored = messageLog.append(message)
                .map(ok -> {
                    LOG.debug("stored {}", message);
                    span.log("message stored");
                    return Boolean.TRUE;
                })
                .otherwise(t -> {
                    LOG.warn("failed to store message of device [{}]", device.getId(), t);
                    TracingHelper.logError(span, "failed to store message", t, true);
                    return Boolean.FALSE;
                });

        return stored
                .compose(saved -> activate(device, span).map(saved))
                .map(saved -> new JsonObject()
                        .put(Constants.FIELD_STATUS, Constants.STATUS_SUCCESS)
                        .put(FIELD_SAVED, saved)
                        .put(Constants.FIELD_DEVICE_ID, device.getId().toString())
                        .put(Constants.FIELD_TIMESTAMP, receivedAt)
                        .put(Constants.FIELD_MESSAGE, saved ? MESSAGE_STORED : MESSAGE_NOT_STORED));
    }

    /**
     * Sets a device's status to {@link DeviceStatus#ACTIVE} if its current status
     * allows activation by a message.
     *
     * @return A succeeded future. A failure to update the status is only logged.
     */
    private Future<Void> activate(final Device device, final Span span) {

        if (!device.getStatus().activatesOnAuthenticatedMessage()) {
            return Future.succeededFuture();
        }
        return registry.updateStatus(device.getId(), DeviceStatus.ACTIVE)
                .map(updated -> {
                    LOG.info("activated device [{}], previous status was {}", device.getId(), device.getStatus());
                    span.log("device activated");
                    return (Void) null;
                })
                .otherwise(t -> {
                    LOG.warn("failed to activate device [{}]", device.getId(), t);
                    TracingHelper.logError(span, "failed to activate device", t, true);
                    return null;
                });
    }

    static String getMessageType(final JsonObject payload) {
        final Object type = payload.getValue(FIELD_MESSAGE_TYPE);
        return type == null ? DEFAULT_MESSAGE_TYPE : type.toString();
    }

    static JsonObject getData(final JsonObject payload) {
        final Object data = payload.getValue(FIELD_DATA);
        if (data == null) {
            return new JsonObject();
        } else if (data instanceof JsonObject) {
            return (JsonObject) data;
        } else {
            return new JsonObject().put(FIELD_VALUE, data);
        }
    }

    /**
     * Gets the application defined timestamp of a message.
     * <p>
     * Timestamps without offset are interpreted as UTC.
     *
     * @param payload The message payload.
     * @param fallback The instant to use if the payload does not contain a
     *                 parseable ISO-8601 timestamp.
     * @return The timestamp.
     */
    static Instant getTimestamp(final JsonObject payload, final Instant fallback) {
        final Object value = payload.getValue(Constants.FIELD_TIMESTAMP);
        if (!(value instanceof String)) {
            return fallback;
        }
        final String timestamp = ((String) value).trim();
        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (final DateTimeParseException e) {
            LOG.trace("timestamp [{}] has no offset", timestamp);
        }
        try {
            return LocalDateTime.parse(timestamp).toInstant(ZoneOffset.UTC);
        } catch (final DateTimeParseException e) {
            LOG.trace("timestamp [{}] is no local date time", timestamp);
        }
        try {
            return LocalDate.parse(timestamp).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (final DateTimeParseException e) {
            LOG.debug("cannot parse timestamp [{}], using time of receipt", timestamp);
            return fallback;
        }
    }
}
