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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import io.vertx.core.json.JsonObject;

/**
 * A message that an authenticated device has sent.
 * <p>
 * Messages are immutable. They are appended to the {@link MessageLog} once
 * and never modified afterwards.
 */
public final class DeviceMessage {

    static final String FIELD_ID = "id";
    static final String FIELD_DEVICE_ID = "device_id";
    static final String FIELD_MESSAGE_TYPE = "message_type";
    static final String FIELD_TIMESTAMP = "timestamp";
    static final String FIELD_DATA = "data";
    static final String FIELD_RECEIVED_AT = "received_at";
    static final String FIELD_IP_ADDRESS = "ip_address";
    static final String FIELD_CERTIFICATE_SERIAL = "certificate_serial";

    private final UUID id;
    private final UUID deviceId;
    private final String messageType;
    private final Instant timestamp;
    private final JsonObject data;
    private final Instant receivedAt;
    private final String ipAddress;
    private final String certificateSerial;

    private DeviceMessage(final Builder builder) {
        this.id = Objects.requireNonNull(builder.id);
        this.deviceId = Objects.requireNonNull(builder.deviceId);
        this.messageType = Objects.requireNonNull(builder.messageType);
        this.timestamp = Objects.requireNonNull(builder.timestamp);
        this.data = builder.data == null ? new JsonObject() : builder.data.copy();
        this.receivedAt = Objects.requireNonNull(builder.receivedAt);
        this.ipAddress = builder.ipAddress;
        this.certificateSerial = builder.certificateSerial;
    }

    /**
     * Creates a builder for a message from a device.
     *
     * @param deviceId The device that has sent the message.
     * @return The builder.
     * @throws NullPointerException if device ID is {@code null}.
     */
    public static Builder builder(final UUID deviceId) {
        return new Builder(deviceId);
    }

    /**
     * Creates a message from its JSON representation.
     *
     * @param json The JSON object as created by {@link #toJson()}.
     * @return The message.
     * @throws NullPointerException if a mandatory property is missing.
     * @throws IllegalArgumentException if a property has an invalid value.
     * @throws ClassCastException if a property has the wrong type.
     */
    public static DeviceMessage fromJson(final JsonObject json) {
        Objects.requireNonNull(json);
        return new Builder(UUID.fromString(json.getString(FIELD_DEVICE_ID)))
                .id(UUID.fromString(json.getString(FIELD_ID)))
                .messageType(json.getString(FIELD_MESSAGE_TYPE))
                .timestamp(json.getInstant(FIELD_TIMESTAMP))
                .data(json.getJsonObject(FIELD_DATA))
                .receivedAt(json.getInstant(FIELD_RECEIVED_AT))
                .ipAddress(json.getString(FIELD_IP_ADDRESS))
                .certificateSerial(json.getString(FIELD_CERTIFICATE_SERIAL))
                .build();
    }

    /**
     * Gets the JSON representation of this message.
     *
     * @return A new JSON object.
     */
    public JsonObject toJson() {
        final JsonObject json = new JsonObject()
                .put(FIELD_ID, id.toString())
                .put(FIELD_DEVICE_ID, deviceId.toString())
                .put(FIELD_MESSAGE_TYPE, messageType)
                .put(FIELD_TIMESTAMP, timestamp)
                .put(FIELD_DATA, data.copy())
                .put(FIELD_RECEIVED_AT, receivedAt);
        if (ipAddress != null) {
            json.put(FIELD_IP_ADDRESS, ipAddress);
        }
        if (certificateSerial != null) {
            json.put(FIELD_CERTIFICATE_SERIAL, certificateSerial);
        }
        return json;
    }

    public UUID getId() {
        return id;
    }

    public UUID getDeviceId() {
        return deviceId;
    }

    public String getMessageType() {
        return messageType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Gets the application data.
     *
     * @return A copy of the data.
     */
    public JsonObject getData() {
        return data.copy();
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getCertificateSerial() {
        return certificateSerial;
    }

    @Override
    public String toString() {
        return String.format("DeviceMessage [id: %s, device: %s, type: %s, timestamp: %s]",
                id, deviceId, messageType, timestamp);
    }

    /**
     * A builder for messages.
     */
    public static final class Builder {

        private final UUID deviceId;
        private UUID id = UUID.randomUUID();
        private String messageType = "unknown";
        private Instant timestamp;
        private JsonObject data;
        private Instant receivedAt;
        private String ipAddress;
        private String certificateSerial;

        private Builder(final UUID deviceId) {
            this.deviceId = Objects.requireNonNull(deviceId);
        }

        /**
         * Sets the message identifier.
         * <p>
         * A random identifier is used by default.
         *
         * @param value The identifier.
         * @return This builder.
         */
        public Builder id(final UUID value) {
            this.id = value;
            return this;
        }

        /**
         * Sets the application defined message type.
         *
         * @param value The type.
         * @return This builder.
         */
        public Builder messageType(final String value) {
            this.messageType = value;
            return this;
        }

        /**
         * Sets the application defined timestamp.
         *
         * @param value The timestamp.
         * @return This builder.
         */
        public Builder timestamp(final Instant value) {
            this.timestamp = value;
            return this;
        }

        /**
         * Sets the application data.
         *
         * @param value The data.
         * @return This builder.
         */
        public Builder data(final JsonObject value) {
            this.data = value;
            return this;
        }

        /**
         * Sets the time at which the message has been received.
         *
         * @param value The instant.
         * @return This builder.
         */
        public Builder receivedAt(final Instant value) {
            this.receivedAt = value;
            return this;
        }

        /**
         * Sets the IP address that the message has been sent from.
         *
         * @param value The address.
         * @return This builder.
         */
        public Builder ipAddress(final String value) {
            this.ipAddress = value;
            return this;
        }

        /**
         * Sets the serial number of the certificate that the device has authenticated with.
         *
         * @param value The serial number.
         * @return This builder.
         */
        public Builder certificateSerial(final String value) {
            this.certificateSerial = value;
            return this;
        }

        /**
         * Creates the message.
         *
         * @return The message.
         * @throws NullPointerException if a mandatory property has not been set.
         */
        public DeviceMessage build() {
            return new DeviceMessage(this);
        }
    }
}
