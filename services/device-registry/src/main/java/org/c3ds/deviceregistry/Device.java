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

import org.c3ds.pki.CertificateAlgorithm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Device Information.
 */
@JsonInclude(value = Include.NON_NULL)
public class Device {

    @JsonProperty("id")
    private UUID id;
    @JsonProperty("name")
    private String name;
    @JsonProperty("description")
    private String description;
    @JsonProperty("device_type")
    private String deviceType;
    @JsonProperty("latitude")
    private String latitude;
    @JsonProperty("longitude")
    private String longitude;
    @JsonProperty("status")
    private DeviceStatus status = DeviceStatus.PENDING;
    @JsonProperty("certificate_algorithm")
    private CertificateAlgorithm certificateAlgorithm = CertificateAlgorithm.DEFAULT;
    @JsonProperty("certificate")
    private DeviceCertificate certificate;
    @JsonProperty("created_by")
    private String createdBy;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("updated_at")
    private Instant updatedAt;

    /**
     * Creates a new Device instance.
     */
    public Device() {
    }

    /**
     * Creates a new instance cloned from an existing instance.
     *
     * @param other The device to copy from.
     * @throws NullPointerException if other is {@code null}.
     */
    public Device(final Device other) {
        Objects.requireNonNull(other);
        this.id = other.id;
        this.name = other.name;
        this.description = other.description;
        this.deviceType = other.deviceType;
        this.latitude = other.latitude;
        this.longitude = other.longitude;
        this.status = other.status;
        this.certificateAlgorithm = other.certificateAlgorithm;
        if (other.certificate != null) {
            this.certificate = new DeviceCertificate(other.certificate);
        }
        this.createdBy = other.createdBy;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
    }

    public UUID getId() {
        return id;
    }

    /**
     * Sets the device identifier.
     *
     * @param id The identifier.
     * @return A reference to this for fluent use.
     */
    public Device setId(final UUID id) {
        this.id = id;
        return this;
    }

    public String getName() {
        return name;
    }

    /**
     * Sets the device's friendly name.
     *
     * @param name The name.
     * @return A reference to this for fluent use.
     */
    public Device setName(final String name) {
        this.name = name;
        return this;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Sets the device's description.
     *
     * @param description The description.
     * @return A reference to this for fluent use.
     */
    public Device setDescription(final String description) {
        this.description = description;
        return this;
    }

    public String getDeviceType() {
        return deviceType;
    }

    /**
     * Sets the type of device, e.g. <em>ESP8266</em>.
     *
     * @param deviceType The type.
     * @return A reference to this for fluent use.
     */
    public Device setDeviceType(final String deviceType) {
        this.deviceType = deviceType;
        return this;
    }

    public String getLatitude() {
        return latitude;
    }

    /**
     * Sets the latitude of the device's location.
     *
     * @param latitude The latitude.
     * @return A reference to this for fluent use.
     */
    public Device setLatitude(final String latitude) {
        this.latitude = latitude;
        return this;
    }

    public String getLongitude() {
        return longitude;
    }

    /**
     * Sets the longitude of the device's location.
     *
     * @param longitude The longitude.
     * @return A reference to this for fluent use.
     */
    public Device setLongitude(final String longitude) {
        this.longitude = longitude;
        return this;
    }

    public DeviceStatus getStatus() {
        return status;
    }

    /**
     * Sets the device's status.
     *
     * @param status The status.
     * @return A reference to this for fluent use.
     * @throws NullPointerException if status is {@code null}.
     */
    public Device setStatus(final DeviceStatus status) {
        this.status = Objects.requireNonNull(status);
        return this;
    }

    public CertificateAlgorithm getCertificateAlgorithm() {
        return certificateAlgorithm;
    }

    /**
     * Sets the algorithm to use for the device's certificates.
     *
     * @param certificateAlgorithm The algorithm.
     * @return A reference to this for fluent use.
     * @throws NullPointerException if algorithm is {@code null}.
     */
    public Device setCertificateAlgorithm(final CertificateAlgorithm certificateAlgorithm) {
        this.certificateAlgorithm = Objects.requireNonNull(certificateAlgorithm);
        return this;
    }

    public DeviceCertificate getCertificate() {
        return certificate;
    }

    /**
     * Sets the device's current certificate.
     *
     * @param certificate The certificate or {@code null} if none has been issued yet.
     * @return A reference to this for fluent use.
     */
    public Device setCertificate(final DeviceCertificate certificate) {
        this.certificate = certificate;
        return this;
    }

    /**
     * Gets the serial number of the device's current certificate.
     *
     * @return The serial number or {@code null} if no certificate has been issued.
     */
    @JsonIgnore
    public String getCertificateSerial() {
        return certificate == null ? null : certificate.getSerial();
    }

    public String getCreatedBy() {
        return createdBy;
    }

    /**
     * Sets the name of the user that has registered the device.
     *
     * @param createdBy The user name.
     * @return A reference to this for fluent use.
     */
    public Device setCreatedBy(final String createdBy) {
        this.createdBy = createdBy;
        return this;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Sets the creation time.
     *
     * @param createdAt The instant.
     * @return A reference to this for fluent use.
     */
    public Device setCreatedAt(final Instant createdAt) {
        this.createdAt = createdAt;
        return this;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Sets the time of the last modification.
     *
     * @param updatedAt The instant.
     * @return A reference to this for fluent use.
     */
    public Device setUpdatedAt(final Instant updatedAt) {
        this.updatedAt = updatedAt;
        return this;
    }

    @Override
    public String toString() {
        return String.format("%s (%s)", name, status);
    }
}
