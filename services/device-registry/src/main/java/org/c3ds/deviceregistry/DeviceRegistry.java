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

import java.util.UUID;

import org.c3ds.pki.CertificateAlgorithm;
import org.c3ds.util.Lifecycle;

import io.vertx.core.Future;

/**
 * A store for device records.
 * <p>
 * Implementations hand out copies of the stored records, so modifying a returned
 * {@link Device} has no effect on the registry.
 * Failed futures carry a {@link org.c3ds.client.ServiceInvocationException} that
 * indicates the outcome.
 */
public interface DeviceRegistry extends Lifecycle {

    /**
     * Gets a device.
     *
     * @param deviceId The identifier of the device.
     * @return A future indicating the outcome of the operation.
     *         The future will be failed with a {@code ClientErrorException} with status 404
     *         if no such device exists.
     * @throws NullPointerException if device ID is {@code null}.
     */
    Future<Device> findDevice(UUID deviceId);

    /**
     * Registers a new device.
     * <p>
     * The creation and update timestamps are set by the registry.
     *
     * @param device The device. Its identifier must be set.
     * @return A future indicating the outcome of the operation.
     *         The future will be completed with the stored device or failed with a
     *         {@code ClientErrorException} with status 409 if a device with the same
     *         identifier exists already.
     * @throws NullPointerException if device or its ID is {@code null}.
     */
    Future<Device> createDevice(Device device);

    /**
     * Assigns a new certificate to an existing device.
     * <p>
     * The certificate replaces the device's current one, which is thereby superseded.
     * All other properties of the stored record, including its status, are kept.
     * A certificate serial number can only be assigned once. Assigning a serial
     * number that any device has used before fails the operation.
     *
     * @param deviceId The identifier of the device.
     * @param algorithm The algorithm of the certificate's key.
     * @param certificate The certificate.
     * @return A future indicating the outcome of the operation.
     *         The future will be completed with the stored device or failed with a
     *         {@code ClientErrorException} with status 404 if no such device exists,
     *         403 if the device has been revoked or 409 if the certificate's serial number
     *         is not unique.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    Future<Device> replaceCertificate(UUID deviceId, CertificateAlgorithm algorithm, DeviceCertificate certificate);

    /**
     * Removes the private key from a device's certificate.
     * <p>
     * The key is only removed if the device's current certificate has the given serial number.
     *
     * @param deviceId The identifier of the device.
     * @param serial The serial number of the certificate.
     * @return A future indicating the outcome of the operation.
     *         The future will be completed with the stored device or failed with a
     *         {@code ClientErrorException} with status 404 if no such device exists.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    Future<Device> removePrivateKey(UUID deviceId, String serial);

    /**
     * Sets the status of a device.
     *
     * @param deviceId The identifier of the device.
     * @param status The new status.
     * @return A future indicating the outcome of the operation.
     *         The future will be completed with the stored device or failed with a
     *         {@code ClientErrorException} with status 404 if no such device exists
     *         or 409 if the device is in a terminal state that differs from the given one.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    Future<Device> updateStatus(UUID deviceId, DeviceStatus status);
}
