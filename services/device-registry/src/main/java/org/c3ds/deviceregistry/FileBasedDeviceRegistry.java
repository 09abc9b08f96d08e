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

import java.net.HttpURLConnection;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.c3ds.client.ClientErrorException;
import org.c3ds.pki.CertificateAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * A device registry that keeps all data in memory but is backed by a file.
 * <p>
 * The registry's content is written to the file every 3 seconds if it has changed
 * and when the registry is stopped.
 */
public class FileBasedDeviceRegistry implements DeviceRegistry {

    static final String FIELD_DEVICES = "devices";
    static final String FIELD_USED_SERIALS = "used_serials";

    private static final Logger LOG = LoggerFactory.getLogger(FileBasedDeviceRegistry.class);
    private static final long SAVE_INTERVAL_MILLIS = 3000;

    private final ConcurrentMap<UUID, Device> devices = new ConcurrentHashMap<>();
    // every serial number that has ever been assigned to a device
    private final Set<String> usedSerials = ConcurrentHashMap.newKeySet();
    private final Object serialLock = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean dirty = new AtomicBoolean(false);
    private final Vertx vertx;
    private final DeviceRegistryConfigProperties config;
    private final Clock clock;

    private long saveTimerId = -1;

    /**
     * Creates a new registry.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The configuration properties.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public FileBasedDeviceRegistry(final Vertx vertx, final DeviceRegistryConfigProperties config) {
        this(vertx, config, Clock.systemUTC());
    }

    /**
     * Creates a new registry.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The configuration properties.
     * @param clock The clock to use for setting creation and update timestamps.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public FileBasedDeviceRegistry(
            final Vertx vertx,
            final DeviceRegistryConfigProperties config,
            final Clock clock) {
        this.vertx = Objects.requireNonNull(vertx);
        this.config = Objects.requireNonNull(config);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public Future<Void> start() {

        final Promise<Void> result = Promise.promise();

        if (running.compareAndSet(false, true)) {

            if (config.getFilename() == null) {
                LOG.info("device registry filename is not set, devices will be kept in memory only");
                result.complete();
            } else {
                checkFileExists(config.isSaveToFile())
                    .compose(ok -> loadDevices())
                    .onSuccess(ok -> {
                        if (config.isSaveToFile()) {
                            LOG.info("saving devices to file every 3 seconds");
                            saveTimerId = vertx.setPeriodic(SAVE_INTERVAL_MILLIS, tid -> saveToFile());
                        } else {
                            LOG.info("persistence is disabled, will not save devices to file");
                        }
                    })
                    .onFailure(t -> {
                        LOG.error("failed to start up device registry", t);
                        running.set(false);
                    })
                    .onComplete(result);
            }
        } else {
            result.complete();
        }
        return result.future();
    }

    Future<Void> loadDevices() {

        final Promise<Buffer> readResult = Promise.promise();
        vertx.fileSystem().readFile(config.getFilename(), readResult);
        return readResult.future()
                .compose(this::addAll)
                .recover(t -> {
                    LOG.debug("cannot load devices from file [{}]: {}", config.getFilename(), t.getMessage());
                    return Future.succeededFuture();
                });
    }

    private Future<Void> checkFileExists(final boolean createIfMissing) {

        final Promise<Void> result = Promise.promise();
        if (vertx.fileSystem().existsBlocking(config.getFilename())) {
            result.complete();
        } else if (createIfMissing) {
            vertx.fileSystem().createFile(config.getFilename(), result);
        } else {
            LOG.debug("no such file [{}]", config.getFilename());
            result.complete();
        }
        return result.future();
    }

    private Future<Void> addAll(final Buffer content) {

        if (content.length() == 0) {
            LOG.info("device registry file [{}] is empty", config.getFilename());
            return Future.succeededFuture();
        }
        try {
            final JsonObject registry = content.toJsonObject();
            int deviceCount = 0;
            for (final Object obj : registry.getJsonArray(FIELD_DEVICES, new JsonArray())) {
                if (obj instanceof JsonObject entry) {
                    final Device device = mapFromStoredJson(entry);
                    if (device.getId() == null) {
                        LOG.debug("device without id, skipping!");
                    } else {
                        devices.put(device.getId(), device);
                        Optional.ofNullable(device.getCertificateSerial()).ifPresent(usedSerials::add);
                        deviceCount++;
                    }
                }
            }
            for (final Object serial : registry.getJsonArray(FIELD_USED_SERIALS, new JsonArray())) {
                if (serial instanceof String s) {
                    usedSerials.add(s);
                }
            }
            LOG.info("successfully loaded {} devices from file [{}]", deviceCount, config.getFilename());
            return Future.succeededFuture();
        } catch (final DecodeException | IllegalArgumentException | ClassCastException e) {
            LOG.warn("cannot read malformed JSON from device registry file [{}]", config.getFilename());
            return Future.failedFuture(e);
        }
    }

    private static Device mapFromStoredJson(final JsonObject json) {
        // unsupported field, but used in stored data as explanation
        json.remove("comment");
        return json.mapTo(Device.class);
    }

    @Override
    public Future<Void> stop() {

        final Promise<Void> result = Promise.promise();

        if (running.compareAndSet(true, false)) {
            if (saveTimerId != -1) {
                vertx.cancelTimer(saveTimerId);
                saveTimerId = -1;
            }
            saveToFile().onComplete(result);
        } else {
            result.complete();
        }
        return result.future();
    }

    Future<Void> saveToFile() {

        if (config.getFilename() == null || !config.isSaveToFile()) {
            return Future.succeededFuture();
        }

        if (!dirty.get()) {
            LOG.trace("registry does not need to be persisted");
            return Future.succeededFuture();
        }

        return checkFileExists(true).compose(s -> {
            // reset before taking the snapshot so that concurrent changes are not lost
            dirty.set(false);
            final JsonArray deviceArray = new JsonArray();
            devices.values().forEach(device -> deviceArray.add(JsonObject.mapFrom(device)));
            final JsonObject registry = new JsonObject()
                    .put(FIELD_DEVICES, deviceArray)
                    .put(FIELD_USED_SERIALS, new JsonArray(usedSerials.stream().sorted().toList()));

            final Promise<Void> writeHandler = Promise.promise();
            vertx.fileSystem().writeFile(config.getFilename(), Buffer.buffer(registry.encodePrettily()), writeHandler);
            return writeHandler.future().map(ok -> {
                LOG.trace("successfully wrote {} devices to file {}", deviceArray.size(), config.getFilename());
                return (Void) null;
            }).otherwise(t -> {
                dirty.set(true);
                LOG.warn("could not write devices to file {}", config.getFilename(), t);
                return (Void) null;
            });
        });
    }

    private static ClientErrorException notFound(final UUID deviceId) {
        LOG.debug("no such device [{}]", deviceId);
        return new ClientErrorException(HttpURLConnection.HTTP_NOT_FOUND, "Device not found");
    }

    @Override
    public Future<Device> findDevice(final UUID deviceId) {
        Objects.requireNonNull(deviceId);

        return Optional.ofNullable(devices.get(deviceId))
                .map(device -> Future.succeededFuture(new Device(device)))
                .orElseGet(() -> Future.failedFuture(notFound(deviceId)));
    }

    @Override
    public Future<Device> createDevice(final Device device) {
        Objects.requireNonNull(device);
        Objects.requireNonNull(device.getId());

        final Instant now = Instant.now(clock);
        final Device newDevice = new Device(device)
                .setCreatedAt(now)
                .setUpdatedAt(now);
        synchronized (serialLock) {
            final String serial = newDevice.getCertificateSerial();
            if (serial != null && usedSerials.contains(serial)) {
                return Future.failedFuture(serialInUse(serial));
            }
            if (devices.putIfAbsent(newDevice.getId(), newDevice) != null) {
                LOG.debug("device [{}] already exists", newDevice.getId());
                return Future.failedFuture(new ClientErrorException(
                        HttpURLConnection.HTTP_CONFLICT, "Device already exists"));
            }
            if (serial != null) {
                usedSerials.add(serial);
            }
        }
        dirty.set(true);
        LOG.debug("created device [{}]", newDevice.getId());
        return Future.succeededFuture(new Device(newDevice));
    }

    @Override
    public Future<Device> replaceCertificate(
            final UUID deviceId,
            final CertificateAlgorithm algorithm,
            final DeviceCertificate certificate) {

        Objects.requireNonNull(deviceId);
        Objects.requireNonNull(algorithm);
        Objects.requireNonNull(certificate);
        Objects.requireNonNull(certificate.getSerial());

        final String serial = certificate.getSerial();
        try {
            final Device updated;
            synchronized (serialLock) {
                if (usedSerials.contains(serial)) {
                    return Future.failedFuture(serialInUse(serial));
                }
                updated = devices.computeIfPresent(deviceId, (id, existing) -> {
                    if (existing.getStatus().isTerminal()) {
                        LOG.debug("refusing to assign certificate to device [{}] with status {}",
                                deviceId, existing.getStatus());
                        throw new ClientErrorException(HttpURLConnection.HTTP_FORBIDDEN, "Device has been revoked");
                    }
                    return new Device(existing)
                            .setCertificateAlgorithm(algorithm)
                            .setCertificate(new DeviceCertificate(certificate))
                            .setUpdatedAt(Instant.now(clock));
                });
                if (updated != null) {
                    usedSerials.add(serial);
                }
            }
            if (updated == null) {
                return Future.failedFuture(notFound(deviceId));
            }
            dirty.set(true);
            LOG.debug("assigned certificate [serial: {}] to device [{}]", serial, deviceId);
            return Future.succeededFuture(new Device(updated));
        } catch (final ClientErrorException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<Device> removePrivateKey(final UUID deviceId, final String serial) {
        Objects.requireNonNull(deviceId);
        Objects.requireNonNull(serial);

        final Device updated = devices.computeIfPresent(deviceId, (id, existing) -> {
            final DeviceCertificate certificate = existing.getCertificate();
            if (certificate == null || !serial.equals(certificate.getSerial())
                    || certificate.getPrivateKeyPem() == null) {
                return existing;
            }
            dirty.set(true);
            final Device purged = new Device(existing).setUpdatedAt(Instant.now(clock));
            purged.getCertificate().setPrivateKeyPem(null);
            return purged;
        });
        if (updated == null) {
            return Future.failedFuture(notFound(deviceId));
        }
        return Future.succeededFuture(new Device(updated));
    }

    private static ClientErrorException serialInUse(final String serial) {
        LOG.debug("certificate serial number [{}] has been used before", serial);
        return new ClientErrorException(HttpURLConnection.HTTP_CONFLICT, "Certificate serial number is not unique");
    }

    @Override
    public Future<Device> updateStatus(final UUID deviceId, final DeviceStatus status) {
        Objects.requireNonNull(deviceId);
        Objects.requireNonNull(status);

        try {
            final Device updated = devices.computeIfPresent(deviceId, (id, existing) -> {
                if (existing.getStatus() == status) {
                    return existing;
                }
                if (existing.getStatus().isTerminal()) {
                    throw new ClientErrorException(HttpURLConnection.HTTP_CONFLICT,
                            String.format("Device status %s cannot be changed", existing.getStatus()));
                }
                LOG.debug("changing status of device [{}] from {} to {}", deviceId, existing.getStatus(), status);
                dirty.set(true);
                return new Device(existing).setStatus(status).setUpdatedAt(Instant.now(clock));
            });
            if (updated == null) {
                return Future.failedFuture(notFound(deviceId));
            }
            return Future.succeededFuture(new Device(updated));
        } catch (final ClientErrorException e) {
            return Future.failedFuture(e);
        }
    }
}
