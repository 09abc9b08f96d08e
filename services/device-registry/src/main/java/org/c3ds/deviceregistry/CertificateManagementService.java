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

import java.math.BigDecimal;
import java.net.HttpURLConnection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.c3ds.client.ClientErrorException;
import org.c3ds.client.ServerErrorException;
import org.c3ds.client.ServiceInvocationException;
import org.c3ds.pki.CertificateAlgorithm;
import org.c3ds.pki.CertificateIssuer;
import org.c3ds.pki.UnsupportedAlgorithmException;
import org.c3ds.service.auth.Capabilities;
import org.c3ds.service.auth.ManagementUser;
import org.c3ds.util.Constants;
import org.c3ds.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Lets the owners of devices register devices, issue certificates for them,
 * download the certificate and key material and revoke devices.
 * <p>
 * All operations verify that the user may manage the device and fail with a
 * {@link ServiceInvocationException} indicating the outcome otherwise.
 */
public class CertificateManagementService {

    static final String FIELD_ALGORITHM = "algorithm";
    static final String FIELD_NAME = "name";
    static final String FIELD_DESCRIPTION = "description";
    static final String FIELD_DEVICE_TYPE = "device_type";
    static final String FIELD_LATITUDE = "latitude";
    static final String FIELD_LONGITUDE = "longitude";
    static final String FIELD_CERTIFICATE_ALGORITHM = "certificate_algorithm";

    /**
     * The number of messages included in a device summary.
     */
    static final int RECENT_MESSAGES_LIMIT = 5;

    private static final Logger LOG = LoggerFactory.getLogger(CertificateManagementService.class);

    private final Vertx vertx;
    private final DeviceRegistry registry;
    private final MessageLog messageLog;
    private final CertificateIssuer issuer;
    private final CertificateManagementConfigProperties config;
    private final Clock clock;

    /**
     * Creates a new service.
     *
     * @param vertx The vert.x instance to run key generation on.
     * @param registry The registry to read and store devices from/in.
     * @param messageLog The log to get message statistics from.
     * @param issuer The issuer to use for creating certificates.
     * @param config The configuration properties.
     * @param clock The clock to use for determining generation time and download window.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public CertificateManagementService(
            final Vertx vertx,
            final DeviceRegistry registry,
            final MessageLog messageLog,
            final CertificateIssuer issuer,
            final CertificateManagementConfigProperties config,
            final Clock clock) {

        this.vertx = Objects.requireNonNull(vertx);
        this.registry = Objects.requireNonNull(registry);
        this.messageLog = Objects.requireNonNull(messageLog);
        this.issuer = Objects.requireNonNull(issuer);
        this.config = Objects.requireNonNull(config);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Registers a new device for a user.
     * <p>
     * The device gets a random identifier and status {@link DeviceStatus#PENDING}.
     *
     * @param user The user that registers the device.
     * @param request The device's properties. Only <em>name</em> is mandatory.
     * @return A future indicating the outcome of the operation.
     *         The future will be completed with the device's summary or failed with a
     *         {@link ClientErrorException} with status 400 if the request is invalid.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<JsonObject> registerDevice(final ManagementUser user, final JsonObject request) {
        Objects.requireNonNull(user);
        Objects.requireNonNull(request);

        final Device device;
        try {
            device = deviceFromRequest(request)
                    .setId(UUID.randomUUID())
                    .setStatus(DeviceStatus.PENDING)
                    .setCreatedBy(user.getUsername());
        } catch (final ClassCastException e) {
            return Future.failedFuture(new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "Invalid device properties", e));
        } catch (final ClientErrorException e) {
            return Future.failedFuture(e);
        }
        return registry.createDevice(device)
                .onSuccess(d -> LOG.info("user [{}] registered device [{}]", user.getUsername(), d.getId()))
                .compose(this::toSummary);
    }

    private static Device deviceFromRequest(final JsonObject request) {

        final String name = Strings.trimToNull(request.getString(FIELD_NAME));
        if (name == null) {
            throw new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "Device name is required");
        }
        final Device device = new Device()
                .setName(name)
                .setDescription(Strings.trimToNull(request.getString(FIELD_DESCRIPTION)))
                .setDeviceType(Strings.trimToNull(request.getString(FIELD_DEVICE_TYPE)))
                .setLatitude(coordinate(request.getValue(FIELD_LATITUDE), FIELD_LATITUDE, 90))
                .setLongitude(coordinate(request.getValue(FIELD_LONGITUDE), FIELD_LONGITUDE, 180));
        final String algorithm = request.getString(FIELD_CERTIFICATE_ALGORITHM);
        if (algorithm != null) {
            try {
                device.setCertificateAlgorithm(CertificateAlgorithm.from(algorithm));
            } catch (final UnsupportedAlgorithmException e) {
                throw new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "Unsupported certificate algorithm", e);
            }
        }
        return device;
    }

    private static String coordinate(final Object value, final String name, final int bound) {
        if (value == null) {
            return null;
        }
        try {
            final BigDecimal coordinate = new BigDecimal(value.toString().trim());
            if (coordinate.abs().compareTo(BigDecimal.valueOf(bound)) > 0) {
                throw new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST,
                        String.format("%s must be between -%d and %d", name, bound, bound));
            }
            return coordinate.toPlainString();
        } catch (final NumberFormatException e) {
            throw new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, String.format("invalid %s", name), e);
        }
    }

    /**
     * Gets a summary of a device's state.
     *
     * @param user The user requesting the summary.
     * @param deviceId The device.
     * @return A future indicating the outcome of the operation.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<JsonObject> getDeviceSummary(final ManagementUser user, final UUID deviceId) {
        return findManagedDevice(user, deviceId).compose(this::toSummary);
    }

    /**
     * Issues a new certificate for a device.
     * <p>
     * The key pair is generated on a worker thread. If the registry rejects the certificate
     * because its serial number has been used before, issuance is retried up to the configured
     * number of attempts. The device's previous certificate is replaced and the algorithm is
     * stored as the device's certificate algorithm.
     *
     * @param user The user requesting the certificate.
     * @param deviceId The device.
     * @param algorithmName The name of the algorithm to use or {@code null} to use the device's
     *                      configured algorithm.
     * @return A future indicating the outcome of the operation.
     *         The future will be completed with information about the certificate (not containing
     *         any key material) or failed with a {@link ServiceInvocationException} with status
     *         404 if the device does not exist, 403 if the user may not manage the device or the device
     *         has been revoked or 500 if the certificate could not be issued.
     * @throws NullPointerException if user or device ID are {@code null}.
     */
    public Future<JsonObject> issueCertificate(final ManagementUser user, final UUID deviceId, final String algorithmName) {

        return findManagedDevice(user, deviceId)
                .compose(device -> {
                    if (device.getStatus() == DeviceStatus.REVOKED) {
                        return Future.failedFuture(new ClientErrorException(
                                HttpURLConnection.HTTP_FORBIDDEN, "Device has been revoked"));
                    }
                    final CertificateAlgorithm algorithm;
                    try {
                        algorithm = algorithmName == null ? device.getCertificateAlgorithm()
                                : CertificateAlgorithm.from(algorithmName);
                    } catch (final UnsupportedAlgorithmException e) {
                        LOG.debug("cannot issue certificate for device [{}]: {}", deviceId, e.getMessage());
                        return Future.failedFuture(issuanceFailed("Unsupported certificate algorithm", e));
                    }
                    return issueAndStore(device, algorithm, 1);
                })
                .map(device -> {
                    LOG.info("issued certificate [serial: {}] for device [{}] on behalf of user [{}]",
                            device.getCertificateSerial(), deviceId, user.getUsername());
                    return toIssuanceInfo(device);
                });
    }

    private Future<Device> issueAndStore(final Device device, final CertificateAlgorithm algorithm, final int attempt) {

        return vertx.executeBlocking(() -> issuer.issue(device.getId(), algorithm), false)
                .recover(t -> {
                    LOG.warn("cannot issue certificate for device [{}]", device.getId(), t);
                    return Future.failedFuture(issuanceFailed(null, t));
                })
                .compose(issued -> registry.replaceCertificate(
                        device.getId(),
                        algorithm,
                        DeviceCertificate.from(issued, Instant.now(clock))))
                .recover(t -> {
                    if (ServiceInvocationException.extractStatusCode(t) != HttpURLConnection.HTTP_CONFLICT) {
                        return Future.failedFuture(t);
                    } else if (attempt < config.getIssuanceAttempts()) {
                        LOG.info("serial number collision for device [{}], retrying [attempt {} of {}]",
                                device.getId(), attempt + 1, config.getIssuanceAttempts());
                        return issueAndStore(device, algorithm, attempt + 1);
                    } else {
                        LOG.warn("giving up issuing certificate for device [{}] after {} attempts",
                                device.getId(), attempt);
                        return Future.failedFuture(issuanceFailed(null, t));
                    }
                });
    }

    private static ServerErrorException issuanceFailed(final String clientFacingMessage, final Throwable cause) {
        final ServerErrorException e = new ServerErrorException(
                HttpURLConnection.HTTP_INTERNAL_ERROR, "cannot issue certificate", cause);
        e.setClientFacingMessage(clientFacingMessage);
        return e;
    }

    /**
     * Gets a device's certificate for download.
     *
     * @param user The user requesting the certificate.
     * @param deviceId The device.
     * @return A future indicating the outcome of the operation.
     *         The future will be failed with a {@link ClientErrorException} with status 404
     *         if no certificate is available or 410 if the download window has closed.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<PemDownload> downloadCertificate(final ManagementUser user, final UUID deviceId) {
        return download(user, deviceId, false);
    }

    /**
     * Gets a device's private key for download.
     * <p>
     * If configured, the key is deleted when it is requested after the download window has closed.
     *
     * @param user The user requesting the key.
     * @param deviceId The device.
     * @return A future indicating the outcome of the operation.
     *         The future will be failed with a {@link ClientErrorException} with status 404
     *         if no key is available or 410 if the download window has closed.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<PemDownload> downloadPrivateKey(final ManagementUser user, final UUID deviceId) {
        return download(user, deviceId, true);
    }

    private Future<PemDownload> download(final ManagementUser user, final UUID deviceId, final boolean privateKey) {

        return findManagedDevice(user, deviceId).compose(device -> {
            final DeviceCertificate certificate = device.getCertificate();
            if (certificate == null) {
                return Future.failedFuture(new ClientErrorException(HttpURLConnection.HTTP_NOT_FOUND,
                        "No certificate available"));
            }
            if (!certificate.isDownloadWindowOpen(Instant.now(clock), config.getDownloadWindow())) {
                LOG.debug("download window for device [{}] has closed", deviceId);
                final ClientErrorException gone = new ClientErrorException(HttpURLConnection.HTTP_GONE,
                        "Download window has closed");
                return purgePrivateKey(device).<PemDownload> transform(ar -> Future.failedFuture(gone));
            }
            final String material = privateKey ? certificate.getPrivateKeyPem() : certificate.getCertificatePem();
            if (material == null) {
                return Future.failedFuture(new ClientErrorException(HttpURLConnection.HTTP_NOT_FOUND,
                        privateKey ? "No private key available" : "No certificate available"));
            }
            LOG.debug("user [{}] downloads {} of device [{}]", user.getUsername(),
                    privateKey ? "private key" : "certificate", deviceId);
            return Future.succeededFuture(new PemDownload(deviceId + (privateKey ? ".key" : ".crt"), material));
        });
    }

    private Future<Void> purgePrivateKey(final Device device) {

        if (!config.isPurgeExpiredPrivateKeys() || device.getCertificate().getPrivateKeyPem() == null) {
            return Future.succeededFuture();
        }
        return registry.removePrivateKey(device.getId(), device.getCertificateSerial())
                .onSuccess(d -> LOG.info("purged private key of device [{}]", d.getId()))
                .onFailure(t -> LOG.warn("cannot purge private key of device [{}]", device.getId(), t))
                .mapEmpty();
    }

    /**
     * Revokes a device.
     * <p>
     * Revoking a device that has been revoked already succeeds.
     *
     * @param user The user revoking the device.
     * @param deviceId The device.
     * @return A future indicating the outcome of the operation.
     *         The future will be completed with the device's summary or failed with a
     *         {@link ClientErrorException} with status 409 if the device's status does
     *         not allow revocation.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public Future<JsonObject> revokeDevice(final ManagementUser user, final UUID deviceId) {

        return findManagedDevice(user, deviceId)
                .compose(device -> {
                    if (device.getStatus() == DeviceStatus.REVOKED) {
                        LOG.debug("device [{}] has been revoked already", deviceId);
                        return Future.succeededFuture(device);
                    } else if (!device.getStatus().isRevocable()) {
                        return Future.failedFuture(new ClientErrorException(HttpURLConnection.HTTP_CONFLICT,
                                String.format("Device with status %s cannot be revoked", device.getStatus())));
                    } else {
                        return registry.updateStatus(deviceId, DeviceStatus.REVOKED)
                                .onSuccess(d -> LOG.info("user [{}] revoked device [{}]", user.getUsername(), deviceId));
                    }
                })
                .compose(this::toSummary);
    }

    private Future<Device> findManagedDevice(final ManagementUser user, final UUID deviceId) {
        Objects.requireNonNull(user);
        Objects.requireNonNull(deviceId);

        return registry.findDevice(deviceId)
                .compose(device -> {
                    try {
                        Capabilities.checkMayManage(user, device.getCreatedBy());
                        return Future.succeededFuture(device);
                    } catch (final ClientErrorException e) {
                        LOG.debug("user [{}] may not manage device [{}]", user.getUsername(), deviceId);
                        return Future.failedFuture(e);
                    }
                });
    }

    private JsonObject toIssuanceInfo(final Device device) {
        final DeviceCertificate certificate = device.getCertificate();
        return new JsonObject()
                .put(Constants.FIELD_DEVICE_ID, device.getId().toString())
                .put("serial", certificate.getSerial())
                .put(FIELD_ALGORITHM, device.getCertificateAlgorithm().name())
                .put("not_after", certificate.getNotAfter())
                .put("generated_at", certificate.getGeneratedAt())
                .put("download_expires_at", certificate.getDownloadExpiresAt(config.getDownloadWindow()));
    }

    private Future<JsonObject> toSummary(final Device device) {

        return Future.all(
                    messageLog.countMessages(device.getId()),
                    messageLog.findRecentMessages(device.getId(), RECENT_MESSAGES_LIMIT))
                .map(result -> {
                    final Long count = result.resultAt(0);
                    final List<DeviceMessage> recent = result.resultAt(1);
                    return toSummary(device, count, recent);
                });
    }

    private JsonObject toSummary(final Device device, final long messageCount, final List<DeviceMessage> recent) {

        final DeviceCertificate certificate = device.getCertificate();
        final JsonArray recentMessages = new JsonArray();
        recent.forEach(msg -> recentMessages.add(new JsonObject()
                .put("id", msg.getId().toString())
                .put("message_type", msg.getMessageType())
                .put("timestamp", msg.getTimestamp())
                .put("received_at", msg.getReceivedAt())
                .put("data", msg.getData())));

        return new JsonObject()
                .put("id", device.getId().toString())
                .put(FIELD_NAME, device.getName())
                .put(FIELD_DESCRIPTION, device.getDescription())
                .put(FIELD_DEVICE_TYPE, device.getDeviceType())
                .put(FIELD_LATITUDE, device.getLatitude())
                .put(FIELD_LONGITUDE, device.getLongitude())
                .put("status", device.getStatus().name())
                .put("status_display", device.getStatus().getDisplayName())
                .put(FIELD_CERTIFICATE_ALGORITHM, device.getCertificateAlgorithm().name())
                .put("algorithm_display", device.getCertificateAlgorithm().getDisplayName())
                .put("certificate_serial", device.getCertificateSerial())
                .put("certificate_expiry", certificate == null ? null : certificate.getNotAfter())
                .put("certificate_available", certificate != null
                        && certificate.isDownloadWindowOpen(Instant.now(clock), config.getDownloadWindow()))
                .put("created_by", device.getCreatedBy())
                .put("created_at", device.getCreatedAt())
                .put("updated_at", device.getUpdatedAt())
                .put("message_count", messageCount)
                .put("recent_messages", recentMessages);
    }
}
