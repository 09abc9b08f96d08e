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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.c3ds.client.ServerErrorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * A message log that appends messages to a file containing one JSON object per line.
 * <p>
 * The file is the only complete record of the messages. In memory, the log keeps
 * the number of messages per device and a bounded number of each device's most recent
 * messages. If no file name is configured, messages are not persisted at all.
 */
public class FileBasedMessageLog implements MessageLog {

    /**
     * The default number of messages per device that are kept in memory.
     */
    public static final int DEFAULT_RECENT_MESSAGES_CAPACITY = 20;

    private static final Logger LOG = LoggerFactory.getLogger(FileBasedMessageLog.class);
    private static final Comparator<DeviceMessage> NEWEST_FIRST = Comparator
            .comparing(DeviceMessage::getTimestamp)
            .thenComparing(DeviceMessage::getReceivedAt)
            .reversed();

    private final ConcurrentMap<UUID, DeviceHistory> histories = new ConcurrentHashMap<>();
    private final Vertx vertx;
    private final String filename;
    private final int recentMessagesCapacity;

    private AsyncFile file;

    /**
     * Creates a new message log that keeps {@value #DEFAULT_RECENT_MESSAGES_CAPACITY}
     * messages per device in memory.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The configuration properties.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public FileBasedMessageLog(final Vertx vertx, final DeviceRegistryConfigProperties config) {
        this(vertx, config, DEFAULT_RECENT_MESSAGES_CAPACITY);
    }

    /**
     * Creates a new message log.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The configuration properties.
     * @param recentMessagesCapacity The number of messages per device to keep in memory.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if capacity is not positive.
     */
    public FileBasedMessageLog(
            final Vertx vertx,
            final DeviceRegistryConfigProperties config,
            final int recentMessagesCapacity) {

        this.vertx = Objects.requireNonNull(vertx);
        this.filename = Objects.requireNonNull(config).getMessageLogFilename();
        if (recentMessagesCapacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.recentMessagesCapacity = recentMessagesCapacity;
    }

    @Override
    public Future<Void> start() {

        if (filename == null) {
            LOG.info("message log filename is not set, messages will not be persisted");
            return Future.succeededFuture();
        }
        if (file != null) {
            return Future.succeededFuture();
        }
        return vertx.fileSystem().exists(filename)
            .compose(exists -> exists ? vertx.fileSystem().readFile(filename).map(this::addAll) : Future.succeededFuture(0))
            .compose(count -> {
                LOG.info("loaded {} messages from file [{}]", count, filename);
                return vertx.fileSystem().open(filename, new OpenOptions().setAppend(true).setCreate(true).setWrite(true));
            })
            .onSuccess(asyncFile -> file = asyncFile)
            .onFailure(t -> LOG.error("cannot open message log file [{}]", filename, t))
            .mapEmpty();
    }

    private int addAll(final Buffer content) {
        int count = 0;
        for (final String line : content.toString().split("\n")) {
            if (!line.isBlank()) {
                try {
                    addToMemory(DeviceMessage.fromJson(new JsonObject(line)));
                    count++;
                } catch (final DecodeException | IllegalArgumentException | NullPointerException | ClassCastException e) {
                    LOG.warn("skipping malformed entry in message log file [{}]: {}", filename, e.getMessage());
                }
            }
        }
        return count;
    }

    private void addToMemory(final DeviceMessage message) {
        histories.computeIfAbsent(message.getDeviceId(), id -> new DeviceHistory()).add(message);
    }

    @Override
    public Future<Void> stop() {
        if (file == null) {
            return Future.succeededFuture();
        }
        final AsyncFile toClose = file;
        file = null;
        return toClose.close();
    }

    @Override
    public Future<DeviceMessage> append(final DeviceMessage message) {
        Objects.requireNonNull(message);

        if (filename == null) {
            addToMemory(message);
            return Future.succeededFuture(message);
        }
        if (file == null) {
            return Future.failedFuture(new ServerErrorException(
                    HttpURLConnection.HTTP_UNAVAILABLE, "message log is not open"));
        }
        return file.write(Buffer.buffer(message.toJson().encode()).appendString("\n"))
                .recover(t -> {
                    LOG.warn("cannot append message [{}] to file [{}]", message.getId(), filename, t);
                    return Future.failedFuture(new ServerErrorException(
                            HttpURLConnection.HTTP_INTERNAL_ERROR, "cannot write message log", t));
                })
                .map(ok -> {
                    addToMemory(message);
                    LOG.debug("appended message [id: {}, device: {}]", message.getId(), message.getDeviceId());
                    return message;
                });
    }

    @Override
    public Future<Long> countMessages(final UUID deviceId) {
        Objects.requireNonNull(deviceId);
        final DeviceHistory history = histories.get(deviceId);
        return Future.succeededFuture(history == null ? 0L : history.count());
    }

    /**
     * {@inheritDoc}
     * <p>
     * At most as many messages as this log keeps in memory per device are returned.
     */
    @Override
    public Future<List<DeviceMessage>> findRecentMessages(final UUID deviceId, final int limit) {
        Objects.requireNonNull(deviceId);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        final DeviceHistory history = histories.get(deviceId);
        return Future.succeededFuture(history == null ? List.of() : history.newest(limit));
    }

    /**
     * The number of messages of a device and its most recent messages, newest first.
     */
    private final class DeviceHistory {

        private final List<DeviceMessage> recent = new ArrayList<>();
        private long count;

        synchronized void add(final DeviceMessage message) {
            count++;
            int index = 0;
            while (index < recent.size() && NEWEST_FIRST.compare(recent.get(index), message) <= 0) {
                index++;
            }
            if (index < recentMessagesCapacity) {
                recent.add(index, message);
                if (recent.size() > recentMessagesCapacity) {
                    recent.remove(recent.size() - 1);
                }
            }
        }

        synchronized long count() {
            return count;
        }

        synchronized List<DeviceMessage> newest(final int limit) {
            return new ArrayList<>(recent.subList(0, Math.min(limit, recent.size())));
        }
    }
}
