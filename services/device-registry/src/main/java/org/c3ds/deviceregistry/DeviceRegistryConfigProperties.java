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

import java.util.Objects;

/**
 * Configuration properties for the file based device registry and message log.
 *
 */
public final class DeviceRegistryConfigProperties {

    private String filename;
    private boolean saveToFile = true;
    private String messageLogFilename;

    /**
     * Creates new properties using default values.
     */
    public DeviceRegistryConfigProperties() {
        super();
    }

    /**
     * Creates new properties from existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options are {@code null}.
     */
    public DeviceRegistryConfigProperties(final DeviceRegistryOptions options) {
        Objects.requireNonNull(options);
        this.filename = options.filename().orElse(null);
        this.saveToFile = options.saveToFile();
        this.messageLogFilename = options.messageLogFilename().orElse(null);
    }

    public String getFilename() {
        return filename;
    }

    /**
     * Sets the path to the file that the registry's content is persisted to.
     *
     * @param filename The path or {@code null} if devices should be kept in memory only.
     */
    public void setFilename(final String filename) {
        this.filename = filename;
    }

    public boolean isSaveToFile() {
        return saveToFile;
    }

    public String getMessageLogFilename() {
        return messageLogFilename;
    }

    /**
     * Sets the path to the file that messages are appended to.
     *
     * @param messageLogFilename The path or {@code null} if messages should be kept in memory only.
     */
    public void setMessageLogFilename(final String messageLogFilename) {
        this.messageLogFilename = messageLogFilename;
    }
}
