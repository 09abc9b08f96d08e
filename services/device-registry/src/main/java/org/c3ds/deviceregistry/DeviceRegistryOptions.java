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

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.ConfigMapping.NamingStrategy;
import io.smallrye.config.WithDefault;

/**
 * Configuration options for the file based device registry and message log.
 *
 */
@ConfigMapping(prefix = "c3ds.registry", namingStrategy = NamingStrategy.VERBATIM)
public interface DeviceRegistryOptions {

    /**
     * Gets the path to the file that the registry's content is persisted to.
     *
     * @return The path or an empty optional if devices are kept in memory only.
     */
    Optional<String> filename();

    /**
     * Checks if changes to the registry are written to the file.
     *
     * @return {@code true} if changes are persisted.
     */
    @WithDefault("true")
    boolean saveToFile();

    /**
     * Gets the path to the file that messages are appended to.
     *
     * @return The path or an empty optional if messages are kept in memory only.
     */
    Optional<String> messageLogFilename();
}
