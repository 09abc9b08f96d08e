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

package org.c3ds.application;

import java.nio.file.Path;

import picocli.CommandLine;

/**
 * The option for specifying the configuration file.
 *
 */
public class ConfigFileOptions {

    @CommandLine.Option(
            names = { "-c", "--config" },
            description = {
                "The YAML file to read the configuration from",
                "If not set, file " + AppConfiguration.DEFAULT_CONFIG_FILE + " is read from the working directory if it exists" },
            paramLabel = "FILE")
    Path configFile;

    /**
     * Gets the configuration file.
     *
     * @return The file or {@code null} if not set.
     */
    public Path getConfigFile() {
        return configFile;
    }
}
