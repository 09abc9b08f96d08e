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

import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.c3ds.config.ServerOptions;
import org.c3ds.deviceregistry.CertificateManagementOptions;
import org.c3ds.deviceregistry.DeviceRegistryOptions;
import org.c3ds.pki.CertificateAuthorityOptions;
import org.c3ds.service.auth.ManagementUserOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.source.yaml.YamlConfigSource;

/**
 * The application's configuration.
 * <p>
 * Properties are read from a YAML file. Environment variables and system properties
 * override the values from the file, e.g. {@code C3DS_SERVER_PORT=9090} overrides
 * property {@code c3ds.server.port}.
 */
public final class AppConfiguration {

    /**
     * The name of the YAML file that is read from the working directory if no file
     * has been specified explicitly.
     */
    public static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private static final Logger LOG = LoggerFactory.getLogger(AppConfiguration.class);

    private final SmallRyeConfig config;

    private AppConfiguration(final SmallRyeConfig config) {
        this.config = config;
    }

    /**
     * Loads the configuration.
     *
     * @param configFile The YAML file to read or {@code null} if the default file should be
     *                   read from the working directory, if it exists.
     * @return The configuration.
     * @throws NoSuchFileException if the given file does not exist.
     * @throws IOException if the file cannot be read.
     * @throws io.smallrye.config.ConfigValidationException if the properties cannot be mapped.
     */
    public static AppConfiguration load(final Path configFile) throws IOException {

        final SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withMapping(CertificateAuthorityOptions.class)
                .withMapping(ServerOptions.class)
                .withMapping(DeviceRegistryOptions.class)
                .withMapping(CertificateManagementOptions.class)
                .withMapping(ManagementUserOptions.class)
                .withValidateUnknown(false);

        if (configFile != null) {
            if (!Files.isRegularFile(configFile)) {
                throw new NoSuchFileException(configFile.toString());
            }
            builder.withSources(yamlSource(configFile));
        } else if (Files.isRegularFile(Path.of(DEFAULT_CONFIG_FILE))) {
            builder.withSources(yamlSource(Path.of(DEFAULT_CONFIG_FILE)));
        } else {
            LOG.info("no configuration file found, using defaults");
        }
        return new AppConfiguration(builder.build());
    }

    private static YamlConfigSource yamlSource(final Path file) throws IOException {
        final URL url = file.toAbsolutePath().toUri().toURL();
        LOG.info("reading configuration from [{}]", url);
        return new YamlConfigSource(url);
    }

    /**
     * Gets the location of the CA material.
     *
     * @return The options.
     */
    public CertificateAuthorityOptions ca() {
        return config.getConfigMapping(CertificateAuthorityOptions.class);
    }

    /**
     * Gets the HTTP server options.
     *
     * @return The options.
     */
    public ServerOptions server() {
        return config.getConfigMapping(ServerOptions.class);
    }

    /**
     * Gets the device registry options.
     *
     * @return The options.
     */
    public DeviceRegistryOptions registry() {
        return config.getConfigMapping(DeviceRegistryOptions.class);
    }

    /**
     * Gets the certificate management options.
     *
     * @return The options.
     */
    public CertificateManagementOptions certificates() {
        return config.getConfigMapping(CertificateManagementOptions.class);
    }

    /**
     * Gets the users that may access the management API.
     *
     * @return The options.
     */
    public ManagementUserOptions management() {
        return config.getConfigMapping(ManagementUserOptions.class);
    }
}
