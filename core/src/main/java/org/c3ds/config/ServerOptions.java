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

package org.c3ds.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Options for configuring the HTTP server that devices and device owners connect to.
 *
 */
@ConfigMapping(prefix = "c3ds.server", namingStrategy = ConfigMapping.NamingStrategy.VERBATIM)
public interface ServerOptions {

    /**
     * Gets the host name or literal IP address of the network interface that the
     * server is bound to.
     *
     * @return The host name.
     */
    @WithDefault("0.0.0.0")
    String bindAddress();

    /**
     * Gets the port the server listens on.
     *
     * @return The port number.
     */
    @WithDefault("8080")
    int port();

    /**
     * Gets the path to the PEM file containing the server's private key.
     * <p>
     * TLS is enabled only if both key and certificate paths are set.
     *
     * @return The path.
     */
    Optional<String> keyPath();

    /**
     * Gets the path to the PEM file containing the server's certificate chain.
     *
     * @return The path.
     */
    Optional<String> certPath();

    /**
     * Gets the maximum size of a request body that the server accepts.
     *
     * @return The number of bytes.
     */
    @WithDefault("65536")
    int maxPayloadSize();

    /**
     * Gets the number of seconds after which an idle connection is closed.
     *
     * @return The timeout in seconds (0 disables the timeout).
     */
    @WithDefault("60")
    int idleTimeout();
}
