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

import java.util.Objects;

import org.c3ds.util.Constants;
import org.c3ds.util.Strings;

/**
 * Configuration properties for an HTTP based service.
 *
 */
public class HttpServiceConfigProperties {

    private String bindAddress = "0.0.0.0";
    private int port = Constants.PORT_UNCONFIGURED;
    private String keyPath;
    private String certPath;
    private int maxPayloadSize = 65536;
    private int idleTimeout = 60;

    /**
     * Creates new properties using default values.
     */
    public HttpServiceConfigProperties() {
        super();
    }

    /**
     * Creates new properties from existing options.
     *
     * @param options The options to copy.
     * @throws NullPointerException if options are {@code null}.
     */
    public HttpServiceConfigProperties(final ServerOptions options) {
        Objects.requireNonNull(options);
        setBindAddress(options.bindAddress());
        setPort(options.port());
        this.keyPath = options.keyPath().orElse(null);
        this.certPath = options.certPath().orElse(null);
        setMaxPayloadSize(options.maxPayloadSize());
        setIdleTimeout(options.idleTimeout());
    }

    /**
     * Gets the address of the network interface to bind to.
     *
     * @return The address.
     */
    public final String getBindAddress() {
        return bindAddress;
    }

    /**
     * Sets the address of the network interface to bind to.
     *
     * @param address The address.
     * @throws NullPointerException if address is {@code null}.
     */
    public final void setBindAddress(final String address) {
        this.bindAddress = Objects.requireNonNull(address);
    }

    /**
     * Gets the port to listen on.
     *
     * @param defaultPort The port to use if no port has been configured explicitly.
     * @return The port.
     */
    public final int getPort(final int defaultPort) {
        return port == Constants.PORT_UNCONFIGURED ? defaultPort : port;
    }

    /**
     * Sets the port to listen on.
     * <p>
     * A value of 0 makes the server bind to an arbitrary free port.
     *
     * @param port The port.
     * @throws IllegalArgumentException if port is &lt; 0 or &gt; 65535.
     */
    public final void setPort(final int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("invalid port number");
        }
        this.port = port;
    }

    /**
     * Gets the path to the server's private key file.
     *
     * @return The path or {@code null} if not set.
     */
    public final String getKeyPath() {
        return keyPath;
    }

    /**
     * Gets the path to the server's certificate file.
     *
     * @return The path or {@code null} if not set.
     */
    public final String getCertPath() {
        return certPath;
    }

    /**
     * Checks if the server should use TLS.
     *
     * @return {@code true} if key and certificate paths are set.
     */
    public final boolean isTlsEnabled() {
        return !Strings.isNullOrEmpty(keyPath) && !Strings.isNullOrEmpty(certPath);
    }

    /**
     * Gets the maximum size of a request body.
     *
     * @return The number of bytes.
     */
    public final int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    /**
     * Sets the maximum size of a request body.
     *
     * @param maxPayloadSize The number of bytes.
     * @throws IllegalArgumentException if size is &lt;= 0.
     */
    public final void setMaxPayloadSize(final int maxPayloadSize) {
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("max payload size must be > 0");
        }
        this.maxPayloadSize = maxPayloadSize;
    }

    /**
     * Gets the idle timeout for connections.
     *
     * @return The timeout in seconds.
     */
    public final int getIdleTimeout() {
        return idleTimeout;
    }

    /**
     * Sets the idle timeout for connections.
     *
     * @param idleTimeout The timeout in seconds.
     * @throws IllegalArgumentException if timeout is &lt; 0.
     */
    public final void setIdleTimeout(final int idleTimeout) {
        if (idleTimeout < 0) {
            throw new IllegalArgumentException("idle timeout must be >= 0");
        }
        this.idleTimeout = idleTimeout;
    }
}
