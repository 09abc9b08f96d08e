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

import java.util.Objects;

import org.c3ds.config.HttpServiceConfigProperties;
import org.c3ds.deviceregistry.DeviceRegistry;
import org.c3ds.deviceregistry.MessageLog;
import org.c3ds.pki.CertificateAuthority;
import org.c3ds.pki.CertificateAuthorityException;
import org.c3ds.pki.CertificateAuthorityProvider;
import org.c3ds.service.http.HttpServiceBase;

import io.vertx.core.Future;

/**
 * The HTTP server exposing the device message and certificate management endpoints.
 * <p>
 * The server starts the device registry and the message log before binding to its port
 * and stops them after it has been shut down. It does not start up if the CA material
 * cannot be loaded.
 */
public class DeviceAuthenticatorServer extends HttpServiceBase {

    private final DeviceRegistry registry;
    private final MessageLog messageLog;
    private final CertificateAuthorityProvider caProvider;

    /**
     * Creates a new server.
     *
     * @param config The HTTP server configuration.
     * @param registry The device registry used by the endpoints.
     * @param messageLog The message log used by the endpoints.
     * @param caProvider The source of the CA used by the endpoints.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public DeviceAuthenticatorServer(
            final HttpServiceConfigProperties config,
            final DeviceRegistry registry,
            final MessageLog messageLog,
            final CertificateAuthorityProvider caProvider) {
        super(config);
        this.registry = Objects.requireNonNull(registry);
        this.messageLog = Objects.requireNonNull(messageLog);
        this.caProvider = Objects.requireNonNull(caProvider);
    }

    @Override
    protected Future<Void> preStartServers() {

        final CertificateAuthority ca;
        try {
            ca = caProvider.getCertificateAuthority();
        } catch (final CertificateAuthorityException e) {
            log.error("cannot load CA material, run the create-ca command to create it", e);
            return Future.failedFuture(e);
        }
        log.info("using {}", ca);
        return registry.start()
                .compose(ok -> messageLog.start());
    }

    @Override
    protected Future<Void> postShutdown() {
        return Future.all(messageLog.stop(), registry.stop())
                .onFailure(t -> log.warn("error stopping device registry", t))
                .mapEmpty();
    }
}
