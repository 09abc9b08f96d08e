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

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.c3ds.adapter.http.DeviceAuthenticator;
import org.c3ds.adapter.http.DeviceMessageHttpEndpoint;
import org.c3ds.adapter.http.MessageIngestPipeline;
import org.c3ds.adapter.http.MicrometerBasedHttpAdapterMetrics;
import org.c3ds.config.HttpServiceConfigProperties;
import org.c3ds.deviceregistry.CertificateManagementConfigProperties;
import org.c3ds.deviceregistry.CertificateManagementHttpEndpoint;
import org.c3ds.deviceregistry.CertificateManagementService;
import org.c3ds.deviceregistry.DeviceRegistryConfigProperties;
import org.c3ds.deviceregistry.FileBasedDeviceRegistry;
import org.c3ds.deviceregistry.FileBasedMessageLog;
import org.c3ds.pki.CertificateAuthorityProvider;
import org.c3ds.pki.CertificateIssuer;
import org.c3ds.pki.FileBasedCertificateAuthorityProvider;
import org.c3ds.service.auth.ConfiguredUsersAuthProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import io.opentracing.Tracer;
import io.opentracing.util.GlobalTracer;
import io.vertx.core.Vertx;
import picocli.CommandLine;

/**
 * Runs the HTTP server.
 *
 */
@CommandLine.Command(
        name = "serve",
        description = { "Starts the HTTP server accepting device messages and certificate management requests." },
        mixinStandardHelpOptions = true,
        versionProvider = PropertiesVersionProvider.class)
public class ServeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ServeCommand.class);
    private static final long STARTUP_TIMEOUT_SECONDS = 60;

    @CommandLine.Mixin
    ConfigFileOptions configOptions = new ConfigFileOptions();

    /**
     * Creates the server and its components.
     *
     * @param vertx The vert.x instance to run on.
     * @param config The configuration.
     * @param caProvider The source of the CA.
     * @param meterRegistry The registry to report metrics to.
     * @param tracer The tracer to trace device message uploads with.
     * @param clock The clock to use for time based decisions.
     * @return The server, ready to be deployed.
     * @throws NullPointerException if any of the parameters is {@code null}.
     * @throws IllegalArgumentException if a configured management user has an unknown role.
     */
    static DeviceAuthenticatorServer createServer(
            final Vertx vertx,
            final AppConfiguration config,
            final CertificateAuthorityProvider caProvider,
            final MeterRegistry meterRegistry,
            final Tracer tracer,
            final Clock clock) {

        Objects.requireNonNull(vertx);
        Objects.requireNonNull(config);
        Objects.requireNonNull(caProvider);
        Objects.requireNonNull(meterRegistry);
        Objects.requireNonNull(tracer);
        Objects.requireNonNull(clock);

        final DeviceRegistryConfigProperties registryConfig = new DeviceRegistryConfigProperties(config.registry());
        final FileBasedDeviceRegistry registry = new FileBasedDeviceRegistry(vertx, registryConfig, clock);
        final FileBasedMessageLog messageLog = new FileBasedMessageLog(vertx, registryConfig);

        final CertificateManagementService managementService = new CertificateManagementService(
                vertx,
                registry,
                messageLog,
                new CertificateIssuer(caProvider, clock),
                new CertificateManagementConfigProperties(config.certificates()),
                clock);

        final DeviceMessageHttpEndpoint messageEndpoint = new DeviceMessageHttpEndpoint(
                vertx,
                new DeviceAuthenticator(registry, caProvider, clock),
                new MessageIngestPipeline(registry, messageLog, clock));
        messageEndpoint.setMetrics(new MicrometerBasedHttpAdapterMetrics(meterRegistry));
        messageEndpoint.setTracer(tracer);

        final DeviceAuthenticatorServer server = new DeviceAuthenticatorServer(
                new HttpServiceConfigProperties(config.server()),
                registry,
                messageLog,
                caProvider);
        server.addEndpoint(messageEndpoint);
        server.addEndpoint(new CertificateManagementHttpEndpoint(
                vertx,
                managementService,
                new ConfiguredUsersAuthProvider(vertx, config.management())));
        return server;
    }

    private static MeterRegistry createMeterRegistry() {
        final LoggingMeterRegistry registry = new LoggingMeterRegistry();
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        return registry;
    }

    @Override
    public Integer call() throws Exception {

        final AppConfiguration config = AppConfiguration.load(configOptions.getConfigFile());
        final Vertx vertx = Vertx.vertx();
        final MeterRegistry meterRegistry = createMeterRegistry();
        final DeviceAuthenticatorServer server = createServer(
                vertx,
                config,
                new FileBasedCertificateAuthorityProvider(config.ca()),
                meterRegistry,
                GlobalTracer.get(),
                Clock.systemUTC());

        try {
            vertx.deployVerticle(server)
                .toCompletionStage()
                .toCompletableFuture()
                .get(STARTUP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (final ExecutionException | TimeoutException e) {
            LOG.error("failed to start server", e);
            meterRegistry.close();
            vertx.close();
            return 1;
        }

        LOG.info("server is up and running [port: {}]", server.getActualPort());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(vertx, meterRegistry), "shutdown"));
        return 0;
    }

    private static void shutdown(final Vertx vertx, final MeterRegistry meterRegistry) {
        LOG.info("shutting down");
        final CountDownLatch closed = new CountDownLatch(1);
        vertx.close().onComplete(ar -> {
            if (ar.failed()) {
                LOG.warn("error closing vert.x", ar.cause());
            }
            closed.countDown();
        });
        try {
            if (!closed.await(10, TimeUnit.SECONDS)) {
                LOG.warn("timed out waiting for vert.x to close");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        meterRegistry.close();
    }
}
