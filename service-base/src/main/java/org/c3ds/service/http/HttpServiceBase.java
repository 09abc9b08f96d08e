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

package org.c3ds.service.http;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.c3ds.config.HttpServiceConfigProperties;
import org.c3ds.util.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.net.PemKeyCertOptions;
import io.vertx.ext.web.Route;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;

/**
 * A base class for implementing services using HTTP.
 * <p>
 * The service binds a single HTTP server which uses TLS if a key and certificate
 * are configured. Requests are dispatched to the registered {@link HttpEndpoint}s.
 */
public abstract class HttpServiceBase extends AbstractVerticle {

    /**
     * The default port.
     */
    public static final int DEFAULT_PORT = 8080;

    /**
     * A logger to be shared with subclasses.
     */
    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final Map<String, HttpEndpoint> endpoints = new LinkedHashMap<>();
    private final HttpServiceConfigProperties config;

    private HttpServer server;

    /**
     * Creates a new service.
     *
     * @param config The configuration properties.
     * @throws NullPointerException if config is {@code null}.
     */
    protected HttpServiceBase(final HttpServiceConfigProperties config) {
        this.config = Objects.requireNonNull(config);
    }

    /**
     * Adds an endpoint to this server.
     *
     * @param ep The endpoint.
     * @throws NullPointerException if endpoint is {@code null}.
     */
    public final void addEndpoint(final HttpEndpoint ep) {
        Objects.requireNonNull(ep);
        if (endpoints.putIfAbsent(ep.getName(), ep) != null) {
            log.warn("multiple endpoints defined with name [{}]", ep.getName());
        } else {
            log.debug("registering endpoint [{}]", ep.getName());
        }
    }

    /**
     * Iterates over the endpoints registered with this service.
     *
     * @return The endpoints.
     */
    protected final Iterable<HttpEndpoint> endpoints() {
        return endpoints.values();
    }

    /**
     * Gets the port that the server is bound to.
     *
     * @return The port or {@link Constants#PORT_UNCONFIGURED} if the server is not running.
     */
    public final int getActualPort() {
        return server != null ? server.actualPort() : Constants.PORT_UNCONFIGURED;
    }

    /**
     * Invoked before the http server is started.
     * <p>
     * Subclasses may override this method to do any kind of initialization work.
     *
     * @return A future indicating the outcome of the operation. The start up process fails if the returned future
     *         fails.
     */
    protected Future<Void> preStartServers() {
        return Future.succeededFuture();
    }

    @Override
    public final void start(final Promise<Void> startPromise) {

        preStartServers()
            .compose(s -> startEndpoints())
            .compose(this::bindHttpServer)
            .onSuccess(s -> startPromise.complete())
            .onFailure(startPromise::fail);
    }

    /**
     * Invoked after the http server has been shut down successfully.
     * <p>
     * May be overridden by subclasses.
     *
     * @return A future that has to be completed when this operation is finished.
     */
    protected Future<Void> postShutdown() {
        return Future.succeededFuture();
    }

    /**
     * Creates the router for handling requests.
     * <p>
     * The router has a body handler, limited to the configured maximum payload size,
     * and the {@link DefaultFailureHandler} applied to all routes. A default handler
     * for unknown resources is registered as well.
     *
     * @return The newly created router (never {@code null}).
     */
    protected Router createRouter() {

        final Router router = Router.router(vertx);
        final Route matchAllRoute = router.route();
        matchAllRoute.handler(BodyHandler.create(false).setBodyLimit(config.getMaxPayloadSize()));
        matchAllRoute.failureHandler(new DefaultFailureHandler());
        HttpUtils.addDefault404ErrorHandler(router);
        return router;
    }

    /**
     * Adds custom routes for handling requests that are not handled by the registered endpoints.
     * <p>
     * This default implementation does not register any routes.
     *
     * @param router The router to add the custom routes to.
     */
    protected void addCustomRoutes(final Router router) {
        // empty default implementation
    }

    /**
     * Gets the options to use for creating the http server.
     * <p>
     * Subclasses may override this method in order to customize the server.
     *
     * @return The http server options.
     */
    protected HttpServerOptions getHttpServerOptions() {

        final HttpServerOptions options = new HttpServerOptions()
                .setHost(config.getBindAddress())
                .setPort(config.getPort(DEFAULT_PORT))
                .setMaxChunkSize(4096)
                .setIdleTimeout(config.getIdleTimeout());
        if (config.isTlsEnabled()) {
            log.info("enabling TLS using key [{}] and certificate [{}]", config.getKeyPath(), config.getCertPath());
            options.setSsl(true).setKeyCertOptions(new PemKeyCertOptions()
                    .setKeyPath(config.getKeyPath())
                    .setCertPath(config.getCertPath()));
        }
        return options;
    }

    private Future<HttpServer> bindHttpServer(final Router router) {

        server = vertx.createHttpServer(getHttpServerOptions());
        return server.requestHandler(router).listen()
                .onSuccess(s -> log.info("server listens on [{}:{}], TLS: {}",
                        config.getBindAddress(), s.actualPort(), config.isTlsEnabled()))
                .onFailure(t -> log.error("cannot bind to port", t));
    }

    private Future<Router> startEndpoints() {

        final Router router = createRouter();
        for (final HttpEndpoint ep : endpoints()) {
            ep.addRoutes(router);
        }
        addCustomRoutes(router);
        final List<Future<Void>> endpointFutures = new ArrayList<>(endpoints.size());
        for (final HttpEndpoint ep : endpoints()) {
            log.info("starting endpoint [name: {}, class: {}]", ep.getName(), ep.getClass().getName());
            endpointFutures.add(ep.start());
        }
        return Future.all(endpointFutures).map(router);
    }

    @Override
    public final void stop(final Promise<Void> stopPromise) {

        final List<Future<Void>> endpointFutures = new ArrayList<>(endpoints.size());
        for (final HttpEndpoint ep : endpoints()) {
            log.info("stopping endpoint [name: {}, class: {}]", ep.getName(), ep.getClass().getName());
            endpointFutures.add(ep.stop());
        }
        Future.all(endpointFutures)
            .compose(ok -> server == null ? Future.<Void> succeededFuture() : server.close())
            .compose(ok -> postShutdown())
            .onComplete(ar -> {
                if (ar.succeeded()) {
                    server = null;
                    stopPromise.complete();
                } else {
                    stopPromise.fail(ar.cause());
                }
            });
    }
}
