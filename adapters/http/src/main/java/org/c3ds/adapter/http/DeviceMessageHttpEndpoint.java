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

package org.c3ds.adapter.http;

import java.net.HttpURLConnection;
import java.util.Objects;

import org.c3ds.service.http.AbstractHttpEndpoint;
import org.c3ds.tracing.TracingHelper;
import org.c3ds.util.Constants;

import io.micrometer.core.instrument.Timer;
import io.opentracing.Span;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

/**
 * An HTTP endpoint that devices send signed messages to.
 * <p>
 * The endpoint always responds with a JSON object. Rejected messages are answered
 * with the status code and error message of the {@link AuthenticationFailure}.
 */
public class DeviceMessageHttpEndpoint extends AbstractHttpEndpoint {

    /**
     * The URI path that devices post messages to.
     */
    public static final String PATH_DEVICE_MESSAGE = "/api/device/message";

    private static final String SPAN_NAME_UPLOAD_MESSAGE = "upload message";

    private final DeviceAuthenticator authenticator;
    private final MessageIngestPipeline pipeline;
    private HttpAdapterMetrics metrics = HttpAdapterMetrics.NOOP;

    /**
     * Creates a new endpoint.
     *
     * @param vertx The vert.x instance to use.
     * @param authenticator The authenticator to verify messages with.
     * @param pipeline The pipeline to process authenticated messages with.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public DeviceMessageHttpEndpoint(
            final Vertx vertx,
            final DeviceAuthenticator authenticator,
            final MessageIngestPipeline pipeline) {
        super(vertx);
        this.authenticator = Objects.requireNonNull(authenticator);
        this.pipeline = Objects.requireNonNull(pipeline);
    }

    /**
     * Sets the metrics to report processed messages to.
     *
     * @param metrics The metrics.
     * @throws NullPointerException if metrics is {@code null}.
     */
    public final void setMetrics(final HttpAdapterMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public String getName() {
        return "device-message";
    }

    @Override
    public void addRoutes(final Router router) {
        router.post(PATH_DEVICE_MESSAGE).handler(this::handleMessage);
        router.post(PATH_DEVICE_MESSAGE + "/").handler(this::handleMessage);
    }

    private void handleMessage(final RoutingContext ctx) {

        final Timer.Sample timer = metrics.startTimer();
        final Span span = TracingHelper.buildServerSpan(getTracer(), SPAN_NAME_UPLOAD_MESSAGE, getClass().getSimpleName())
                .start();
        final HttpServerRequest request = ctx.request();
        final Buffer body = ctx.body().buffer();

        authenticator.authenticate(
                    request.getHeader(Constants.HEADER_DEVICE_CERTIFICATE),
                    request.getHeader(Constants.HEADER_DEVICE_SIGNATURE),
                    body,
                    span)
            .<Void> compose(result -> {
                if (!result.isAuthenticated()) {
                    final AuthenticationFailure failure = result.getFailure();
                    metrics.reportRejectedMessage(failure, timer);
                    writeJson(ctx, failure.getStatus(), errorResponse(failure), span);
                    return Future.succeededFuture();
                }
                final String clientIp = ClientIpAddressHelper.getClientIp(request).orElse(null);
                return pipeline.process(result, clientIp, span)
                        .map(response -> {
                            metrics.reportAcceptedMessage(
                                    response.getBoolean(MessageIngestPipeline.FIELD_SAVED),
                                    body.length(),
                                    timer);
                            writeJson(ctx, HttpURLConnection.HTTP_OK, response, span);
                            return null;
                        });
            })
            .onFailure(t -> failRequest(ctx, t, span))
            .onComplete(ar -> span.finish());
    }

    static JsonObject errorResponse(final AuthenticationFailure failure) {
        return new JsonObject()
                .put(Constants.FIELD_STATUS, Constants.STATUS_ERROR)
                .put(Constants.FIELD_ERROR, failure.getMessage());
    }
}
