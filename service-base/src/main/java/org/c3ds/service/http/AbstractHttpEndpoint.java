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

import java.net.HttpURLConnection;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;

import org.c3ds.client.ClientErrorException;
import org.c3ds.client.ServiceInvocationException;
import org.c3ds.tracing.TracingHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.Span;
import io.opentracing.Tracer;
import io.opentracing.noop.NoopTracerFactory;
import io.opentracing.tag.Tags;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;


/**
 * Base class for HTTP based endpoints.
 *
 */
public abstract class AbstractHttpEndpoint implements HttpEndpoint {

    /**
     * The key that is used to put a valid JSON payload to the RoutingContext.
     */
    protected static final String KEY_REQUEST_BODY = "KEY_REQUEST_BODY";
    /**
     * The name of the URI path parameter for the device ID.
     */
    protected static final String PARAM_DEVICE_ID = "device_id";

    /**
     * A logger to be shared with subclasses.
     */
    protected final Logger logger = LoggerFactory.getLogger(getClass());
    /**
     * The Vert.x instance this endpoint is running on.
     */
    protected final Vertx vertx;

    private Tracer tracer = NoopTracerFactory.create();

    /**
     * Creates an endpoint for a Vertx instance.
     *
     * @param vertx The Vertx instance to use.
     * @throws NullPointerException if vertx is {@code null};
     */
    protected AbstractHttpEndpoint(final Vertx vertx) {
        this.vertx = Objects.requireNonNull(vertx);
    }

    /**
     * Sets the OpenTracing {@code Tracer} to use for tracing the processing
     * of requests.
     * <p>
     * If not set, a no-op tracer is used.
     *
     * @param opentracingTracer The tracer.
     * @throws NullPointerException if tracer is {@code null}.
     */
    public final void setTracer(final Tracer opentracingTracer) {
        this.tracer = Objects.requireNonNull(opentracingTracer);
        logger.info("using OpenTracing Tracer implementation [{}]", opentracingTracer.getClass().getName());
    }

    /**
     * Gets the tracer used for tracing the processing of requests.
     *
     * @return The tracer.
     */
    protected final Tracer getTracer() {
        return tracer;
    }

    /**
     * {@inheritDoc}
     * <p>
     * This default implementation does nothing.
     */
    @Override
    public Future<Void> start() {
        return Future.succeededFuture();
    }

    /**
     * {@inheritDoc}
     * <p>
     * This default implementation does nothing.
     */
    @Override
    public Future<Void> stop() {
        return Future.succeededFuture();
    }

    /**
     * Extracts JSON payload from a request body, if not empty.
     * <p>
     * This method tries to de-serialize the content of the request body
     * into a {@code JsonObject} and put it to the request context using key
     * {@value #KEY_REQUEST_BODY}.
     * <p>
     * The request is failed with a 400 status code if de-serialization fails, for example
     * because the content is not a valid JSON object.
     *
     * @param ctx The routing context to retrieve the JSON request body from.
     */
    protected final void extractOptionalJsonPayload(final RoutingContext ctx) {

        final Buffer body = ctx.body().buffer();
        if (body == null || body.length() == 0) {
            ctx.next();
        } else {
            try {
                ctx.put(KEY_REQUEST_BODY, new JsonObject(body));
                ctx.next();
            } catch (final DecodeException | ClassCastException e) {
                ctx.fail(new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST, "Invalid JSON", e));
            }
        }
    }

    /**
     * Gets the JSON payload that has been put to the context by {@link #extractOptionalJsonPayload(RoutingContext)}.
     *
     * @param ctx The routing context.
     * @return The payload or an empty object if the request had no body.
     */
    protected final JsonObject getRequestPayload(final RoutingContext ctx) {
        return Optional.ofNullable(ctx.<JsonObject> get(KEY_REQUEST_BODY)).orElseGet(JsonObject::new);
    }

    /**
     * Gets the device identifier from the standard parameter name {@link #PARAM_DEVICE_ID}.
     *
     * @param ctx The routing context of the request.
     * @return A future indicating the outcome of the operation.
     *         The future will be completed with the identifier if it is a valid UUID.
     *         Otherwise, the future will be failed with a {@link ClientErrorException} with status 400.
     * @throws NullPointerException If ctx is null.
     */
    protected final Future<UUID> getDeviceIdParam(final RoutingContext ctx) {
        return getRequestParameter(ctx, PARAM_DEVICE_ID, null, UUID::fromString, Objects::nonNull);
    }

    /**
     * Gets the value of a request parameter.
     * <p>
     * This method first tries to get the value of the parameter with the given name from the
     * request. If the request contains such a parameter, the given converter is used to transform
     * its value to the expected type. Otherwise, the default value is used.
     * The parameter value is then validated by means of the given predicate.
     *
     * @param <C> The expected type of the parameter.
     * @param ctx The routing context to get the parameter from.
     * @param paramName The name of the parameter.
     * @param defaultValue A default value to use if the request does not contain a parameter with the given name
     *                     or {@code null} if no default value is defined.
     * @param converter A function for converting the request parameter value to the expected type.
     *                  The function may throw an {@code IllegalArgumentException}
     *                  instead of returning a value in order to convey additional
     *                  information about why the parameter could not be converted to the expected type.
     * @param validator A predicate to use for validating the parameter value.
     * @return A future indicating the outcome of the operation.
     *         The future will be completed with the converted parameter value if validation was successful.
     *         Otherwise, the future will be failed with a {@link ClientErrorException} with status 400.
     * @throws NullPointerException if any of the parameters other than default value are {@code null}.
     */
    protected final <C> Future<C> getRequestParameter(
            final RoutingContext ctx,
            final String paramName,
            final C defaultValue,
            final Function<String, C> converter,
            final Predicate<C> validator) {

        Objects.requireNonNull(ctx);
        Objects.requireNonNull(paramName);
        Objects.requireNonNull(converter);
        Objects.requireNonNull(validator);

        final Promise<C> result = Promise.promise();
        final String value = ctx.pathParam(paramName) != null ? ctx.pathParam(paramName) : ctx.request().getParam(paramName);

        try {
            final C typedValue = Optional.ofNullable(value)
                    .map(converter)
                    .orElse(defaultValue);
            if (validator.test(typedValue)) {
                result.complete(typedValue);
            } else {
                result.fail(new ClientErrorException(HttpURLConnection.HTTP_BAD_REQUEST,
                        String.format("request parameter [name: %s, value: %s] failed validation", paramName, value)));
            }
        } catch (final IllegalArgumentException e) {
            result.fail(new ClientErrorException(
                    HttpURLConnection.HTTP_BAD_REQUEST,
                    String.format("request parameter [name: %s, value: %s] failed validation", paramName, value),
                    e));
        }
        return result.future();
    }

    /**
     * Fails a request with a given error.
     * <p>
     * This method logs the error to the given span, sets the span's <em>http.status</em> tag
     * and fails the context with the error.
     *
     * @param ctx The context to fail the request for.
     * @param error The cause for the failed request.
     * @param span The OpenTracing span to log the error to.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    protected final void failRequest(final RoutingContext ctx, final Throwable error, final Span span) {

        Objects.requireNonNull(ctx);
        Objects.requireNonNull(error);
        Objects.requireNonNull(span);

        final String msg = "error processing request";
        logger.debug(msg, error);
        TracingHelper.logError(span, msg, error, error instanceof ServiceInvocationException);
        final int statusCode = ServiceInvocationException.extractStatusCode(error);
        Tags.HTTP_STATUS.set(span, statusCode);
        ctx.fail(statusCode, error);
    }

    /**
     * Ends a request with a JSON response body.
     * <p>
     * This method sets the span's <em>http.status</em> tag.
     *
     * @param ctx The context of the request.
     * @param status The HTTP status code of the response.
     * @param body The response body.
     * @param span The OpenTracing span of the request.
     * @throws NullPointerException if any of the parameters are {@code null}.
     */
    protected final void writeJson(final RoutingContext ctx, final int status, final JsonObject body, final Span span) {

        Objects.requireNonNull(ctx);
        Objects.requireNonNull(body);
        Objects.requireNonNull(span);

        Tags.HTTP_STATUS.set(span, status);
        ctx.response().setStatusCode(status);
        HttpUtils.setResponseBody(ctx.response(), body);
        ctx.response().end();
    }
}
