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

import org.c3ds.client.ServiceInvocationException;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

/**
 * A collection of utility methods for processing HTTP requests.
 *
 */
public final class HttpUtils {

    /**
     * The <em>application/json; charset=utf-8</em> content type.
     */
    public static final String CONTENT_TYPE_JSON_UTF8 = "application/json; charset=utf-8";
    /**
     * The content type of PEM encoded certificates and keys offered for download.
     */
    public static final String CONTENT_TYPE_PEM = "application/x-pem-file";

    private HttpUtils() {
        // prevent instantiation
    }

    /**
     * Fails a request with a given error.
     * <p>
     * This method does nothing if the context is already failed
     * or if the response has already ended.
     *
     * @param ctx The request context to fail.
     * @param error The reason for the failure.
     * @throws NullPointerException if request context or error are {@code null}.
     */
    public static void fail(final RoutingContext ctx, final ServiceInvocationException error) {

        Objects.requireNonNull(ctx);
        Objects.requireNonNull(error);

        if (!ctx.failed() && !ctx.response().ended()) {
            ctx.fail(error);
        }
    }

    /**
     * Writes a JSON object to an HTTP response body.
     * <p>
     * This method also sets the <em>content-length</em> header of the HTTP response
     * and sets the <em>content-type</em> header to {@link #CONTENT_TYPE_JSON_UTF8}
     * but does not end the response.
     *
     * @param response The HTTP response.
     * @param body The JSON object to serialize to the response body (may be {@code null}).
     * @throws NullPointerException if response is {@code null}.
     */
    public static void setResponseBody(final HttpServerResponse response, final JsonObject body) {
        Objects.requireNonNull(response);
        if (body != null) {
            setResponseBody(response, body.toBuffer(), CONTENT_TYPE_JSON_UTF8);
        }
    }

    /**
     * Writes a Buffer to an HTTP response body.
     * <p>
     * This method also sets the <em>content-length</em> and <em>content-type</em>
     * headers of the HTTP response accordingly but does not end the response.
     * <p>
     * If the response is already ended or closed or the buffer is {@code null}, this method
     * does nothing.
     *
     * @param response The HTTP response.
     * @param buffer The Buffer to set as the response body (may be {@code null}).
     * @param contentType The type of the content. If {@code null}, a default value of
     *                    {@link #CONTENT_TYPE_JSON_UTF8} will be used.
     * @throws NullPointerException if response is {@code null}.
     */
    public static void setResponseBody(final HttpServerResponse response, final Buffer buffer, final String contentType) {

        Objects.requireNonNull(response);
        if (!response.ended() && !response.closed() && buffer != null) {
            if (contentType == null) {
                response.putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON_UTF8);
            } else {
                response.putHeader(HttpHeaders.CONTENT_TYPE, contentType);
            }
            response.putHeader(HttpHeaders.CONTENT_LENGTH, String.valueOf(buffer.length()));
            response.write(buffer);
        }
    }

    /**
     * Gets the absolute URI of a request for logging purposes.
     *
     * @param request The request.
     * @return The URI or the request path if the URI cannot be determined.
     */
    public static String getAbsoluteURI(final HttpServerRequest request) {
        try {
            return request.absoluteURI();
        } catch (final IllegalArgumentException e) {
            return request.path();
        }
    }

    /**
     * Adds a default error handler for HTTP status code 404 (Not Found).
     * <p>
     * The handler writes a JSON body containing an <em>error</em> property.
     *
     * @param router The router to add the handler to.
     * @throws NullPointerException if router is {@code null}.
     */
    public static void addDefault404ErrorHandler(final Router router) {
        Objects.requireNonNull(router);
        router.errorHandler(HttpURLConnection.HTTP_NOT_FOUND, ctx -> {
            if (!ctx.response().ended()) {
                ctx.response().setStatusCode(HttpURLConnection.HTTP_NOT_FOUND);
                setResponseBody(ctx.response(), new JsonObject().put("error", "Not found"));
                ctx.response().end();
            }
        });
    }
}
