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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import static com.google.common.truth.Truth.assertThat;

import java.net.HttpURLConnection;

import org.c3ds.client.ClientErrorException;
import org.c3ds.client.ServerErrorException;
import org.c3ds.util.Constants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;


/**
 * Verifies behavior of {@link DefaultFailureHandler}.
 *
 */
public class DefaultFailureHandlerTest {

    private HttpServerResponse response;
    private RoutingContext ctx;

    /**
     * Sets up the fixture.
     */
    @BeforeEach
    public void setUp() {
        final HttpServerRequest request = mock(HttpServerRequest.class, Mockito.RETURNS_MOCKS);
        response = mock(HttpServerResponse.class);
        when(response.ended()).thenReturn(false);
        ctx = mock(RoutingContext.class);
        when(ctx.request()).thenReturn(request);
        when(ctx.response()).thenReturn(response);
        when(ctx.failed()).thenReturn(true);
    }

    private String handleAndGetErrorMessage(final int expectedStatus) {
        new DefaultFailureHandler().handle(ctx);
        final ArgumentCaptor<Buffer> bufferCaptor = ArgumentCaptor.forClass(Buffer.class);
        verify(response).setStatusCode(expectedStatus);
        verify(response).write(bufferCaptor.capture());
        verify(response).end();
        return bufferCaptor.getValue().toJsonObject().getString(Constants.FIELD_ERROR);
    }

    /**
     * Verifies that the handler does not try to process a failed
     * context if the response is already ended.
     */
    @Test
    public void testHandlerDetectsEndedResponse() {
        when(response.ended()).thenReturn(true);

        new DefaultFailureHandler().handle(ctx);

        verify(response, never()).setStatusCode(anyInt());
        verify(response, never()).write(any(Buffer.class));
        verify(response, never()).end();
    }

    /**
     * Verifies that the handler writes the detail message and error code of a client error
     * to the response.
     */
    @Test
    public void testHandlerWritesClientErrorDetails() {
        when(ctx.failure()).thenReturn(new ClientErrorException(HttpURLConnection.HTTP_GONE, "download window closed"));

        assertThat(handleAndGetErrorMessage(HttpURLConnection.HTTP_GONE)).isEqualTo("download window closed");
    }

    /**
     * Verifies that the handler does not expose the detail message of a server error.
     */
    @Test
    public void testHandlerHidesServerErrorDetails() {
        when(ctx.failure()).thenReturn(new ServerErrorException(
                HttpURLConnection.HTTP_INTERNAL_ERROR, "cannot read /etc/c3ds/ca.key"));

        assertThat(handleAndGetErrorMessage(HttpURLConnection.HTTP_INTERNAL_ERROR)).isEqualTo("Internal server error");
    }

    /**
     * Verifies that the handler uses the client facing message of a server error, if set.
     */
    @Test
    public void testHandlerUsesClientFacingMessage() {
        final ServerErrorException error = new ServerErrorException(HttpURLConnection.HTTP_UNAVAILABLE, "disk full");
        error.setClientFacingMessage("Device registry unavailable");
        when(ctx.failure()).thenReturn(error);

        assertThat(handleAndGetErrorMessage(HttpURLConnection.HTTP_UNAVAILABLE)).isEqualTo("Device registry unavailable");
    }

    /**
     * Verifies that the handler keeps the routing context's error status code
     * for failures that are not service invocation exceptions.
     */
    @Test
    public void testHandlerKeepsContextErrorStatus() {
        when(ctx.statusCode()).thenReturn(HttpURLConnection.HTTP_FORBIDDEN);
        when(ctx.failure()).thenReturn(new IllegalStateException("not allowed"));

        assertThat(handleAndGetErrorMessage(HttpURLConnection.HTTP_FORBIDDEN)).isEqualTo("not allowed");
    }

    /**
     * Verifies that the handler reports an unexpected exception as an internal error.
     */
    @Test
    public void testHandlerReportsUnexpectedExceptionAsInternalError() {
        when(ctx.statusCode()).thenReturn(-1);
        when(ctx.failure()).thenReturn(new IllegalStateException("NPE in line 42"));

        assertThat(handleAndGetErrorMessage(HttpURLConnection.HTTP_INTERNAL_ERROR)).isEqualTo("Internal server error");
    }

    /**
     * Verifies that the handler writes <em>N/A</em> if the context has failed with a status code only.
     */
    @Test
    public void testHandlerWithFailedContextAndEmptyFailure() {
        when(ctx.statusCode()).thenReturn(HttpURLConnection.HTTP_NOT_FOUND);

        assertThat(handleAndGetErrorMessage(HttpURLConnection.HTTP_NOT_FOUND)).isEqualTo("N/A");
    }

    /**
     * Verifies that the handler passes on non-failed contexts.
     */
    @Test
    public void testHandlerSkipsNonFailedContext() {
        when(ctx.failed()).thenReturn(false);

        new DefaultFailureHandler().handle(ctx);

        verify(ctx).next();
        verify(response, never()).setStatusCode(anyInt());
    }
}
