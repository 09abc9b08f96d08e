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

package org.c3ds.tracing;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentracing.Span;
import io.opentracing.Tracer;
import io.opentracing.log.Fields;
import io.opentracing.tag.BooleanTag;
import io.opentracing.tag.StringTag;
import io.opentracing.tag.Tags;

/**
 * A helper class providing utility methods for interacting with the
 * OpenTracing API.
 *
 */
public final class TracingHelper {

    /**
     * An OpenTracing tag indicating if a client (device) has been authenticated.
     */
    public static final BooleanTag TAG_AUTHENTICATED = new BooleanTag("authenticated");
    /**
     * An OpenTracing tag that contains the serial number of the certificate a device has presented.
     */
    public static final StringTag TAG_CERTIFICATE_SERIAL = new StringTag("certificate_serial");
    /**
     * An OpenTracing tag that contains the identifier of a device.
     */
    public static final StringTag TAG_DEVICE_ID = new StringTag("device_id");
    /**
     * An OpenTracing tag that contains the subject DN of a certificate.
     */
    public static final StringTag TAG_SUBJECT_DN = new StringTag("subject_dn");

    private static final Logger LOG = LoggerFactory.getLogger(TracingHelper.class);

    private TracingHelper() {
        // prevent instantiation
    }

    /**
     * Creates a set of items to log for a message and an error.
     *
     * @param message The message.
     * @param error The error.
     * @return The items to log.
     */
    public static Map<String, Object> getErrorLogItems(final String message, final Throwable error) {
        final Map<String, Object> items = new HashMap<>(4);
        items.put(Fields.EVENT, Tags.ERROR.getKey());
        Optional.ofNullable(message)
                .ifPresent(ok -> items.put(Fields.MESSAGE, message));
        if (error != null) {
            // stack traces of our own exceptions rarely add information
            if (error.getClass().getName().startsWith("org.c3ds.")) {
                items.put(Fields.ERROR_OBJECT, error.toString());
            } else {
                items.put(Fields.ERROR_OBJECT, error);
            }
        }
        return items;
    }

    /**
     * Marks an <em>OpenTracing</em> span as erroneous and logs a message.
     * <p>
     * This method does <em>not</em> finish the span.
     *
     * @param span The span to mark.
     * @param message The message to log on the span.
     * @throws NullPointerException if message is {@code null}.
     */
    public static void logError(final Span span, final String message) {
        Objects.requireNonNull(message);
        logError(span, message, null, true);
    }

    /**
     * Marks an <em>OpenTracing</em> span as erroneous and logs an exception.
     * <p>
     * This method does <em>not</em> finish the span.
     *
     * @param span The span to mark.
     * @param error The exception that has occurred.
     * @throws NullPointerException if error is {@code null}.
     */
    public static void logError(final Span span, final Throwable error) {
        Objects.requireNonNull(error);
        logError(span, null, error, false);
    }

    /**
     * Marks an <em>OpenTracing</em> span as erroneous, logs a message and an error.
     * <p>
     * This method does <em>not</em> finish the span.
     * <p>
     * Unexpected errors like a {@code NullPointerException} are also logged at <em>WARN</em>
     * level unless the check for such errors is skipped.
     *
     * @param span The span to mark.
     * @param message The message to log on the span.
     * @param error The error to log on the span.
     * @param skipUnexpectedErrorCheck Whether to skip the check for an unexpected error.
     * @throws NullPointerException if both message and error are {@code null}.
     */
    public static void logError(
            final Span span,
            final String message,
            final Throwable error,
            final boolean skipUnexpectedErrorCheck) {

        if (message == null && error == null) {
            throw new NullPointerException("Either message or error must not be null");
        }
        if (!skipUnexpectedErrorCheck && (error instanceof NullPointerException
                || error instanceof IllegalArgumentException
                || error instanceof IllegalStateException)) {
            LOG.warn("An unexpected error occurred!", error);
        }
        if (span != null) {
            Tags.ERROR.set(span, Boolean.TRUE);
            span.log(getErrorLogItems(message, error));
        }
    }

    /**
     * Creates a span builder for a server side operation.
     * <p>
     * The builder ignores the active span and sets the <em>component</em>
     * and <em>span.kind</em> tags.
     *
     * @param tracer The Tracer to use.
     * @param operationName The operation name to set for the span.
     * @param component The component to set for the span.
     * @return The span builder.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static Tracer.SpanBuilder buildServerSpan(
            final Tracer tracer,
            final String operationName,
            final String component) {

        Objects.requireNonNull(tracer);
        Objects.requireNonNull(operationName);
        Objects.requireNonNull(component);

        return tracer.buildSpan(operationName)
                .ignoreActiveSpan()
                .withTag(Tags.COMPONENT.getKey(), component)
                .withTag(Tags.SPAN_KIND.getKey(), Tags.SPAN_KIND_SERVER);
    }
}
