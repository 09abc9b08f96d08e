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

package org.c3ds.deviceregistry;

import java.net.HttpURLConnection;
import java.util.Objects;
import java.util.UUID;
import java.util.function.BiFunction;

import org.c3ds.client.ClientErrorException;
import org.c3ds.service.auth.Capabilities;
import org.c3ds.service.auth.ManagementUser;
import org.c3ds.service.auth.Role;
import org.c3ds.service.http.AbstractHttpEndpoint;
import org.c3ds.service.http.HttpUtils;
import org.c3ds.tracing.TracingHelper;

import io.opentracing.Span;
import io.opentracing.tag.Tags;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.auth.authentication.AuthenticationProvider;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BasicAuthHandler;

/**
 * An HTTP endpoint that exposes the {@link CertificateManagementService} to device owners.
 * <p>
 * All requests need to be authenticated using HTTP Basic authentication.
 */
public class CertificateManagementHttpEndpoint extends AbstractHttpEndpoint {

    /**
     * The base path of the resources exposed by this endpoint.
     */
    public static final String BASE_PATH = "/v1/devices";

    private static final String REALM = "c3ds";
    private static final String SPAN_NAME_REGISTER_DEVICE = "register device";
    private static final String SPAN_NAME_GET_DEVICE = "get device";
    private static final String SPAN_NAME_ISSUE_CERTIFICATE = "issue certificate";
    private static final String SPAN_NAME_DOWNLOAD_CERTIFICATE = "download certificate";
    private static final String SPAN_NAME_DOWNLOAD_PRIVATE_KEY = "download private key";
    private static final String SPAN_NAME_REVOKE_DEVICE = "revoke device";

    private final CertificateManagementService service;
    private final AuthenticationProvider authProvider;

    /**
     * Creates an endpoint for a service instance.
     *
     * @param vertx The vert.x instance to use.
     * @param service The service to forward requests to.
     * @param authProvider The provider to authenticate users with.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public CertificateManagementHttpEndpoint(
            final Vertx vertx,
            final CertificateManagementService service,
            final AuthenticationProvider authProvider) {
        super(vertx);
        this.service = Objects.requireNonNull(service);
        this.authProvider = Objects.requireNonNull(authProvider);
    }

    @Override
    public String getName() {
        return "certificate-management";
    }

    @Override
    public void addRoutes(final Router router) {

        final String devicePath = String.format("%s/:%s", BASE_PATH, PARAM_DEVICE_ID);

        router.route(BASE_PATH + "*")
            .handler(BasicAuthHandler.create(authProvider, REALM))
            .handler(Capabilities.requireAnyRole(Role.PARTICIPANT, Role.ADMIN));

        router.post(BASE_PATH)
            .handler(this::extractOptionalJsonPayload)
            .handler(this::registerDevice);
        router.get(devicePath)
            .handler(this::getDevice);
        router.post(devicePath + "/certificate")
            .handler(this::extractOptionalJsonPayload)
            .handler(this::issueCertificate);
        router.get(devicePath + "/certificate")
            .handler(ctx -> download(ctx, SPAN_NAME_DOWNLOAD_CERTIFICATE, service::downloadCertificate));
        router.get(devicePath + "/private-key")
            .handler(ctx -> download(ctx, SPAN_NAME_DOWNLOAD_PRIVATE_KEY, service::downloadPrivateKey));
        router.post(devicePath + "/revoke")
            .handler(this::revokeDevice);
    }

    private Span newSpan(final String operationName, final ManagementUser user) {
        final Span span = TracingHelper.buildServerSpan(getTracer(), operationName, getClass().getSimpleName()).start();
        span.setTag("user", user.getUsername());
        return span;
    }

    private void registerDevice(final RoutingContext ctx) {

        final ManagementUser user = ManagementUser.fromContext(ctx);
        final Span span = newSpan(SPAN_NAME_REGISTER_DEVICE, user);
        service.registerDevice(user, getRequestPayload(ctx))
            .onSuccess(summary -> {
                TracingHelper.TAG_DEVICE_ID.set(span, summary.getString("id"));
                writeJson(ctx, HttpURLConnection.HTTP_CREATED, summary, span);
            })
            .onFailure(t -> failRequest(ctx, t, span))
            .onComplete(ar -> span.finish());
    }

    private void getDevice(final RoutingContext ctx) {

        final ManagementUser user = ManagementUser.fromContext(ctx);
        final Span span = newSpan(SPAN_NAME_GET_DEVICE, user);
        getDeviceIdParam(ctx)
            .compose(deviceId -> {
                TracingHelper.TAG_DEVICE_ID.set(span, deviceId.toString());
                return service.getDeviceSummary(user, deviceId);
            })
            .onSuccess(summary -> writeJson(ctx, HttpURLConnection.HTTP_OK, summary, span))
            .onFailure(t -> failRequest(ctx, t, span))
            .onComplete(ar -> span.finish());
    }

    private void issueCertificate(final RoutingContext ctx) {

        final ManagementUser user = ManagementUser.fromContext(ctx);
        final Span span = newSpan(SPAN_NAME_ISSUE_CERTIFICATE, user);
        getDeviceIdParam(ctx)
            .compose(deviceId -> {
                TracingHelper.TAG_DEVICE_ID.set(span, deviceId.toString());
                final Object algorithm = getRequestPayload(ctx).getValue(CertificateManagementService.FIELD_ALGORITHM);
                if (algorithm != null && !(algorithm instanceof String)) {
                    return Future.failedFuture(new ClientErrorException(
                            HttpURLConnection.HTTP_BAD_REQUEST, "algorithm must be a string"));
                }
                return service.issueCertificate(user, deviceId, (String) algorithm);
            })
            .onSuccess(info -> writeJson(ctx, HttpURLConnection.HTTP_CREATED, info, span))
            .onFailure(t -> failRequest(ctx, t, span))
            .onComplete(ar -> span.finish());
    }

    private void download(
            final RoutingContext ctx,
            final String operationName,
            final BiFunction<ManagementUser, UUID, Future<PemDownload>> downloadFunction) {

        final ManagementUser user = ManagementUser.fromContext(ctx);
        final Span span = newSpan(operationName, user);
        getDeviceIdParam(ctx)
            .compose(deviceId -> {
                TracingHelper.TAG_DEVICE_ID.set(span, deviceId.toString());
                return downloadFunction.apply(user, deviceId);
            })
            .onSuccess(download -> {
                Tags.HTTP_STATUS.set(span, HttpURLConnection.HTTP_OK);
                ctx.response()
                    .setStatusCode(HttpURLConnection.HTTP_OK)
                    .putHeader(HttpHeaders.CONTENT_DISPOSITION,
                            String.format("attachment; filename=\"%s\"", download.getFilename()));
                HttpUtils.setResponseBody(ctx.response(), Buffer.buffer(download.getContent()), HttpUtils.CONTENT_TYPE_PEM);
                ctx.response().end();
            })
            .onFailure(t -> failRequest(ctx, t, span))
            .onComplete(ar -> span.finish());
    }

    private void revokeDevice(final RoutingContext ctx) {

        final ManagementUser user = ManagementUser.fromContext(ctx);
        final Span span = newSpan(SPAN_NAME_REVOKE_DEVICE, user);
        getDeviceIdParam(ctx)
            .compose(deviceId -> {
                TracingHelper.TAG_DEVICE_ID.set(span, deviceId.toString());
                return service.revokeDevice(user, deviceId);
            })
            .onSuccess(summary -> writeJson(ctx, HttpURLConnection.HTTP_OK, summary, span))
            .onFailure(t -> failRequest(ctx, t, span))
            .onComplete(ar -> span.finish());
    }
}
