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

package org.c3ds.util;

/**
 * Constants used throughout the C3DS components.
 *
 */
public final class Constants {

    /**
     * The name of the HTTP header carrying the base64 encoded device certificate.
     */
    public static final String HEADER_DEVICE_CERTIFICATE = "X-Device-Certificate";
    /**
     * The name of the HTTP header carrying the base64 encoded message signature.
     */
    public static final String HEADER_DEVICE_SIGNATURE = "X-Device-Signature";
    /**
     * The name of the HTTP header carrying the client address as seen by a proxy.
     */
    public static final String HEADER_X_FORWARDED_FOR = "X-Forwarded-For";

    /**
     * The name of the JSON property containing a device's identifier.
     */
    public static final String FIELD_DEVICE_ID = "device_id";
    /**
     * The name of the JSON property containing an error message.
     */
    public static final String FIELD_ERROR = "error";
    /**
     * The name of the JSON property containing the outcome of an operation.
     */
    public static final String FIELD_STATUS = "status";
    /**
     * The name of the JSON property containing a human readable description of the outcome.
     */
    public static final String FIELD_MESSAGE = "message";
    /**
     * The name of the JSON property containing a point in time.
     */
    public static final String FIELD_TIMESTAMP = "timestamp";

    /**
     * The value of the {@value #FIELD_STATUS} property of a successful response.
     */
    public static final String STATUS_SUCCESS = "success";
    /**
     * The value of the {@value #FIELD_STATUS} property of a failure response.
     */
    public static final String STATUS_ERROR = "error";

    /**
     * The port number indicating that a port has not been configured or bound.
     */
    public static final int PORT_UNCONFIGURED = -1;

    private Constants() {
        // prevent instantiation
    }
}
