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

package org.c3ds.pki;

import java.security.GeneralSecurityException;

/**
 * Indicates that a key or signature algorithm is not supported.
 *
 */
public class UnsupportedAlgorithmException extends GeneralSecurityException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception for a detail message.
     *
     * @param msg The detail message.
     */
    public UnsupportedAlgorithmException(final String msg) {
        super(msg);
    }
}
