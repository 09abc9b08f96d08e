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
 * A helper class for working with {@link String}s.
 */
public final class Strings {

    private Strings() {
    }

    /**
     * Checks if a value is {@code null} or has an empty string representation.
     *
     * @param value The value to check.
     * @return {@code true} if the value is {@code null} or the string representation is empty.
     */
    public static boolean isNullOrEmpty(final Object value) {
        if (value == null) {
            return true;
        }

        final String s = value.toString();

        return s == null || s.isEmpty();
    }

    /**
     * Checks if a string is {@code null} or consists of white space only.
     *
     * @param value The value to check.
     * @return {@code true} if the value is {@code null} or blank.
     */
    public static boolean isNullOrBlank(final String value) {
        return value == null || value.isBlank();
    }

    /**
     * Gets a trimmed version of a string.
     *
     * @param value The string to trim (may be {@code null}).
     * @return The trimmed string or {@code null} if the given value is
     *         {@code null} or blank.
     */
    public static String trimToNull(final String value) {
        if (isNullOrBlank(value)) {
            return null;
        }
        return value.trim();
    }
}
