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

import java.util.Objects;

/**
 * PEM encoded material offered for download.
 */
public final class PemDownload {

    private final String filename;
    private final String content;

    /**
     * Creates a new download.
     *
     * @param filename The name to suggest to the client for storing the content.
     * @param content The PEM text.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public PemDownload(final String filename, final String content) {
        this.filename = Objects.requireNonNull(filename);
        this.content = Objects.requireNonNull(content);
    }

    public String getFilename() {
        return filename;
    }

    public String getContent() {
        return content;
    }
}
