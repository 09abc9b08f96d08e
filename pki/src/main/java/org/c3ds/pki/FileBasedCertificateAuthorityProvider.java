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

import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A provider that loads the certificate authority's material from the file system
 * on first access and keeps it in memory afterwards.
 * <p>
 * A failed attempt is not cached, i.e. the material is loaded again on the next access.
 * The cached material is discarded only by means of {@link #invalidate()}, which needs
 * to be invoked after the material on the file system has been re-created.
 */
public final class FileBasedCertificateAuthorityProvider implements CertificateAuthorityProvider {

    private static final Logger LOG = LoggerFactory.getLogger(FileBasedCertificateAuthorityProvider.class);

    private final Path keyPath;
    private final Path certPath;
    private volatile CertificateAuthority cached;

    /**
     * Creates a new provider.
     *
     * @param options The options indicating the location of the CA's files.
     * @throws NullPointerException if options are {@code null}.
     */
    public FileBasedCertificateAuthorityProvider(final CertificateAuthorityOptions options) {
        this(Path.of(Objects.requireNonNull(options).keyPath()), Path.of(options.certPath()));
    }

    /**
     * Creates a new provider.
     *
     * @param keyPath The path to the CA's private key file.
     * @param certPath The path to the CA's certificate file.
     * @throws NullPointerException if any of the paths are {@code null}.
     */
    public FileBasedCertificateAuthorityProvider(final Path keyPath, final Path certPath) {
        this.keyPath = Objects.requireNonNull(keyPath);
        this.certPath = Objects.requireNonNull(certPath);
    }

    @Override
    public CertificateAuthority getCertificateAuthority() throws CertificateAuthorityException {
        CertificateAuthority ca = cached;
        if (ca == null) {
            synchronized (this) {
                ca = cached;
                if (ca == null) {
                    ca = CertificateAuthority.load(keyPath, certPath);
                    LOG.info("loaded {}", ca);
                    cached = ca;
                }
            }
        }
        return ca;
    }

    /**
     * Discards the cached material.
     */
    public void invalidate() {
        cached = null;
    }
}
