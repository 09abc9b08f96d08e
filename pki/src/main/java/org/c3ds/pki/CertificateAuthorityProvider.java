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

import java.util.Objects;

/**
 * A source of the certificate authority's material.
 *
 */
@FunctionalInterface
public interface CertificateAuthorityProvider {

    /**
     * Gets the certificate authority.
     *
     * @return The certificate authority.
     * @throws CertificateAuthorityException if the material is not available.
     */
    CertificateAuthority getCertificateAuthority() throws CertificateAuthorityException;

    /**
     * Creates a provider for a fixed certificate authority.
     *
     * @param ca The certificate authority.
     * @return The provider.
     * @throws NullPointerException if ca is {@code null}.
     */
    static CertificateAuthorityProvider of(final CertificateAuthority ca) {
        Objects.requireNonNull(ca);
        return () -> ca;
    }
}
