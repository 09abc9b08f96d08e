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

package org.c3ds.application;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

import org.c3ds.pki.CertificateAuthority;
import org.c3ds.pki.CertificateAuthorityOptions;

import picocli.CommandLine;

/**
 * Creates the CA's key and self-signed certificate unless they already exist.
 *
 */
@CommandLine.Command(
        name = "create-ca",
        description = {
            "Creates the root CA's private key and self-signed certificate.",
            "Does nothing if both files already exist." },
        mixinStandardHelpOptions = true,
        versionProvider = PropertiesVersionProvider.class,
        sortOptions = false)
public class CreateCaCommand implements Callable<Integer> {

    @CommandLine.Mixin
    ConfigFileOptions configOptions = new ConfigFileOptions();

    @CommandLine.Option(
            names = { "--key-path" },
            description = { "The file to write the PEM encoded private key to", "Overrides c3ds.ca.keyPath" },
            paramLabel = "FILE",
            order = 1)
    Path keyPath;

    @CommandLine.Option(
            names = { "--cert-path" },
            description = { "The file to write the PEM encoded certificate to", "Overrides c3ds.ca.certPath" },
            paramLabel = "FILE",
            order = 2)
    Path certPath;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {

        final CertificateAuthorityOptions options = AppConfiguration.load(configOptions.getConfigFile()).ca();
        final Path key = keyPath != null ? keyPath : Path.of(options.keyPath());
        final Path cert = certPath != null ? certPath : Path.of(options.certPath());

        if (CertificateAuthority.bootstrap(key, cert, Clock.systemUTC())) {
            spec.commandLine().getOut().printf("created CA key [%s] and certificate [%s]%n", key, cert);
        } else {
            spec.commandLine().getOut().printf("CA key [%s] and certificate [%s] already exist%n", key, cert);
        }
        return 0;
    }
}
