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

import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

import picocli.CommandLine.IVersionProvider;

/**
 * Reads the application version from a properties file on the class path.
 *
 */
public final class PropertiesVersionProvider implements IVersionProvider {

    static final String BUILD_PROPERTIES = "/c3ds-build.properties";

    @Override
    public String[] getVersion() throws Exception {
        final URL url = getClass().getResource(BUILD_PROPERTIES);
        if (url == null) {
            return new String[] { "unknown" };
        }
        final Properties properties = new Properties();
        try (InputStream inputStream = url.openStream()) {
            properties.load(inputStream);
        }
        return new String[] {
                String.format("c3ds %s", properties.getProperty("version")),
                "running on ${os.name} ${os.version} ${os.arch}"
        };
    }
}
