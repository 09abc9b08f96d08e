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

package org.c3ds.service.auth;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;

import org.c3ds.test.ConfigMappingSupport;
import org.junit.jupiter.api.Test;

/**
 * Tests verifying the mapping of {@link ManagementUserOptions}.
 *
 */
public class ManagementUserOptionsTest {

    /**
     * Verifies that users are mapped from YAML and that the default role is applied.
     */
    @Test
    public void testUsersAreMapped() {
        final ManagementUserOptions options = ConfigMappingSupport.getConfigMapping(
                ManagementUserOptions.class,
                this.getClass().getResource("/management-users.yaml"));

        assertThat(options.users().isPresent()).isTrue();
        final List<ManagementUserOptions.UserEntry> users = options.users().get();
        assertThat(users).hasSize(2);
        assertThat(users.get(0).username()).isEqualTo("alice");
        assertThat(users.get(0).roles()).containsExactly("PARTICIPANT");
        assertThat(users.get(1).username()).isEqualTo("root");
        assertThat(users.get(1).roles()).containsExactly("PARTICIPANT", "ADMIN").inOrder();
        assertThat(users.get(1).password()).startsWith("$2a$04$");
    }
}
