/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.database;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceBuilder;
import org.bemade.odoo.kubernetes.operator.OperatorTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

@EnableKubernetesMockClient(crud = true)
class StaleRoleSweeperTest {

    private static final String RELEASE = OperatorTestUtils.RELEASE;

    KubernetesClient client;

    private InMemoryDatabaseAdminClient databases;
    private StaleRoleSweeper sweeper;

    @BeforeEach
    void setUp() {
        databases = new InMemoryDatabaseAdminClient();
        sweeper = new StaleRoleSweeper(client, databases, RELEASE, Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        sweeper.close();
    }

    @Test
    void shouldDropRolesOfDeletedInstances() {
        // Given
        givenNamespace("shop");
        givenNamespace("legacy");
        client.resource(instance("shop", "demo")).create();
        databases.ensureRoleAndDatabase("shop-odoo-demo", "pw");
        databases.ensureRoleAndDatabase("shop-odoo-gone", "pw");
        databases.ensureRoleAndDatabase("legacy-odoo-old", "pw");

        // When
        Map<String, List<String>> dropped = sweeper.sweep();

        // Then
        assertThat(dropped).containsOnly(
                Map.entry("legacy", List.of("legacy-odoo-old")),
                Map.entry("shop", List.of("shop-odoo-gone")));
        assertThat(databases.roles()).containsOnlyKeys("shop-odoo-demo");
        assertThat(databases.hasDatabase("shop-odoo-gone")).isFalse();
    }

    @Test
    void shouldLeaveRolesOfOtherReleasesAlone() {
        // Given
        givenNamespace("shop");
        databases.ensureRoleAndDatabase("shop-other-demo", "pw");

        // When
        Map<String, List<String>> dropped = sweeper.sweep();

        // Then
        assertThat(dropped).isEmpty();
        assertThat(databases.roles()).containsOnlyKeys("shop-other-demo");
    }

    @Test
    void shouldNotDropRoleOwnedByNamespaceSharingThePrefix() {
        // Given
        givenNamespace("shop");
        givenNamespace("shop-odoo");
        client.resource(instance("shop-odoo", "web")).create();
        databases.ensureRoleAndDatabase("shop-odoo-odoo-web", "pw");

        // When
        Map<String, List<String>> dropped = sweeper.sweep();

        // Then
        assertThat(dropped).isEmpty();
        assertThat(databases.roles()).containsOnlyKeys("shop-odoo-odoo-web");
    }

    @Test
    void shouldKeepInstancesOfNamespaceAndOverlappingRoleSuffixes() {
        // Given
        List<OdooInstance> instances = List.of(
                instance("shop", "demo"),
                instance("shop-odoo", "web"),
                instance("warehouse", "erp"));

        // When
        var keep = sweeper.namesToKeep("shop", instances);

        // Then
        assertThat(keep).containsExactlyInAnyOrder("demo", "odoo-web");
    }

    private void givenNamespace(String name) {
        client.resource(new NamespaceBuilder().withNewMetadata().withName(name).endMetadata().build()).create();
    }

    private static OdooInstance instance(String namespace, String name) {
        return new OdooInstanceBuilder(OperatorTestUtils.minimalInstance(name))
                .editMetadata()
                    .withNamespace(namespace)
                .endMetadata()
                .build();
    }
}
