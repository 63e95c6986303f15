/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceBuilder;
import org.bemade.odoo.kubernetes.operator.database.InMemoryDatabaseAdminClient;
import org.bemade.odoo.kubernetes.operator.dispatch.KeyedLocks;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;
import org.bemade.odoo.kubernetes.operator.model.ObservedState;

import static org.bemade.odoo.kubernetes.operator.assertj.OperatorAssertions.assertThat;
import static org.assertj.core.api.Assertions.assertThat;

@EnableKubernetesMockClient(crud = true)
class InstanceConvergerTest {

    private static final String NAMESPACE = OperatorTestUtils.NAMESPACE;
    private static final String DATABASE = "shop-odoo-demo";

    KubernetesClient client;

    private OperatorConfig config;
    private InMemoryDatabaseAdminClient databases;
    private InstanceConverger converger;

    @BeforeEach
    void setUp() {
        config = OperatorTestUtils.config();
        databases = new InMemoryDatabaseAdminClient();
        converger = new InstanceConverger(new ResourceApplier(client), databases, config, new KeyedLocks());
    }

    @Test
    void shouldCreateDatabaseAndOwnedObjectsOfNewInstance() {
        // Given
        OdooInstance instance = OperatorTestUtils.minimalInstance("demo");

        // When
        InstanceConverger.ConvergeResult result = converge(instance);

        // Then
        assertThat(result.database().roleCreated()).isTrue();
        assertThat(result.database().databaseCreated()).isTrue();
        assertThat(result.outcomes()).doesNotContain(ApplyOutcome.UPDATED);
        assertThat(databases.roles()).containsKey(DATABASE);
        assertThat(databases.database(DATABASE).owner()).isEqualTo(DATABASE);

        assertThat(client.apps().deployments().inNamespace(NAMESPACE).withName("odoo-demo").get()).isNotNull();
        assertThat(client.services().inNamespace(NAMESPACE).withName("odoo-demo").get()).isNotNull();
        assertThat(client.configMaps().inNamespace(NAMESPACE).withName("odoo-config-demo").get()).isNotNull();
        assertThat(client.secrets().inNamespace(NAMESPACE).withName("odoo-admin-demo").get()).isNotNull();
        assertThat(client.network().v1().ingresses().inNamespace(NAMESPACE).withName("odoo-demo").get()).isNull();
        PersistentVolumeClaim claim = client.persistentVolumeClaims().inNamespace(NAMESPACE).withName("odoo-filestore-demo").get();
        assertThat(claim).hasNoOwnerRefs();

        Secret credentials = client.secrets().inNamespace(NAMESPACE).withName("odoo-db-credentials-demo").get();
        assertThat(ResourcesUtil.secretValue(credentials, DatabaseCredentialsSecret.PASSWORD_KEY))
                .hasValueSatisfying(password -> assertThat(databases.roles()).containsEntry(DATABASE, password));
    }

    @Test
    void shouldMakeNoChangesWhenConvergingConvergedInstance() {
        // Given
        OdooInstance instance = OperatorTestUtils.minimalInstance("demo");
        converge(instance);
        List<String> operationsBefore = databases.operations();

        // When
        InstanceConverger.ConvergeResult second = converge(instance);

        // Then
        assertThat(second.mutations()).isZero();
        assertThat(second.database().changed()).isFalse();
        assertThat(databases.operations()).hasSize(operationsBefore.size() + 1).last().isEqualTo("ensure " + DATABASE);
    }

    @Test
    void shouldReportConvergedInstanceAsCurrent() {
        // Given
        OdooInstance instance = OperatorTestUtils.minimalInstance("demo");
        DesiredSpec spec = DesiredSpec.from(instance, null);
        assertThat(converger.isCurrent(instance, spec, ObservedState.read(client, instance))).isFalse();

        // When
        converge(instance);

        // Then
        assertThat(converger.isCurrent(instance, spec, ObservedState.read(client, instance))).isTrue();
    }

    @Test
    void shouldUpdateDeploymentWhenImageChanges() {
        // Given
        OdooInstance instance = OperatorTestUtils.minimalInstance("demo");
        converge(instance);
        OdooInstance upgraded = new OdooInstanceBuilder(instance).editSpec().withImage("odoo:18.0").endSpec().build();

        // When
        InstanceConverger.ConvergeResult result = converge(upgraded);

        // Then
        assertThat(result.outcomes()).contains(ApplyOutcome.UPDATED);
        Deployment deployment = client.apps().deployments().inNamespace(NAMESPACE).withName("odoo-demo").get();
        assertThat(deployment.getSpec().getTemplate().getSpec().getContainers())
                .anySatisfy(container -> assertThat(container.getImage()).isEqualTo("odoo:18.0"));
    }

    @Test
    void shouldDeleteIngressRemovedFromSpec() {
        // Given
        OdooInstance exposed = new OdooInstanceBuilder(OperatorTestUtils.minimalInstance("demo"))
                .editSpec().withNewIngress().withHostname("demo.example.com").endIngress().endSpec()
                .build();
        converge(exposed);
        assertThat(client.network().v1().ingresses().inNamespace(NAMESPACE).withName("odoo-demo").get()).isNotNull();

        // When
        InstanceConverger.ConvergeResult result = converge(OperatorTestUtils.minimalInstance("demo"));

        // Then
        assertThat(result.outcomes()).contains(ApplyOutcome.DELETED);
        assertThat(client.network().v1().ingresses().inNamespace(NAMESPACE).withName("odoo-demo").get()).isNull();
    }

    @Test
    void shouldResetPasswordOfRoleWhoseCredentialsWereLost() {
        // Given
        databases.ensureRoleAndDatabase(DATABASE, "forgotten");
        OdooInstance instance = OperatorTestUtils.minimalInstance("demo");

        // When
        converge(instance);

        // Then
        assertThat(databases.operations()).contains("set-password " + DATABASE);
        Secret credentials = client.secrets().inNamespace(NAMESPACE).withName("odoo-db-credentials-demo").get();
        assertThat(ResourcesUtil.secretValue(credentials, DatabaseCredentialsSecret.PASSWORD_KEY))
                .hasValueSatisfying(password -> assertThat(password).isNotEqualTo("forgotten")
                        .isEqualTo(databases.roles().get(DATABASE)));
    }

    @Test
    void shouldRetainFilestoreAndDatabaseOnTeardownWithoutPurge() {
        // Given
        OdooInstance instance = OperatorTestUtils.minimalInstance("demo");
        converge(instance);

        // When
        List<ApplyOutcome> outcomes = converger.teardown(instance, false);

        // Then
        assertThat(outcomes).contains(ApplyOutcome.DELETED);
        assertThat(client.apps().deployments().inNamespace(NAMESPACE).withName("odoo-demo").get()).isNull();
        assertThat(client.secrets().inNamespace(NAMESPACE).withName("odoo-db-credentials-demo").get()).isNull();
        assertThat(client.persistentVolumeClaims().inNamespace(NAMESPACE).withName("odoo-filestore-demo").get()).isNotNull();
        assertThat(databases.hasDatabase(DATABASE)).isTrue();
    }

    @Test
    void shouldRemoveFilestoreAndDatabaseOnTeardownWithPurge() {
        // Given
        OdooInstance instance = OperatorTestUtils.minimalInstance("demo");
        converge(instance);

        // When
        converger.teardown(instance, true);

        // Then
        assertThat(client.persistentVolumeClaims().inNamespace(NAMESPACE).withName("odoo-filestore-demo").get()).isNull();
        assertThat(databases.hasDatabase(DATABASE)).isFalse();
        assertThat(databases.roles()).doesNotContainKey(DATABASE);
    }

    @Test
    void shouldTearDownInstanceThatWasNeverConverged() {
        // Given
        OdooInstance instance = OperatorTestUtils.minimalInstance("demo");

        // When
        List<ApplyOutcome> outcomes = converger.teardown(instance, true);

        // Then
        assertThat(outcomes).containsOnly(ApplyOutcome.UNCHANGED);
    }

    @Test
    void shouldSerialiseConcurrentConvergenceOfSameInstance() throws Exception {
        // Given
        var applier = new ConcurrencyTrackingApplier(client);
        converger = new InstanceConverger(applier, databases, config, new KeyedLocks());
        OdooInstance instance = OperatorTestUtils.minimalInstance("demo");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<InstanceConverger.ConvergeResult>> results = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < 4; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return converge(instance);
                }));
            }
            start.countDown();
            for (Future<InstanceConverger.ConvergeResult> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        }
        finally {
            pool.shutdownNow();
        }

        // Then
        assertThat(applier.maxConcurrent()).isEqualTo(1);
        assertThat(databases.roles()).containsOnlyKeys(DATABASE);
    }

    private InstanceConverger.ConvergeResult converge(OdooInstance instance) {
        return converger.converge(instance, DesiredSpec.from(instance, null), ObservedState.read(client, instance));
    }

    private static class ConcurrencyTrackingApplier extends ResourceApplier {

        private final AtomicInteger inside = new AtomicInteger();
        private final AtomicInteger maxInside = new AtomicInteger();

        ConcurrencyTrackingApplier(KubernetesClient client) {
            super(client);
        }

        @Override
        public ApplyOutcome apply(HasMetadata desired) {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            try {
                Thread.sleep(2);
                return super.apply(desired);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            finally {
                inside.decrementAndGet();
            }
        }

        int maxConcurrent() {
            return maxInside.get();
        }
    }
}
