/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceBuilder;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.bemade.odoo.kubernetes.operator.assertj.OperatorAssertions.assertThat;

class OdooInstanceStatusFactoryTest {

    private static final Instant EPOCH = Instant.EPOCH;
    private static final Clock TEST_CLOCK = Clock.fixed(EPOCH, ZoneId.of("Z"));
    private static final OdooInstanceStatusFactory.Observation OBSERVATION = new OdooInstanceStatusFactory.Observation(1, "shop-odoo-demo",
            "https://demo.example.com", "fingerprint-1");

    private OdooInstanceStatusFactory statusFactory;
    private OdooInstance instance;

    @BeforeEach
    void setUp() {
        statusFactory = new OdooInstanceStatusFactory(TEST_CLOCK);
        instance = OperatorTestUtils.minimalInstance("demo");
    }

    @Test
    void shouldKeepNewInstancePendingWhenValidationFails() {
        // Given

        // When
        OdooInstance patch = statusFactory.validationFailed(instance, "spec.replicas must not be negative");

        // Then
        assertThat(patch.getStatus())
                .hasPhase(OdooInstanceStatus.Phase.PENDING)
                .acceptedCondition().isAcceptedFalse("Validation", "spec.replicas must not be negative");
    }

    @Test
    void shouldLeavePhaseAloneWhenValidationFailsLater() {
        // Given
        OdooInstance ready = withStatus(statusFactory.ready(instance, OBSERVATION));

        // When
        OdooInstance patch = statusFactory.validationFailed(ready, "spec.replicas must not be negative");

        // Then
        assertThat(patch.getStatus()).hasPhase(OdooInstanceStatus.Phase.READY);
    }

    @Test
    void shouldRecordObservationWhileProvisioning() {
        // Given

        // When
        OdooInstance patch = statusFactory.provisioning(instance, OBSERVATION, "0/1 replicas ready");

        // Then
        assertThat(patch.getStatus())
                .hasPhase(OdooInstanceStatus.Phase.PROVISIONING)
                .hasObservedGeneration(1L)
                .hasReadyReplicas(1)
                .lastAppliedFingerprint().isEqualTo("fingerprint-1");
        assertThat(patch.getStatus()).readyCondition()
                .isReadyFalse(OdooInstanceStatusFactory.REASON_PROVISIONING)
                .hasMessage("0/1 replicas ready")
                .hasLastTransitionTime(EPOCH);
        assertThat(patch.getStatus().getDatabaseName()).isEqualTo("shop-odoo-demo");
        assertThat(patch.getStatus().getUrl()).isEqualTo("https://demo.example.com");
    }

    @Test
    void shouldKeepRecordedFingerprintWhenObservationHasNone() {
        // Given
        OdooInstance ready = withStatus(statusFactory.ready(instance, OBSERVATION));

        // When
        OdooInstance patch = statusFactory.ready(ready, new OdooInstanceStatusFactory.Observation(1, "shop-odoo-demo", null, null));

        // Then
        assertThat(patch.getStatus()).lastAppliedFingerprint().isEqualTo("fingerprint-1");
        assertThat(patch.getStatus().getUrl()).isNull();
    }

    @Test
    void shouldResetHealthCheckFailuresWhenReady() {
        // Given
        var aMinuteAgo = new OdooInstanceStatusFactory(Clock.offset(TEST_CLOCK, Duration.ofMinutes(-1)));
        OdooInstance degraded = withStatus(aMinuteAgo.degraded(instance, OBSERVATION, 2, "GET /web/health returned 503", false));

        // When
        OdooInstance patch = statusFactory.ready(degraded, OBSERVATION);

        // Then
        assertThat(patch.getStatus())
                .hasPhase(OdooInstanceStatus.Phase.READY)
                .healthCheckFailures().isZero();
        assertThat(patch.getStatus()).readyCondition().isReadyTrue();
    }

    @Test
    void shouldCountHealthCheckFailuresWhenDegraded() {
        // Given

        // When
        OdooInstance patch = statusFactory.degraded(instance, OBSERVATION, 2, "GET /web/health returned 503", false);

        // Then
        assertThat(patch.getStatus())
                .hasPhase(OdooInstanceStatus.Phase.DEGRADED)
                .healthCheckFailures().isEqualTo(2);
        assertThat(patch.getStatus()).readyCondition()
                .isReadyFalse(OdooInstanceStatusFactory.REASON_DEGRADED)
                .hasMessage("GET /web/health returned 503");
    }

    @Test
    void shouldMarkPersistentFailure() {
        // Given

        // When
        OdooInstance patch = statusFactory.degraded(instance, OBSERVATION, 3, "GET /web/health returned 503", true);

        // Then
        assertThat(patch.getStatus()).readyCondition().isReadyFalse(OdooInstanceStatusFactory.REASON_PERSISTENT_FAILURE);
    }

    @Test
    void shouldMarkTerminating() {
        // Given
        OdooInstance ready = withStatus(statusFactory.ready(instance, OBSERVATION));

        // When
        OdooInstance patch = statusFactory.terminating(ready, "Removing owned resources");

        // Then
        assertThat(patch.getStatus())
                .hasPhase(OdooInstanceStatus.Phase.TERMINATING)
                .readyCondition().isReadyFalse(OdooInstanceStatusFactory.REASON_TERMINATING);
        assertThat(patch.getStatus()).acceptedCondition().isAcceptedTrue();
    }

    private OdooInstance withStatus(OdooInstance patch) {
        return new OdooInstanceBuilder(instance).withStatus(patch.getStatus()).build();
    }
}
