/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobCoordinatorTest {

    private final JobCoordinator coordinator = new JobCoordinator();

    @Test
    void firstClaimSucceeds() {
        assertThat(coordinator.claim("ns/demo", "OdooBackupJob nightly")).isEmpty();
        assertThat(coordinator.holderOf("ns/demo")).contains("OdooBackupJob nightly");
    }

    @Test
    void claimIsReentrantForTheSameJob() {
        coordinator.claim("ns/demo", "OdooBackupJob nightly");
        assertThat(coordinator.claim("ns/demo", "OdooBackupJob nightly")).isEmpty();
    }

    @Test
    void secondJobIsToldWhoHoldsTheInstance() {
        // Given
        coordinator.claim("ns/demo", "OdooBackupJob nightly");

        // When
        var holder = coordinator.claim("ns/demo", "OdooRestoreJob refresh");

        // Then
        assertThat(holder).contains("OdooBackupJob nightly");
    }

    @Test
    void claimsOnDifferentInstancesAreIndependent() {
        coordinator.claim("ns/demo", "OdooBackupJob nightly");
        assertThat(coordinator.claim("ns/other", "OdooBackupJob other")).isEmpty();
    }

    @Test
    void releaseByNonHolderIsIgnored() {
        // Given
        coordinator.claim("ns/demo", "OdooBackupJob nightly");

        // When
        coordinator.release("ns/demo", "OdooRestoreJob refresh");

        // Then
        assertThat(coordinator.holderOf("ns/demo")).contains("OdooBackupJob nightly");
    }

    @Test
    void releaseFreesTheInstance() {
        // Given
        coordinator.claim("ns/demo", "OdooBackupJob nightly");

        // When
        coordinator.release("ns/demo", "OdooBackupJob nightly");

        // Then
        assertThat(coordinator.holderOf("ns/demo")).isEmpty();
        assertThat(coordinator.claim("ns/demo", "OdooRestoreJob refresh")).isEmpty();
    }
}
