/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.assertj;

import org.assertj.core.api.AbstractIntegerAssert;
import org.assertj.core.api.AbstractStringAssert;
import org.assertj.core.api.Assertions;

import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatus;

public class OdooInstanceStatusAssert extends AbstractStatusAssert<OdooInstanceStatus, OdooInstanceStatusAssert> {
    protected OdooInstanceStatusAssert(OdooInstanceStatus actual) {
        super(actual, OdooInstanceStatusAssert.class,
                OdooInstanceStatus::getObservedGeneration,
                OdooInstanceStatus::getConditions);
    }

    public static OdooInstanceStatusAssert assertThat(OdooInstanceStatus actual) {
        return new OdooInstanceStatusAssert(actual);
    }

    public OdooInstanceStatusAssert hasPhase(OdooInstanceStatus.Phase expected) {
        isNotNull();
        Assertions.assertThat(actual.getPhase()).as("phase").isEqualTo(expected);
        return this;
    }

    public AbstractIntegerAssert<?> healthCheckFailures() {
        return Assertions.assertThat(actual.getHealthCheckFailures()).as("healthCheckFailures");
    }

    public AbstractStringAssert<?> lastAppliedFingerprint() {
        return Assertions.assertThat(actual.getLastAppliedFingerprint()).as("lastAppliedFingerprint");
    }

    public OdooInstanceStatusAssert hasReadyReplicas(int expected) {
        Assertions.assertThat(actual.getReadyReplicas()).as("readyReplicas").isEqualTo(expected);
        return this;
    }
}
