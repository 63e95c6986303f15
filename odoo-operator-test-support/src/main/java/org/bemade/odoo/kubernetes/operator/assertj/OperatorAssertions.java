/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.assertj;

import java.util.List;

import io.fabric8.kubernetes.api.model.HasMetadata;

import org.bemade.odoo.kubernetes.api.common.Condition;
import org.bemade.odoo.kubernetes.api.common.JobStatus;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatus;

public class OperatorAssertions {

    private OperatorAssertions() {
    }

    public static OdooInstanceStatusAssert assertThat(OdooInstanceStatus actual) {
        return OdooInstanceStatusAssert.assertThat(actual);
    }

    public static JobStatusAssert assertThat(JobStatus actual) {
        return JobStatusAssert.assertThat(actual);
    }

    public static ConditionAssert assertThat(Condition actual) {
        return ConditionAssert.assertThat(actual);
    }

    public static ConditionListAssert assertThat(List<Condition> actual) {
        return ConditionListAssert.assertThat(actual);
    }

    public static <T extends HasMetadata> MetadataAssert<T> assertThat(T actual) {
        return MetadataAssert.assertThat(actual);
    }
}
