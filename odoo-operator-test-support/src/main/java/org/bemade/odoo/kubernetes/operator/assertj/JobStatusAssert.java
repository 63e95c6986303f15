/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.assertj;

import org.assertj.core.api.AbstractStringAssert;
import org.assertj.core.api.Assertions;

import org.bemade.odoo.kubernetes.api.common.JobStatus;

public class JobStatusAssert extends AbstractStatusAssert<JobStatus, JobStatusAssert> {
    protected JobStatusAssert(JobStatus actual) {
        super(actual, JobStatusAssert.class,
                JobStatus::getObservedGeneration,
                JobStatus::getConditions);
    }

    public static JobStatusAssert assertThat(JobStatus actual) {
        return new JobStatusAssert(actual);
    }

    public JobStatusAssert hasPhase(JobStatus.Phase expected) {
        isNotNull();
        Assertions.assertThat(actual.getPhase()).as("phase").isEqualTo(expected);
        return this;
    }

    public JobStatusAssert isTerminal() {
        isNotNull();
        Assertions.assertThat(actual.getPhase()).as("phase").isNotNull();
        Assertions.assertThat(actual.getPhase().isTerminal()).as("phase %s is terminal", actual.getPhase()).isTrue();
        Assertions.assertThat(actual.getCompletionTime()).as("completionTime").isNotNull();
        return this;
    }

    public JobStatusAssert hasArchiveSize(long expected) {
        Assertions.assertThat(actual.getArchiveSize()).as("archiveSize").isEqualTo(expected);
        return this;
    }

    public AbstractStringAssert<?> archiveChecksum() {
        return Assertions.assertThat(actual.getArchiveChecksum()).as("archiveChecksum");
    }

    public AbstractStringAssert<?> message() {
        return Assertions.assertThat(actual.getMessage()).as("message");
    }
}
