/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.CustomResource;

import org.bemade.odoo.kubernetes.api.common.Condition;
import org.bemade.odoo.kubernetes.api.common.JobStatus;
import org.bemade.odoo.kubernetes.api.common.JobStatusBuilder;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Status patches for backup and restore jobs.
 *
 * @param <J> the job resource type
 */
public class JobStatusFactory<J extends CustomResource<?, JobStatus>> extends StatusFactory<J> {

    public static final String REASON_QUEUED = "Queued";
    public static final String REASON_RUNNING = "Running";
    public static final String REASON_SUCCEEDED = "Succeeded";
    public static final String REASON_INTERRUPTED = "Interrupted";
    public static final String REASON_SPEC_CHANGE_IGNORED = "SpecChangeIgnored";

    private final Supplier<J> resourceFactory;

    public JobStatusFactory(Clock clock, Supplier<J> resourceFactory) {
        super(clock);
        this.resourceFactory = resourceFactory;
    }

    private static <J extends CustomResource<?, JobStatus>> JobStatusBuilder statusFrom(J observed) {
        JobStatus existing = observed.getStatus();
        return existing == null ? new JobStatusBuilder() : existing.edit();
    }

    private static <J extends CustomResource<?, JobStatus>> List<Condition> merged(J observed, Condition... conditions) {
        var existing = Optional.ofNullable(observed.getStatus()).map(JobStatus::getConditions).orElse(null);
        return ResourceState.newConditions(existing, ResourceState.of(conditions));
    }

    private J statusPatch(J observed, JobStatus status) {
        J patch = resourceFactory.get();
        patch.setMetadata(new ObjectMetaBuilder()
                .withUid(ResourcesUtil.uid(observed))
                .withName(ResourcesUtil.name(observed))
                .withNamespace(ResourcesUtil.namespace(observed))
                .build());
        patch.setStatus(status);
        return patch;
    }

    /**
     * The job is waiting for another job on the same instance to finish.
     */
    public J queued(J observed, String activeJob) {
        Condition ready = newFalseCondition(observed, Condition.Type.Ready, REASON_QUEUED,
                "Waiting for " + activeJob + " to finish");
        return statusPatch(observed, statusFrom(observed)
                .withObservedGeneration(ResourcesUtil.generation(observed))
                .withPhase(JobStatus.Phase.PENDING)
                .withMessage("Queued behind " + activeJob)
                .withConditions(merged(observed, newTrueCondition(observed, Condition.Type.Accepted), ready))
                .build());
    }

    /**
     * The job's workflow has been submitted. The observed generation is fixed here, later spec changes are ignored.
     */
    public J running(J observed, Instant startTime) {
        Condition ready = newFalseCondition(observed, Condition.Type.Ready, REASON_RUNNING, "");
        return statusPatch(observed, statusFrom(observed)
                .withObservedGeneration(ResourcesUtil.generation(observed))
                .withPhase(JobStatus.Phase.RUNNING)
                .withStartTime(startTime)
                .withMessage(null)
                .withConditions(merged(observed, newTrueCondition(observed, Condition.Type.Accepted), ready))
                .build());
    }

    public J succeeded(J observed, @Nullable Long archiveSize, @Nullable String archiveChecksum) {
        Condition ready = newConditionBuilder(observed)
                .withObservedGeneration(observedGeneration(observed))
                .withType(Condition.Type.Ready)
                .withStatus(Condition.Status.TRUE)
                .withReason(REASON_SUCCEEDED)
                .withMessage("")
                .build();
        return statusPatch(observed, statusFrom(observed)
                .withPhase(JobStatus.Phase.SUCCEEDED)
                .withCompletionTime(now())
                .withArchiveSize(archiveSize)
                .withArchiveChecksum(archiveChecksum)
                .withMessage(null)
                .withConditions(merged(observed, ready))
                .build());
    }

    /**
     * @param reason CamelCase reason, usually the error kind
     */
    public J failed(J observed, String reason, String message) {
        Condition ready = newConditionBuilder(observed)
                .withObservedGeneration(observedGeneration(observed))
                .withType(Condition.Type.Ready)
                .withStatus(Condition.Status.FALSE)
                .withReason(reason)
                .withMessage(message)
                .build();
        JobStatusBuilder status = statusFrom(observed)
                .withPhase(JobStatus.Phase.FAILED)
                .withCompletionTime(now())
                .withMessage(message)
                .withConditions(merged(observed, ready));
        if (observed.getStatus() == null || observed.getStatus().getObservedGeneration() == null) {
            status.withObservedGeneration(ResourcesUtil.generation(observed));
        }
        return statusPatch(observed, status.build());
    }

    /**
     * The job was rejected before it started.
     */
    public J rejected(J observed, String reason, String message) {
        Condition accepted = newFalseCondition(observed, Condition.Type.Accepted, reason, message);
        J failed = failed(observed, reason, message);
        failed.getStatus().setConditions(ResourceState.newConditions(failed.getStatus().getConditions(), ResourceState.of(accepted)));
        return failed;
    }

    /**
     * The spec changed after the job started. The change is ignored.
     */
    public J specChangeIgnored(J observed) {
        Condition accepted = newFalseCondition(observed, Condition.Type.Accepted, REASON_SPEC_CHANGE_IGNORED,
                "The spec changed at generation " + ResourcesUtil.generation(observed)
                        + " after the job started at generation " + observedGeneration(observed) + "; the change is ignored");
        return statusPatch(observed, statusFrom(observed)
                .withConditions(merged(observed, accepted))
                .build());
    }

    /**
     * @return true if the spec was edited after the job recorded its generation
     */
    public static boolean hasIgnoredSpecChange(CustomResource<?, JobStatus> job) {
        JobStatus status = job.getStatus();
        return status != null
                && status.getObservedGeneration() != null
                && ResourcesUtil.generation(job) > status.getObservedGeneration();
    }

    private static long observedGeneration(CustomResource<?, JobStatus> job) {
        return Optional.ofNullable(job.getStatus())
                .map(JobStatus::getObservedGeneration)
                .orElse(ResourcesUtil.generation(job));
    }

    @Override
    public J newUnknownConditionStatusPatch(J observed,
                                            Condition.Type type,
                                            String reason,
                                            Exception e) {
        Condition unknown = newUnknownCondition(observed, type, reason, e);
        return statusPatch(observed, statusFrom(observed)
                .withConditions(merged(observed, unknown))
                .build());
    }

    @Override
    public J newFalseConditionStatusPatch(J observed,
                                          Condition.Type type,
                                          String reason,
                                          String message) {
        Condition falseCondition = newFalseCondition(observed, type, reason, message);
        return statusPatch(observed, statusFrom(observed)
                .withConditions(merged(observed, falseCondition))
                .build());
    }

    @Override
    public J newTrueConditionStatusPatch(J observed,
                                         Condition.Type type) {
        Condition trueCondition = newTrueCondition(observed, type);
        return statusPatch(observed, statusFrom(observed)
                .withConditions(merged(observed, trueCondition))
                .build());
    }
}
