/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

import org.bemade.odoo.kubernetes.api.common.Condition;
import org.bemade.odoo.kubernetes.api.common.InstanceRef;
import org.bemade.odoo.kubernetes.api.common.JobStatus;
import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.InvalidResourceException;
import org.bemade.odoo.kubernetes.operator.JobStatusFactory;
import org.bemade.odoo.kubernetes.operator.OperatorConfig;
import org.bemade.odoo.kubernetes.operator.PreconditionFailedException;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;
import org.bemade.odoo.kubernetes.operator.dispatch.ErrorKind;
import org.bemade.odoo.kubernetes.operator.dispatch.FailureClassifier;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.name;
import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * Drives a job through {@code Pending -> Running -> Succeeded | Failed}.
 * <ul>
 * <li>Pending: validate, resolve the instance, check the flow's precondition, claim the instance and submit the workflow</li>
 * <li>Running: poll the execution until it finishes</li>
 * <li>Succeeded and Failed are terminal and never re-run</li>
 * </ul>
 * Deleting a job cancels its execution. The instance stays claimed until the execution's worker has exited.
 *
 * @param <J> the job resource type
 */
public abstract class AbstractJobReconciler<J extends CustomResource<?, JobStatus>> implements
        Reconciler<J>,
        Cleaner<J> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractJobReconciler.class);

    static final Duration RUNNING_POLL_INTERVAL = Duration.ofSeconds(5);

    protected final OperatorConfig config;
    private final Clock clock;
    private final JobCoordinator coordinator;
    private final JobRunner runner;
    private final JobStatusFactory<J> statusFactory;

    protected AbstractJobReconciler(Clock clock,
                                    OperatorConfig config,
                                    JobCoordinator coordinator,
                                    JobRunner runner,
                                    JobStatusFactory<J> statusFactory) {
        this.clock = Objects.requireNonNull(clock);
        this.config = Objects.requireNonNull(config);
        this.coordinator = Objects.requireNonNull(coordinator);
        this.runner = Objects.requireNonNull(runner);
        this.statusFactory = Objects.requireNonNull(statusFactory);
    }

    /**
     * @throws InvalidResourceException listing every problem of the spec
     */
    protected abstract void validate(J job);

    protected abstract InstanceRef instanceRef(J job);

    /**
     * @throws PreconditionFailedException if the job cannot start against {@code instance}
     */
    protected abstract void checkPrecondition(J job, OdooInstance instance, KubernetesClient client);

    protected abstract JobWorkflow workflow(J job, OdooInstance instance, KubernetesClient client);

    @Override
    public UpdateControl<J> reconcile(J job, Context<J> context) {
        JobStatus.Phase phase = phaseOf(job);
        if (phase.isTerminal()) {
            runner.remove(jobKey(job));
            return recordIgnoredSpecChange(job);
        }
        else if (phase == JobStatus.Phase.RUNNING) {
            return poll(job);
        }
        return start(job, context.getClient());
    }

    private UpdateControl<J> start(J job, KubernetesClient client) {
        try {
            validate(job);
        }
        catch (InvalidResourceException e) {
            LOGGER.warn("{} is invalid: {}", ResourcesUtil.namespacedSlug(job), e.getMessage());
            return UpdateControl.patchStatus(statusFactory.rejected(job, ErrorKind.VALIDATION.reason(), e.getMessage()));
        }

        String instanceName = instanceRef(job).getName();
        OdooInstance instance = client.resources(OdooInstance.class).inNamespace(namespace(job)).withName(instanceName).get();
        if (instance == null) {
            String message = "OdooInstance " + namespace(job) + "/" + instanceName + " does not exist";
            LOGGER.warn("Rejecting {}: {}", ResourcesUtil.namespacedSlug(job), message);
            return UpdateControl.patchStatus(statusFactory.rejected(job, ErrorKind.FATAL.reason(), message));
        }
        try {
            checkPrecondition(job, instance, client);
        }
        catch (PreconditionFailedException e) {
            LOGGER.warn("Rejecting {}: {}", ResourcesUtil.namespacedSlug(job), e.getMessage());
            return UpdateControl.patchStatus(statusFactory.rejected(job, PreconditionFailedException.REASON, e.getMessage()));
        }

        String instanceKey = instanceKey(job);
        Optional<String> holder = coordinator.claim(instanceKey, displayName(job));
        if (holder.isPresent()) {
            LOGGER.atInfo().setMessage("{} is queued behind {}")
                    .addArgument(() -> ResourcesUtil.namespacedSlug(job))
                    .addArgument(holder::get)
                    .log();
            return patchIfChanged(job, statusFactory.queued(job, holder.get()))
                    .rescheduleAfter(config.jobQueuePollInterval());
        }
        try {
            String jobName = displayName(job);
            runner.submit(jobKey(job), workflow(job, instance, client), () -> coordinator.release(instanceKey, jobName));
        }
        catch (RuntimeException e) {
            coordinator.release(instanceKey, displayName(job));
            throw e;
        }
        LOGGER.info("Started {} against {}", ResourcesUtil.namespacedSlug(job), ResourcesUtil.namespacedSlug(instance));
        return UpdateControl.patchStatus(statusFactory.running(job, clock.instant()))
                .rescheduleAfter(RUNNING_POLL_INTERVAL);
    }

    /**
     * An execution only reports done once its worker has exited, which has already released the claim.
     */
    private UpdateControl<J> poll(J job) {
        Optional<JobRunner.Execution> execution = runner.find(jobKey(job));
        if (execution.isEmpty()) {
            coordinator.release(instanceKey(job), displayName(job));
            LOGGER.warn("{} was running when the operator stopped, marking it failed", ResourcesUtil.namespacedSlug(job));
            return UpdateControl.patchStatus(statusFactory.failed(job, JobStatusFactory.REASON_INTERRUPTED,
                    "The operator restarted while the job was running"));
        }
        if (!execution.get().isDone()) {
            UpdateControl<J> control = recordIgnoredSpecChange(job);
            return control.rescheduleAfter(RUNNING_POLL_INTERVAL);
        }

        try {
            JobOutcome outcome = execution.get().outcome();
            LOGGER.info("{} succeeded", ResourcesUtil.namespacedSlug(job));
            return UpdateControl.patchStatus(statusFactory.succeeded(job, outcome.archiveSize(), outcome.archiveChecksum()));
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            ErrorKind kind = FailureClassifier.classify(cause);
            LOGGER.warn("{} failed ({})", ResourcesUtil.namespacedSlug(job), kind.reason(), cause);
            return UpdateControl.patchStatus(statusFactory.failed(job, kind.reason(), messageOf(cause)));
        }
        catch (TimeoutException e) {
            LOGGER.warn("{} failed: {}", ResourcesUtil.namespacedSlug(job), e.getMessage());
            return UpdateControl.patchStatus(statusFactory.failed(job, ErrorKind.TRANSIENT.reason(), e.getMessage()));
        }
        catch (CancellationException e) {
            return UpdateControl.patchStatus(statusFactory.failed(job, JobStatusFactory.REASON_INTERRUPTED, "The job was cancelled"));
        }
    }

    private UpdateControl<J> recordIgnoredSpecChange(J job) {
        if (JobStatusFactory.hasIgnoredSpecChange(job)) {
            return patchIfChanged(job, statusFactory.specChangeIgnored(job));
        }
        return UpdateControl.noUpdate();
    }

    @Override
    public ErrorStatusUpdateControl<J> updateErrorStatus(J job, Context<J> context, Exception e) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Completed reconciliation of {}/{} with error {}", namespace(job), name(job), e.toString());
        }
        return ErrorStatusUpdateControl.patchStatus(statusFactory.newUnknownConditionStatusPatch(job, Condition.Type.Ready,
                FailureClassifier.classify(e).reason(), e));
    }

    @Override
    public DeleteControl cleanup(J job, Context<J> context) {
        boolean submitted = runner.find(jobKey(job)).isPresent();
        runner.cancel(jobKey(job));
        if (!submitted) {
            // a submitted job's claim is released when its worker exits
            coordinator.release(instanceKey(job), displayName(job));
        }
        return DeleteControl.defaultDelete();
    }

    private UpdateControl<J> patchIfChanged(J observed, J patch) {
        if (Objects.equals(observed.getStatus(), patch.getStatus())) {
            return UpdateControl.noUpdate();
        }
        return UpdateControl.patchStatus(patch);
    }

    private static JobStatus.Phase phaseOf(CustomResource<?, JobStatus> job) {
        return Optional.ofNullable(job.getStatus()).map(JobStatus::getPhase).orElse(JobStatus.Phase.PENDING);
    }

    String instanceKey(J job) {
        String instanceName = Optional.ofNullable(job.getSpec()).map(spec -> instanceRef(job)).map(InstanceRef::getName).orElse("");
        return namespace(job) + "/" + instanceName;
    }

    static String jobKey(CustomResource<?, JobStatus> job) {
        return job.getKind() + "-" + namespace(job) + "-" + name(job) + "-" + ResourcesUtil.uid(job);
    }

    static String displayName(CustomResource<?, JobStatus> job) {
        return job.getKind() + " " + name(job);
    }

    static String messageOf(Throwable t) {
        return Optional.ofNullable(t.getMessage()).orElse(t.getClass().getSimpleName());
    }

    /**
     * @throws InvalidResourceException if there are violations
     */
    static void requireValid(List<String> violations) {
        if (!violations.isEmpty()) {
            throw new InvalidResourceException(String.join("; ", violations));
        }
    }
}
