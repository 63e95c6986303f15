/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.javaoperatorsdk.operator.api.config.informer.InformerEventSourceConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceContext;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.RetryInfo;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.javaoperatorsdk.operator.processing.event.source.EventSource;
import io.javaoperatorsdk.operator.processing.event.source.informer.InformerEventSource;

import org.bemade.odoo.kubernetes.api.common.Condition;
import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatus;
import org.bemade.odoo.kubernetes.operator.database.DatabaseAdminClient;
import org.bemade.odoo.kubernetes.operator.dispatch.ErrorKind;
import org.bemade.odoo.kubernetes.operator.dispatch.FailureClassifier;
import org.bemade.odoo.kubernetes.operator.dispatch.KeyedLocks;
import org.bemade.odoo.kubernetes.operator.dispatch.RetryPolicy;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;
import org.bemade.odoo.kubernetes.operator.model.ObservedState;
import org.bemade.odoo.kubernetes.operator.model.OdooInstanceValidator;
import org.bemade.odoo.kubernetes.operator.model.SpecFingerprint;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.name;
import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * Reconciles {@link OdooInstance}s: validates the spec, converges the database and the owned objects,
 * then tracks the health of the workload.
 * <ul>
 * <li>Pending/Provisioning until every replica is ready and the workload answers its health check</li>
 * <li>Ready instances failing a check become Degraded; checks are retried with backoff until the retry policy is exhausted</li>
 * <li>Deletion removes the owned objects. The filestore and the database are only removed when the instance
 * carries the purge annotation</li>
 * </ul>
 */
public class OdooInstanceReconciler implements
        Reconciler<OdooInstance>,
        Cleaner<OdooInstance> {

    private static final Logger LOGGER = LoggerFactory.getLogger(OdooInstanceReconciler.class);

    static final Duration PROVISIONING_POLL_INTERVAL = Duration.ofSeconds(10);

    private final Clock clock;
    private final OperatorConfig config;
    private final DatabaseAdminClient databaseAdminClient;
    private final HealthProbe healthProbe;
    private final KeyedLocks locks;
    private final OdooInstanceStatusFactory statusFactory;
    private final OdooInstanceValidator validator = new OdooInstanceValidator();
    private final Map<String, Instant> nextHealthCheck = new ConcurrentHashMap<>();

    public OdooInstanceReconciler(Clock clock,
                                  OperatorConfig config,
                                  DatabaseAdminClient databaseAdminClient,
                                  HealthProbe healthProbe,
                                  KeyedLocks locks) {
        this.clock = Objects.requireNonNull(clock);
        this.config = Objects.requireNonNull(config);
        this.databaseAdminClient = Objects.requireNonNull(databaseAdminClient);
        this.healthProbe = Objects.requireNonNull(healthProbe);
        this.locks = Objects.requireNonNull(locks);
        this.statusFactory = new OdooInstanceStatusFactory(clock);
    }

    @Override
    public List<EventSource<?, OdooInstance>> prepareEventSources(EventSourceContext<OdooInstance> context) {
        return List.of(
                ownedObjectEventSource(context, Deployment.class),
                ownedObjectEventSource(context, Service.class),
                ownedObjectEventSource(context, Ingress.class),
                ownedObjectEventSource(context, ConfigMap.class),
                ownedObjectEventSource(context, Secret.class),
                ownedObjectEventSource(context, PersistentVolumeClaim.class));
    }

    private static <R extends HasMetadata> InformerEventSource<R, OdooInstance> ownedObjectEventSource(EventSourceContext<OdooInstance> context,
                                                                                                      Class<R> type) {
        InformerEventSourceConfiguration<R> configuration = InformerEventSourceConfiguration.from(type, OdooInstance.class)
                .withName(type.getSimpleName().toLowerCase(Locale.ROOT))
                .withLabelSelector(Labels.MANAGED_BY + "=" + Labels.OPERATOR_NAME)
                .withSecondaryToPrimaryMapper(OdooInstanceReconciler::owningInstance)
                .build();
        return new InformerEventSource<>(configuration, context);
    }

    static Set<ResourceID> owningInstance(HasMetadata owned) {
        Map<String, String> labels = owned.getMetadata().getLabels();
        String instance = labels == null ? null : labels.get(Labels.INSTANCE);
        if (instance == null) {
            return Set.of();
        }
        return Set.of(new ResourceID(instance, namespace(owned)));
    }

    @Override
    public UpdateControl<OdooInstance> reconcile(OdooInstance instance, Context<OdooInstance> context) {
        KubernetesClient client = context.getClient();
        ObservedState observed = ObservedState.read(client, instance);
        try {
            validator.validate(instance, observed.filestoreClaim());
        }
        catch (InvalidResourceException e) {
            LOGGER.atWarn().setMessage("{} is invalid: {}")
                    .addArgument(() -> ResourcesUtil.namespacedSlug(instance))
                    .addArgument(e.getMessage())
                    .log();
            return patchIfChanged(instance, statusFactory.validationFailed(instance, e.getMessage()));
        }

        DesiredSpec spec = DesiredSpec.from(instance, config.defaultStorageClass());
        String fingerprint = SpecFingerprint.of(spec);
        InstanceConverger converger = converger(client);
        String url = spec.ingress() == null ? null : spec.ingress().url();
        var observation = new OdooInstanceStatusFactory.Observation(observed.readyReplicas(), converger.databaseName(instance), url, fingerprint);

        if (fingerprint.equals(lastAppliedFingerprint(instance)) && converger.isCurrent(instance, spec, observed)) {
            return checkReadiness(instance, spec, observation);
        }

        try {
            InstanceConverger.ConvergeResult result = converger.converge(instance, spec, observed);
            LOGGER.atInfo().setMessage("Converged {} with {} change(s)")
                    .addArgument(() -> ResourcesUtil.namespacedSlug(instance))
                    .addArgument(result::mutations)
                    .log();
        }
        catch (RuntimeException e) {
            return handleConvergeFailure(instance, e);
        }
        nextHealthCheck.remove(InstanceConverger.lockKey(instance));
        return patchIfChanged(instance, statusFactory.provisioning(instance, observation, "Waiting for the workload to become ready"))
                .rescheduleAfter(PROVISIONING_POLL_INTERVAL);
    }

    private UpdateControl<OdooInstance> checkReadiness(OdooInstance instance,
                                                       DesiredSpec spec,
                                                       OdooInstanceStatusFactory.Observation observation) {
        String key = InstanceConverger.lockKey(instance);
        Instant due = nextHealthCheck.get(key);
        Instant now = clock.instant();
        if (due != null && now.isBefore(due)) {
            // a status patch of our own, or some other event, arrived before the next check is due
            return UpdateControl.<OdooInstance> noUpdate().rescheduleAfter(Duration.between(now, due));
        }

        HealthProbe.Result health;
        if (observation.readyReplicas() < spec.replicas()) {
            health = HealthProbe.Result.unhealthy(observation.readyReplicas() + "/" + spec.replicas() + " replicas ready");
        }
        else if (spec.replicas() == 0) {
            health = HealthProbe.Result.HEALTHY;
        }
        else {
            health = healthProbe.check(instance);
        }

        if (health.healthy()) {
            nextHealthCheck.remove(key);
            if (phaseOf(instance) != OdooInstanceStatus.Phase.READY) {
                LOGGER.info("{} is ready", ResourcesUtil.namespacedSlug(instance));
            }
            return patchIfChanged(instance, statusFactory.ready(instance, observation));
        }

        OdooInstanceStatus.Phase phase = phaseOf(instance);
        if (phase == OdooInstanceStatus.Phase.READY || phase == OdooInstanceStatus.Phase.DEGRADED) {
            RetryPolicy retryPolicy = config.retryPolicy();
            int failures = healthCheckFailures(instance) + 1;
            boolean persistent = retryPolicy.isExhausted(failures);
            LOGGER.atWarn().setMessage("Health check {} of {} failed: {}")
                    .addArgument(failures)
                    .addArgument(() -> ResourcesUtil.namespacedSlug(instance))
                    .addArgument(health.detail())
                    .log();
            UpdateControl<OdooInstance> control = patchIfChanged(instance,
                    statusFactory.degraded(instance, observation, failures, health.detail(), persistent));
            if (persistent) {
                nextHealthCheck.put(key, now.plus(config.resyncInterval()));
                return control;
            }
            Duration delay = retryPolicy.delayAfter(failures);
            nextHealthCheck.put(key, now.plus(delay));
            return control.rescheduleAfter(delay);
        }
        return patchIfChanged(instance, statusFactory.provisioning(instance, observation, health.detail()))
                .rescheduleAfter(PROVISIONING_POLL_INTERVAL);
    }

    private UpdateControl<OdooInstance> handleConvergeFailure(OdooInstance instance, RuntimeException e) {
        ErrorKind kind = FailureClassifier.classify(e);
        switch (kind) {
            case VALIDATION:
                return patchIfChanged(instance, statusFactory.validationFailed(instance, StatusFactory.messageOf(e)));
            case CONFLICT:
                LOGGER.info("Conflict while converging {}, retrying in {}: {}", ResourcesUtil.namespacedSlug(instance),
                        config.conflictRetryDelay(), StatusFactory.messageOf(e));
                return patchIfChanged(instance, statusFactory.newFalseConditionStatusPatch(instance, Condition.Type.Ready, kind.reason(),
                        StatusFactory.messageOf(e)))
                        .rescheduleAfter(config.conflictRetryDelay());
            case FATAL:
                LOGGER.error("Unable to converge {}", ResourcesUtil.namespacedSlug(instance), e);
                return patchIfChanged(instance, statusFactory.newFalseConditionStatusPatch(instance, Condition.Type.Ready, kind.reason(),
                        StatusFactory.messageOf(e)));
            default:
                throw e;
        }
    }

    @Override
    public ErrorStatusUpdateControl<OdooInstance> updateErrorStatus(OdooInstance instance, Context<OdooInstance> context, Exception e) {
        boolean lastAttempt = context.getRetryInfo().map(RetryInfo::isLastAttempt).orElse(false);
        String reason = lastAttempt ? OdooInstanceStatusFactory.REASON_PERSISTENT_FAILURE : FailureClassifier.classify(e).reason();
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Completed reconciliation of {}/{} with error {}", namespace(instance), name(instance), e.toString());
        }
        return ErrorStatusUpdateControl.patchStatus(statusFactory.newUnknownConditionStatusPatch(instance, Condition.Type.Ready, reason, e));
    }

    @Override
    public DeleteControl cleanup(OdooInstance instance, Context<OdooInstance> context) {
        KubernetesClient client = context.getClient();
        nextHealthCheck.remove(InstanceConverger.lockKey(instance));
        markTerminating(client, instance);
        boolean purge = Annotations.isPurgeOnDelete(instance);
        try {
            List<ApplyOutcome> outcomes = converger(client).teardown(instance, purge);
            LOGGER.atInfo().setMessage("Removed {} object(s) of {}{}")
                    .addArgument(() -> outcomes.stream().filter(ApplyOutcome::isMutation).count())
                    .addArgument(() -> ResourcesUtil.namespacedSlug(instance))
                    .addArgument(purge ? " including its filestore and database" : "")
                    .log();
        }
        catch (RuntimeException e) {
            if (FailureClassifier.classify(e) == ErrorKind.CONFLICT) {
                LOGGER.info("Conflict while removing {}, retrying in {}: {}", ResourcesUtil.namespacedSlug(instance),
                        config.conflictRetryDelay(), StatusFactory.messageOf(e));
                return DeleteControl.noFinalizerRemoval().rescheduleAfter(config.conflictRetryDelay());
            }
            throw e;
        }
        return DeleteControl.defaultDelete();
    }

    private void markTerminating(KubernetesClient client, OdooInstance instance) {
        if (phaseOf(instance) == OdooInstanceStatus.Phase.TERMINATING) {
            return;
        }
        try {
            client.resource(statusFactory.terminating(instance, "Removing owned objects")).patchStatus();
        }
        catch (KubernetesClientException e) {
            LOGGER.warn("Unable to mark {} as terminating: {}", ResourcesUtil.namespacedSlug(instance), e.getMessage());
        }
    }

    private InstanceConverger converger(KubernetesClient client) {
        return new InstanceConverger(new ResourceApplier(client), databaseAdminClient, config, locks);
    }

    private static UpdateControl<OdooInstance> patchIfChanged(OdooInstance observed, OdooInstance patch) {
        if (Objects.equals(observed.getStatus(), patch.getStatus())) {
            return UpdateControl.noUpdate();
        }
        return UpdateControl.patchStatus(patch);
    }

    private static OdooInstanceStatus.Phase phaseOf(OdooInstance instance) {
        return Optional.ofNullable(instance.getStatus()).map(OdooInstanceStatus::getPhase).orElse(OdooInstanceStatus.Phase.PENDING);
    }

    private static String lastAppliedFingerprint(OdooInstance instance) {
        return Optional.ofNullable(instance.getStatus()).map(OdooInstanceStatus::getLastAppliedFingerprint).orElse(null);
    }

    private static int healthCheckFailures(OdooInstance instance) {
        return Optional.ofNullable(instance.getStatus()).map(OdooInstanceStatus::getHealthCheckFailures).orElse(0);
    }
}
