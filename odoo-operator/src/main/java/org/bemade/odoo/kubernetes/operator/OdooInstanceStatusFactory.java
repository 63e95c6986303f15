/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import org.bemade.odoo.kubernetes.api.common.Condition;
import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceBuilder;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatus;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatusBuilder;

import edu.umd.cs.findbugs.annotations.Nullable;

public class OdooInstanceStatusFactory extends StatusFactory<OdooInstance> {

    public static final String REASON_PROVISIONING = "Provisioning";
    public static final String REASON_DEGRADED = "Degraded";
    public static final String REASON_PERSISTENT_FAILURE = "PersistentFailure";
    public static final String REASON_TERMINATING = "Terminating";

    public OdooInstanceStatusFactory(Clock clock) {
        super(clock);
    }

    /**
     * Observed facts recorded alongside the phase.
     *
     * @param readyReplicas ready replicas of the deployment
     * @param databaseName the managed database
     * @param url external URL, if the instance has an ingress
     * @param fingerprint fingerprint of the applied desired state, or null to keep the recorded one
     */
    public record Observation(int readyReplicas, String databaseName, @Nullable String url, @Nullable String fingerprint) {}

    private OdooInstanceStatusBuilder statusFrom(OdooInstance observed) {
        OdooInstanceStatus existing = observed.getStatus();
        OdooInstanceStatusBuilder builder = existing == null ? new OdooInstanceStatusBuilder() : existing.edit();
        return builder.withObservedGeneration(ResourcesUtil.generation(observed));
    }

    private static List<Condition> merged(OdooInstance observed, Condition... conditions) {
        var existing = Optional.ofNullable(observed.getStatus()).map(OdooInstanceStatus::getConditions).orElse(null);
        return ResourceState.newConditions(existing, ResourceState.of(conditions));
    }

    private static OdooInstanceStatusBuilder record(OdooInstanceStatusBuilder builder, Observation observation) {
        builder.withReadyReplicas(observation.readyReplicas())
                .withDatabaseName(observation.databaseName())
                .withUrl(observation.url());
        if (observation.fingerprint() != null) {
            builder.withLastAppliedFingerprint(observation.fingerprint());
        }
        return builder;
    }

    private OdooInstance statusPatch(OdooInstance observed, OdooInstanceStatus status) {
        // @formatter:off
        return new OdooInstanceBuilder()
                .withNewMetadata()
                    .withUid(ResourcesUtil.uid(observed))
                    .withName(ResourcesUtil.name(observed))
                    .withNamespace(ResourcesUtil.namespace(observed))
                .endMetadata()
                .withStatus(status)
                .build();
        // @formatter:on
    }

    /**
     * The spec failed validation. The phase is left alone, new objects stay Pending.
     */
    public OdooInstance validationFailed(OdooInstance observed, String message) {
        Condition accepted = newFalseCondition(observed, Condition.Type.Accepted, "Validation", message);
        OdooInstanceStatus.Phase phase = Optional.ofNullable(observed.getStatus())
                .map(OdooInstanceStatus::getPhase)
                .orElse(OdooInstanceStatus.Phase.PENDING);
        return statusPatch(observed, statusFrom(observed)
                .withPhase(phase)
                .withConditions(merged(observed, accepted))
                .build());
    }

    public OdooInstance provisioning(OdooInstance observed, Observation observation, String message) {
        Condition accepted = newTrueCondition(observed, Condition.Type.Accepted);
        Condition ready = newFalseCondition(observed, Condition.Type.Ready, REASON_PROVISIONING, message);
        return statusPatch(observed, record(statusFrom(observed), observation)
                .withPhase(OdooInstanceStatus.Phase.PROVISIONING)
                .withHealthCheckFailures(0)
                .withConditions(merged(observed, accepted, ready))
                .build());
    }

    public OdooInstance ready(OdooInstance observed, Observation observation) {
        Condition accepted = newTrueCondition(observed, Condition.Type.Accepted);
        Condition ready = newTrueCondition(observed, Condition.Type.Ready);
        return statusPatch(observed, record(statusFrom(observed), observation)
                .withPhase(OdooInstanceStatus.Phase.READY)
                .withHealthCheckFailures(0)
                .withConditions(merged(observed, accepted, ready))
                .build());
    }

    /**
     * A previously ready instance is failing its health checks.
     *
     * @param failures consecutive failed checks, including this one
     * @param persistent true once no further automatic checks will be scheduled
     */
    public OdooInstance degraded(OdooInstance observed, Observation observation, int failures, String message, boolean persistent) {
        Condition ready = newFalseCondition(observed, Condition.Type.Ready,
                persistent ? REASON_PERSISTENT_FAILURE : REASON_DEGRADED, message);
        return statusPatch(observed, record(statusFrom(observed), observation)
                .withPhase(OdooInstanceStatus.Phase.DEGRADED)
                .withHealthCheckFailures(failures)
                .withConditions(merged(observed, ready))
                .build());
    }

    public OdooInstance terminating(OdooInstance observed, String message) {
        Condition ready = newFalseCondition(observed, Condition.Type.Ready, REASON_TERMINATING, message);
        return statusPatch(observed, statusFrom(observed)
                .withPhase(OdooInstanceStatus.Phase.TERMINATING)
                .withConditions(merged(observed, ready))
                .build());
    }

    @Override
    public OdooInstance newUnknownConditionStatusPatch(OdooInstance observed,
                                                       Condition.Type type,
                                                       String reason,
                                                       Exception e) {
        Condition unknown = newUnknownCondition(observed, type, reason, e);
        return statusPatch(observed, statusFrom(observed)
                .withConditions(merged(observed, unknown))
                .build());
    }

    @Override
    public OdooInstance newFalseConditionStatusPatch(OdooInstance observed,
                                                     Condition.Type type,
                                                     String reason,
                                                     String message) {
        Condition falseCondition = newFalseCondition(observed, type, reason, message);
        return statusPatch(observed, statusFrom(observed)
                .withConditions(merged(observed, falseCondition))
                .build());
    }

    @Override
    public OdooInstance newTrueConditionStatusPatch(OdooInstance observed,
                                                    Condition.Type type) {
        Condition trueCondition = newTrueCondition(observed, type);
        return statusPatch(observed, statusFrom(observed)
                .withConditions(merged(observed, trueCondition))
                .build());
    }
}
