/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.CustomResource;

import org.bemade.odoo.kubernetes.api.common.Condition;
import org.bemade.odoo.kubernetes.api.common.ConditionBuilder;

/**
 * Builds status patches. A patch carries only the identifying metadata of the observed resource
 * and its new status.
 *
 * @param <R> the custom resource type
 */
public abstract class StatusFactory<R extends CustomResource<?, ?>> {

    private final Clock clock;

    protected StatusFactory(Clock clock) {
        this.clock = clock;
    }

    Instant now() {
        return clock.instant();
    }

    ConditionBuilder newConditionBuilder(HasMetadata observedGenerationSource) {
        return new ConditionBuilder()
                .withLastTransitionTime(now())
                .withObservedGeneration(ResourcesUtil.generation(observedGenerationSource));
    }

    Condition newTrueCondition(HasMetadata observedGenerationSource, Condition.Type type) {
        return newConditionBuilder(observedGenerationSource)
                .withType(type)
                .withStatus(Condition.Status.TRUE)
                .withMessage("")
                .withReason(type.name())
                .build();
    }

    Condition newFalseCondition(HasMetadata observedGenerationSource,
                                Condition.Type type,
                                String reason,
                                String message) {
        return newConditionBuilder(observedGenerationSource)
                .withType(type)
                .withStatus(Condition.Status.FALSE)
                .withReason(reason)
                .withMessage(message)
                .build();
    }

    Condition newUnknownCondition(HasMetadata observedGenerationSource,
                                  Condition.Type type,
                                  String reason,
                                  Exception e) {
        return newConditionBuilder(observedGenerationSource)
                .withType(type)
                .withStatus(Condition.Status.UNKNOWN)
                .withReason(reason)
                .withMessage(messageOf(e))
                .build();
    }

    static String messageOf(Throwable e) {
        return Optional.ofNullable(e.getMessage()).orElse(e.getClass().getSimpleName());
    }

    public abstract R newUnknownConditionStatusPatch(R observed,
                                                     Condition.Type type,
                                                     String reason,
                                                     Exception e);

    public abstract R newFalseConditionStatusPatch(R observed,
                                                   Condition.Type type,
                                                   String reason,
                                                   String message);

    public abstract R newTrueConditionStatusPatch(R observed,
                                                  Condition.Type type);
}
