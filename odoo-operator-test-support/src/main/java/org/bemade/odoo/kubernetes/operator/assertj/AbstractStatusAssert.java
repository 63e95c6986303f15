/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.assertj;

import java.util.List;
import java.util.function.Function;

import org.assertj.core.api.AbstractLongAssert;
import org.assertj.core.api.AbstractObjectAssert;
import org.assertj.core.api.Assertions;

import io.fabric8.kubernetes.api.model.HasMetadata;

import org.bemade.odoo.kubernetes.api.common.Condition;

abstract class AbstractStatusAssert<A, S extends AbstractStatusAssert<A, S>> extends AbstractObjectAssert<S, A> {
    private final Function<A, Long> observedGenerationAccessor;
    private final Function<A, List<Condition>> conditionsAccessor;

    AbstractStatusAssert(A actual,
                         Class<S> selfType,
                         Function<A, Long> observedGenerationAccessor,
                         Function<A, List<Condition>> conditionsAccessor) {
        super(actual, selfType);
        this.observedGenerationAccessor = observedGenerationAccessor;
        this.conditionsAccessor = conditionsAccessor;
    }

    public AbstractLongAssert<?> observedGeneration() {
        return Assertions.assertThat(observedGenerationAccessor.apply(actual));
    }

    @SuppressWarnings("unchecked")
    public S hasObservedGeneration(Long observedGeneration) {
        observedGeneration().isEqualTo(observedGeneration);
        return (S) this;
    }

    public S hasObservedGenerationInSyncWithMetadataOf(HasMetadata thing) {
        return hasObservedGeneration(thing.getMetadata().getGeneration());
    }

    public ConditionListAssert conditionList() {
        return ConditionListAssert.assertThat(conditionsAccessor.apply(actual));
    }

    public ConditionAssert singleCondition() {
        conditionList().hasSize(1);
        return ConditionAssert.assertThat(conditionsAccessor.apply(actual).get(0));
    }

    public ConditionAssert readyCondition() {
        return conditionList().singleOfType(Condition.Type.Ready);
    }

    public ConditionAssert acceptedCondition() {
        return conditionList().singleOfType(Condition.Type.Accepted);
    }
}
