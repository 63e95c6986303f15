/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.assertj;

import java.time.Instant;

import org.assertj.core.api.AbstractInstantAssert;
import org.assertj.core.api.AbstractLongAssert;
import org.assertj.core.api.AbstractObjectAssert;
import org.assertj.core.api.AbstractStringAssert;
import org.assertj.core.api.Assertions;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.assertj.core.api.ObjectAssert;

import io.fabric8.kubernetes.api.model.HasMetadata;

import org.bemade.odoo.kubernetes.api.common.Condition;

@SuppressWarnings("UnusedReturnValue")
public class ConditionAssert extends AbstractObjectAssert<ConditionAssert, Condition> {
    protected ConditionAssert(Condition actual) {
        super(actual, ConditionAssert.class);
    }

    public static ConditionAssert assertThat(Condition actual) {
        return new ConditionAssert(actual);
    }

    public AbstractLongAssert<?> observedGeneration() {
        return Assertions.assertThat(actual.getObservedGeneration());
    }

    public ConditionAssert hasObservedGeneration(Long expected) {
        observedGeneration().isEqualTo(expected);
        return this;
    }

    public ConditionAssert hasObservedGenerationInSyncWithMetadataOf(HasMetadata thing) {
        return hasObservedGeneration(thing.getMetadata().getGeneration());
    }

    public ObjectAssert<Condition.Type> type() {
        return Assertions.assertThat(actual.getType()).asInstanceOf(InstanceOfAssertFactories.type(Condition.Type.class));
    }

    public ConditionAssert hasType(Condition.Type expected) {
        type().isEqualTo(expected);
        return this;
    }

    public ObjectAssert<Condition.Status> status() {
        return Assertions.assertThat(actual.getStatus()).asInstanceOf(InstanceOfAssertFactories.type(Condition.Status.class));
    }

    public ConditionAssert hasStatus(Condition.Status expected) {
        status().isEqualTo(expected);
        return this;
    }

    public AbstractStringAssert<?> reason() {
        return Assertions.assertThat(actual.getReason());
    }

    public ConditionAssert hasReason(String expected) {
        reason().isEqualTo(expected);
        return this;
    }

    public AbstractStringAssert<?> message() {
        return Assertions.assertThat(actual.getMessage());
    }

    public ConditionAssert hasMessage(String expected) {
        message().isEqualTo(expected);
        return this;
    }

    public ConditionAssert hasMessageContaining(String expected) {
        message().contains(expected);
        return this;
    }

    public AbstractInstantAssert<?> lastTransitionTime() {
        return Assertions.assertThat(actual.getLastTransitionTime());
    }

    public ConditionAssert hasLastTransitionTime(Instant expected) {
        lastTransitionTime().isEqualTo(expected);
        return this;
    }

    public ConditionAssert isReadyTrue() {
        hasType(Condition.Type.Ready);
        hasStatus(Condition.Status.TRUE);
        message().isEmpty();
        return this;
    }

    public ConditionAssert isReadyFalse(String reason) {
        hasType(Condition.Type.Ready);
        hasStatus(Condition.Status.FALSE);
        hasReason(reason);
        return this;
    }

    public ConditionAssert isReadyUnknown(String reason) {
        hasType(Condition.Type.Ready);
        hasStatus(Condition.Status.UNKNOWN);
        hasReason(reason);
        return this;
    }

    public ConditionAssert isAcceptedTrue() {
        hasType(Condition.Type.Accepted);
        hasStatus(Condition.Status.TRUE);
        message().isEmpty();
        return this;
    }

    public ConditionAssert isAcceptedFalse(String reason, String message) {
        hasType(Condition.Type.Accepted);
        hasStatus(Condition.Status.FALSE);
        hasReason(reason);
        hasMessage(message);
        return this;
    }
}
