/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.common;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.Nulls;

import io.fabric8.generator.annotation.Default;
import io.fabric8.generator.annotation.Required;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A status condition shared by every Odoo custom resource.
 * The {@code reason} of a failure condition carries the error kind
 * (for example {@code Validation} or {@code Transient}).
 */
@com.fasterxml.jackson.annotation.JsonInclude(com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL)
@com.fasterxml.jackson.annotation.JsonPropertyOrder({ "observedGeneration", "type", "status", "lastTransitionTime", "reason", "message" })
@com.fasterxml.jackson.databind.annotation.JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@lombok.EqualsAndHashCode()
@io.sundr.builder.annotations.Buildable(editableEnabled = false, validationEnabled = false, generateBuilderPackage = false, builderPackage = "io.fabric8.kubernetes.api.builder", refs = {
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.ObjectMeta.class)
})
public class Condition implements io.fabric8.kubernetes.api.builder.Editable<ConditionBuilder>, io.fabric8.kubernetes.api.model.KubernetesResource {

    @Override
    public ConditionBuilder edit() {
        return new ConditionBuilder(this);
    }

    @com.fasterxml.jackson.annotation.JsonProperty("lastTransitionTime")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("The last time the condition changed status.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = Nulls.FAIL)
    @com.fasterxml.jackson.annotation.JsonFormat(shape = com.fasterxml.jackson.annotation.JsonFormat.Shape.STRING)
    private Instant lastTransitionTime;

    public Instant getLastTransitionTime() {
        return lastTransitionTime;
    }

    public void setLastTransitionTime(Instant lastTransitionTime) {
        this.lastTransitionTime = lastTransitionTime;
    }

    @com.fasterxml.jackson.annotation.JsonProperty(value = "message", defaultValue = "")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Human readable detail about the transition. May be empty.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = Nulls.FAIL, value = "")
    @Default("")
    private String message = "";

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message == null ? "" : message;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("observedGeneration")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("The metadata.generation the condition was computed from.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = Nulls.FAIL)
    private Long observedGeneration;

    public Long getObservedGeneration() {
        return observedGeneration;
    }

    public void setObservedGeneration(Long observedGeneration) {
        this.observedGeneration = observedGeneration;
    }

    @com.fasterxml.jackson.annotation.JsonProperty(value = "reason", defaultValue = "")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("CamelCase identifier of the reason for the last transition.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = Nulls.FAIL, value = "")
    @Required
    private String reason;

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    @Override
    public String toString() {
        return "Condition{" +
                "type=" + type +
                ", status=" + status +
                ", observedGeneration=" + observedGeneration +
                ", lastTransitionTime=" + lastTransitionTime +
                ", reason='" + reason + '\'' +
                ", message='" + message + '\'' +
                '}';
    }

    public enum Status {

        @com.fasterxml.jackson.annotation.JsonProperty("True")
        TRUE("True"),
        @com.fasterxml.jackson.annotation.JsonProperty("False")
        FALSE("False"),
        @com.fasterxml.jackson.annotation.JsonProperty("Unknown")
        UNKNOWN("Unknown");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @com.fasterxml.jackson.annotation.JsonValue()
        public String getValue() {
            return value;
        }
    }

    @com.fasterxml.jackson.annotation.JsonProperty("status")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("One of True, False, Unknown.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = Nulls.SKIP)
    private Status status;

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    @com.fasterxml.jackson.annotation.JsonProperty(value = "type")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("The condition type.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = Nulls.FAIL)
    private Type type;

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }

    public enum Type {
        /** The resource has converged (instances) or completed (jobs). */
        Ready("Ready"),
        /** The resource's spec passed validation. */
        Accepted("Accepted");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    public static boolean isReadyTrue(@NonNull Condition condition) {
        Objects.requireNonNull(condition);
        return Type.Ready.equals(condition.getType())
                && Status.TRUE.equals(condition.getStatus());
    }
}
