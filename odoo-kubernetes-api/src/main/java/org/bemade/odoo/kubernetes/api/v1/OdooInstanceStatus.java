/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.v1;

import java.util.List;

import org.bemade.odoo.kubernetes.api.common.Condition;

@com.fasterxml.jackson.annotation.JsonInclude(com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL)
@com.fasterxml.jackson.annotation.JsonPropertyOrder({ "observedGeneration", "phase", "conditions", "readyReplicas", "url", "databaseName", "lastAppliedFingerprint",
        "healthCheckFailures" })
@com.fasterxml.jackson.databind.annotation.JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@io.sundr.builder.annotations.Buildable(editableEnabled = false, validationEnabled = false, generateBuilderPackage = false, builderPackage = "io.fabric8.kubernetes.api.builder", refs = {
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.ObjectMeta.class),
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.EnvVar.class),
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.ResourceRequirements.class)
})
@lombok.ToString()
@lombok.EqualsAndHashCode()
public class OdooInstanceStatus implements io.fabric8.kubernetes.api.builder.Editable<OdooInstanceStatusBuilder>, io.fabric8.kubernetes.api.model.KubernetesResource {

    @Override
    public OdooInstanceStatusBuilder edit() {
        return new OdooInstanceStatusBuilder(this);
    }

    public enum Phase {
        @com.fasterxml.jackson.annotation.JsonProperty("Pending")
        PENDING("Pending"),
        @com.fasterxml.jackson.annotation.JsonProperty("Provisioning")
        PROVISIONING("Provisioning"),
        @com.fasterxml.jackson.annotation.JsonProperty("Ready")
        READY("Ready"),
        @com.fasterxml.jackson.annotation.JsonProperty("Degraded")
        DEGRADED("Degraded"),
        @com.fasterxml.jackson.annotation.JsonProperty("Terminating")
        TERMINATING("Terminating");

        private final String value;

        Phase(String value) {
            this.value = value;
        }

        @com.fasterxml.jackson.annotation.JsonValue()
        public String getValue() {
            return value;
        }
    }

    @com.fasterxml.jackson.annotation.JsonProperty("observedGeneration")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("The metadata.generation last reconciled.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private Long observedGeneration;

    public Long getObservedGeneration() {
        return observedGeneration;
    }

    public void setObservedGeneration(Long observedGeneration) {
        this.observedGeneration = observedGeneration;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("phase")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private Phase phase;

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("conditions")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private List<Condition> conditions;

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("readyReplicas")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private Integer readyReplicas;

    public Integer getReadyReplicas() {
        return readyReplicas;
    }

    public void setReadyReplicas(Integer readyReplicas) {
        this.readyReplicas = readyReplicas;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("url")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("External URL when an ingress is configured.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String url;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("databaseName")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Name of the PostgreSQL role and database owned by this instance.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String databaseName;

    public String getDatabaseName() {
        return databaseName;
    }

    public void setDatabaseName(String databaseName) {
        this.databaseName = databaseName;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("lastAppliedFingerprint")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Fingerprint of the last fully applied desired state.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String lastAppliedFingerprint;

    public String getLastAppliedFingerprint() {
        return lastAppliedFingerprint;
    }

    public void setLastAppliedFingerprint(String lastAppliedFingerprint) {
        this.lastAppliedFingerprint = lastAppliedFingerprint;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("healthCheckFailures")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Consecutive failed health checks since the instance was last Ready.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private Integer healthCheckFailures;

    public Integer getHealthCheckFailures() {
        return healthCheckFailures;
    }

    public void setHealthCheckFailures(Integer healthCheckFailures) {
        this.healthCheckFailures = healthCheckFailures;
    }
}
