/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.v1.odooinstancespec;

/**
 * Secret used to fetch a private addon repository.
 * An {@code ssh} secret holds {@code ssh-privatekey}, a {@code basic} secret holds {@code username} and {@code password}.
 */
@com.fasterxml.jackson.annotation.JsonInclude(com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL)
@com.fasterxml.jackson.annotation.JsonPropertyOrder({ "secretName", "type" })
@com.fasterxml.jackson.databind.annotation.JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@lombok.ToString()
@lombok.EqualsAndHashCode()
@io.sundr.builder.annotations.Buildable(editableEnabled = false, validationEnabled = false, generateBuilderPackage = false, builderPackage = "io.fabric8.kubernetes.api.builder")
public class GitCredentials implements io.fabric8.kubernetes.api.builder.Editable<GitCredentialsBuilder>, io.fabric8.kubernetes.api.model.KubernetesResource {

    public static final String SSH_PRIVATE_KEY = "ssh-privatekey";
    public static final String USERNAME = "username";
    public static final String PASSWORD = "password";

    @Override
    public GitCredentialsBuilder edit() {
        return new GitCredentialsBuilder(this);
    }

    public enum Type {
        @com.fasterxml.jackson.annotation.JsonProperty("ssh")
        SSH("ssh"),
        @com.fasterxml.jackson.annotation.JsonProperty("basic")
        BASIC("basic");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @com.fasterxml.jackson.annotation.JsonValue()
        public String getValue() {
            return value;
        }
    }

    @com.fasterxml.jackson.annotation.JsonProperty("secretName")
    @io.fabric8.generator.annotation.Required()
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String secretName;

    public String getSecretName() {
        return secretName;
    }

    public void setSecretName(String secretName) {
        this.secretName = secretName;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("type")
    @io.fabric8.generator.annotation.Required()
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private Type type;

    public Type getType() {
        return type;
    }

    public void setType(Type type) {
        this.type = type;
    }
}
