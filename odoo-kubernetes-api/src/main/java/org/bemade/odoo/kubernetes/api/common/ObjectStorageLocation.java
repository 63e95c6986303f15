/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.common;

/**
 * An object in an S3 compatible store.
 * The credentials secret must hold the keys {@code accessKeyId} and {@code secretAccessKey}.
 */
@com.fasterxml.jackson.annotation.JsonInclude(com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL)
@com.fasterxml.jackson.annotation.JsonPropertyOrder({ "bucket", "key", "endpoint", "region", "pathStyleAccess", "credentialsSecret" })
@com.fasterxml.jackson.databind.annotation.JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@lombok.ToString()
@lombok.EqualsAndHashCode()
@io.sundr.builder.annotations.Buildable(editableEnabled = false, validationEnabled = false, generateBuilderPackage = false, builderPackage = "io.fabric8.kubernetes.api.builder")
public class ObjectStorageLocation implements io.fabric8.kubernetes.api.builder.Editable<ObjectStorageLocationBuilder>, io.fabric8.kubernetes.api.model.KubernetesResource {

    public static final String ACCESS_KEY_ID_KEY = "accessKeyId";
    public static final String SECRET_ACCESS_KEY_KEY = "secretAccessKey";

    @Override
    public ObjectStorageLocationBuilder edit() {
        return new ObjectStorageLocationBuilder(this);
    }

    @com.fasterxml.jackson.annotation.JsonProperty("bucket")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Bucket name.")
    @io.fabric8.generator.annotation.Required()
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String bucket;

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("key")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Object key within the bucket.")
    @io.fabric8.generator.annotation.Required()
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String key;

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("endpoint")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Endpoint URL of an S3 compatible service. AWS S3 is used when absent.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String endpoint;

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("region")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Signing region.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    @io.fabric8.generator.annotation.Default("us-east-1")
    private String region;

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("pathStyleAccess")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Use path style addressing, needed by most S3 compatible services.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private Boolean pathStyleAccess;

    public Boolean getPathStyleAccess() {
        return pathStyleAccess;
    }

    public void setPathStyleAccess(Boolean pathStyleAccess) {
        this.pathStyleAccess = pathStyleAccess;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("credentialsSecret")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Name of a Secret in the same namespace holding accessKeyId and secretAccessKey.")
    @io.fabric8.generator.annotation.Required()
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String credentialsSecret;

    public String getCredentialsSecret() {
        return credentialsSecret;
    }

    public void setCredentialsSecret(String credentialsSecret) {
        this.credentialsSecret = credentialsSecret;
    }
}
