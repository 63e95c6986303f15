/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.v1.odoorestorejobspec;

import org.bemade.odoo.kubernetes.api.common.ObjectStorageLocation;

/**
 * Where the archive to restore comes from. Exactly one of the fields must be set.
 */
@com.fasterxml.jackson.annotation.JsonInclude(com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL)
@com.fasterxml.jackson.annotation.JsonPropertyOrder({ "objectStorage", "url" })
@com.fasterxml.jackson.databind.annotation.JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@lombok.ToString()
@lombok.EqualsAndHashCode()
@io.sundr.builder.annotations.Buildable(editableEnabled = false, validationEnabled = false, generateBuilderPackage = false, builderPackage = "io.fabric8.kubernetes.api.builder")
public class RestoreSource implements io.fabric8.kubernetes.api.builder.Editable<RestoreSourceBuilder>, io.fabric8.kubernetes.api.model.KubernetesResource {

    @Override
    public RestoreSourceBuilder edit() {
        return new RestoreSourceBuilder(this);
    }

    @com.fasterxml.jackson.annotation.JsonProperty("objectStorage")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private ObjectStorageLocation objectStorage;

    public ObjectStorageLocation getObjectStorage() {
        return objectStorage;
    }

    public void setObjectStorage(ObjectStorageLocation objectStorage) {
        this.objectStorage = objectStorage;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("url")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("HTTP(S) URL of the archive, for example a pre-signed link.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String url;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }
}
