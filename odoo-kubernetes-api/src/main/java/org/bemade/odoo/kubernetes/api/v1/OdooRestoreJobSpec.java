/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.v1;

import org.bemade.odoo.kubernetes.api.common.ArchiveFormat;
import org.bemade.odoo.kubernetes.api.common.InstanceRef;
import org.bemade.odoo.kubernetes.api.v1.odoorestorejobspec.RestoreSource;

@com.fasterxml.jackson.annotation.JsonInclude(com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL)
@com.fasterxml.jackson.annotation.JsonPropertyOrder({ "instanceRef", "source", "format", "neutralize" })
@com.fasterxml.jackson.databind.annotation.JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@io.sundr.builder.annotations.Buildable(editableEnabled = false, validationEnabled = false, generateBuilderPackage = false, builderPackage = "io.fabric8.kubernetes.api.builder", refs = {
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.ObjectMeta.class)
})
@lombok.ToString()
@lombok.EqualsAndHashCode()
public class OdooRestoreJobSpec implements io.fabric8.kubernetes.api.builder.Editable<OdooRestoreJobSpecBuilder>, io.fabric8.kubernetes.api.model.KubernetesResource {

    @Override
    public OdooRestoreJobSpecBuilder edit() {
        return new OdooRestoreJobSpecBuilder(this);
    }

    @com.fasterxml.jackson.annotation.JsonProperty("instanceRef")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("The instance whose database and filestore are replaced.")
    @io.fabric8.generator.annotation.Required()
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private InstanceRef instanceRef;

    public InstanceRef getInstanceRef() {
        return instanceRef;
    }

    public void setInstanceRef(InstanceRef instanceRef) {
        this.instanceRef = instanceRef;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("source")
    @io.fabric8.generator.annotation.Required()
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private RestoreSource source;

    public RestoreSource getSource() {
        return source;
    }

    public void setSource(RestoreSource source) {
        this.source = source;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("format")
    @io.fabric8.generator.annotation.Default("zip")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private ArchiveFormat format;

    public ArchiveFormat getFormat() {
        return format;
    }

    public void setFormat(ArchiveFormat format) {
        this.format = format;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("neutralize")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Disable outbound mail, payment providers and other production side effects after loading.")
    @io.fabric8.generator.annotation.Default("false")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private Boolean neutralize;

    public Boolean getNeutralize() {
        return neutralize;
    }

    public void setNeutralize(Boolean neutralize) {
        this.neutralize = neutralize;
    }
}
