/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.v1;

/**
 * Desired state of one Odoo deployment: workload, filestore, database role and optional ingress.
 */
@io.fabric8.kubernetes.model.annotation.Version(value = "v1", storage = true, served = true)
@io.fabric8.kubernetes.model.annotation.Group("odoo.bemade.org")
@io.fabric8.kubernetes.model.annotation.Singular("odooinstance")
@io.fabric8.kubernetes.model.annotation.Plural("odooinstances")
@io.fabric8.kubernetes.model.annotation.ShortNames("odoo")
@io.sundr.builder.annotations.Buildable(editableEnabled = false, validationEnabled = false, generateBuilderPackage = false, builderPackage = "io.fabric8.kubernetes.api.builder", refs = {
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.ObjectMeta.class),
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.EnvVar.class),
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.ResourceRequirements.class)
})
@lombok.ToString()
@lombok.EqualsAndHashCode(callSuper = true)
public class OdooInstance extends io.fabric8.kubernetes.client.CustomResource<OdooInstanceSpec, OdooInstanceStatus>
        implements io.fabric8.kubernetes.api.model.Namespaced, io.fabric8.kubernetes.api.builder.Editable<OdooInstanceBuilder> {

    @Override
    public OdooInstanceBuilder edit() {
        return new OdooInstanceBuilder(this);
    }
}
