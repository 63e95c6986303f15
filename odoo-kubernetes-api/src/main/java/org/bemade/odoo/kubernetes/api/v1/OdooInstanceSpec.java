/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.v1;

import java.util.List;

import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.AdminCredentials;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.Addon;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.Filestore;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.IngressSpec;

@com.fasterxml.jackson.annotation.JsonInclude(com.fasterxml.jackson.annotation.JsonInclude.Include.NON_NULL)
@com.fasterxml.jackson.annotation.JsonPropertyOrder({ "image", "replicas", "adminCredentials", "resources", "filestore", "ingress", "addons", "env" })
@com.fasterxml.jackson.databind.annotation.JsonDeserialize(using = com.fasterxml.jackson.databind.JsonDeserializer.None.class)
@io.sundr.builder.annotations.Buildable(editableEnabled = false, validationEnabled = false, generateBuilderPackage = false, builderPackage = "io.fabric8.kubernetes.api.builder", refs = {
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.ObjectMeta.class),
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.EnvVar.class),
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.ResourceRequirements.class)
})
@lombok.ToString()
@lombok.EqualsAndHashCode()
public class OdooInstanceSpec implements io.fabric8.kubernetes.api.builder.Editable<OdooInstanceSpecBuilder>, io.fabric8.kubernetes.api.model.KubernetesResource {

    @Override
    public OdooInstanceSpecBuilder edit() {
        return new OdooInstanceSpecBuilder(this);
    }

    @com.fasterxml.jackson.annotation.JsonProperty("image")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Odoo container image reference, for example odoo:17.0.")
    @io.fabric8.generator.annotation.Required()
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private String image;

    public String getImage() {
        return image;
    }

    public void setImage(String image) {
        this.image = image;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("replicas")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Number of Odoo pods.")
    @io.fabric8.generator.annotation.Default("1")
    @io.fabric8.generator.annotation.Min(0.0)
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private Integer replicas;

    public Integer getReplicas() {
        return replicas;
    }

    public void setReplicas(Integer replicas) {
        this.replicas = replicas;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("adminCredentials")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Secret holding the Odoo master (admin) password. Generated when absent.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private AdminCredentials adminCredentials;

    public AdminCredentials getAdminCredentials() {
        return adminCredentials;
    }

    public void setAdminCredentials(AdminCredentials adminCredentials) {
        this.adminCredentials = adminCredentials;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("resources")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Compute resources of the Odoo container.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private io.fabric8.kubernetes.api.model.ResourceRequirements resources;

    public io.fabric8.kubernetes.api.model.ResourceRequirements getResources() {
        return resources;
    }

    public void setResources(io.fabric8.kubernetes.api.model.ResourceRequirements resources) {
        this.resources = resources;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("filestore")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Persistent volume holding the Odoo filestore. Its size cannot change once provisioned.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private Filestore filestore;

    public Filestore getFilestore() {
        return filestore;
    }

    public void setFilestore(Filestore filestore) {
        this.filestore = filestore;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("ingress")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Exposes the instance through an Ingress when present.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private IngressSpec ingress;

    public IngressSpec getIngress() {
        return ingress;
    }

    public void setIngress(IngressSpec ingress) {
        this.ingress = ingress;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("addons")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Git repositories fetched into the addons path before Odoo starts.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private List<Addon> addons;

    public List<Addon> getAddons() {
        return addons;
    }

    public void setAddons(List<Addon> addons) {
        this.addons = addons;
    }

    @com.fasterxml.jackson.annotation.JsonProperty("env")
    @com.fasterxml.jackson.annotation.JsonPropertyDescription("Additional environment variables for the Odoo container.")
    @com.fasterxml.jackson.annotation.JsonSetter(nulls = com.fasterxml.jackson.annotation.Nulls.SKIP)
    private List<io.fabric8.kubernetes.api.model.EnvVar> env;

    public List<io.fabric8.kubernetes.api.model.EnvVar> getEnv() {
        return env;
    }

    public void setEnv(List<io.fabric8.kubernetes.api.model.EnvVar> env) {
        this.env = env;
    }
}
