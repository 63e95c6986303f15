/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.v1;

import org.bemade.odoo.kubernetes.api.common.JobStatus;

/**
 * One-shot request to archive an instance's database and filestore to object storage.
 */
@io.fabric8.kubernetes.model.annotation.Version(value = "v1", storage = true, served = true)
@io.fabric8.kubernetes.model.annotation.Group("odoo.bemade.org")
@io.fabric8.kubernetes.model.annotation.Singular("odoobackupjob")
@io.fabric8.kubernetes.model.annotation.Plural("odoobackupjobs")
@io.sundr.builder.annotations.Buildable(editableEnabled = false, validationEnabled = false, generateBuilderPackage = false, builderPackage = "io.fabric8.kubernetes.api.builder", refs = {
        @io.sundr.builder.annotations.BuildableReference(io.fabric8.kubernetes.api.model.ObjectMeta.class)
})
@lombok.ToString()
@lombok.EqualsAndHashCode(callSuper = true)
public class OdooBackupJob extends io.fabric8.kubernetes.client.CustomResource<OdooBackupJobSpec, JobStatus>
        implements io.fabric8.kubernetes.api.model.Namespaced, io.fabric8.kubernetes.api.builder.Editable<OdooBackupJobBuilder> {

    @Override
    public OdooBackupJobBuilder edit() {
        return new OdooBackupJobBuilder(this);
    }
}
