/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.api.model.Quantity;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * The {@code odoo-filestore-{name}} claim. It has no owner reference so that it outlives the instance,
 * and is never updated after creation.
 */
public final class FilestoreClaim {

    static final String COMPONENT = "filestore";

    private FilestoreClaim() {
    }

    public static PersistentVolumeClaim desired(OdooInstance instance, DesiredSpec spec) {
        // @formatter:off
        return new PersistentVolumeClaimBuilder()
                .withNewMetadata()
                    .withName(ResourceNames.filestoreClaim(instance))
                    .withNamespace(namespace(instance))
                    .addToLabels(Labels.standardLabels(instance, COMPONENT))
                .endMetadata()
                .withNewSpec()
                    .withAccessModes("ReadWriteOnce")
                    .withStorageClassName(spec.filestore().storageClassName())
                    .withNewResources()
                        .addToRequests("storage", new Quantity(spec.filestore().size()))
                    .endResources()
                .endSpec()
                .build();
        // @formatter:on
    }
}
