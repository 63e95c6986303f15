/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * The {@code odoo-{name}} ClusterIP Service in front of the Odoo pods.
 */
public final class OdooService {

    private OdooService() {
    }

    public static Service desired(OdooInstance instance) {
        // @formatter:off
        return new ServiceBuilder()
                .withNewMetadata()
                    .withName(ResourceNames.workload(instance))
                    .withNamespace(namespace(instance))
                    .addToLabels(Labels.standardLabels(instance, OdooDeployment.COMPONENT))
                    .addNewOwnerReferenceLike(ResourcesUtil.newOwnerReferenceTo(instance)).endOwnerReference()
                .endMetadata()
                .withNewSpec()
                    .withType("ClusterIP")
                    .withSelector(Labels.podSelector(instance))
                    .addNewPort()
                        .withName(OdooDeployment.HTTP_PORT_NAME)
                        .withPort(OdooDeployment.HTTP_PORT)
                        .withTargetPort(new IntOrString(OdooDeployment.HTTP_PORT_NAME))
                        .withProtocol("TCP")
                    .endPort()
                    .addNewPort()
                        .withName(OdooDeployment.LONGPOLLING_PORT_NAME)
                        .withPort(OdooDeployment.LONGPOLLING_PORT)
                        .withTargetPort(new IntOrString(OdooDeployment.LONGPOLLING_PORT_NAME))
                        .withProtocol("TCP")
                    .endPort()
                .endSpec()
                .build();
        // @formatter:on
    }
}
