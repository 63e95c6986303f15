/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressTLSBuilder;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * The {@code odoo-{name}} Ingress, routing the instance's hostname to its Service.
 */
public final class OdooIngress {

    private OdooIngress() {
    }

    public static Ingress desired(OdooInstance instance, DesiredSpec.IngressSettings ingress) {
        // @formatter:off
        IngressBuilder builder = new IngressBuilder()
                .withNewMetadata()
                    .withName(ResourceNames.workload(instance))
                    .withNamespace(namespace(instance))
                    .addToLabels(Labels.standardLabels(instance, OdooDeployment.COMPONENT))
                    .addToAnnotations(ingress.annotations())
                    .addNewOwnerReferenceLike(ResourcesUtil.newOwnerReferenceTo(instance)).endOwnerReference()
                .endMetadata()
                .withNewSpec()
                    .withIngressClassName(ingress.className())
                    .addNewRule()
                        .withHost(ingress.hostname())
                        .withNewHttp()
                            .addNewPath()
                                .withPath("/")
                                .withPathType("Prefix")
                                .withNewBackend()
                                    .withNewService()
                                        .withName(ResourceNames.workload(instance))
                                        .withNewPort()
                                            .withName(OdooDeployment.HTTP_PORT_NAME)
                                        .endPort()
                                    .endService()
                                .endBackend()
                            .endPath()
                        .endHttp()
                    .endRule()
                .endSpec();
        // @formatter:on
        if (ingress.tls()) {
            builder.editSpec()
                    .withTls(new IngressTLSBuilder()
                            .withHosts(ingress.hostname())
                            .withSecretName(ingress.tlsSecretName())
                            .build())
                    .endSpec();
        }
        return builder.build();
    }
}
