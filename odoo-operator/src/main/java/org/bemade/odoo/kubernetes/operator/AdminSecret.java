/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.AdminCredentials;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.base64;
import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * The generated {@code odoo-admin-{name}} Secret, used when the instance does not name its own admin credentials.
 * It is created once and never rotated.
 */
public final class AdminSecret {

    private AdminSecret() {
    }

    public static Secret desired(OdooInstance instance, String password) {
        // @formatter:off
        return new SecretBuilder()
                .withNewMetadata()
                    .withName(ResourceNames.generatedAdminSecret(instance))
                    .withNamespace(namespace(instance))
                    .addToLabels(Labels.standardLabels(instance, DatabaseCredentialsSecret.COMPONENT))
                    .addNewOwnerReferenceLike(ResourcesUtil.newOwnerReferenceTo(instance)).endOwnerReference()
                .endMetadata()
                .withType("Opaque")
                .addToData(AdminCredentials.DEFAULT_KEY, base64(password))
                .build();
        // @formatter:on
    }
}
