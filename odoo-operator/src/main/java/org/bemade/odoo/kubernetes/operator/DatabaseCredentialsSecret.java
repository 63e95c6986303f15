/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.util.LinkedHashMap;
import java.util.Map;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.base64;
import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * The {@code odoo-db-credentials-{name}} Secret, holding the connection details of the instance's database role.
 */
public final class DatabaseCredentialsSecret {

    public static final String HOST_KEY = "host";
    public static final String PORT_KEY = "port";
    public static final String USERNAME_KEY = "username";
    public static final String PASSWORD_KEY = "password";
    public static final String DATABASE_KEY = "database";

    static final String COMPONENT = "credentials";

    private DatabaseCredentialsSecret() {
    }

    public static Secret desired(OdooInstance instance, OperatorConfig config, String databaseName, String password) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put(HOST_KEY, base64(config.dbHost()));
        data.put(PORT_KEY, base64(Integer.toString(config.dbPort())));
        data.put(USERNAME_KEY, base64(databaseName));
        data.put(PASSWORD_KEY, base64(password));
        data.put(DATABASE_KEY, base64(databaseName));
        // @formatter:off
        return new SecretBuilder()
                .withNewMetadata()
                    .withName(ResourceNames.databaseCredentialsSecret(instance))
                    .withNamespace(namespace(instance))
                    .addToLabels(Labels.standardLabels(instance, COMPONENT))
                    .addNewOwnerReferenceLike(ResourcesUtil.newOwnerReferenceTo(instance)).endOwnerReference()
                .endMetadata()
                .withType("Opaque")
                .withData(data)
                .build();
        // @formatter:on
    }
}
