/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;

/**
 * Names of the objects created for an instance.
 */
public final class ResourceNames {

    private ResourceNames() {
    }

    /** The Deployment, Service and Ingress share this name. */
    public static String workload(OdooInstance instance) {
        return "odoo-" + ResourcesUtil.name(instance);
    }

    public static String configMap(OdooInstance instance) {
        return "odoo-config-" + ResourcesUtil.name(instance);
    }

    public static String filestoreClaim(OdooInstance instance) {
        return "odoo-filestore-" + ResourcesUtil.name(instance);
    }

    public static String databaseCredentialsSecret(OdooInstance instance) {
        return "odoo-db-credentials-" + ResourcesUtil.name(instance);
    }

    public static String generatedAdminSecret(OdooInstance instance) {
        return "odoo-admin-" + ResourcesUtil.name(instance);
    }

    public static String defaultTlsSecret(OdooInstance instance) {
        return "odoo-" + ResourcesUtil.name(instance) + "-tls";
    }

    /**
     * @return the in-cluster DNS name of the instance's Service
     */
    public static String serviceHost(OdooInstance instance) {
        return workload(instance) + "." + ResourcesUtil.namespace(instance) + ".svc";
    }
}
