/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.util.LinkedHashMap;
import java.util.Map;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;

public class Labels {

    public static final String MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String NAME = "app.kubernetes.io/name";
    public static final String COMPONENT = "app.kubernetes.io/component";
    public static final String INSTANCE = "app.kubernetes.io/instance";

    static final String OPERATOR_NAME = "odoo-operator";
    static final String APP_NAME = "odoo";

    private Labels() {
        // singleton
    }

    public static Map<String, String> standardLabels(OdooInstance instance, String component) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(MANAGED_BY, OPERATOR_NAME);
        labels.put(NAME, APP_NAME);
        labels.put(COMPONENT, component);
        labels.put(INSTANCE, ResourcesUtil.name(instance));
        return labels;
    }

    /**
     * Labels that select the pods of an instance.
     */
    public static Map<String, String> podSelector(OdooInstance instance) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(NAME, APP_NAME);
        labels.put(INSTANCE, ResourcesUtil.name(instance));
        return labels;
    }

    /**
     * Labels shared by every object the operator creates on behalf of instances.
     */
    public static Map<String, String> managedObjectSelector() {
        return Map.of(MANAGED_BY, OPERATOR_NAME, NAME, APP_NAME);
    }
}
