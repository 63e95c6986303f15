/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;

/**
 * Asks a running instance whether it is healthy.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * @param healthy true if the instance answered that it is healthy
     * @param detail why the check failed, empty when healthy
     */
    record Result(boolean healthy, String detail) {

        public static final Result HEALTHY = new Result(true, "");

        public static Result unhealthy(String detail) {
            return new Result(false, detail);
        }
    }

    Result check(OdooInstance instance);
}
