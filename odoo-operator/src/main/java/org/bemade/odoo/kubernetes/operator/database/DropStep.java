/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.database;

/**
 * The steps of dropping a role and its database, in execution order.
 */
public enum DropStep {
    TERMINATE_BACKENDS,
    REASSIGN_OWNED,
    DROP_OWNED,
    DROP_DATABASE,
    DROP_ROLE
}
