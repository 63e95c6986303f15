/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.database;

/**
 * What {@link DatabaseAdminClient#ensureRoleAndDatabase(String, String)} had to change.
 *
 * @param roleCreated the role did not exist
 * @param databaseCreated the database did not exist
 * @param ownershipChanged the database existed with another owner
 */
public record EnsureResult(boolean roleCreated, boolean databaseCreated, boolean ownershipChanged) {

    public static final EnsureResult UNCHANGED = new EnsureResult(false, false, false);

    public boolean changed() {
        return roleCreated || databaseCreated || ownershipChanged;
    }
}
