/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

/**
 * What {@link ResourceApplier} did to one object.
 */
public enum ApplyOutcome {
    CREATED,
    UPDATED,
    DELETED,
    UNCHANGED;

    /**
     * @return true if the cluster was changed
     */
    public boolean isMutation() {
        return this != UNCHANGED;
    }
}
