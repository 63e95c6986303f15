/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.neutralization;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;

/**
 * Makes a restored database safe to run alongside production: no outgoing mail, no payments, no
 * scheduled jobs beyond the base ones.
 */
public interface NeutralizationPolicy {

    /**
     * @param instance the instance the database is restored into
     * @param database the database to neutralize, not yet in use by the workload
     */
    void neutralize(OdooInstance instance, String database) throws IOException, InterruptedException, TimeoutException;
}
