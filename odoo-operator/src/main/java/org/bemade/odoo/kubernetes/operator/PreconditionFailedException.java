/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

/**
 * A job's target instance is not in a state the job can start from, for example a backup of an
 * instance that is not Ready.
 */
public class PreconditionFailedException extends RuntimeException {

    public static final String REASON = "PreconditionFailed";

    public PreconditionFailedException(String message) {
        super(message);
    }
}
