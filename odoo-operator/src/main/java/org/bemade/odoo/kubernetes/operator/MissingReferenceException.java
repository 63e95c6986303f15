/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

/**
 * A resource named by a spec, such as a credentials secret or the target instance of a job, does not exist
 * or lacks an expected key.
 */
public class MissingReferenceException extends RuntimeException {

    public MissingReferenceException(String message) {
        super(message);
    }

}
