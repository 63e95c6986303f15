/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

/**
 * A primary resource whose spec is not valid.
 * The API server's schema rejects most invalid resources. This exception covers the
 * checks only the operator can make, such as comparing against objects that already exist.
 */
public class InvalidResourceException extends RuntimeException {

    public InvalidResourceException(String message) {
        super(message);
    }

}
