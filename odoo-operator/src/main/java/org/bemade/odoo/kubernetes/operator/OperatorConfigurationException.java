/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

/**
 * Thrown at startup when the operator's environment does not describe a usable configuration.
 */
public class OperatorConfigurationException extends RuntimeException {

    public OperatorConfigurationException(String message) {
        super(message);
    }

    public OperatorConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
