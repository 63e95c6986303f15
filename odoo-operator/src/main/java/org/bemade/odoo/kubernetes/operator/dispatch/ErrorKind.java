/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.dispatch;

/**
 * How a failure is handled by the controllers.
 */
public enum ErrorKind {
    /** The resource's spec is invalid. Surfaced as a condition, not retried until the spec changes. */
    VALIDATION("Validation"),
    /** Retried with backoff. */
    TRANSIENT("Transient"),
    /** Surfaced as a condition and retried after a short fixed delay. */
    CONFLICT("Conflict"),
    /** Surfaced as a condition and not retried. */
    FATAL("Fatal");

    private final String reason;

    ErrorKind(String reason) {
        this.reason = reason;
    }

    /**
     * @return the CamelCase condition reason for this kind
     */
    public String reason() {
        return reason;
    }
}
