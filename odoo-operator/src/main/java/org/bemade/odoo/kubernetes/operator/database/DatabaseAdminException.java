/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.database;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A failed administrative database operation.
 */
public class DatabaseAdminException extends RuntimeException {

    public enum Kind {
        /** Connection loss, timeout, cancellation or resource exhaustion. */
        TRANSIENT,
        /** Active connections or dependent objects block the operation. */
        CONFLICT,
        /** The template of a clone has active connections. */
        SOURCE_IN_USE,
        FATAL
    }

    private final Kind kind;
    private final @Nullable String sqlState;
    private final @Nullable DropStep step;

    public DatabaseAdminException(Kind kind, String message, @Nullable String sqlState, @Nullable DropStep step, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind);
        this.sqlState = sqlState;
        this.step = step;
    }

    public DatabaseAdminException(Kind kind, String message) {
        this(kind, message, null, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    @Nullable
    public String getSqlState() {
        return sqlState;
    }

    /**
     * @return the step a drop had reached when it failed, or null for other operations
     */
    @Nullable
    public DropStep getStep() {
        return step;
    }

    /**
     * Classifies a SQLSTATE.
     *
     * @param sqlState the state, null when the failure happened before the server answered
     * @return the kind
     */
    public static Kind kindOf(@Nullable String sqlState) {
        if (sqlState == null) {
            return Kind.TRANSIENT;
        }
        if (sqlState.startsWith("08")
                || sqlState.startsWith("57P0")
                || sqlState.equals("57014")
                || sqlState.startsWith("53")) {
            return Kind.TRANSIENT;
        }
        if (sqlState.equals("55006") || sqlState.equals("2BP01")) {
            return Kind.CONFLICT;
        }
        return Kind.FATAL;
    }
}
