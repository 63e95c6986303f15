/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.workload;

import java.util.List;

/**
 * A command run in the workload exited with a non-zero status.
 */
public class WorkloadCommandException extends RuntimeException {

    private final int exitCode;

    public WorkloadCommandException(List<String> command, int exitCode, String stderr) {
        super("'" + String.join(" ", command) + "' exited with status " + exitCode + (stderr.isBlank() ? "" : ": " + stderr.strip()));
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
