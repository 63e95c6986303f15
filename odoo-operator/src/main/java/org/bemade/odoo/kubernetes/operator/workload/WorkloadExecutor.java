/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.workload;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.TimeoutException;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Runs commands inside the Odoo container of a running pod of an instance.
 */
public interface WorkloadExecutor {

    /**
     * @param instance the instance whose pod runs the command
     * @param command the command and its arguments
     * @param stdin fed to the command, or null for none
     * @param stdout receives the command's standard output
     * @throws WorkloadCommandException if the command exits with a non-zero status
     * @throws org.bemade.odoo.kubernetes.operator.MissingReferenceException if the instance has no running pod
     */
    void run(OdooInstance instance, List<String> command, @Nullable InputStream stdin, OutputStream stdout)
            throws IOException, InterruptedException, TimeoutException;
}
