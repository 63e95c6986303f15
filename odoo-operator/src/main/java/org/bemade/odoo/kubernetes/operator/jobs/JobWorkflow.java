/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.nio.file.Path;

/**
 * The work of one job, run on a {@link JobRunner} thread. Implementations respond to interruption
 * by stopping and cleaning up what they started.
 */
@FunctionalInterface
public interface JobWorkflow {

    /**
     * @param stagingDir a private, existing directory for the job's files, deleted once the workflow returns
     */
    JobOutcome run(Path stagingDir) throws Exception;
}
