/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.neutralization;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.OdooDeployment;
import org.bemade.odoo.kubernetes.operator.workload.WorkloadExecutor;

/**
 * Neutralizes with the image's own {@code odoo neutralize}, which also runs the neutralization hooks of
 * the installed modules.
 */
public class WorkloadNeutralizationPolicy implements NeutralizationPolicy {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkloadNeutralizationPolicy.class);

    private final WorkloadExecutor executor;

    public WorkloadNeutralizationPolicy(WorkloadExecutor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    @Override
    public void neutralize(OdooInstance instance, String database) throws IOException, InterruptedException, TimeoutException {
        executor.run(instance, command(database), null, OutputStream.nullOutputStream());
        LOGGER.info("Neutralized database {}", database);
    }

    static List<String> command(String database) {
        return List.of("odoo", "neutralize", "-c", OdooDeployment.CONFIG_FILE, "-d", database);
    }
}
