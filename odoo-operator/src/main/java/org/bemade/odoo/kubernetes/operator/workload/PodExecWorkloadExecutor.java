/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.workload;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.ContainerResource;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import io.fabric8.kubernetes.client.dsl.TtyExecOutputErrorable;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.MissingReferenceException;
import org.bemade.odoo.kubernetes.operator.OdooDeployment;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;
import org.bemade.odoo.kubernetes.operator.model.ObservedState;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * {@link WorkloadExecutor} over the Kubernetes exec API.
 */
public class PodExecWorkloadExecutor implements WorkloadExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PodExecWorkloadExecutor.class);

    private static final int STDERR_LIMIT = 4096;

    private final KubernetesClient client;
    private final Duration timeout;

    public PodExecWorkloadExecutor(KubernetesClient client, Duration timeout) {
        this.client = Objects.requireNonNull(client);
        this.timeout = Objects.requireNonNull(timeout);
    }

    @Override
    public void run(OdooInstance instance, List<String> command, @Nullable InputStream stdin, OutputStream stdout)
            throws IOException, InterruptedException, TimeoutException {
        Pod pod = ObservedState.read(client, instance).runningPod()
                .orElseThrow(() -> new MissingReferenceException(ResourcesUtil.namespacedSlug(instance) + " has no running pod"));
        LOGGER.atDebug().setMessage("Running '{}' in pod {}")
                .addArgument(() -> String.join(" ", command))
                .addArgument(() -> ResourcesUtil.name(pod))
                .log();

        var stderr = new ByteArrayOutputStream();
        ContainerResource container = client.pods()
                .inNamespace(ResourcesUtil.namespace(pod))
                .withName(ResourcesUtil.name(pod))
                .inContainer(OdooDeployment.CONTAINER_NAME);
        TtyExecOutputErrorable execution = stdin == null ? container : container.readingInput(stdin);
        try (ExecWatch watch = execution.writingOutput(stdout).writingError(stderr).exec(command.toArray(String[]::new))) {
            Integer exitCode = watch.exitCode().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (exitCode == null || exitCode != 0) {
                throw new WorkloadCommandException(command, exitCode == null ? -1 : exitCode, tail(stderr));
            }
        }
        catch (ExecutionException e) {
            throw new IOException("Exec of '" + String.join(" ", command) + "' in " + ResourcesUtil.name(pod) + " failed", e.getCause());
        }
    }

    private static String tail(ByteArrayOutputStream stderr) {
        String text = stderr.toString(StandardCharsets.UTF_8);
        return text.length() <= STDERR_LIMIT ? text : text.substring(text.length() - STDERR_LIMIT);
    }
}
