/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.database;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.client.KubernetesClient;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;
import org.bemade.odoo.tag.RunsOnThread;
import org.bemade.odoo.tag.VisibleForTesting;

/**
 * Periodically drops the roles and databases of instances that no longer exist.
 * Roles whose name happens to start with the prefix of another namespace are never dropped.
 */
public class StaleRoleSweeper implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StaleRoleSweeper.class);

    private final KubernetesClient client;
    private final DatabaseAdminClient databaseAdminClient;
    private final String releaseName;
    private final Duration interval;
    private final ScheduledExecutorService executor;

    public StaleRoleSweeper(KubernetesClient client, DatabaseAdminClient databaseAdminClient, String releaseName, Duration interval) {
        this.client = client;
        this.databaseAdminClient = databaseAdminClient;
        this.releaseName = releaseName;
        this.interval = interval;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stale-role-sweeper");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        LOGGER.info("Sweeping stale database roles every {}", interval);
        executor.scheduleWithFixedDelay(this::sweepLoggingFailures, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    @RunsOnThread("stale-role-sweeper")
    private void sweepLoggingFailures() {
        try {
            sweep();
        }
        catch (RuntimeException e) {
            // the next run retries
            LOGGER.warn("Stale role sweep failed", e);
        }
    }

    /**
     * Runs one sweep over every namespace.
     *
     * @return the dropped roles, by namespace
     */
    public Map<String, List<String>> sweep() {
        List<OdooInstance> instances = client.resources(OdooInstance.class).inAnyNamespace().list().getItems();
        Set<String> namespaces = new TreeSet<>();
        client.namespaces().list().getItems().stream()
                .map(Namespace::getMetadata)
                .forEach(metadata -> namespaces.add(metadata.getName()));
        instances.forEach(instance -> namespaces.add(ResourcesUtil.namespace(instance)));

        Map<String, List<String>> dropped = new LinkedHashMap<>();
        for (String namespace : namespaces) {
            List<String> roles = databaseAdminClient.reconcileStaleRoles(namespace, releaseName, namesToKeep(namespace, instances));
            if (!roles.isEmpty()) {
                dropped.put(namespace, roles);
            }
        }
        LOGGER.atInfo().setMessage("Stale role sweep finished, dropped {}").addArgument(dropped).log();
        return dropped;
    }

    /**
     * The instances of {@code namespace}, plus the role suffixes of instances in other namespaces
     * whose role name starts with the prefix of {@code namespace}.
     */
    @VisibleForTesting
    Set<String> namesToKeep(String namespace, List<OdooInstance> instances) {
        String prefix = DatabaseNames.rolePrefix(namespace, releaseName);
        List<String> keep = new ArrayList<>();
        for (OdooInstance instance : instances) {
            String instanceNamespace = ResourcesUtil.namespace(instance);
            if (namespace.equals(instanceNamespace)) {
                keep.add(ResourcesUtil.name(instance));
            }
            else {
                String role = DatabaseNames.roleName(instanceNamespace, releaseName, ResourcesUtil.name(instance));
                if (role.startsWith(prefix)) {
                    keep.add(role.substring(prefix.length()));
                }
            }
        }
        return keep.stream().collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
