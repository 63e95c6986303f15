/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.database.DatabaseAdminClient;
import org.bemade.odoo.kubernetes.operator.database.DatabaseNames;
import org.bemade.odoo.kubernetes.operator.database.EnsureResult;
import org.bemade.odoo.kubernetes.operator.dispatch.KeyedLocks;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;
import org.bemade.odoo.kubernetes.operator.model.ObservedState;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.name;
import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * Brings the database role and the owned objects of one instance in line with its desired spec.
 * Work on a given instance is serialised, whoever the caller.
 */
public class InstanceConverger {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceConverger.class);

    private final ResourceApplier applier;
    private final DatabaseAdminClient databaseAdminClient;
    private final OperatorConfig config;
    private final KeyedLocks locks;

    /**
     * @param outcomes what happened to each owned object
     * @param database what happened to the database role
     */
    public record ConvergeResult(List<ApplyOutcome> outcomes, EnsureResult database) {

        public long mutations() {
            return outcomes.stream().filter(ApplyOutcome::isMutation).count() + (database.changed() ? 1 : 0);
        }
    }

    public InstanceConverger(ResourceApplier applier, DatabaseAdminClient databaseAdminClient, OperatorConfig config, KeyedLocks locks) {
        this.applier = applier;
        this.databaseAdminClient = databaseAdminClient;
        this.config = config;
        this.locks = locks;
    }

    public String databaseName(OdooInstance instance) {
        return DatabaseNames.roleName(namespace(instance), config.releaseName(), name(instance));
    }

    /**
     * @return true if every owned object exists and was applied from {@code spec}
     */
    public boolean isCurrent(OdooInstance instance, DesiredSpec spec, ObservedState observed) {
        Optional<String> password = ResourcesUtil.secretValue(observed.databaseCredentials(), DatabaseCredentialsSecret.PASSWORD_KEY);
        if (password.isEmpty() || observed.filestoreClaim() == null) {
            return false;
        }
        if (spec.adminCredentials() == null && observed.generatedAdminSecret() == null) {
            return false;
        }
        if (spec.ingress() == null && observed.ingress() != null) {
            return false;
        }
        return desiredObjects(instance, spec, password.get()).stream()
                .allMatch(desired -> applier.isCurrent(desired, observed.counterpartOf(desired).orElse(null)));
    }

    public ConvergeResult converge(OdooInstance instance, DesiredSpec spec, ObservedState observed) {
        return locks.withLock(lockKey(instance), () -> createOwnedObjects(instance, spec, observed));
    }

    private ConvergeResult createOwnedObjects(OdooInstance instance, DesiredSpec spec, ObservedState observed) {
        String databaseName = databaseName(instance);
        Optional<String> existingPassword = ResourcesUtil.secretValue(observed.databaseCredentials(), DatabaseCredentialsSecret.PASSWORD_KEY);
        String password = existingPassword.orElseGet(Passwords::generate);
        EnsureResult database = databaseAdminClient.ensureRoleAndDatabase(databaseName, password);
        if (existingPassword.isEmpty() && !database.roleCreated()) {
            LOGGER.info("Credentials of role {} were lost, setting a new password", databaseName);
            databaseAdminClient.setPassword(databaseName, password);
        }

        List<ApplyOutcome> outcomes = new ArrayList<>();
        outcomes.add(applier.createIfAbsent(FilestoreClaim.desired(instance, spec)));
        if (spec.adminCredentials() == null) {
            outcomes.add(applier.createIfAbsent(AdminSecret.desired(instance, Passwords.generate())));
        }
        for (HasMetadata desired : desiredObjects(instance, spec, password)) {
            outcomes.add(applier.apply(desired));
        }
        if (spec.ingress() == null) {
            outcomes.add(applier.delete(Ingress.class, namespace(instance), ResourceNames.workload(instance)));
        }
        var result = new ConvergeResult(outcomes, database);
        LOGGER.atDebug().setMessage("Converged {}: {}").addArgument(() -> ResourcesUtil.namespacedSlug(instance)).addArgument(result).log();
        return result;
    }

    /**
     * The objects that are updated whenever their desired content changes.
     */
    private List<HasMetadata> desiredObjects(OdooInstance instance, DesiredSpec spec, String password) {
        String databaseName = databaseName(instance);
        List<HasMetadata> desired = new ArrayList<>();
        desired.add(DatabaseCredentialsSecret.desired(instance, config, databaseName, password));
        desired.add(OdooConfigMap.desired(instance, spec, config, databaseName));
        desired.add(OdooDeployment.desired(instance, spec, config, databaseName));
        desired.add(OdooService.desired(instance));
        if (spec.ingress() != null) {
            desired.add(OdooIngress.desired(instance, spec.ingress()));
        }
        return desired;
    }

    /**
     * Deletes the owned objects of a deleted instance. The filestore claim and the database are only
     * removed when {@code purge} is true.
     */
    public List<ApplyOutcome> teardown(OdooInstance instance, boolean purge) {
        return locks.withLock(lockKey(instance), () -> {
            String namespace = namespace(instance);
            List<ApplyOutcome> outcomes = new ArrayList<>();
            outcomes.add(applier.delete(Ingress.class, namespace, ResourceNames.workload(instance)));
            outcomes.add(applier.delete(Service.class, namespace, ResourceNames.workload(instance)));
            outcomes.add(applier.delete(Deployment.class, namespace, ResourceNames.workload(instance)));
            outcomes.add(applier.delete(ConfigMap.class, namespace, ResourceNames.configMap(instance)));
            outcomes.add(applier.delete(Secret.class, namespace, ResourceNames.generatedAdminSecret(instance)));
            outcomes.add(applier.delete(Secret.class, namespace, ResourceNames.databaseCredentialsSecret(instance)));
            if (purge) {
                outcomes.add(applier.delete(PersistentVolumeClaim.class, namespace, ResourceNames.filestoreClaim(instance)));
                databaseAdminClient.dropRoleAndDatabase(databaseName(instance));
            }
            else {
                LOGGER.info("Retaining database {} and claim {} of deleted {}", databaseName(instance),
                        ResourceNames.filestoreClaim(instance), ResourcesUtil.namespacedSlug(instance));
            }
            return outcomes;
        });
    }

    static String lockKey(OdooInstance instance) {
        return namespace(instance) + "/" + name(instance);
    }
}
