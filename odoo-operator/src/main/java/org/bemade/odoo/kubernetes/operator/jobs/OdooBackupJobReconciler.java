/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.client.KubernetesClient;

import org.bemade.odoo.kubernetes.api.common.ArchiveFormat;
import org.bemade.odoo.kubernetes.api.common.InstanceRef;
import org.bemade.odoo.kubernetes.api.v1.OdooBackupJob;
import org.bemade.odoo.kubernetes.api.v1.OdooBackupJobSpec;
import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.JobStatusFactory;
import org.bemade.odoo.kubernetes.operator.OperatorConfig;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;
import org.bemade.odoo.kubernetes.operator.database.DatabaseNames;
import org.bemade.odoo.kubernetes.operator.storage.ObjectStorage;
import org.bemade.odoo.kubernetes.operator.workload.WorkloadArchiver;
import org.bemade.odoo.kubernetes.operator.workload.WorkloadExecutor;

/**
 * Reconciles {@link OdooBackupJob}s.
 */
public class OdooBackupJobReconciler extends AbstractJobReconciler<OdooBackupJob> {

    private final WorkloadArchiver archiver;
    private final ObjectStorage storage;

    public OdooBackupJobReconciler(Clock clock,
                                   OperatorConfig config,
                                   JobCoordinator coordinator,
                                   JobRunner runner,
                                   WorkloadExecutor executor,
                                   ObjectStorage storage) {
        super(clock, config, coordinator, runner, new JobStatusFactory<>(clock, OdooBackupJob::new));
        this.archiver = new WorkloadArchiver(executor);
        this.storage = Objects.requireNonNull(storage);
    }

    @Override
    protected void validate(OdooBackupJob job) {
        List<String> violations = new ArrayList<>();
        OdooBackupJobSpec spec = job.getSpec();
        if (spec == null) {
            violations.add("spec is required");
        }
        else {
            if (spec.getInstanceRef() == null || JobSpecChecks.isBlank(spec.getInstanceRef().getName())) {
                violations.add("spec.instanceRef.name is required");
            }
            if (spec.getDestination() == null) {
                violations.add("spec.destination is required");
            }
            else {
                JobSpecChecks.checkLocation("spec.destination", spec.getDestination(), violations);
            }
        }
        requireValid(violations);
    }

    @Override
    protected InstanceRef instanceRef(OdooBackupJob job) {
        return job.getSpec().getInstanceRef();
    }

    @Override
    protected void checkPrecondition(OdooBackupJob job, OdooInstance instance, KubernetesClient client) {
        BackupWorkflow.requireReady(instance, instance);
    }

    @Override
    protected JobWorkflow workflow(OdooBackupJob job, OdooInstance instance, KubernetesClient client) {
        String database = DatabaseNames.roleName(ResourcesUtil.namespace(instance), config.releaseName(), ResourcesUtil.name(instance));
        ArchiveFormat format = Optional.ofNullable(job.getSpec().getFormat()).orElse(ArchiveFormat.ZIP);
        return new BackupWorkflow(client, instance, database, format, job.getSpec().getDestination(), archiver, storage);
    }
}
