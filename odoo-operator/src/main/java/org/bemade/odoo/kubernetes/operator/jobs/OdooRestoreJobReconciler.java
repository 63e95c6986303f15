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
import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatus;
import org.bemade.odoo.kubernetes.api.v1.OdooRestoreJob;
import org.bemade.odoo.kubernetes.api.v1.OdooRestoreJobSpec;
import org.bemade.odoo.kubernetes.api.v1.odoorestorejobspec.RestoreSource;
import org.bemade.odoo.kubernetes.operator.JobStatusFactory;
import org.bemade.odoo.kubernetes.operator.OperatorConfig;
import org.bemade.odoo.kubernetes.operator.PreconditionFailedException;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;
import org.bemade.odoo.kubernetes.operator.database.DatabaseAdminClient;
import org.bemade.odoo.kubernetes.operator.database.DatabaseNames;
import org.bemade.odoo.kubernetes.operator.model.ObservedState;
import org.bemade.odoo.kubernetes.operator.neutralization.NeutralizationPolicy;
import org.bemade.odoo.kubernetes.operator.storage.ObjectStorage;
import org.bemade.odoo.kubernetes.operator.storage.UrlArchiveFetcher;
import org.bemade.odoo.kubernetes.operator.workload.WorkloadArchiver;
import org.bemade.odoo.kubernetes.operator.workload.WorkloadExecutor;

/**
 * Reconciles {@link OdooRestoreJob}s.
 */
public class OdooRestoreJobReconciler extends AbstractJobReconciler<OdooRestoreJob> {

    private final Clock clock;
    private final WorkloadArchiver archiver;
    private final DatabaseAdminClient databaseAdminClient;
    private final NeutralizationPolicy neutralizationPolicy;
    private final ObjectStorage storage;
    private final UrlArchiveFetcher urlFetcher;

    public OdooRestoreJobReconciler(Clock clock,
                                    OperatorConfig config,
                                    JobCoordinator coordinator,
                                    JobRunner runner,
                                    WorkloadExecutor executor,
                                    DatabaseAdminClient databaseAdminClient,
                                    NeutralizationPolicy neutralizationPolicy,
                                    ObjectStorage storage,
                                    UrlArchiveFetcher urlFetcher) {
        super(clock, config, coordinator, runner, new JobStatusFactory<>(clock, OdooRestoreJob::new));
        this.clock = clock;
        this.archiver = new WorkloadArchiver(executor);
        this.databaseAdminClient = Objects.requireNonNull(databaseAdminClient);
        this.neutralizationPolicy = Objects.requireNonNull(neutralizationPolicy);
        this.storage = Objects.requireNonNull(storage);
        this.urlFetcher = Objects.requireNonNull(urlFetcher);
    }

    @Override
    protected void validate(OdooRestoreJob job) {
        List<String> violations = new ArrayList<>();
        OdooRestoreJobSpec spec = job.getSpec();
        if (spec == null) {
            violations.add("spec is required");
        }
        else {
            if (spec.getInstanceRef() == null || JobSpecChecks.isBlank(spec.getInstanceRef().getName())) {
                violations.add("spec.instanceRef.name is required");
            }
            checkSource(spec.getSource(), violations);
        }
        requireValid(violations);
    }

    private static void checkSource(RestoreSource source, List<String> violations) {
        if (source == null) {
            violations.add("spec.source is required");
            return;
        }
        boolean hasObjectStorage = source.getObjectStorage() != null;
        boolean hasUrl = !JobSpecChecks.isBlank(source.getUrl());
        if (hasObjectStorage == hasUrl) {
            violations.add("spec.source must set exactly one of objectStorage and url");
        }
        else if (hasObjectStorage) {
            JobSpecChecks.checkLocation("spec.source.objectStorage", source.getObjectStorage(), violations);
        }
        else if (!JobSpecChecks.isHttpUrl(source.getUrl())) {
            violations.add("spec.source.url must be an http or https URL");
        }
    }

    @Override
    protected InstanceRef instanceRef(OdooRestoreJob job) {
        return job.getSpec().getInstanceRef();
    }

    @Override
    protected void checkPrecondition(OdooRestoreJob job, OdooInstance instance, KubernetesClient client) {
        boolean terminating = instance.getMetadata().getDeletionTimestamp() != null
                || Optional.ofNullable(instance.getStatus()).map(OdooInstanceStatus::getPhase).orElse(null) == OdooInstanceStatus.Phase.TERMINATING;
        if (terminating) {
            throw new PreconditionFailedException(ResourcesUtil.namespacedSlug(instance) + " is terminating");
        }
        if (ObservedState.read(client, instance).runningPod().isEmpty()) {
            throw new PreconditionFailedException(ResourcesUtil.namespacedSlug(instance) + " has no running pod");
        }
    }

    @Override
    protected JobWorkflow workflow(OdooRestoreJob job, OdooInstance instance, KubernetesClient client) {
        OdooRestoreJobSpec spec = job.getSpec();
        String database = DatabaseNames.roleName(ResourcesUtil.namespace(instance), config.releaseName(), ResourcesUtil.name(instance));
        ArchiveFormat format = Optional.ofNullable(spec.getFormat()).orElse(ArchiveFormat.ZIP);
        NeutralizationPolicy neutralization = Boolean.TRUE.equals(spec.getNeutralize()) ? neutralizationPolicy : null;
        return new RestoreWorkflow(client, clock, instance, database, spec.getSource(), format, neutralization,
                archiver, databaseAdminClient, storage, urlFetcher);
    }
}
