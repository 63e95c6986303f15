/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;

import org.bemade.odoo.kubernetes.api.common.ArchiveFormat;
import org.bemade.odoo.kubernetes.api.common.Condition;
import org.bemade.odoo.kubernetes.api.common.ObjectStorageLocation;
import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceStatus;
import org.bemade.odoo.kubernetes.operator.PreconditionFailedException;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;
import org.bemade.odoo.kubernetes.operator.checksum.FileDigests;
import org.bemade.odoo.kubernetes.operator.storage.ObjectStorage;
import org.bemade.odoo.kubernetes.operator.storage.ObjectStorageCredentials;
import org.bemade.odoo.kubernetes.operator.workload.WorkloadArchiver;

/**
 * Exports an instance's database, and for zip archives its filestore, and uploads the archive.
 */
public class BackupWorkflow implements JobWorkflow {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupWorkflow.class);

    private final KubernetesClient client;
    private final OdooInstance instance;
    private final String database;
    private final ArchiveFormat format;
    private final ObjectStorageLocation destination;
    private final WorkloadArchiver archiver;
    private final ObjectStorage storage;

    public BackupWorkflow(KubernetesClient client,
                          OdooInstance instance,
                          String database,
                          ArchiveFormat format,
                          ObjectStorageLocation destination,
                          WorkloadArchiver archiver,
                          ObjectStorage storage) {
        this.client = Objects.requireNonNull(client);
        this.instance = Objects.requireNonNull(instance);
        this.database = Objects.requireNonNull(database);
        this.format = Objects.requireNonNull(format);
        this.destination = Objects.requireNonNull(destination);
        this.archiver = Objects.requireNonNull(archiver);
        this.storage = Objects.requireNonNull(storage);
    }

    @Override
    public JobOutcome run(Path stagingDir) throws Exception {
        OdooInstance current = client.resources(OdooInstance.class)
                .inNamespace(ResourcesUtil.namespace(instance))
                .withName(ResourcesUtil.name(instance))
                .get();
        requireReady(current, instance);

        Path archive = stagingDir.resolve(database + "." + format.getValue());
        try {
            archiver.export(current, database, format, archive);
            long size = Files.size(archive);
            String checksum = FileDigests.sha256Hex(archive);
            LOGGER.info("Exported {} ({} bytes, sha256 {})", database, size, checksum);

            var credentials = ObjectStorageCredentials.resolve(client, ResourcesUtil.namespace(instance), destination);
            storage.upload(destination, credentials, archive);
            return new JobOutcome(size, checksum);
        }
        finally {
            Files.deleteIfExists(archive);
        }
    }

    static void requireReady(OdooInstance current, OdooInstance requested) {
        if (current == null) {
            throw new PreconditionFailedException(ResourcesUtil.namespacedSlug(requested) + " no longer exists");
        }
        OdooInstanceStatus status = current.getStatus();
        boolean ready = status != null
                && status.getPhase() == OdooInstanceStatus.Phase.READY
                && status.getConditions() != null
                && status.getConditions().stream().anyMatch(Condition::isReadyTrue);
        if (!ready) {
            String phase = status == null || status.getPhase() == null ? "Pending" : status.getPhase().getValue();
            throw new PreconditionFailedException(ResourcesUtil.namespacedSlug(current) + " is " + phase + ", not Ready");
        }
    }
}
