/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;

import org.bemade.odoo.kubernetes.api.common.ArchiveFormat;
import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.odoorestorejobspec.RestoreSource;
import org.bemade.odoo.kubernetes.operator.Annotations;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;
import org.bemade.odoo.kubernetes.operator.checksum.FileDigests;
import org.bemade.odoo.kubernetes.operator.database.DatabaseAdminClient;
import org.bemade.odoo.kubernetes.operator.database.DatabaseNames;
import org.bemade.odoo.kubernetes.operator.neutralization.NeutralizationPolicy;
import org.bemade.odoo.kubernetes.operator.storage.ObjectStorage;
import org.bemade.odoo.kubernetes.operator.storage.ObjectStorageCredentials;
import org.bemade.odoo.kubernetes.operator.storage.UrlArchiveFetcher;
import org.bemade.odoo.kubernetes.operator.workload.WorkloadArchiver;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Restores an archive into an instance. The archive is loaded into a staging database first, so the
 * instance's database is only replaced once the load, and any neutralization, has succeeded. The restored
 * filestore replaces the instance's only after its database has been replaced.
 */
public class RestoreWorkflow implements JobWorkflow {

    private static final Logger LOGGER = LoggerFactory.getLogger(RestoreWorkflow.class);

    private final KubernetesClient client;
    private final Clock clock;
    private final OdooInstance instance;
    private final String database;
    private final RestoreSource source;
    private final ArchiveFormat format;
    private final @Nullable NeutralizationPolicy neutralization;
    private final WorkloadArchiver archiver;
    private final DatabaseAdminClient databaseAdminClient;
    private final ObjectStorage storage;
    private final UrlArchiveFetcher urlFetcher;

    /**
     * @param neutralization applied to the staging database, or null to restore as is
     */
    public RestoreWorkflow(KubernetesClient client,
                           Clock clock,
                           OdooInstance instance,
                           String database,
                           RestoreSource source,
                           ArchiveFormat format,
                           @Nullable NeutralizationPolicy neutralization,
                           WorkloadArchiver archiver,
                           DatabaseAdminClient databaseAdminClient,
                           ObjectStorage storage,
                           UrlArchiveFetcher urlFetcher) {
        this.client = Objects.requireNonNull(client);
        this.clock = Objects.requireNonNull(clock);
        this.instance = Objects.requireNonNull(instance);
        this.database = Objects.requireNonNull(database);
        this.source = Objects.requireNonNull(source);
        this.format = Objects.requireNonNull(format);
        this.neutralization = neutralization;
        this.archiver = Objects.requireNonNull(archiver);
        this.databaseAdminClient = Objects.requireNonNull(databaseAdminClient);
        this.storage = Objects.requireNonNull(storage);
        this.urlFetcher = Objects.requireNonNull(urlFetcher);
    }

    @Override
    public JobOutcome run(Path stagingDir) throws Exception {
        Path archive = stagingDir.resolve("restore." + format.getValue());
        fetch(archive);
        long size = Files.size(archive);
        String checksum = FileDigests.sha256Hex(archive);
        LOGGER.info("Staged archive for {} ({} bytes, sha256 {})", database, size, checksum);

        String staging = DatabaseNames.stagingName(database);
        databaseAdminClient.dropDatabase(staging);
        databaseAdminClient.createDatabase(staging, database);
        boolean filestoreSwapped = false;
        try {
            archiver.importArchive(instance, staging, format, archive);
            Files.deleteIfExists(archive);
            if (neutralization != null) {
                neutralization.neutralize(instance, staging);
            }
            databaseAdminClient.cloneDatabase(staging, database, database);
            LOGGER.info("Replaced database {} with the restored copy", database);
            // the filestore follows the database only once the database has been replaced
            if (format == ArchiveFormat.ZIP) {
                archiver.replaceFilestore(instance, staging, database);
                filestoreSwapped = true;
            }
        }
        finally {
            cleanUp(staging, filestoreSwapped);
        }
        restartWorkload();
        return new JobOutcome(size, checksum);
    }

    private void fetch(Path archive) throws Exception {
        if (source.getObjectStorage() != null) {
            var credentials = ObjectStorageCredentials.resolve(client, ResourcesUtil.namespace(instance), source.getObjectStorage());
            storage.download(source.getObjectStorage(), credentials, archive);
        }
        else {
            urlFetcher.fetch(source.getUrl(), archive);
        }
    }

    private void cleanUp(String staging, boolean filestoreSwapped) {
        try {
            databaseAdminClient.dropDatabase(staging);
        }
        catch (RuntimeException e) {
            LOGGER.warn("Unable to drop staging database {}: {}", staging, e.getMessage());
        }
        if (format == ArchiveFormat.ZIP && !filestoreSwapped) {
            try {
                archiver.dropFilestore(instance, staging);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while dropping staging filestore {}", staging);
            }
            catch (Exception e) {
                LOGGER.warn("Unable to drop staging filestore {}: {}", staging, e.getMessage());
            }
        }
    }

    private void restartWorkload() {
        String restartedAt = clock.instant().toString();
        client.resources(OdooInstance.class)
                .inNamespace(ResourcesUtil.namespace(instance))
                .withName(ResourcesUtil.name(instance))
                .edit(current -> {
                    Map<String, String> annotations = new LinkedHashMap<>(ResourcesUtil.annotations(current));
                    annotations.put(Annotations.RESTARTED_AT, restartedAt);
                    current.getMetadata().setAnnotations(annotations);
                    return current;
                });
        LOGGER.info("Restarting the workload of {}", ResourcesUtil.namespacedSlug(instance));
    }
}
