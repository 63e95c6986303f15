/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.workload;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

import org.bemade.odoo.kubernetes.api.common.ArchiveFormat;
import org.bemade.odoo.kubernetes.api.v1.OdooInstance;

/**
 * The {@code odoo-archive} commands of the Odoo image.
 * <ul>
 * <li>{@code export} writes an archive of a database, and for zip archives its filestore, to stdout</li>
 * <li>{@code import} reads an archive from stdin into a database and the filestore of that database</li>
 * <li>{@code replace-filestore} moves one database's filestore over another's</li>
 * <li>{@code drop-filestore} removes a database's filestore</li>
 * </ul>
 */
public class WorkloadArchiver {

    static final String ARCHIVE_COMMAND = "odoo-archive";

    private final WorkloadExecutor executor;

    public WorkloadArchiver(WorkloadExecutor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    public void export(OdooInstance instance, String database, ArchiveFormat format, Path target)
            throws IOException, InterruptedException, TimeoutException {
        try (OutputStream out = Files.newOutputStream(target)) {
            executor.run(instance, List.of(ARCHIVE_COMMAND, "export", "--database", database, "--format", format.getValue()), null, out);
        }
    }

    public void importArchive(OdooInstance instance, String database, ArchiveFormat format, Path source)
            throws IOException, InterruptedException, TimeoutException {
        try (InputStream in = Files.newInputStream(source)) {
            executor.run(instance, List.of(ARCHIVE_COMMAND, "import", "--database", database, "--format", format.getValue()), in,
                    OutputStream.nullOutputStream());
        }
    }

    public void replaceFilestore(OdooInstance instance, String from, String to)
            throws IOException, InterruptedException, TimeoutException {
        executor.run(instance, List.of(ARCHIVE_COMMAND, "replace-filestore", "--from", from, "--to", to), null, OutputStream.nullOutputStream());
    }

    public void dropFilestore(OdooInstance instance, String database)
            throws IOException, InterruptedException, TimeoutException {
        executor.run(instance, List.of(ARCHIVE_COMMAND, "drop-filestore", "--database", database), null, OutputStream.nullOutputStream());
    }
}
