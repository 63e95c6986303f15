/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.workload;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.database.InMemoryDatabaseAdminClient;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Pretends to be the {@code odoo-archive} tooling of the Odoo image. Exports write a fixed archive and
 * imports load the usual Odoo tables into the target database.
 */
public class RecordingWorkloadExecutor implements WorkloadExecutor {

    public static final byte[] ARCHIVE = "PK\u0003\u0004 odoo archive".getBytes(StandardCharsets.UTF_8);
    public static final String[] ODOO_TABLES = { "ir_mail_server", "ir_cron", "ir_config_parameter" };

    private final @Nullable InMemoryDatabaseAdminClient databases;
    private final List<List<String>> commands = new CopyOnWriteArrayList<>();
    private final Map<String, Exception> failures = new HashMap<>();
    private volatile long importedBytes;

    public RecordingWorkloadExecutor() {
        this(null);
    }

    public RecordingWorkloadExecutor(@Nullable InMemoryDatabaseAdminClient databases) {
        this.databases = databases;
    }

    /**
     * Makes every later {@code odoo-archive <subcommand>} fail with {@code failure}.
     */
    public RecordingWorkloadExecutor failOn(String subcommand, Exception failure) {
        failures.put(subcommand, failure);
        return this;
    }

    public List<List<String>> commands() {
        return List.copyOf(commands);
    }

    public long importedBytes() {
        return importedBytes;
    }

    @Override
    public void run(OdooInstance instance, List<String> command, @Nullable InputStream stdin, OutputStream stdout) throws IOException {
        commands.add(List.copyOf(command));
        String subcommand = command.size() > 1 ? command.get(1) : "";
        Exception failure = failures.get(subcommand);
        if (failure instanceof IOException e) {
            throw e;
        }
        else if (failure instanceof RuntimeException e) {
            throw e;
        }
        if (!WorkloadArchiver.ARCHIVE_COMMAND.equals(command.get(0))) {
            return;
        }
        switch (subcommand) {
            case "export" -> stdout.write(ARCHIVE);
            case "import" -> {
                importedBytes = stdin == null ? 0 : stdin.readAllBytes().length;
                if (databases != null) {
                    databases.createTables(command.get(command.indexOf("--database") + 1), ODOO_TABLES);
                }
            }
            default -> {
                // filestore commands have no observable effect here
            }
        }
    }
}
