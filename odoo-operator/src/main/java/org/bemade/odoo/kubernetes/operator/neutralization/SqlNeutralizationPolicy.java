/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.neutralization;

import java.util.List;
import java.util.Objects;

import org.jooq.DSLContext;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.database.DatabaseAdminClient;

/**
 * Neutralizes with plain SQL over the admin connection, in one transaction. Tables of modules that are
 * not installed are skipped.
 */
public class SqlNeutralizationPolicy implements NeutralizationPolicy {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlNeutralizationPolicy.class);

    static final String IS_NEUTRALIZED_KEY = "database.is_neutralized";
    static final String ENTERPRISE_CODE_KEY = "database.enterprise_code";

    private record TableUpdate(String table, String sql) {}

    private static final List<TableUpdate> UPDATES = List.of(
            new TableUpdate("ir_mail_server", "update ir_mail_server set active = false"),
            new TableUpdate("fetchmail_server", "update fetchmail_server set active = false"),
            new TableUpdate("payment_provider", "update payment_provider set state = 'disabled' where state <> 'disabled'"),
            new TableUpdate("payment_acquirer", "update payment_acquirer set state = 'disabled' where state <> 'disabled'"),
            new TableUpdate("ir_cron", "update ir_cron set active = false where id not in "
                    + "(select res_id from ir_model_data where model = 'ir.cron' and module = 'base')"));

    private final DatabaseAdminClient databaseAdminClient;

    public SqlNeutralizationPolicy(DatabaseAdminClient databaseAdminClient) {
        this.databaseAdminClient = Objects.requireNonNull(databaseAdminClient);
    }

    @Override
    public void neutralize(OdooInstance instance, String database) {
        databaseAdminClient.execute(database, dsl -> {
            dsl.transaction(configuration -> neutralize(DSL.using(configuration)));
            return null;
        });
        LOGGER.info("Neutralized database {}", database);
    }

    private static void neutralize(DSLContext tx) {
        for (TableUpdate update : UPDATES) {
            if (tableExists(tx, update.table())) {
                int rows = tx.execute(update.sql());
                LOGGER.debug("{} row(s) of {} neutralized", rows, update.table());
            }
        }
        tx.execute("delete from ir_config_parameter where key = ?", ENTERPRISE_CODE_KEY);
        tx.execute("insert into ir_config_parameter (key, value) values (?, 'true') "
                + "on conflict (key) do update set value = excluded.value", IS_NEUTRALIZED_KEY);
    }

    private static boolean tableExists(DSLContext tx, String table) {
        return tx.fetchValue("select pg_catalog.to_regclass(?)::text", table) != null;
    }
}
