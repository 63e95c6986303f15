/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.neutralization;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.OperatorTestUtils;
import org.bemade.odoo.kubernetes.operator.database.DatabaseAdminException;
import org.bemade.odoo.kubernetes.operator.database.InMemoryDatabaseAdminClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlNeutralizationPolicyTest {

    private static final String DATABASE = "shop-odoo-demo-restore";

    private final OdooInstance instance = OperatorTestUtils.minimalInstance("demo");
    private InMemoryDatabaseAdminClient databases;
    private SqlNeutralizationPolicy policy;

    @BeforeEach
    void setUp() {
        databases = new InMemoryDatabaseAdminClient();
        databases.createDatabase(DATABASE, "shop-odoo-demo");
        policy = new SqlNeutralizationPolicy(databases);
    }

    @Test
    void shouldDisableMailPaymentsAndCronsOfInstalledModules() {
        // Given
        databases.createTables(DATABASE, "ir_mail_server", "fetchmail_server", "payment_provider", "ir_cron", "ir_config_parameter");

        // When
        policy.neutralize(instance, DATABASE);

        // Then
        List<String> statements = databases.database(DATABASE).statements();
        assertThat(statements)
                .contains("update ir_mail_server set active = false",
                        "update fetchmail_server set active = false",
                        "update payment_provider set state = 'disabled' where state <> 'disabled'")
                .anySatisfy(statement -> assertThat(statement).startsWith("update ir_cron set active = false")
                        .contains("module = 'base'"))
                .noneSatisfy(statement -> assertThat(statement).contains("payment_acquirer"));
    }

    @Test
    void shouldSkipTablesOfModulesThatAreNotInstalled() {
        // Given
        databases.createTables(DATABASE, "ir_config_parameter");

        // When
        policy.neutralize(instance, DATABASE);

        // Then
        assertThat(databases.database(DATABASE).statements())
                .noneSatisfy(statement -> assertThat(statement).startsWith("update"));
    }

    @Test
    void shouldMarkDatabaseNeutralizedAndForgetEnterpriseCode() {
        // Given
        databases.createTables(DATABASE, "ir_config_parameter");

        // When
        policy.neutralize(instance, DATABASE);

        // Then
        assertThat(databases.database(DATABASE).statements())
                .containsSubsequence(
                        "delete from ir_config_parameter where key = '" + SqlNeutralizationPolicy.ENTERPRISE_CODE_KEY + "'",
                        "insert into ir_config_parameter (key, value) values ('" + SqlNeutralizationPolicy.IS_NEUTRALIZED_KEY + "', 'true') "
                                + "on conflict (key) do update set value = excluded.value");
    }

    @Test
    void shouldFailForMissingDatabase() {
        // Given

        // When / Then
        assertThatThrownBy(() -> policy.neutralize(instance, "shop-odoo-missing"))
                .isInstanceOf(DatabaseAdminException.class)
                .hasMessageContaining("shop-odoo-missing");
    }
}
