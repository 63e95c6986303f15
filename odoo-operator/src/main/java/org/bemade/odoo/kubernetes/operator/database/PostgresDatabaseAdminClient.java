/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.bemade.odoo.kubernetes.operator.OperatorConfig;
import org.bemade.odoo.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

import static org.jooq.impl.DSL.inline;
import static org.jooq.impl.DSL.name;

/**
 * {@link DatabaseAdminClient} for PostgreSQL. Each operation opens its own connection and
 * each statement commits on its own, so a failure leaves every earlier step in place.
 * Statements are bounded by {@link OperatorConfig#dbOperationTimeout()}, except clones and
 * {@link #execute(String, Function)} which are bounded by the job timeout.
 */
public class PostgresDatabaseAdminClient implements DatabaseAdminClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresDatabaseAdminClient.class);

    static final String ADMIN_DATABASE = "postgres";
    private static final String OBJECT_IN_USE = "55006";
    private static final String DUPLICATE_OBJECT = "42710";
    private static final String DUPLICATE_DATABASE = "42P04";

    /**
     * Opens admin connections to a named database.
     */
    @FunctionalInterface
    public interface ConnectionSource extends AutoCloseable {
        Connection open(String database) throws SQLException;

        @Override
        default void close() {
        }
    }

    private final ConnectionSource connections;
    private final Duration longOperationTimeout;

    /**
     * @param connections admin connections
     * @param longOperationTimeout statement bound for clones and work run through {@link #execute(String, Function)},
     * which replaces the per-connection default
     */
    public PostgresDatabaseAdminClient(ConnectionSource connections, Duration longOperationTimeout) {
        this.connections = connections;
        this.longOperationTimeout = longOperationTimeout;
    }

    /**
     * @param config operator configuration holding the admin credentials and timeouts
     * @return a client connecting with the admin credentials
     */
    public static PostgresDatabaseAdminClient create(OperatorConfig config) {
        return new PostgresDatabaseAdminClient(new DataSourceConnectionSource(config), config.jobTimeout());
    }

    @Override
    public EnsureResult ensureRoleAndDatabase(String name, String password) {
        return inDatabase(ADMIN_DATABASE, "ensure role and database " + name, dsl -> {
            boolean roleCreated = false;
            if (!roleExists(dsl, name)) {
                roleCreated = createIfAbsent(() -> dsl.execute("create role {0} with login createdb password {1}", name(name), inline(password)));
            }
            boolean databaseCreated = false;
            boolean ownershipChanged = false;
            Optional<String> owner = databaseOwner(dsl, name);
            if (owner.isEmpty()) {
                databaseCreated = createIfAbsent(() -> dsl.execute("create database {0} owner {1}", name(name), name(name)));
            }
            else if (!owner.get().equals(name)) {
                dsl.execute("alter database {0} owner to {1}", name(name), name(name));
                ownershipChanged = true;
            }
            var result = new EnsureResult(roleCreated, databaseCreated, ownershipChanged);
            if (result.changed()) {
                LOGGER.atInfo().setMessage("Ensured role and database {}: {}").addArgument(name).addArgument(result).log();
            }
            return result;
        });
    }

    @Override
    public void setPassword(String name, String password) {
        inDatabase(ADMIN_DATABASE, "set password of " + name, dsl -> dsl.execute("alter role {0} with password {1}", name(name), inline(password)));
        LOGGER.info("Reset password of role {}", name);
    }

    @Override
    public void dropRoleAndDatabase(String name) {
        inDatabase(ADMIN_DATABASE, "drop role and database " + name, dsl -> {
            step(DropStep.TERMINATE_BACKENDS, name, () -> terminateBackends(dsl, name));
            if (roleExists(dsl, name)) {
                step(DropStep.REASSIGN_OWNED, name, () -> dsl.execute("reassign owned by {0} to current_user", name(name)));
                step(DropStep.DROP_OWNED, name, () -> dsl.execute("drop owned by {0}", name(name)));
            }
            step(DropStep.DROP_DATABASE, name, () -> dsl.execute("drop database if exists {0}", name(name)));
            step(DropStep.DROP_ROLE, name, () -> dsl.execute("drop role if exists {0}", name(name)));
            return null;
        });
        LOGGER.info("Dropped role and database {}", name);
    }

    @Override
    public void cloneDatabase(String source, String target, String owner) {
        String incoming = DatabaseNames.incomingName(target);
        inDatabase(ADMIN_DATABASE, "clone database " + source + " to " + target, dsl -> {
            if (activeConnections(dsl, source) > 0) {
                throw new DatabaseAdminException(DatabaseAdminException.Kind.SOURCE_IN_USE,
                        "Database " + source + " has active connections and cannot be used as a template");
            }
            useStatementTimeout(dsl, longOperationTimeout);
            dsl.execute("drop database if exists {0}", name(incoming));
            try {
                dsl.execute("create database {0} with template {1} owner {2}", name(incoming), name(source), name(owner));
            }
            catch (DataAccessException e) {
                String sqlState = sqlStateOf(e);
                if (OBJECT_IN_USE.equals(sqlState)) {
                    throw new DatabaseAdminException(DatabaseAdminException.Kind.SOURCE_IN_USE,
                            "Database " + source + " is being accessed by other users", sqlState, null, e);
                }
                throw e;
            }
            swapIn(dsl, incoming, target);
            return null;
        });
        LOGGER.info("Cloned database {} to {} owned by {}", source, target, owner);
    }

    /**
     * Gives {@code incoming} the name {@code target}. Until the renames are done the target refuses new
     * connections, and on failure the target is put back as it was.
     */
    private static void swapIn(DSLContext dsl, String incoming, String target) {
        String previous = DatabaseNames.previousName(target);
        boolean targetExists = databaseOwner(dsl, target).isPresent();
        if (targetExists) {
            dsl.execute("drop database if exists {0}", name(previous));
            dsl.execute("alter database {0} with allow_connections false", name(target));
            try {
                terminateBackends(dsl, target);
                dsl.execute("alter database {0} rename to {1}", name(target), name(previous));
            }
            catch (DataAccessException e) {
                undo(e, () -> dsl.execute("alter database {0} with allow_connections true", name(target)));
                undo(e, () -> dsl.execute("drop database if exists {0}", name(incoming)));
                throw e;
            }
        }
        try {
            dsl.execute("alter database {0} rename to {1}", name(incoming), name(target));
        }
        catch (DataAccessException e) {
            if (targetExists) {
                undo(e, () -> dsl.execute("alter database {0} rename to {1}", name(previous), name(target)));
                undo(e, () -> dsl.execute("alter database {0} with allow_connections true", name(target)));
            }
            undo(e, () -> dsl.execute("drop database if exists {0}", name(incoming)));
            throw e;
        }
        if (targetExists) {
            try {
                dsl.execute("drop database if exists {0}", name(previous));
            }
            catch (DataAccessException e) {
                // dropped again by the next clone
                LOGGER.warn("Unable to drop replaced database {}: {}", previous, e.getMessage());
            }
        }
    }

    private static void undo(DataAccessException failure, Runnable step) {
        try {
            step.run();
        }
        catch (DataAccessException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public void createDatabase(String name, String owner) {
        inDatabase(ADMIN_DATABASE, "create database " + name,
                dsl -> dsl.execute("create database {0} owner {1}", name(name), name(owner)));
    }

    @Override
    public void dropDatabase(String name) {
        inDatabase(ADMIN_DATABASE, "drop database " + name, dsl -> {
            terminateBackends(dsl, name);
            return dsl.execute("drop database if exists {0}", name(name));
        });
    }

    @Override
    public List<String> listRoles(String prefix) {
        return inDatabase(ADMIN_DATABASE, "list roles", dsl -> dsl.fetch(
                "select rolname from pg_catalog.pg_roles where rolname like ? escape '\\' order by rolname",
                escapeLike(prefix) + "%")
                .getValues(0, String.class)
                .stream()
                // LIKE is only a pre-filter
                .filter(role -> role.startsWith(prefix))
                .toList());
    }

    @Override
    public List<String> reconcileStaleRoles(String namespace, String release, Collection<String> currentInstanceNames) {
        Set<String> keep = Set.copyOf(currentInstanceNames);
        String prefix = DatabaseNames.rolePrefix(namespace, release);
        List<String> dropped = new ArrayList<>();
        for (String role : listRoles(prefix)) {
            String suffix = role.substring(prefix.length());
            boolean current = keep.contains(suffix)
                    || keep.stream().anyMatch(instance -> DatabaseNames.roleName(namespace, release, instance).equals(role));
            if (!current) {
                LOGGER.info("Dropping stale role {} in namespace {}", role, namespace);
                dropRoleAndDatabase(role);
                dropped.add(role);
            }
        }
        return dropped;
    }

    @Override
    public <T> T execute(String database, Function<DSLContext, T> work) {
        return inDatabase(database, "execute in " + database, dsl -> {
            useStatementTimeout(dsl, longOperationTimeout);
            return work.apply(dsl);
        });
    }

    @Override
    public void close() {
        connections.close();
    }

    private <T> T inDatabase(String database, String operation, Function<DSLContext, T> work) {
        try (Connection connection = connections.open(database)) {
            DSLContext dsl = DSL.using(connection, SQLDialect.POSTGRES);
            return work.apply(dsl);
        }
        catch (SQLException e) {
            throw new DatabaseAdminException(DatabaseAdminException.kindOf(e.getSQLState()),
                    "Failed to " + operation + ": " + e.getMessage(), e.getSQLState(), null, e);
        }
        catch (DataAccessException e) {
            throw translate(operation, e, null);
        }
    }

    private static void step(DropStep step, String name, Runnable work) {
        try {
            work.run();
        }
        catch (DataAccessException e) {
            throw translate("drop role and database " + name + " at step " + step, e, step);
        }
    }

    private static DatabaseAdminException translate(String operation, DataAccessException e, @Nullable DropStep step) {
        String sqlState = sqlStateOf(e);
        DatabaseAdminException.Kind kind = sqlState == null ? DatabaseAdminException.Kind.FATAL : DatabaseAdminException.kindOf(sqlState);
        return new DatabaseAdminException(kind, "Failed to " + operation + ": " + e.getMessage(), sqlState, step, e);
    }

    private static boolean createIfAbsent(Runnable create) {
        try {
            create.run();
            return true;
        }
        catch (DataAccessException e) {
            String sqlState = sqlStateOf(e);
            if (DUPLICATE_OBJECT.equals(sqlState) || DUPLICATE_DATABASE.equals(sqlState)) {
                // created concurrently
                return false;
            }
            throw e;
        }
    }

    @VisibleForTesting
    @Nullable
    static String sqlStateOf(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException.getSQLState();
            }
        }
        return null;
    }

    private static boolean roleExists(DSLContext dsl, String name) {
        return !dsl.fetch("select 1 from pg_catalog.pg_roles where rolname = ?", name).isEmpty();
    }

    private static Optional<String> databaseOwner(DSLContext dsl, String name) {
        return dsl.fetchOptional("select pg_catalog.pg_get_userbyid(datdba) from pg_catalog.pg_database where datname = ?", name)
                .map(owner -> owner.get(0, String.class));
    }

    private static int activeConnections(DSLContext dsl, String database) {
        return dsl.fetchOptional("select count(*) from pg_catalog.pg_stat_activity where datname = ? and pid <> pg_catalog.pg_backend_pid()", database)
                .map(count -> count.get(0, Integer.class))
                .orElse(0);
    }

    private static void useStatementTimeout(DSLContext dsl, Duration timeout) {
        dsl.execute("set statement_timeout = {0}", inline(timeout.toMillis()));
    }

    private static void terminateBackends(DSLContext dsl, String database) {
        dsl.fetch("select pg_catalog.pg_terminate_backend(pid) from pg_catalog.pg_stat_activity where datname = ? and pid <> pg_catalog.pg_backend_pid()",
                database);
    }

    @VisibleForTesting
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    /**
     * Connections from a {@link PGSimpleDataSource} per database, carrying the admin credentials and timeouts.
     */
    static final class DataSourceConnectionSource implements ConnectionSource {
        private final OperatorConfig config;
        private final Map<String, PGSimpleDataSource> dataSources = new ConcurrentHashMap<>();

        DataSourceConnectionSource(OperatorConfig config) {
            this.config = config;
        }

        @Override
        public Connection open(String database) throws SQLException {
            return dataSources.computeIfAbsent(database, this::newDataSource).getConnection();
        }

        private PGSimpleDataSource newDataSource(String database) {
            Duration statementTimeout = config.dbOperationTimeout();
            Duration longestStatement = statementTimeout.compareTo(config.jobTimeout()) >= 0 ? statementTimeout : config.jobTimeout();
            var dataSource = new PGSimpleDataSource();
            dataSource.setServerNames(new String[]{ config.dbHost() });
            dataSource.setPortNumbers(new int[]{ config.dbPort() });
            dataSource.setDatabaseName(database);
            dataSource.setUser(config.dbAdminUser());
            dataSource.setPassword(config.dbAdminPassword());
            dataSource.setApplicationName("odoo-operator");
            dataSource.setConnectTimeout((int) Math.max(1, statementTimeout.toSeconds()));
            // the socket must outlive the longest server side statement timeout
            dataSource.setSocketTimeout((int) longestStatement.plusSeconds(10).toSeconds());
            dataSource.setOptions("-c statement_timeout=" + statementTimeout.toMillis());
            return dataSource;
        }

        @Override
        public void close() {
            dataSources.clear();
        }
    }
}
