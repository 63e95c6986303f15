/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.database;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record1;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.jooq.tools.jdbc.MockConnection;
import org.jooq.tools.jdbc.MockResult;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Roles and databases held in memory. Statements run through {@link #execute(String, Function)} are recorded
 * against their database, with bind values inlined, and copied along when a database is cloned.
 */
public class InMemoryDatabaseAdminClient implements DatabaseAdminClient {

    private static final DSLContext CREATE = DSL.using(SQLDialect.POSTGRES);
    private static final Field<String> TEXT = DSL.field("v", SQLDataType.VARCHAR);

    /**
     * A database and what has been done to it.
     */
    public static final class Database {
        private final String owner;
        private final List<String> statements = new CopyOnWriteArrayList<>();
        private final Set<String> tables = Collections.synchronizedSet(new LinkedHashSet<>());

        private Database(String owner) {
            this.owner = owner;
        }

        public String owner() {
            return owner;
        }

        public List<String> statements() {
            return List.copyOf(statements);
        }

        public Set<String> tables() {
            return Set.copyOf(tables);
        }
    }

    private final Map<String, String> roles = new TreeMap<>();
    private final Map<String, Database> databases = new TreeMap<>();
    private final List<String> operations = new CopyOnWriteArrayList<>();
    private volatile @Nullable DatabaseAdminException cloneFailure;

    /**
     * @return the admin operations performed, such as {@code clone demo-restore demo}
     */
    public List<String> operations() {
        return List.copyOf(operations);
    }

    public synchronized Map<String, String> roles() {
        return Map.copyOf(roles);
    }

    public synchronized Database database(String name) {
        return databases.get(name);
    }

    public synchronized boolean hasDatabase(String name) {
        return databases.containsKey(name);
    }

    /**
     * Makes every later clone fail with {@code failure}, leaving the target as it was.
     */
    public void failClonesWith(DatabaseAdminException failure) {
        this.cloneFailure = failure;
    }

    /**
     * Marks tables as present in a database, as loading an Odoo archive would.
     */
    public synchronized void createTables(String database, String... tables) {
        requireDatabase(database).tables.addAll(Arrays.asList(tables));
    }

    @Override
    public synchronized EnsureResult ensureRoleAndDatabase(String name, String password) {
        operations.add("ensure " + name);
        boolean roleCreated = roles.putIfAbsent(name, password) == null;
        Database database = databases.get(name);
        boolean databaseCreated = false;
        boolean ownershipChanged = false;
        if (database == null) {
            databases.put(name, new Database(name));
            databaseCreated = true;
        }
        else if (!database.owner.equals(name)) {
            Database reowned = new Database(name);
            reowned.statements.addAll(database.statements);
            reowned.tables.addAll(database.tables);
            databases.put(name, reowned);
            ownershipChanged = true;
        }
        return new EnsureResult(roleCreated, databaseCreated, ownershipChanged);
    }

    @Override
    public synchronized void setPassword(String name, String password) {
        operations.add("set-password " + name);
        roles.put(name, password);
    }

    @Override
    public synchronized void dropRoleAndDatabase(String name) {
        operations.add("drop-role-and-database " + name);
        databases.remove(name);
        roles.remove(name);
    }

    @Override
    public synchronized void cloneDatabase(String source, String target, String owner) {
        operations.add("clone " + source + " " + target);
        DatabaseAdminException failure = cloneFailure;
        if (failure != null) {
            throw failure;
        }
        Database template = requireDatabase(source);
        Database copy = new Database(owner);
        copy.statements.addAll(template.statements);
        copy.tables.addAll(template.tables);
        databases.put(target, copy);
    }

    @Override
    public synchronized void createDatabase(String name, String owner) {
        operations.add("create " + name);
        if (databases.containsKey(name)) {
            throw new DatabaseAdminException(DatabaseAdminException.Kind.FATAL, "database " + name + " already exists");
        }
        databases.put(name, new Database(owner));
    }

    @Override
    public synchronized void dropDatabase(String name) {
        operations.add("drop " + name);
        databases.remove(name);
    }

    @Override
    public synchronized List<String> listRoles(String prefix) {
        return roles.keySet().stream().filter(role -> role.startsWith(prefix)).toList();
    }

    @Override
    public synchronized List<String> reconcileStaleRoles(String namespace, String release, Collection<String> currentInstanceNames) {
        String prefix = DatabaseNames.rolePrefix(namespace, release);
        List<String> dropped = new ArrayList<>();
        for (String role : listRoles(prefix)) {
            if (!currentInstanceNames.contains(role.substring(prefix.length()))) {
                dropRoleAndDatabase(role);
                dropped.add(role);
            }
        }
        return dropped;
    }

    @Override
    public <T> T execute(String database, Function<DSLContext, T> work) {
        Database target;
        synchronized (this) {
            target = requireDatabase(database);
        }
        var connection = new MockConnection(ctx -> {
            Object[] bindings = ctx.bindings();
            if (ctx.sql().startsWith("select pg_catalog.to_regclass")) {
                String table = (String) bindings[0];
                return new MockResult[]{ text(target.tables.contains(table) ? table : null) };
            }
            target.statements.add(inline(ctx.sql(), bindings));
            return new MockResult[]{ new MockResult(1) };
        });
        return work.apply(DSL.using(connection, SQLDialect.POSTGRES));
    }

    @Override
    public void close() {
        // nothing held
    }

    private Database requireDatabase(String name) {
        Database database = databases.get(name);
        if (database == null) {
            throw new DatabaseAdminException(DatabaseAdminException.Kind.FATAL, "database " + name + " does not exist");
        }
        return database;
    }

    private static String inline(String sql, Object[] bindings) {
        StringBuilder inlined = new StringBuilder();
        int next = 0;
        for (char c : sql.toCharArray()) {
            if (c == '?' && next < bindings.length) {
                inlined.append('\'').append(bindings[next++]).append('\'');
            }
            else {
                inlined.append(c);
            }
        }
        return inlined.toString();
    }

    private static MockResult text(String value) {
        Result<Record1<String>> result = CREATE.newResult(TEXT);
        Record1<String> record = CREATE.newRecord(TEXT);
        record.value1(value);
        result.add(record);
        return new MockResult(1, result);
    }
}
