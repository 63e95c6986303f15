/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.database;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;

import org.jooq.DSLContext;

/**
 * Administrative operations on the shared PostgreSQL cluster, performed with the admin connection.
 * Every operation is idempotent and fails with a {@link DatabaseAdminException}.
 */
public interface DatabaseAdminClient extends AutoCloseable {

    /**
     * Creates the login role {@code name} and the database {@code name} owned by it, as needed.
     *
     * @param name role and database name
     * @param password password given to a newly created role
     * @return what had to change
     */
    EnsureResult ensureRoleAndDatabase(String name, String password);

    /**
     * Sets the password of an existing role.
     */
    void setPassword(String name, String password);

    /**
     * Drops the database {@code name} and the role {@code name}. Succeeds if neither exists.
     * A failure names the {@link DropStep} reached.
     */
    void dropRoleAndDatabase(String name);

    /**
     * Replaces {@code target} with a copy of {@code source}, owned by {@code owner}. The copy is made beside
     * the target, which is only replaced once the copy is complete and is left as it was if the clone fails.
     * Fails with {@link DatabaseAdminException.Kind#SOURCE_IN_USE} if {@code source} has active connections.
     */
    void cloneDatabase(String source, String target, String owner);

    /**
     * Creates an empty database owned by {@code owner}.
     */
    void createDatabase(String name, String owner);

    /**
     * Terminates the connections to a database and drops it, if it exists.
     */
    void dropDatabase(String name);

    /**
     * @return the role names starting with {@code prefix}
     */
    List<String> listRoles(String prefix);

    /**
     * Drops the roles of a namespace whose instance no longer exists.
     *
     * @param namespace namespace
     * @param release release name
     * @param currentInstanceNames names that must be kept
     * @return the dropped role names
     */
    List<String> reconcileStaleRoles(String namespace, String release, Collection<String> currentInstanceNames);

    /**
     * Runs {@code work} against the named database, bounded by the job timeout rather than the statement timeout.
     */
    <T> T execute(String database, Function<DSLContext, T> work);

    @Override
    void close();
}
