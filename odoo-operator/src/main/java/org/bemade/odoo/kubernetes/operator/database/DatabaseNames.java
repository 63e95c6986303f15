/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.database;

import java.nio.charset.StandardCharsets;

/**
 * Naming of the PostgreSQL roles and databases that back instances.
 */
public final class DatabaseNames {

    /** PostgreSQL's NAMEDATALEN - 1. */
    public static final int MAX_IDENTIFIER_BYTES = 63;

    static final String STAGING_SUFFIX = "-restore";
    static final String INCOMING_SUFFIX = "-incoming";
    static final String PREVIOUS_SUFFIX = "-previous";

    private DatabaseNames() {
    }

    /**
     * @return the role and database name of an instance: {@code {namespace}-{release}-{instance}}, truncated to 63 bytes
     */
    public static String roleName(String namespace, String release, String instance) {
        return truncate(rolePrefix(namespace, release) + instance, MAX_IDENTIFIER_BYTES);
    }

    /**
     * @return the prefix shared by every role the operator manages in a namespace
     */
    public static String rolePrefix(String namespace, String release) {
        return namespace + "-" + release + "-";
    }

    /**
     * @return the database a restore is loaded into before it replaces {@code database}
     */
    public static String stagingName(String database) {
        return suffixed(database, STAGING_SUFFIX);
    }

    /**
     * @return the database a clone is copied into before it takes the name {@code database}
     */
    static String incomingName(String database) {
        return suffixed(database, INCOMING_SUFFIX);
    }

    /**
     * @return the name {@code database} is moved to while a clone takes its place
     */
    static String previousName(String database) {
        return suffixed(database, PREVIOUS_SUFFIX);
    }

    private static String suffixed(String database, String suffix) {
        return truncate(database, MAX_IDENTIFIER_BYTES - suffix.length()) + suffix;
    }

    static String truncate(String name, int maxBytes) {
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= maxBytes) {
            return name;
        }
        int end = maxBytes;
        // do not split a multi-byte character
        while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }
}
