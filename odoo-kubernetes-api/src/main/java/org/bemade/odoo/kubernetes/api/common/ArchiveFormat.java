/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.api.common;

/**
 * Layout of a backup archive.
 */
public enum ArchiveFormat {

    /** Zip file holding {@code dump.sql}, the {@code filestore/} tree and {@code manifest.json}. */
    @com.fasterxml.jackson.annotation.JsonProperty("zip")
    ZIP("zip"),
    /** PostgreSQL custom-format dump only, without filestore. */
    @com.fasterxml.jackson.annotation.JsonProperty("dump")
    DUMP("dump");

    private final String value;

    ArchiveFormat(String value) {
        this.value = value;
    }

    @com.fasterxml.jackson.annotation.JsonValue()
    public String getValue() {
        return value;
    }
}
