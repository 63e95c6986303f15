/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.io.IOException;
import java.util.Properties;

import org.slf4j.LoggerFactory;

/**
 * The operator's build version.
 */
public record VersionInfo(String version) {

    private static final String UNKNOWN = "unknown";

    public static final VersionInfo VERSION_INFO = load();

    private static VersionInfo load() {
        try (var resource = VersionInfo.class.getClassLoader().getResourceAsStream("META-INF/odoo-operator.properties")) {
            if (resource != null) {
                Properties properties = new Properties();
                properties.load(resource);
                return new VersionInfo(properties.getProperty("odoo.operator.version", UNKNOWN));
            }
        }
        catch (IOException e) {
            LoggerFactory.getLogger(VersionInfo.class).warn("Failed to retrieve version information (ignored)", e);
        }
        return new VersionInfo(UNKNOWN);
    }
}
