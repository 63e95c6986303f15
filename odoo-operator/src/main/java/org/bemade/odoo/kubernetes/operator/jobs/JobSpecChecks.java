/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.net.URI;
import java.util.List;
import java.util.Locale;

import org.bemade.odoo.kubernetes.api.common.ObjectStorageLocation;

/**
 * Spec checks shared by the job kinds.
 */
final class JobSpecChecks {

    private JobSpecChecks() {
    }

    static void checkLocation(String path, ObjectStorageLocation location, List<String> violations) {
        if (isBlank(location.getBucket())) {
            violations.add(path + ".bucket is required");
        }
        if (isBlank(location.getKey())) {
            violations.add(path + ".key is required");
        }
        if (isBlank(location.getCredentialsSecret())) {
            violations.add(path + ".credentialsSecret is required");
        }
        if (!isBlank(location.getEndpoint()) && !isHttpUrl(location.getEndpoint())) {
            violations.add(path + ".endpoint must be an http or https URL");
        }
    }

    static boolean isHttpUrl(String value) {
        try {
            URI uri = URI.create(value);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            return (scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null;
        }
        catch (IllegalArgumentException e) {
            return false;
        }
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
