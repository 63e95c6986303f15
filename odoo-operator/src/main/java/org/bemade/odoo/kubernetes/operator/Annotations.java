/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.utils.KubernetesResourceUtil;

/**
 * Reads and writes the annotations the operator understands, so that their keys
 * and encodings are kept in one place.
 */
public class Annotations {

    public static final String PURGE_ON_DELETE = "odoo.bemade.org/purge-on-delete";
    public static final String RESTARTED_AT = "odoo.bemade.org/restarted-at";
    public static final String DESIRED_CHECKSUM = "odoo.bemade.org/desired-checksum";
    public static final String ADDON_CHECKSUM = "odoo.bemade.org/addon-checksum";

    private Annotations() {
    }

    /**
     * @param instance the instance
     * @return true if deleting the instance should also drop its database and filestore
     */
    public static boolean isPurgeOnDelete(HasMetadata instance) {
        return "true".equalsIgnoreCase(ResourcesUtil.annotations(instance).get(PURGE_ON_DELETE));
    }

    /**
     * @param instance the instance
     * @return the restart token, if the workload has been asked to restart
     */
    public static Optional<String> readRestartedAt(HasMetadata instance) {
        return Optional.ofNullable(ResourcesUtil.annotations(instance).get(RESTARTED_AT))
                .filter(value -> !value.isBlank());
    }

    public static Optional<String> readDesiredChecksum(HasMetadata resource) {
        return Optional.ofNullable(ResourcesUtil.annotations(resource).get(DESIRED_CHECKSUM));
    }

    /**
     * Mutates a HasMetadata, recording the checksum of its desired content. Metadata and annotations
     * are created if they are null.
     */
    public static void annotateWithDesiredChecksum(HasMetadata resource, String checksum) {
        Objects.requireNonNull(resource);
        Objects.requireNonNull(checksum);
        Map<String, String> annotations = KubernetesResourceUtil.getOrCreateAnnotations(resource);
        annotations.put(DESIRED_CHECKSUM, checksum);
    }
}
