/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;

import org.bemade.odoo.kubernetes.operator.checksum.ResourceChecksum;

import edu.umd.cs.findbugs.annotations.Nullable;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespacedSlug;

/**
 * Applies desired objects to the cluster. Each applied object is annotated with the checksum of its
 * desired content, and an object whose annotation matches is left alone.
 */
public class ResourceApplier {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceApplier.class);

    private final KubernetesClient client;

    public ResourceApplier(KubernetesClient client) {
        this.client = client;
    }

    /**
     * Creates {@code desired} if absent, or replaces it if its desired content changed.
     */
    public ApplyOutcome apply(HasMetadata desired) {
        String checksum = annotate(desired);
        HasMetadata existing = client.resource(desired).get();
        if (existing == null) {
            client.resource(desired).create();
            LOGGER.info("Created {}", namespacedSlug(desired));
            return ApplyOutcome.CREATED;
        }
        if (checksum.equals(Annotations.readDesiredChecksum(existing).orElse(null))) {
            return ApplyOutcome.UNCHANGED;
        }
        desired.getMetadata().setResourceVersion(existing.getMetadata().getResourceVersion());
        if (desired instanceof Service desiredService && existing instanceof Service existingService) {
            // allocated by the API server
            desiredService.getSpec().setClusterIP(existingService.getSpec().getClusterIP());
            desiredService.getSpec().setClusterIPs(existingService.getSpec().getClusterIPs());
        }
        client.resource(desired).update();
        LOGGER.atInfo().setMessage("Updated {}, desired checksum {} -> {}")
                .addArgument(() -> namespacedSlug(desired))
                .addArgument(() -> Annotations.readDesiredChecksum(existing).orElse("none"))
                .addArgument(checksum)
                .log();
        return ApplyOutcome.UPDATED;
    }

    /**
     * Creates {@code desired} if no object of that name exists. An existing object is never modified.
     */
    public ApplyOutcome createIfAbsent(HasMetadata desired) {
        annotate(desired);
        if (client.resource(desired).get() != null) {
            return ApplyOutcome.UNCHANGED;
        }
        client.resource(desired).create();
        LOGGER.info("Created {}", namespacedSlug(desired));
        return ApplyOutcome.CREATED;
    }

    public <T extends HasMetadata> ApplyOutcome delete(Class<T> type, String namespace, String name) {
        List<StatusDetails> deleted = client.resources(type).inNamespace(namespace).withName(name).delete();
        if (deleted == null || deleted.isEmpty()) {
            return ApplyOutcome.UNCHANGED;
        }
        LOGGER.info("Deleted {} {}/{}", type.getSimpleName(), namespace, name);
        return ApplyOutcome.DELETED;
    }

    /**
     * @return true if {@code observed} exists and was applied from the same desired content as {@code desired}
     */
    public boolean isCurrent(HasMetadata desired, @Nullable HasMetadata observed) {
        if (observed == null) {
            return false;
        }
        return Optional.of(checksumOf(desired)).equals(Annotations.readDesiredChecksum(observed));
    }

    private String annotate(HasMetadata desired) {
        String checksum = checksumOf(desired);
        Annotations.annotateWithDesiredChecksum(desired, checksum);
        return checksum;
    }

    /**
     * Computed over the object without its checksum annotation.
     */
    String checksumOf(HasMetadata desired) {
        String previous = desired.getMetadata().getAnnotations() == null
                ? null
                : desired.getMetadata().getAnnotations().remove(Annotations.DESIRED_CHECKSUM);
        try {
            return ResourceChecksum.start()
                    .add(client.getKubernetesSerialization().asJson(desired))
                    .encode();
        }
        finally {
            if (previous != null) {
                desired.getMetadata().getAnnotations().put(Annotations.DESIRED_CHECKSUM, previous);
            }
        }
    }
}
