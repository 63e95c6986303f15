/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceSpec;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.Addon;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.AdminCredentials;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.Filestore;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.GitCredentials;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.IngressSpec;
import org.bemade.odoo.kubernetes.operator.Annotations;
import org.bemade.odoo.kubernetes.operator.ResourceNames;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The spec of an {@link OdooInstance} with every default applied.
 * Two instances that deploy the same thing normalise to equal values.
 *
 * @param image Odoo image
 * @param replicas pod count
 * @param adminCredentials user supplied admin secret, or null when the operator generates one
 * @param resources container resources
 * @param filestore filestore claim settings
 * @param ingress ingress settings, or null when the instance is not exposed
 * @param addons git repositories to fetch, in declaration order
 * @param env extra container environment
 * @param restartedAt restart token copied into the pod template
 */
public record DesiredSpec(String image,
                          int replicas,
                          @Nullable AdminCredentialsRef adminCredentials,
                          ResourceRequirements resources,
                          FilestoreSettings filestore,
                          @Nullable IngressSettings ingress,
                          List<AddonSource> addons,
                          List<EnvVar> env,
                          @Nullable String restartedAt) {

    public static final String DEFAULT_MEMORY_LIMIT = "512Mi";
    public static final String DEFAULT_CPU_LIMIT = "500m";
    public static final String DEFAULT_MEMORY_REQUEST = "256Mi";
    public static final String DEFAULT_CPU_REQUEST = "250m";

    public record AdminCredentialsRef(String secretName, String key) {}

    public record FilestoreSettings(String size, @Nullable String storageClassName) {}

    /**
     * @param tlsSecretName secret holding the certificate, null when TLS is off
     */
    public record IngressSettings(String hostname, boolean tls, String className, Map<String, String> annotations, @Nullable String tlsSecretName) {

        public String url() {
            return (tls ? "https://" : "http://") + hostname;
        }
    }

    public record AddonSource(String name,
                              String repository,
                              @Nullable String branch,
                              @Nullable String commit,
                              @Nullable GitCredentials.Type credentialsType,
                              @Nullable String credentialsSecret) {

        public boolean hasCredentials() {
            return credentialsSecret != null && credentialsType != null;
        }
    }

    /**
     * Normalises the spec of a validated instance.
     *
     * @param instance the instance
     * @param defaultStorageClass storage class used when the filestore does not name one
     * @return the normalised spec
     */
    public static DesiredSpec from(OdooInstance instance, @Nullable String defaultStorageClass) {
        OdooInstanceSpec spec = instance.getSpec();
        return new DesiredSpec(
                spec.getImage().strip(),
                Optional.ofNullable(spec.getReplicas()).orElse(1),
                adminCredentials(spec.getAdminCredentials()),
                resources(spec.getResources()),
                filestore(spec.getFilestore(), defaultStorageClass),
                ingress(instance, spec.getIngress()),
                Optional.ofNullable(spec.getAddons()).orElse(List.of()).stream().map(DesiredSpec::addon).toList(),
                Optional.ofNullable(spec.getEnv()).map(List::copyOf).orElse(List.of()),
                Annotations.readRestartedAt(instance).orElse(null));
    }

    @Nullable
    private static AdminCredentialsRef adminCredentials(@Nullable AdminCredentials credentials) {
        if (credentials == null || credentials.getSecretName() == null || credentials.getSecretName().isBlank()) {
            return null;
        }
        String key = Optional.ofNullable(credentials.getKey()).filter(k -> !k.isBlank()).orElse(AdminCredentials.DEFAULT_KEY);
        return new AdminCredentialsRef(credentials.getSecretName(), key);
    }

    /**
     * @return the limits and requests of an instance that sets no resources
     */
    public static ResourceRequirements defaultResources() {
        return resources(null);
    }

    private static ResourceRequirements resources(@Nullable ResourceRequirements requested) {
        Map<String, Quantity> limits = new TreeMap<>();
        Map<String, Quantity> requests = new TreeMap<>();
        if (requested != null && requested.getLimits() != null && !requested.getLimits().isEmpty()) {
            limits.putAll(requested.getLimits());
        }
        else {
            limits.put("cpu", new Quantity(DEFAULT_CPU_LIMIT));
            limits.put("memory", new Quantity(DEFAULT_MEMORY_LIMIT));
        }
        if (requested != null && requested.getRequests() != null && !requested.getRequests().isEmpty()) {
            requests.putAll(requested.getRequests());
        }
        else {
            requests.put("cpu", new Quantity(DEFAULT_CPU_REQUEST));
            requests.put("memory", new Quantity(DEFAULT_MEMORY_REQUEST));
        }
        return new ResourceRequirementsBuilder()
                .withLimits(limits)
                .withRequests(requests)
                .build();
    }

    private static FilestoreSettings filestore(@Nullable Filestore filestore, @Nullable String defaultStorageClass) {
        String size = Optional.ofNullable(filestore).map(Filestore::getSize).filter(s -> !s.isBlank()).orElse(Filestore.DEFAULT_SIZE);
        String storageClass = Optional.ofNullable(filestore).map(Filestore::getStorageClassName).filter(s -> !s.isBlank()).orElse(defaultStorageClass);
        return new FilestoreSettings(size, storageClass);
    }

    @Nullable
    private static IngressSettings ingress(OdooInstance instance, @Nullable IngressSpec ingress) {
        if (ingress == null) {
            return null;
        }
        boolean tls = Optional.ofNullable(ingress.getTls()).orElse(true);
        String className = Optional.ofNullable(ingress.getClassName()).filter(c -> !c.isBlank()).orElse(IngressSpec.DEFAULT_CLASS_NAME);
        String tlsSecretName = tls
                ? Optional.ofNullable(ingress.getTlsSecretName()).filter(s -> !s.isBlank()).orElse(ResourceNames.defaultTlsSecret(instance))
                : null;
        Map<String, String> annotations = new TreeMap<>(Optional.ofNullable(ingress.getAnnotations()).orElse(Map.of()));
        return new IngressSettings(ingress.getHostname(), tls, className, annotations, tlsSecretName);
    }

    private static AddonSource addon(Addon addon) {
        GitCredentials credentials = addon.getCredentials();
        return new AddonSource(
                addon.getName(),
                addon.getRepository(),
                blankToNull(addon.getBranch()),
                blankToNull(addon.getCommit()),
                credentials == null ? null : Optional.ofNullable(credentials.getType()).orElse(GitCredentials.Type.SSH),
                credentials == null ? null : credentials.getSecretName());
    }

    @Nullable
    private static String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
