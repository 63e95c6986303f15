/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimSpec;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.VolumeResourceRequirements;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.OdooInstanceSpec;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.Addon;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.Filestore;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.IngressSpec;
import org.bemade.odoo.kubernetes.operator.InvalidResourceException;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Checks the spec of an {@link OdooInstance} before anything is created for it.
 * All violations are reported together.
 */
public class OdooInstanceValidator {

    static final Pattern MEMORY_QUANTITY = Pattern.compile("^\\d+[KMGTPEkmgtpe]i?$");
    static final Pattern CPU_QUANTITY = Pattern.compile("^\\d+m?$");

    /**
     * @param instance the instance
     * @param existingClaim the instance's filestore claim, if it has been created
     * @throws InvalidResourceException listing every violation
     */
    public void validate(OdooInstance instance, @Nullable PersistentVolumeClaim existingClaim) {
        List<String> violations = new ArrayList<>();
        OdooInstanceSpec spec = instance.getSpec();
        if (spec == null) {
            throw new InvalidResourceException("spec is required");
        }
        if (spec.getImage() == null || spec.getImage().isBlank()) {
            violations.add("spec.image must not be blank");
        }
        if (spec.getReplicas() != null && spec.getReplicas() < 0) {
            violations.add("spec.replicas must not be negative, got " + spec.getReplicas());
        }
        validateResources(spec.getResources(), violations);
        validateFilestore(spec.getFilestore(), existingClaim, violations);
        validateIngress(spec.getIngress(), violations);
        validateAddons(spec.getAddons(), violations);
        if (spec.getAdminCredentials() != null
                && (spec.getAdminCredentials().getSecretName() == null || spec.getAdminCredentials().getSecretName().isBlank())) {
            violations.add("spec.adminCredentials.secretName must not be blank");
        }
        if (!violations.isEmpty()) {
            throw new InvalidResourceException(String.join("; ", violations));
        }
    }

    /**
     * Checks what an update may not change, before the update is stored.
     *
     * @param previous the instance as stored
     * @param updated the instance as submitted
     * @throws InvalidResourceException if the update changes the filestore size
     */
    public void validateUpdate(OdooInstance previous, OdooInstance updated) {
        String before = filestoreSize(filestore(previous));
        String after = filestoreSize(filestore(updated));
        if (MEMORY_QUANTITY.matcher(before).matches() && MEMORY_QUANTITY.matcher(after).matches()
                && !new Quantity(before).equals(new Quantity(after))) {
            throw new InvalidResourceException("spec.filestore.size cannot change once the instance exists (was " + before
                    + ", requested " + after + "); resize the claim explicitly");
        }
    }

    @Nullable
    private static Filestore filestore(OdooInstance instance) {
        return Optional.ofNullable(instance.getSpec()).map(OdooInstanceSpec::getFilestore).orElse(null);
    }

    private static String filestoreSize(@Nullable Filestore filestore) {
        return Optional.ofNullable(filestore)
                .map(Filestore::getSize)
                .filter(s -> !s.isBlank())
                .orElse(Filestore.DEFAULT_SIZE);
    }

    private static void validateResources(@Nullable ResourceRequirements resources, List<String> violations) {
        if (resources == null) {
            return;
        }
        validateQuantities("spec.resources.limits", resources.getLimits(), violations);
        validateQuantities("spec.resources.requests", resources.getRequests(), violations);
    }

    private static void validateQuantities(String path, @Nullable Map<String, Quantity> quantities, List<String> violations) {
        if (quantities == null) {
            return;
        }
        quantities.forEach((name, quantity) -> {
            String value = quantity == null ? "" : quantity.toString();
            if ("memory".equals(name) && !MEMORY_QUANTITY.matcher(value).matches()) {
                violations.add(path + ".memory is not a valid memory quantity: '" + value + "'");
            }
            else if ("cpu".equals(name) && !CPU_QUANTITY.matcher(value).matches()) {
                violations.add(path + ".cpu is not a valid cpu quantity: '" + value + "'");
            }
        });
    }

    private static void validateFilestore(@Nullable Filestore filestore, @Nullable PersistentVolumeClaim existingClaim, List<String> violations) {
        String size = filestoreSize(filestore);
        if (!MEMORY_QUANTITY.matcher(size).matches()) {
            violations.add("spec.filestore.size is not a valid quantity: '" + size + "'");
            return;
        }
        provisionedSize(existingClaim).ifPresent(provisioned -> {
            if (!new Quantity(size).equals(provisioned)) {
                violations.add("spec.filestore.size cannot change once the filestore exists (provisioned " + provisioned
                        + ", requested " + size + "); resize the claim explicitly");
            }
        });
    }

    private static Optional<Quantity> provisionedSize(@Nullable PersistentVolumeClaim claim) {
        return Optional.ofNullable(claim)
                .map(PersistentVolumeClaim::getSpec)
                .map(PersistentVolumeClaimSpec::getResources)
                .map(VolumeResourceRequirements::getRequests)
                .map(requests -> requests.get("storage"));
    }

    private static void validateIngress(@Nullable IngressSpec ingress, List<String> violations) {
        if (ingress == null) {
            return;
        }
        String hostname = ingress.getHostname();
        if (hostname == null || !ResourcesUtil.isDnsSubdomain(hostname)) {
            violations.add("spec.ingress.hostname must be a valid DNS name, got '" + hostname + "'");
        }
        if (ingress.getTlsSecretName() != null && !ingress.getTlsSecretName().isBlank()
                && !ResourcesUtil.isDnsSubdomain(ingress.getTlsSecretName())) {
            violations.add("spec.ingress.tlsSecretName is not a valid secret name: '" + ingress.getTlsSecretName() + "'");
        }
    }

    private static void validateAddons(@Nullable List<Addon> addons, List<String> violations) {
        if (addons == null) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < addons.size(); i++) {
            Addon addon = addons.get(i);
            String path = "spec.addons[" + i + "]";
            if (addon.getName() == null || !ResourcesUtil.isDnsLabel(addon.getName(), false)) {
                violations.add(path + ".name must be a DNS label, got '" + addon.getName() + "'");
            }
            else if (!seen.add(addon.getName())) {
                violations.add(path + ".name '" + addon.getName() + "' is used by more than one addon");
            }
            if (addon.getRepository() == null || addon.getRepository().isBlank()) {
                violations.add(path + ".repository must not be blank");
            }
            if (addon.getCredentials() != null) {
                String secretName = addon.getCredentials().getSecretName();
                if (secretName == null || !ResourcesUtil.isDnsSubdomain(secretName)) {
                    violations.add(path + ".credentials.secretName is not a valid secret name: '" + secretName + "'");
                }
            }
        }
    }
}
