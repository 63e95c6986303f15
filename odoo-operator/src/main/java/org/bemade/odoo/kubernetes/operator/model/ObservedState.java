/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.model;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentStatus;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.client.KubernetesClient;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.Labels;
import org.bemade.odoo.kubernetes.operator.ResourceNames;
import org.bemade.odoo.kubernetes.operator.ResourcesUtil;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * What exists in the cluster for one instance. Absent objects are null.
 */
public record ObservedState(@Nullable Deployment deployment,
                            @Nullable Service service,
                            @Nullable Ingress ingress,
                            @Nullable PersistentVolumeClaim filestoreClaim,
                            @Nullable ConfigMap configMap,
                            @Nullable Secret databaseCredentials,
                            @Nullable Secret generatedAdminSecret,
                            List<Pod> pods) {

    public ObservedState {
        pods = List.copyOf(pods);
    }

    public static ObservedState read(KubernetesClient client, OdooInstance instance) {
        String namespace = ResourcesUtil.namespace(instance);
        return new ObservedState(
                client.apps().deployments().inNamespace(namespace).withName(ResourceNames.workload(instance)).get(),
                client.services().inNamespace(namespace).withName(ResourceNames.workload(instance)).get(),
                client.network().v1().ingresses().inNamespace(namespace).withName(ResourceNames.workload(instance)).get(),
                client.persistentVolumeClaims().inNamespace(namespace).withName(ResourceNames.filestoreClaim(instance)).get(),
                client.configMaps().inNamespace(namespace).withName(ResourceNames.configMap(instance)).get(),
                client.secrets().inNamespace(namespace).withName(ResourceNames.databaseCredentialsSecret(instance)).get(),
                client.secrets().inNamespace(namespace).withName(ResourceNames.generatedAdminSecret(instance)).get(),
                client.pods().inNamespace(namespace).withLabels(Labels.podSelector(instance)).list().getItems());
    }

    /**
     * @return the observed object with the same kind and name as {@code desired}, if any
     */
    public Optional<HasMetadata> counterpartOf(HasMetadata desired) {
        String name = ResourcesUtil.name(desired);
        return Optional.<HasMetadata>ofNullable(switch (desired.getKind()) {
            case "Deployment" -> deployment;
            case "Service" -> service;
            case "Ingress" -> ingress;
            case "PersistentVolumeClaim" -> filestoreClaim;
            case "ConfigMap" -> configMap;
            case "Secret" -> databaseCredentials != null && name.equals(ResourcesUtil.name(databaseCredentials))
                    ? databaseCredentials
                    : generatedAdminSecret;
            default -> null;
        }).filter(observed -> name.equals(ResourcesUtil.name(observed)));
    }

    public int readyReplicas() {
        return Optional.ofNullable(deployment)
                .map(Deployment::getStatus)
                .map(DeploymentStatus::getReadyReplicas)
                .orElse(0);
    }

    /**
     * @return a pod of the instance that is running and not being deleted
     */
    public Optional<Pod> runningPod() {
        return pods.stream()
                .filter(pod -> pod.getMetadata().getDeletionTimestamp() == null)
                .filter(pod -> "Running".equals(Optional.ofNullable(pod.getStatus()).map(PodStatus::getPhase).orElse(null)))
                .findFirst();
    }
}
