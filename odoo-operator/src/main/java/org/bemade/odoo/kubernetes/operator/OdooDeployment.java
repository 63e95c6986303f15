/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpecBuilder;
import io.fabric8.kubernetes.api.model.Probe;
import io.fabric8.kubernetes.api.model.ProbeBuilder;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.AdminCredentials;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * The {@code odoo-{name}} Deployment running the Odoo server.
 */
public final class OdooDeployment {

    public static final String CONTAINER_NAME = "odoo";
    public static final int HTTP_PORT = 8069;
    public static final int LONGPOLLING_PORT = 8072;
    public static final String HTTP_PORT_NAME = "http";
    public static final String LONGPOLLING_PORT_NAME = "longpolling";
    public static final String HEALTH_PATH = "/web/health";

    static final String FILESTORE_VOLUME = "filestore";
    static final String CONFIG_VOLUME = "config";
    static final String ADDONS_VOLUME = "odoo-addons";
    static final String FILESTORE_MOUNT_PATH = "/var/lib/odoo";
    static final String CONFIG_MOUNT_PATH = "/etc/odoo";
    public static final String CONFIG_FILE = CONFIG_MOUNT_PATH + "/" + OdooConfigMap.ODOO_CONF_KEY;
    static final String ADDONS_MOUNT_PATH = "/mnt/extra-addons";
    static final String COMPONENT = "server";

    private OdooDeployment() {
    }

    /**
     * @param databaseName the instance's role and database
     */
    public static Deployment desired(OdooInstance instance, DesiredSpec spec, OperatorConfig config, String databaseName) {
        // @formatter:off
        return new DeploymentBuilder()
                .withNewMetadata()
                    .withName(ResourceNames.workload(instance))
                    .withNamespace(namespace(instance))
                    .addToLabels(Labels.standardLabels(instance, COMPONENT))
                    .addNewOwnerReferenceLike(ResourcesUtil.newOwnerReferenceTo(instance)).endOwnerReference()
                .endMetadata()
                .withNewSpec()
                    .withReplicas(spec.replicas())
                    .withNewSelector()
                        .withMatchLabels(Labels.podSelector(instance))
                    .endSelector()
                    // the filestore claim is ReadWriteOnce
                    .withNewStrategy()
                        .withType("Recreate")
                    .endStrategy()
                    .withTemplate(podTemplate(instance, spec, config))
                .endSpec()
                .build();
        // @formatter:on
    }

    private static PodTemplateSpec podTemplate(OdooInstance instance, DesiredSpec spec, OperatorConfig config) {
        Map<String, String> annotations = new LinkedHashMap<>();
        if (!spec.addons().isEmpty()) {
            annotations.put(Annotations.ADDON_CHECKSUM, AddonSync.checksum(spec));
        }
        if (spec.restartedAt() != null) {
            annotations.put(Annotations.RESTARTED_AT, spec.restartedAt());
        }
        // @formatter:off
        return new PodTemplateSpecBuilder()
                .withNewMetadata()
                    .addToLabels(Labels.standardLabels(instance, COMPONENT))
                    .addToAnnotations(annotations)
                .endMetadata()
                .withNewSpec()
                    .withInitContainers(AddonSync.initContainer(spec, config))
                    .withContainers(odooContainer(instance, spec))
                    .addNewVolume()
                        .withName(FILESTORE_VOLUME)
                        .withNewPersistentVolumeClaim()
                            .withClaimName(ResourceNames.filestoreClaim(instance))
                        .endPersistentVolumeClaim()
                    .endVolume()
                    .addNewVolume()
                        .withName(CONFIG_VOLUME)
                        .withNewConfigMap()
                            .withName(ResourceNames.configMap(instance))
                        .endConfigMap()
                    .endVolume()
                    .addNewVolume()
                        .withName(ADDONS_VOLUME)
                        .withNewEmptyDir()
                        .endEmptyDir()
                    .endVolume()
                    .addAllToVolumes(AddonSync.volumes(spec))
                .endSpec()
                .build();
        // @formatter:on
    }

    private static Container odooContainer(OdooInstance instance, DesiredSpec spec) {
        // @formatter:off
        return new ContainerBuilder()
                .withName(CONTAINER_NAME)
                .withImage(spec.image())
                .addNewPort()
                    .withName(HTTP_PORT_NAME)
                    .withContainerPort(HTTP_PORT)
                .endPort()
                .addNewPort()
                    .withName(LONGPOLLING_PORT_NAME)
                    .withContainerPort(LONGPOLLING_PORT)
                .endPort()
                .withEnv(env(instance, spec))
                .withResources(spec.resources())
                .addNewVolumeMount()
                    .withName(FILESTORE_VOLUME)
                    .withMountPath(FILESTORE_MOUNT_PATH)
                .endVolumeMount()
                .addNewVolumeMount()
                    .withName(CONFIG_VOLUME)
                    .withMountPath(CONFIG_MOUNT_PATH)
                    .withReadOnly(true)
                .endVolumeMount()
                .addNewVolumeMount()
                    .withName(ADDONS_VOLUME)
                    .withMountPath(ADDONS_MOUNT_PATH)
                .endVolumeMount()
                .withLivenessProbe(healthProbe(60, 6))
                .withReadinessProbe(healthProbe(30, 3))
                .withTerminationMessagePolicy("FallbackToLogsOnError")
                .build();
        // @formatter:on
    }

    private static Probe healthProbe(int initialDelaySeconds, int failureThreshold) {
        // @formatter:off
        return new ProbeBuilder()
                .withNewHttpGet()
                    .withPath(HEALTH_PATH)
                    .withPort(new IntOrString(HTTP_PORT_NAME))
                .endHttpGet()
                .withInitialDelaySeconds(initialDelaySeconds)
                .withPeriodSeconds(10)
                .withTimeoutSeconds(5)
                .withFailureThreshold(failureThreshold)
                .build();
        // @formatter:on
    }

    private static List<EnvVar> env(OdooInstance instance, DesiredSpec spec) {
        String credentials = ResourceNames.databaseCredentialsSecret(instance);
        List<EnvVar> env = new ArrayList<>();
        env.add(secretEnv("ODOO_DB_HOST", credentials, DatabaseCredentialsSecret.HOST_KEY));
        env.add(secretEnv("ODOO_DB_PORT", credentials, DatabaseCredentialsSecret.PORT_KEY));
        env.add(secretEnv("ODOO_DB_USER", credentials, DatabaseCredentialsSecret.USERNAME_KEY));
        env.add(secretEnv("ODOO_DB_PASSWORD", credentials, DatabaseCredentialsSecret.PASSWORD_KEY));
        env.add(secretEnv("ODOO_DB_NAME", credentials, DatabaseCredentialsSecret.DATABASE_KEY));
        if (spec.adminCredentials() != null) {
            env.add(secretEnv("ODOO_ADMIN_PASSWORD", spec.adminCredentials().secretName(), spec.adminCredentials().key()));
        }
        else {
            env.add(secretEnv("ODOO_ADMIN_PASSWORD", ResourceNames.generatedAdminSecret(instance), AdminCredentials.DEFAULT_KEY));
        }
        env.addAll(spec.env());
        return env;
    }

    private static EnvVar secretEnv(String name, String secretName, String key) {
        // @formatter:off
        return new EnvVarBuilder()
                .withName(name)
                .withNewValueFrom()
                    .withNewSecretKeyRef()
                        .withName(secretName)
                        .withKey(key)
                    .endSecretKeyRef()
                .endValueFrom()
                .build();
        // @formatter:on
    }
}
