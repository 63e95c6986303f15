/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;

import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.GitCredentials;
import org.bemade.odoo.kubernetes.operator.checksum.ResourceChecksum;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec.AddonSource;

/**
 * The {@code addon-sync} init container, which clones the instance's addon repositories into the
 * shared addons volume. Git credentials are mounted into this container only.
 */
public final class AddonSync {

    public static final String CONTAINER_NAME = "addon-sync";
    public static final String REPOSITORIES_ENV = "ADDON_REPOSITORIES";
    static final String CREDENTIALS_ROOT = "/etc/git-credentials";
    static final String SCRIPT_MOUNT_PATH = "/opt/addon-sync";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AddonSync() {
    }

    /**
     * @return the init container, which needs {@link #volumes(DesiredSpec)} in the pod
     */
    public static Container initContainer(DesiredSpec spec, OperatorConfig config) {
        List<EnvVar> env = new ArrayList<>();
        env.add(new EnvVar(REPOSITORIES_ENV, repositoriesJson(spec), null));
        env.add(new EnvVar("ADDONS_DIR", OdooDeployment.ADDONS_MOUNT_PATH, null));
        env.add(new EnvVar("ADDON_SYNC_TIMEOUT_SECONDS", Integer.toString(config.addonSyncTimeoutSeconds()), null));
        List<VolumeMount> mounts = new ArrayList<>();
        mounts.add(new VolumeMountBuilder().withName(OdooDeployment.ADDONS_VOLUME).withMountPath(OdooDeployment.ADDONS_MOUNT_PATH).build());
        mounts.add(new VolumeMountBuilder().withName(OdooDeployment.CONFIG_VOLUME).withMountPath(SCRIPT_MOUNT_PATH).withReadOnly(true).build());

        List<AddonSource> addons = spec.addons();
        for (int index = 0; index < addons.size(); index++) {
            AddonSource addon = addons.get(index);
            if (!addon.hasCredentials()) {
                continue;
            }
            if (addon.credentialsType() == GitCredentials.Type.SSH) {
                mounts.add(new VolumeMountBuilder()
                        .withName(credentialsVolumeName(index))
                        .withMountPath(CREDENTIALS_ROOT + "/" + addon.name())
                        .withReadOnly(true)
                        .build());
            }
            else {
                env.add(secretEnv(usernameEnv(index), addon.credentialsSecret(), GitCredentials.USERNAME));
                env.add(secretEnv(passwordEnv(index), addon.credentialsSecret(), GitCredentials.PASSWORD));
            }
        }
        // @formatter:off
        return new ContainerBuilder()
                .withName(CONTAINER_NAME)
                .withImage(config.addonSyncImage())
                .withCommand("/bin/sh", SCRIPT_MOUNT_PATH + "/" + OdooConfigMap.ADDON_SYNC_SCRIPT_KEY)
                .withEnv(env)
                .withVolumeMounts(mounts)
                .withNewSecurityContext()
                    .withAllowPrivilegeEscalation(false)
                .endSecurityContext()
                .build();
        // @formatter:on
    }

    /**
     * @return the secret volumes holding SSH keys
     */
    public static List<Volume> volumes(DesiredSpec spec) {
        List<Volume> volumes = new ArrayList<>();
        List<AddonSource> addons = spec.addons();
        for (int index = 0; index < addons.size(); index++) {
            AddonSource addon = addons.get(index);
            if (addon.hasCredentials() && addon.credentialsType() == GitCredentials.Type.SSH) {
                // @formatter:off
                volumes.add(new VolumeBuilder()
                        .withName(credentialsVolumeName(index))
                        .withNewSecret()
                            .withSecretName(addon.credentialsSecret())
                            .withDefaultMode(0400)
                        .endSecret()
                        .build());
                // @formatter:on
            }
        }
        return volumes;
    }

    /**
     * A checksum of the addon list, so that any change to it restarts the pods.
     */
    public static String checksum(DesiredSpec spec) {
        ResourceChecksum checksum = ResourceChecksum.start();
        for (AddonSource addon : spec.addons()) {
            checksum.addAll(Arrays.asList(
                    addon.name(),
                    addon.repository(),
                    String.valueOf(addon.branch()),
                    String.valueOf(addon.commit()),
                    String.valueOf(addon.credentialsType()),
                    String.valueOf(addon.credentialsSecret())));
        }
        return checksum.encode();
    }

    static String repositoriesJson(DesiredSpec spec) {
        ArrayNode repositories = MAPPER.createArrayNode();
        List<AddonSource> addons = spec.addons();
        for (int index = 0; index < addons.size(); index++) {
            AddonSource addon = addons.get(index);
            ObjectNode repository = repositories.addObject()
                    .put("name", addon.name())
                    .put("url", addon.repository())
                    .put("branch", addon.branch())
                    .put("commit", addon.commit());
            if (addon.hasCredentials()) {
                ObjectNode credentials = repository.putObject("credentials")
                        .put("type", addon.credentialsType().getValue());
                if (addon.credentialsType() == GitCredentials.Type.SSH) {
                    credentials.put("keyPath", CREDENTIALS_ROOT + "/" + addon.name() + "/" + GitCredentials.SSH_PRIVATE_KEY);
                }
                else {
                    credentials.put("usernameEnv", usernameEnv(index))
                            .put("passwordEnv", passwordEnv(index));
                }
            }
        }
        try {
            return MAPPER.writeValueAsString(repositories);
        }
        catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize addon repositories", e);
        }
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

    static String credentialsVolumeName(int index) {
        return "git-credentials-" + index;
    }

    private static String usernameEnv(int index) {
        return "GIT_USERNAME_" + index;
    }

    private static String passwordEnv(int index) {
        return "GIT_PASSWORD_" + index;
    }
}
