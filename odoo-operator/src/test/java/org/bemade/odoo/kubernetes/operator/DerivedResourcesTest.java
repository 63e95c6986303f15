/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.AddonBuilder;
import org.bemade.odoo.kubernetes.api.v1.odooinstancespec.GitCredentials;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;

import static org.bemade.odoo.kubernetes.operator.OperatorTestUtils.minimalInstance;
import static org.bemade.odoo.kubernetes.operator.assertj.OperatorAssertions.assertThat;
import static org.assertj.core.api.Assertions.assertThat;

class DerivedResourcesTest {

    private static final String DATABASE = "shop-odoo-demo";

    private final OperatorConfig config = OperatorTestUtils.config();

    @Test
    void deploymentRunsOdooWithFilestoreAndConfig() {
        // Given
        OdooInstance instance = minimalInstance("demo");
        DesiredSpec spec = DesiredSpec.from(instance, null);

        // When
        Deployment deployment = OdooDeployment.desired(instance, spec, config, DATABASE);

        // Then
        assertThat(deployment.getMetadata().getName()).isEqualTo("odoo-demo");
        assertThat(deployment).hasLabels(Labels.standardLabels(instance, "server"));
        assertThat(deployment.getMetadata().getOwnerReferences()).singleElement()
                .satisfies(ref -> {
                    assertThat(ref.getKind()).isEqualTo("OdooInstance");
                    assertThat(ref.getName()).isEqualTo("demo");
                    assertThat(ref.getUid()).isEqualTo("demo-uid");
                });
        assertThat(deployment.getSpec().getReplicas()).isEqualTo(1);
        assertThat(deployment.getSpec().getStrategy().getType()).isEqualTo("Recreate");
        Container odoo = deployment.getSpec().getTemplate().getSpec().getContainers().get(0);
        assertThat(odoo.getName()).isEqualTo("odoo");
        assertThat(odoo.getImage()).isEqualTo("odoo:17.0");
        assertThat(odoo.getPorts()).extracting(p -> p.getContainerPort()).containsExactly(8069, 8072);
        assertThat(odoo.getReadinessProbe().getHttpGet().getPath()).isEqualTo("/web/health");
        assertThat(odoo.getEnv()).extracting(EnvVar::getName)
                .containsExactly("ODOO_DB_HOST", "ODOO_DB_PORT", "ODOO_DB_USER", "ODOO_DB_PASSWORD", "ODOO_DB_NAME", "ODOO_ADMIN_PASSWORD");
        assertThat(odoo.getEnv().get(5).getValueFrom().getSecretKeyRef().getName()).isEqualTo("odoo-admin-demo");
        assertThat(deployment.getSpec().getTemplate().getSpec().getVolumes()).extracting(Volume::getName)
                .containsExactly("filestore", "config", "odoo-addons");
        assertThat(deployment.getSpec().getTemplate().getSpec().getVolumes().get(0).getPersistentVolumeClaim().getClaimName())
                .isEqualTo("odoo-filestore-demo");
    }

    @Test
    void suppliedAdminSecretIsReferenced() {
        // Given
        OdooInstance instance = minimalInstance("demo").edit()
                .editSpec().withNewAdminCredentials().withSecretName("my-admin").withKey("pw").endAdminCredentials().endSpec()
                .build();

        // When
        Deployment deployment = OdooDeployment.desired(instance, DesiredSpec.from(instance, null), config, DATABASE);

        // Then
        EnvVar admin = deployment.getSpec().getTemplate().getSpec().getContainers().get(0).getEnv().get(5);
        assertThat(admin.getValueFrom().getSecretKeyRef().getName()).isEqualTo("my-admin");
        assertThat(admin.getValueFrom().getSecretKeyRef().getKey()).isEqualTo("pw");
    }

    @Test
    void addonsAreFetchedByInitContainer() throws Exception {
        // Given
        OdooInstance instance = minimalInstance("demo").edit()
                .editSpec()
                    .withAddons(
                            new AddonBuilder().withName("oca-web").withRepository("https://github.com/OCA/web.git").withBranch("17.0").build(),
                            new AddonBuilder().withName("private").withRepository("git@github.com:acme/private.git")
                                    .withNewCredentials().withSecretName("deploy-key").withType(GitCredentials.Type.SSH).endCredentials().build(),
                            new AddonBuilder().withName("vendor").withRepository("https://git.example.com/vendor.git")
                                    .withNewCredentials().withSecretName("vendor-login").withType(GitCredentials.Type.BASIC).endCredentials().build())
                .endSpec()
                .build();
        DesiredSpec spec = DesiredSpec.from(instance, null);

        // When
        Deployment deployment = OdooDeployment.desired(instance, spec, config, DATABASE);

        // Then
        var podSpec = deployment.getSpec().getTemplate().getSpec();
        Container init = podSpec.getInitContainers().get(0);
        assertThat(init.getName()).isEqualTo(AddonSync.CONTAINER_NAME);
        assertThat(init.getImage()).isEqualTo("alpine/git:2.47.1");
        assertThat(init.getVolumeMounts()).anySatisfy(mount -> {
            assertThat(mount.getName()).isEqualTo("git-credentials-1");
            assertThat(mount.getMountPath()).isEqualTo("/etc/git-credentials/private");
        });
        assertThat(init.getEnv()).extracting(EnvVar::getName).contains("GIT_USERNAME_2", "GIT_PASSWORD_2");
        assertThat(podSpec.getVolumes()).anySatisfy(volume -> {
            assertThat(volume.getName()).isEqualTo("git-credentials-1");
            assertThat(volume.getSecret().getSecretName()).isEqualTo("deploy-key");
        });
        assertThat(deployment.getSpec().getTemplate().getMetadata().getAnnotations()).containsKey(Annotations.ADDON_CHECKSUM);

        String repositories = init.getEnv().stream()
                .filter(env -> AddonSync.REPOSITORIES_ENV.equals(env.getName()))
                .findFirst().orElseThrow().getValue();
        JsonNode json = new ObjectMapper().readTree(repositories);
        assertThat(json).hasSize(3);
        assertThat(json.get(0).get("branch").asText()).isEqualTo("17.0");
        assertThat(json.get(0).has("credentials")).isFalse();
        assertThat(json.get(1).get("credentials").get("keyPath").asText()).isEqualTo("/etc/git-credentials/private/ssh-privatekey");
        assertThat(json.get(2).get("credentials").get("usernameEnv").asText()).isEqualTo("GIT_USERNAME_2");
    }

    @Test
    void addonChecksumFollowsTheAddonList() {
        // Given
        OdooInstance one = minimalInstance("demo").edit()
                .editSpec().withAddons(new AddonBuilder().withName("a").withRepository("https://x/a.git").build()).endSpec()
                .build();
        OdooInstance other = minimalInstance("demo").edit()
                .editSpec().withAddons(new AddonBuilder().withName("a").withRepository("https://x/a.git").withCommit("abc123").build()).endSpec()
                .build();

        // When/Then
        assertThat(AddonSync.checksum(DesiredSpec.from(one, null)))
                .isEqualTo(AddonSync.checksum(DesiredSpec.from(one, null)))
                .isNotEqualTo(AddonSync.checksum(DesiredSpec.from(other, null)));
    }

    @Test
    void restartTokenIsCopiedToPodTemplate() {
        OdooInstance instance = minimalInstance("demo").edit()
                .editMetadata().addToAnnotations(Annotations.RESTARTED_AT, "2024-05-01T10:00:00Z").endMetadata()
                .build();
        Deployment deployment = OdooDeployment.desired(instance, DesiredSpec.from(instance, null), config, DATABASE);
        assertThat(deployment.getSpec().getTemplate().getMetadata().getAnnotations())
                .containsEntry(Annotations.RESTARTED_AT, "2024-05-01T10:00:00Z");
    }

    @Test
    void configMapPointsOdooAtItsDatabase() {
        // Given
        OdooInstance instance = minimalInstance("demo").edit()
                .editSpec()
                    .withNewIngress().withHostname("demo.example.com").endIngress()
                    .withAddons(new AddonBuilder().withName("oca-web").withRepository("https://github.com/OCA/web.git").build())
                .endSpec()
                .build();

        // When
        ConfigMap configMap = OdooConfigMap.desired(instance, DesiredSpec.from(instance, null), config, DATABASE);

        // Then
        assertThat(configMap.getMetadata().getName()).isEqualTo("odoo-config-demo");
        assertThat(configMap.getData()).containsKey(OdooConfigMap.ADDON_SYNC_SCRIPT_KEY);
        assertThat(configMap.getData().get(OdooConfigMap.ODOO_CONF_KEY))
                .startsWith("[options]\n")
                .contains("db_host = postgres\n")
                .contains("db_name = shop-odoo-demo\n")
                .contains("dbfilter = ^shop-odoo-demo$\n")
                .contains("list_db = False\n")
                .contains("proxy_mode = True\n")
                .contains("addons_path = /mnt/extra-addons,/mnt/extra-addons/oca-web\n");
    }

    @Test
    void serviceExposesHttpAndLongpolling() {
        OdooInstance instance = minimalInstance("demo");
        Service service = OdooService.desired(instance);
        assertThat(service.getMetadata().getName()).isEqualTo("odoo-demo");
        assertThat(service.getSpec().getSelector()).isEqualTo(Labels.podSelector(instance));
        assertThat(service.getSpec().getPorts()).extracting(p -> p.getPort()).containsExactly(8069, 8072);
    }

    @Test
    void ingressRoutesHostToService() {
        // Given
        OdooInstance instance = minimalInstance("demo").edit()
                .editSpec().withNewIngress().withHostname("demo.example.com").endIngress().endSpec()
                .build();

        // When
        Ingress ingress = OdooIngress.desired(instance, DesiredSpec.from(instance, null).ingress());

        // Then
        assertThat(ingress.getSpec().getIngressClassName()).isEqualTo("nginx");
        assertThat(ingress.getSpec().getRules()).singleElement()
                .satisfies(rule -> assertThat(rule.getHost()).isEqualTo("demo.example.com"));
        assertThat(ingress.getSpec().getTls()).singleElement()
                .satisfies(tls -> assertThat(tls.getSecretName()).isEqualTo("odoo-demo-tls"));
    }

    @Test
    void filestoreClaimIsNotOwnedByTheInstance() {
        // Given
        OdooInstance instance = minimalInstance("demo");

        // When
        PersistentVolumeClaim claim = FilestoreClaim.desired(instance, DesiredSpec.from(instance, "fast"));

        // Then
        assertThat(claim).hasNoOwnerRefs();
        assertThat(claim.getMetadata().getName()).isEqualTo("odoo-filestore-demo");
        assertThat(claim.getSpec().getStorageClassName()).isEqualTo("fast");
        assertThat(claim.getSpec().getResources().getRequests()).containsEntry("storage", new Quantity("10Gi"));
    }

    @Test
    void credentialsSecretCarriesConnectionDetails() {
        // When
        Secret secret = DatabaseCredentialsSecret.desired(minimalInstance("demo"), config, DATABASE, "pw");

        // Then
        assertThat(secret.getMetadata().getName()).isEqualTo("odoo-db-credentials-demo");
        assertThat(secret.getData().keySet()).containsExactly("host", "port", "username", "password", "database");
        assertThat(decode(secret.getData().get("username"))).isEqualTo(DATABASE);
        assertThat(decode(secret.getData().get("password"))).isEqualTo("pw");
    }

    @Test
    void generatedPasswordsAreDistinct() {
        List<String> passwords = List.of(Passwords.generate(), Passwords.generate());
        assertThat(passwords.get(0)).isNotEqualTo(passwords.get(1)).hasSize(16).matches("[A-Za-z0-9]+");
    }

    private static String decode(String value) {
        return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
    }
}
