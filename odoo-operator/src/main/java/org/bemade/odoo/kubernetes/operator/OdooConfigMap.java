/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;
import org.bemade.odoo.kubernetes.operator.model.DesiredSpec;

import static org.bemade.odoo.kubernetes.operator.ResourcesUtil.namespace;

/**
 * The {@code odoo-config-{name}} ConfigMap. It holds {@code odoo.conf} and the addon-sync script.
 * Passwords are never written here, the workload reads them from its environment.
 */
public final class OdooConfigMap {

    public static final String ODOO_CONF_KEY = "odoo.conf";
    public static final String ADDON_SYNC_SCRIPT_KEY = "pull-git-repos.sh";
    static final String COMPONENT = "config";
    private static final String ADDON_SYNC_SCRIPT = loadScript("/addon-sync/" + ADDON_SYNC_SCRIPT_KEY);

    private OdooConfigMap() {
    }

    public static ConfigMap desired(OdooInstance instance, DesiredSpec spec, OperatorConfig config, String databaseName) {
        // @formatter:off
        return new ConfigMapBuilder()
                .withNewMetadata()
                    .withName(ResourceNames.configMap(instance))
                    .withNamespace(namespace(instance))
                    .addToLabels(Labels.standardLabels(instance, COMPONENT))
                    .addNewOwnerReferenceLike(ResourcesUtil.newOwnerReferenceTo(instance)).endOwnerReference()
                .endMetadata()
                .addToData(ODOO_CONF_KEY, odooConf(spec, config, databaseName))
                .addToData(ADDON_SYNC_SCRIPT_KEY, ADDON_SYNC_SCRIPT)
                .build();
        // @formatter:on
    }

    static String odooConf(DesiredSpec spec, OperatorConfig config, String databaseName) {
        StringBuilder conf = new StringBuilder("[options]\n");
        appendOption(conf, "db_host", config.dbHost());
        appendOption(conf, "db_port", Integer.toString(config.dbPort()));
        appendOption(conf, "db_user", databaseName);
        appendOption(conf, "db_name", databaseName);
        appendOption(conf, "dbfilter", "^" + databaseName + "$");
        appendOption(conf, "list_db", "False");
        if (spec.ingress() != null) {
            appendOption(conf, "proxy_mode", "True");
        }
        appendOption(conf, "addons_path", addonsPath(spec));
        appendOption(conf, "data_dir", OdooDeployment.FILESTORE_MOUNT_PATH);
        return conf.toString();
    }

    private static String addonsPath(DesiredSpec spec) {
        if (spec.addons().isEmpty()) {
            return OdooDeployment.ADDONS_MOUNT_PATH;
        }
        return spec.addons().stream()
                .map(addon -> OdooDeployment.ADDONS_MOUNT_PATH + "/" + addon.name())
                .collect(Collectors.joining(",", OdooDeployment.ADDONS_MOUNT_PATH + ",", ""));
    }

    private static void appendOption(StringBuilder conf, String key, String value) {
        conf.append(key).append(" = ").append(value).append('\n');
    }

    private static String loadScript(String resource) {
        try (InputStream is = OdooConfigMap.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Failed to find %s on classpath".formatted(resource));
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
