/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.bemade.odoo.kubernetes.operator.dispatch.RetryPolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Operator settings, read once at startup from environment variables.
 *
 * @param bindAddress management server address, {@code host:port}
 * @param releaseName release name qualifying database role names
 * @param dbHost PostgreSQL host
 * @param dbPort PostgreSQL port
 * @param dbAdminUser PostgreSQL admin role
 * @param dbAdminPassword PostgreSQL admin password
 * @param defaultStorageClass storage class for filestores that do not name one, {@code null} for the cluster default
 * @param addonSyncImage image of the addon-sync init container
 * @param addonSyncTimeoutSeconds git fetch timeout handed to the addon-sync script
 * @param resyncInterval maximum interval between reconciliations of a resource
 * @param retryPolicy backoff applied to failed reconciliations and health checks
 * @param conflictRetryDelay delay before retrying after a conflict
 * @param dbOperationTimeout bound on each admin database statement
 * @param healthCheckTimeout bound on each workload health request
 * @param workloadExecTimeout bound on each command run inside the workload
 * @param objectStorageTimeout bound on each object storage transfer
 * @param jobTimeout overall bound on a backup or restore
 * @param jobQueuePollInterval how often a queued job checks whether its instance is free
 * @param jobWorkerThreads size of the job worker pool
 * @param workDir directory holding archives while they are staged
 * @param neutralizationPolicy how restored databases are neutralized
 * @param staleRoleSweepEnabled whether roles of deleted instances are periodically dropped
 * @param staleRoleSweepInterval interval of the stale role sweep
 * @param webhookBindAddress admission webhook server address, {@code host:port}
 * @param webhookCertPath PEM certificate chain served by the admission webhook server
 * @param webhookKeyPath PEM private key of {@code webhookCertPath}
 */
public record OperatorConfig(String bindAddress,
                             String releaseName,
                             String dbHost,
                             int dbPort,
                             String dbAdminUser,
                             String dbAdminPassword,
                             @Nullable String defaultStorageClass,
                             String addonSyncImage,
                             int addonSyncTimeoutSeconds,
                             Duration resyncInterval,
                             RetryPolicy retryPolicy,
                             Duration conflictRetryDelay,
                             Duration dbOperationTimeout,
                             Duration healthCheckTimeout,
                             Duration workloadExecTimeout,
                             Duration objectStorageTimeout,
                             Duration jobTimeout,
                             Duration jobQueuePollInterval,
                             int jobWorkerThreads,
                             Path workDir,
                             NeutralizationPolicyType neutralizationPolicy,
                             boolean staleRoleSweepEnabled,
                             Duration staleRoleSweepInterval,
                             String webhookBindAddress,
                             Path webhookCertPath,
                             Path webhookKeyPath) {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorConfig.class);

    static final String DEFAULT_DB_ADMIN_PASSWORD_FILE = "/etc/odoo-operator/db-admin/password";
    static final String DEFAULT_WEBHOOK_CERT_DIR = "/tmp/k8s-webhook-server/serving-certs";

    public enum NeutralizationPolicyType {
        SQL,
        WORKLOAD
    }

    public OperatorConfig {
        Objects.requireNonNull(bindAddress);
        Objects.requireNonNull(releaseName);
        Objects.requireNonNull(dbHost);
        Objects.requireNonNull(dbAdminUser);
        Objects.requireNonNull(dbAdminPassword);
        Objects.requireNonNull(addonSyncImage);
        Objects.requireNonNull(retryPolicy);
        Objects.requireNonNull(workDir);
        Objects.requireNonNull(neutralizationPolicy);
        Objects.requireNonNull(webhookBindAddress);
        Objects.requireNonNull(webhookCertPath);
        Objects.requireNonNull(webhookKeyPath);
    }

    /**
     * Reads the configuration from the process environment.
     *
     * @return the configuration
     * @throws OperatorConfigurationException if a variable holds an unusable value
     */
    public static OperatorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the configuration from the given variables.
     *
     * @param env environment variables
     * @return the configuration
     * @throws OperatorConfigurationException if a variable holds an unusable value
     */
    public static OperatorConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env);
        var retryPolicy = new RetryPolicy(
                duration(env, "RETRY_INITIAL_INTERVAL", Duration.ofSeconds(2)),
                decimal(env, "RETRY_MULTIPLIER", 2.0),
                duration(env, "RETRY_MAX_INTERVAL", Duration.ofMinutes(5)),
                positiveInt(env, "RETRY_MAX_ATTEMPTS", 6));
        String releaseName = string(env, "RELEASE_NAME", "odoo");
        if (!ResourcesUtil.isDnsLabel(releaseName, false)) {
            throw new OperatorConfigurationException("RELEASE_NAME must be a DNS label, got '" + releaseName + "'");
        }
        return new OperatorConfig(
                string(env, "BIND_ADDRESS", "0.0.0.0:8080"),
                releaseName,
                string(env, "DB_HOST", "postgres"),
                port(env, "DB_PORT", 5432),
                string(env, "DB_ADMIN_USER", "postgres"),
                adminPassword(env),
                optionalString(env, "DEFAULT_STORAGE_CLASS"),
                string(env, "ADDON_SYNC_IMAGE", "alpine/git:2.47.1"),
                positiveInt(env, "ADDON_SYNC_TIMEOUT_SECONDS", 300),
                duration(env, "RESYNC_INTERVAL", Duration.ofMinutes(10)),
                retryPolicy,
                duration(env, "CONFLICT_RETRY_DELAY", Duration.ofSeconds(5)),
                duration(env, "DB_OPERATION_TIMEOUT", Duration.ofSeconds(30)),
                duration(env, "HEALTH_CHECK_TIMEOUT", Duration.ofSeconds(5)),
                duration(env, "WORKLOAD_EXEC_TIMEOUT", Duration.ofHours(1)),
                duration(env, "OBJECT_STORAGE_TIMEOUT", Duration.ofHours(1)),
                duration(env, "JOB_TIMEOUT", Duration.ofHours(3)),
                duration(env, "JOB_QUEUE_POLL_INTERVAL", Duration.ofSeconds(15)),
                positiveInt(env, "JOB_WORKER_THREADS", 2),
                Path.of(string(env, "WORK_DIR", Path.of(System.getProperty("java.io.tmpdir"), "odoo-operator").toString())),
                neutralizationPolicy(env),
                bool(env, "STALE_ROLE_SWEEP_ENABLED", false),
                duration(env, "STALE_ROLE_SWEEP_INTERVAL", Duration.ofHours(1)),
                string(env, "WEBHOOK_BIND_ADDRESS", "0.0.0.0:9443"),
                Path.of(string(env, "WEBHOOK_CERT_PATH", DEFAULT_WEBHOOK_CERT_DIR + "/tls.crt")),
                Path.of(string(env, "WEBHOOK_KEY_PATH", DEFAULT_WEBHOOK_CERT_DIR + "/tls.key")));
    }

    private static String adminPassword(Map<String, String> env) {
        String file = env.get("DB_ADMIN_PASSWORD_FILE");
        Path path = Path.of(file == null || file.isBlank() ? DEFAULT_DB_ADMIN_PASSWORD_FILE : file);
        if (Files.isReadable(path)) {
            try {
                return Files.readString(path, StandardCharsets.UTF_8).strip();
            }
            catch (IOException e) {
                throw new OperatorConfigurationException("Unable to read the database admin password from " + path, e);
            }
        }
        else if (file != null && !file.isBlank()) {
            throw new OperatorConfigurationException("DB_ADMIN_PASSWORD_FILE " + path + " is not readable");
        }
        String password = env.get("DB_ADMIN_PASSWORD");
        if (password == null || password.isEmpty()) {
            throw new OperatorConfigurationException("Neither DB_ADMIN_PASSWORD nor a readable " + DEFAULT_DB_ADMIN_PASSWORD_FILE + " was supplied");
        }
        LOGGER.debug("Using database admin password from DB_ADMIN_PASSWORD");
        return password;
    }

    private static NeutralizationPolicyType neutralizationPolicy(Map<String, String> env) {
        String value = string(env, "NEUTRALIZATION_POLICY", "sql");
        try {
            return NeutralizationPolicyType.valueOf(value.toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new OperatorConfigurationException("NEUTRALIZATION_POLICY must be 'sql' or 'workload', got '" + value + "'", e);
        }
    }

    private static String string(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return value == null || value.isBlank() ? defaultValue : value.strip();
    }

    @Nullable
    private static String optionalString(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value.strip();
    }

    private static Duration duration(Map<String, String> env, String name, Duration defaultValue) {
        String value = optionalString(env, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            Duration duration = Duration.parse(value);
            if (duration.isNegative() || duration.isZero()) {
                throw new OperatorConfigurationException(name + " must be a positive duration, got '" + value + "'");
            }
            return duration;
        }
        catch (DateTimeParseException e) {
            throw new OperatorConfigurationException(name + " must be an ISO-8601 duration (e.g. PT30S), got '" + value + "'", e);
        }
    }

    private static int positiveInt(Map<String, String> env, String name, int defaultValue) {
        String value = optionalString(env, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed <= 0) {
                throw new OperatorConfigurationException(name + " must be positive, got " + parsed);
            }
            return parsed;
        }
        catch (NumberFormatException e) {
            throw new OperatorConfigurationException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static int port(Map<String, String> env, String name, int defaultValue) {
        int port = positiveInt(env, name, defaultValue);
        if (port > 65535) {
            throw new OperatorConfigurationException(name + " must be a valid port, got " + port);
        }
        return port;
    }

    private static double decimal(Map<String, String> env, String name, double defaultValue) {
        String value = optionalString(env, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value);
            if (parsed < 1.0) {
                throw new OperatorConfigurationException(name + " must be at least 1.0, got " + parsed);
            }
            return parsed;
        }
        catch (NumberFormatException e) {
            throw new OperatorConfigurationException(name + " must be a number, got '" + value + "'", e);
        }
    }

    private static boolean bool(Map<String, String> env, String name, boolean defaultValue) {
        String value = optionalString(env, name);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        else if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new OperatorConfigurationException(name + " must be 'true' or 'false', got '" + value + "'");
    }
}
