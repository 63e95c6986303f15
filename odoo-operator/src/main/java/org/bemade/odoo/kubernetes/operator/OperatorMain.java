/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.Properties;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.Operator;
import io.javaoperatorsdk.operator.monitoring.micrometer.MicrometerMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import org.bemade.odoo.kubernetes.operator.database.DatabaseAdminClient;
import org.bemade.odoo.kubernetes.operator.database.PostgresDatabaseAdminClient;
import org.bemade.odoo.kubernetes.operator.database.StaleRoleSweeper;
import org.bemade.odoo.kubernetes.operator.dispatch.KeyedLocks;
import org.bemade.odoo.kubernetes.operator.jobs.JobCoordinator;
import org.bemade.odoo.kubernetes.operator.jobs.JobRunner;
import org.bemade.odoo.kubernetes.operator.jobs.OdooBackupJobReconciler;
import org.bemade.odoo.kubernetes.operator.jobs.OdooRestoreJobReconciler;
import org.bemade.odoo.kubernetes.operator.management.AllowedMethodsFilter;
import org.bemade.odoo.kubernetes.operator.management.BindAddress;
import org.bemade.odoo.kubernetes.operator.neutralization.NeutralizationPolicy;
import org.bemade.odoo.kubernetes.operator.neutralization.SqlNeutralizationPolicy;
import org.bemade.odoo.kubernetes.operator.neutralization.WorkloadNeutralizationPolicy;
import org.bemade.odoo.kubernetes.operator.storage.S3ObjectStorage;
import org.bemade.odoo.kubernetes.operator.storage.UrlArchiveFetcher;
import org.bemade.odoo.kubernetes.operator.workload.PodExecWorkloadExecutor;
import org.bemade.odoo.kubernetes.operator.webhook.WebhookServer;
import org.bemade.odoo.kubernetes.operator.workload.WorkloadExecutor;
import org.bemade.odoo.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The {@code main} method entrypoint for the operator
 */
public class OperatorMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorMain.class);
    private static final int DEFAULT_MANAGEMENT_PORT = 8080;
    static final String HTTP_PATH_LIVEZ = "/livez";
    static final String HTTP_PATH_METRICS = "/metrics";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Name of the build_info metric. The {@code .info} suffix marks an info metric to Micrometer,
     * which Prometheus exposes as {@code odoo_operator_build_info}.
     */
    private static final String BUILD_INFO_METRIC_NAME = "odoo_operator_build.info";

    private final OperatorConfig config;
    private final Operator operator;
    private final HttpServer managementServer;
    private final @Nullable WebhookServer webhookServer;
    private final DatabaseAdminClient databaseAdminClient;
    private final JobRunner jobRunner;
    private @Nullable StaleRoleSweeper staleRoleSweeper;

    public OperatorMain(OperatorConfig config) throws IOException {
        this(config, null, createHttpServer(config), WebhookServer.create(config).orElse(null), PostgresDatabaseAdminClient.create(config));
    }

    @VisibleForTesting
    OperatorMain(OperatorConfig config,
                 @Nullable KubernetesClient kubeClient,
                 HttpServer managementServer,
                 @Nullable WebhookServer webhookServer,
                 DatabaseAdminClient databaseAdminClient) {
        this.config = config;
        configurePrometheusMetrics(managementServer);
        operator = new Operator(o -> {
            o.withMetrics(enablePrometheusMetrics());
            if (kubeClient != null) {
                o.withKubernetesClient(kubeClient);
            }
        });
        this.managementServer = managementServer;
        this.webhookServer = webhookServer;
        this.databaseAdminClient = databaseAdminClient;
        this.jobRunner = new JobRunner(config.jobWorkerThreads(), config.workDir(), config.jobTimeout());
    }

    public static void main(String[] args) {
        try {
            new OperatorMain(OperatorConfig.fromEnvironment()).start();
        }
        catch (OperatorConfigurationException e) {
            LOGGER.error("Invalid operator configuration: {}. Will now exit.", e.getMessage());
            System.exit(1);
        }
        catch (Exception e) {
            LOGGER.error("Operator has thrown exception during startup. Will now exit.", e);
            System.exit(1);
        }
    }

    /**
     * Starts the operator instance and returns once that has completed successfully.
     */
    void start() {
        operator.installShutdownHook(Duration.ofSeconds(10));
        Clock clock = Clock.systemUTC();
        KubernetesClient client = operator.getKubernetesClient();
        WorkloadExecutor executor = new PodExecWorkloadExecutor(client, config.workloadExecTimeout());
        var storage = new S3ObjectStorage(config.objectStorageTimeout(), CONNECT_TIMEOUT);
        var urlFetcher = new UrlArchiveFetcher(CONNECT_TIMEOUT, config.objectStorageTimeout());
        var coordinator = new JobCoordinator();

        operator.register(new OdooInstanceReconciler(clock, config, databaseAdminClient, new HttpHealthProbe(config.healthCheckTimeout()), new KeyedLocks()),
                o -> o.withRetry(config.retryPolicy().toGenericRetry())
                        .withReconciliationMaxInterval(config.resyncInterval())
                        .withGenerationAware(false));
        operator.register(new OdooBackupJobReconciler(clock, config, coordinator, jobRunner, executor, storage),
                o -> o.withRetry(config.retryPolicy().toGenericRetry()));
        operator.register(new OdooRestoreJobReconciler(clock, config, coordinator, jobRunner, executor, databaseAdminClient,
                neutralizationPolicy(executor), storage, urlFetcher),
                o -> o.withRetry(config.retryPolicy().toGenericRetry()));

        addHttpGetHandler("/", () -> 404);
        managementServer.start();
        addHttpGetHandler(HTTP_PATH_LIVEZ, this::livezStatusCode);
        if (webhookServer != null) {
            webhookServer.start();
        }
        operator.start();
        if (config.staleRoleSweepEnabled()) {
            staleRoleSweeper = new StaleRoleSweeper(client, databaseAdminClient, config.releaseName(), config.staleRoleSweepInterval());
            staleRoleSweeper.start();
        }
        var versionInfo = VersionInfo.VERSION_INFO;
        LOGGER.atInfo().setMessage("Operator started (version: {}, release: {})")
                .addArgument(versionInfo::version)
                .addArgument(config::releaseName)
                .log();
        versionInfoMetric(versionInfo);
    }

    private NeutralizationPolicy neutralizationPolicy(WorkloadExecutor executor) {
        return switch (config.neutralizationPolicy()) {
            case SQL -> new SqlNeutralizationPolicy(databaseAdminClient);
            case WORKLOAD -> new WorkloadNeutralizationPolicy(executor);
        };
    }

    private void addHttpGetHandler(String path,
                                   IntSupplier statusCodeSupplier) {
        managementServer.createContext(path, exchange -> {
            try (exchange) {
                // only GETs reach this handler, so there is no request body to drain
                exchange.sendResponseHeaders(statusCodeSupplier.getAsInt(), -1);
            }
        }).getFilters().add(AllowedMethodsFilter.GET_ONLY);
    }

    private int livezStatusCode() {
        int sc;
        try {
            sc = operator.getRuntimeInfo().allEventSourcesAreHealthy() ? 200 : 400;
        }
        catch (Exception e) {
            sc = 400;
            LOGGER.error("Ignoring exception caught while getting operator health info", e);
        }
        (sc != 200 ? LOGGER.atWarn() : LOGGER.atDebug()).log("Responding {} to GET {}", sc, HTTP_PATH_LIVEZ);
        return sc;
    }

    void stop() {
        operator.stop();
        managementServer.stop(0);
        if (webhookServer != null) {
            webhookServer.close();
        }
        if (staleRoleSweeper != null) {
            staleRoleSweeper.close();
        }
        jobRunner.close();
        databaseAdminClient.close();
        LOGGER.info("Operator stopped.");
    }

    private MicrometerMetrics enablePrometheusMetrics() {
        return MicrometerMetrics.newPerResourceCollectingMicrometerMetricsBuilder(Metrics.globalRegistry)
                .withCleanUpDelayInSeconds(35)
                .withCleaningThreadNumber(1)
                .build();
    }

    private void configurePrometheusMetrics(HttpServer managementServer) {
        final PrometheusMeterRegistry prometheusMeterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        final HttpContext metricsContext = managementServer.createContext(HTTP_PATH_METRICS,
                new MetricsHandler(prometheusMeterRegistry.getPrometheusRegistry()));
        metricsContext.getFilters().add(AllowedMethodsFilter.GET_ONLY);
        Metrics.globalRegistry.add(prometheusMeterRegistry);
    }

    @VisibleForTesting
    static HttpServer createHttpServer(OperatorConfig config) throws IOException {
        final Properties systemProps = System.getProperties();
        if (!systemProps.containsKey("sun.net.httpserver.maxReqTime")) {
            System.setProperty("sun.net.httpserver.maxReqTime", "60");
        }

        if (!systemProps.containsKey("sun.net.httpserver.maxRspTime")) {
            System.setProperty("sun.net.httpserver.maxRspTime", "120");
        }

        return HttpServer.create(bindAddress(config.bindAddress()), 0);
    }

    @VisibleForTesting
    static InetSocketAddress bindAddress(String bindAddress) {
        InetSocketAddress address = BindAddress.parse("BIND_ADDRESS", bindAddress, DEFAULT_MANAGEMENT_PORT);
        LOGGER.info("Starting management server on: {}:{}", address.getHostString(), address.getPort());
        return address;
    }

    private static void versionInfoMetric(VersionInfo versionInfo) {
        Gauge.builder(BUILD_INFO_METRIC_NAME, () -> 1.0)
                .description("Reports Odoo Operator version information")
                .tag("version", versionInfo.version())
                .strongReference(true)
                .register(Metrics.globalRegistry);
    }
}
