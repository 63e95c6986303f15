/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.webhook;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Optional;
import java.util.UUID;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsServer;

import io.fabric8.kubernetes.client.internal.CertUtils;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

import org.bemade.odoo.kubernetes.operator.OperatorConfig;
import org.bemade.odoo.kubernetes.operator.OperatorConfigurationException;
import org.bemade.odoo.kubernetes.operator.management.AllowedMethodsFilter;
import org.bemade.odoo.kubernetes.operator.management.BindAddress;
import org.bemade.odoo.kubernetes.operator.model.OdooInstanceValidator;
import org.bemade.odoo.tag.VisibleForTesting;

/**
 * The HTTPS server the API server calls for {@code OdooInstance} admission.
 * It only runs when a serving certificate and key are mounted.
 */
public class WebhookServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebhookServer.class);

    public static final String VALIDATE_PATH = "/validate-odoo-bemade-org-v1-odooinstance";
    public static final String MUTATE_PATH = "/mutate-odoo-bemade-org-v1-odooinstance";

    private static final int DEFAULT_WEBHOOK_PORT = 9443;
    private static final String KEY_ALGORITHM = "RSA";

    private final HttpServer server;

    @VisibleForTesting
    WebhookServer(HttpServer server, OdooInstanceAdmission admission, KubernetesSerialization serialization) {
        this.server = server;
        server.createContext(VALIDATE_PATH, new AdmissionReviewHandler(serialization, admission::validate))
                .getFilters().add(AllowedMethodsFilter.POST_ONLY);
        server.createContext(MUTATE_PATH, new AdmissionReviewHandler(serialization, admission::mutate))
                .getFilters().add(AllowedMethodsFilter.POST_ONLY);
    }

    /**
     * @return the server, or empty when the serving certificate or key is missing
     * @throws OperatorConfigurationException if the certificate and key cannot be loaded or the address cannot be bound
     */
    public static Optional<WebhookServer> create(OperatorConfig config) {
        Path certPath = config.webhookCertPath();
        Path keyPath = config.webhookKeyPath();
        if (!Files.isReadable(certPath) || !Files.isReadable(keyPath)) {
            LOGGER.warn("Admission webhooks are disabled: no readable serving certificate at {} and key at {}", certPath, keyPath);
            return Optional.empty();
        }
        InetSocketAddress address = BindAddress.parse("WEBHOOK_BIND_ADDRESS", config.webhookBindAddress(), DEFAULT_WEBHOOK_PORT);
        SSLContext sslContext = sslContext(certPath, keyPath);
        try {
            HttpsServer server = HttpsServer.create(address, 0);
            server.setHttpsConfigurator(new HttpsConfigurator(sslContext));
            LOGGER.info("Starting admission webhook server on: {}:{}", address.getHostString(), address.getPort());
            var serialization = new KubernetesSerialization();
            return Optional.of(new WebhookServer(server, new OdooInstanceAdmission(new OdooInstanceValidator(), serialization), serialization));
        }
        catch (IOException e) {
            throw new OperatorConfigurationException("Unable to bind the admission webhook server to " + config.webhookBindAddress(), e);
        }
    }

    @VisibleForTesting
    static SSLContext sslContext(Path certPath, Path keyPath) {
        char[] password = UUID.randomUUID().toString().toCharArray();
        try (InputStream cert = Files.newInputStream(certPath);
                InputStream key = Files.newInputStream(keyPath)) {
            KeyStore keyStore = CertUtils.createKeyStore(cert, key, KEY_ALGORITHM, password, null, password);
            KeyManagerFactory keyManagers = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            keyManagers.init(keyStore, password);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keyManagers.getKeyManagers(), null, null);
            return context;
        }
        catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            throw new OperatorConfigurationException("Unable to load the admission webhook certificate " + certPath + " and key " + keyPath, e);
        }
    }

    public void start() {
        server.start();
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
