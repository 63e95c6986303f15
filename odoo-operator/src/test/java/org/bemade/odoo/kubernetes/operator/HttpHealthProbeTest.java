/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpServer;

import static org.assertj.core.api.Assertions.assertThat;

class HttpHealthProbeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private HttpServer server;
    private HttpHealthProbe probe;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        probe = new HttpHealthProbe(HttpClient.newBuilder().connectTimeout(TIMEOUT).build(), TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void shouldBeHealthyWhenStatusPasses() {
        // Given
        respond(200, "{\"status\": \"pass\"}");

        // When
        HealthProbe.Result result = probe.check(healthUri());

        // Then
        assertThat(result).isEqualTo(HealthProbe.Result.HEALTHY);
    }

    @Test
    void shouldBeUnhealthyOnNon200() {
        // Given
        respond(503, "{\"status\": \"pass\"}");

        // When
        HealthProbe.Result result = probe.check(healthUri());

        // Then
        assertThat(result.healthy()).isFalse();
        assertThat(result.detail()).isEqualTo("GET " + healthUri() + " returned 503");
    }

    @Test
    void shouldBeUnhealthyWhenStatusDoesNotPass() {
        // Given
        respond(200, "{\"status\": \"fail\"}");

        // When
        HealthProbe.Result result = probe.check(healthUri());

        // Then
        assertThat(result.healthy()).isFalse();
        assertThat(result.detail()).endsWith("reported status 'fail'");
    }

    @Test
    void shouldBeUnhealthyWhenStatusIsMissing() {
        // Given
        respond(200, "{}");

        // When
        HealthProbe.Result result = probe.check(healthUri());

        // Then
        assertThat(result.healthy()).isFalse();
        assertThat(result.detail()).endsWith("reported status ''");
    }

    @Test
    void shouldBeUnhealthyWhenBodyIsNotJson() {
        // Given
        respond(200, "<html>Internal Server Error</html>");

        // When
        HealthProbe.Result result = probe.check(healthUri());

        // Then
        assertThat(result.healthy()).isFalse();
        assertThat(result.detail()).startsWith("GET " + healthUri() + " failed: ");
    }

    @Test
    void shouldBeUnhealthyWhenNothingListens() {
        // Given
        URI uri = healthUri();
        server.stop(0);

        // When
        HealthProbe.Result result = probe.check(uri);

        // Then
        assertThat(result.healthy()).isFalse();
        assertThat(result.detail()).startsWith("GET " + uri + " failed");
    }

    private URI healthUri() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + OdooDeployment.HEALTH_PATH);
    }

    private void respond(int statusCode, String body) {
        server.createContext(OdooDeployment.HEALTH_PATH, exchange -> {
            try (exchange) {
                byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().add("Content-Type", "application/json");
                exchange.sendResponseHeaders(statusCode, bytes.length);
                exchange.getResponseBody().write(bytes);
            }
        });
    }
}
