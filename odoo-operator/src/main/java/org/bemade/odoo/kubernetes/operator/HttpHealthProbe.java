/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.bemade.odoo.kubernetes.api.v1.OdooInstance;

/**
 * Calls {@code /web/health} on the instance's Service, expecting 200 and {@code {"status": "pass"}}.
 */
public class HttpHealthProbe implements HealthProbe {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpHealthProbe.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpHealthProbe(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    HttpHealthProbe(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override
    public Result check(OdooInstance instance) {
        return check(URI.create("http://" + ResourceNames.serviceHost(instance) + ":" + OdooDeployment.HTTP_PORT + OdooDeployment.HEALTH_PATH));
    }

    Result check(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri).GET().timeout(timeout).build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                return Result.unhealthy("GET " + uri + " returned " + response.statusCode());
            }
            JsonNode status = MAPPER.readTree(response.body()).path("status");
            if (!"pass".equals(status.asText())) {
                return Result.unhealthy("GET " + uri + " reported status '" + status.asText() + "'");
            }
            return Result.HEALTHY;
        }
        catch (IOException e) {
            LOGGER.debug("Health check of {} failed", uri, e);
            return Result.unhealthy("GET " + uri + " failed: " + e.getMessage());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.unhealthy("GET " + uri + " was interrupted");
        }
    }
}
