/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.webhook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;

import io.fabric8.kubernetes.api.model.admission.v1.AdmissionRequest;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionResponse;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReview;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReviewBuilder;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Reads an {@link AdmissionReview} from the request body and answers with the review carrying
 * the decision. A body that is not a review is answered with {@code 400} and a denial.
 */
class AdmissionReviewHandler implements HttpHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdmissionReviewHandler.class);

    static final String API_VERSION = "admission.k8s.io/v1";
    static final String KIND = "AdmissionReview";

    private final KubernetesSerialization serialization;
    private final Function<AdmissionRequest, AdmissionResponse> decision;

    AdmissionReviewHandler(KubernetesSerialization serialization, Function<AdmissionRequest, AdmissionResponse> decision) {
        this.serialization = serialization;
        this.decision = decision;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try (exchange) {
            AdmissionRequest request = readRequest(exchange);
            if (request == null) {
                respond(exchange, 400, OdooInstanceAdmission.denied(null, "No admission request provided"));
                return;
            }
            AdmissionResponse response;
            try {
                response = decision.apply(request);
            }
            catch (RuntimeException e) {
                LOGGER.warn("Admission of {} {}/{} failed", request.getOperation(), request.getNamespace(), request.getName(), e);
                response = OdooInstanceAdmission.denied(request.getUid(), "Error admitting OdooInstance: " + e.getMessage());
            }
            respond(exchange, 200, response);
        }
    }

    @Nullable
    private AdmissionRequest readRequest(HttpExchange exchange) throws IOException {
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }
        if (body.length == 0) {
            return null;
        }
        try {
            AdmissionReview review = serialization.unmarshal(new String(body, StandardCharsets.UTF_8), AdmissionReview.class);
            return review == null ? null : review.getRequest();
        }
        catch (RuntimeException e) {
            LOGGER.info("Ignoring unreadable admission review from {}: {}", exchange.getRemoteAddress(), e.getMessage());
            return null;
        }
    }

    private void respond(HttpExchange exchange, int statusCode, AdmissionResponse response) throws IOException {
        AdmissionReview review = new AdmissionReviewBuilder()
                .withApiVersion(API_VERSION)
                .withKind(KIND)
                .withResponse(response)
                .build();
        byte[] body = serialization.asJson(review).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
}
