/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.webhook;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReview;
import io.fabric8.kubernetes.api.model.admission.v1.AdmissionReviewBuilder;
import io.fabric8.kubernetes.client.utils.KubernetesSerialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdmissionReviewHandlerTest {

    private final KubernetesSerialization serialization = new KubernetesSerialization();

    @Mock
    private HttpExchange exchange;

    @Test
    void shouldDenyWhenDecisionFails() throws IOException {
        // Given
        var handler = new AdmissionReviewHandler(serialization, request -> {
            throw new IllegalStateException("validator unavailable");
        });
        String review = serialization.asJson(new AdmissionReviewBuilder()
                .withNewRequest().withUid("uid-9").withOperation("CREATE").endRequest()
                .build());
        ByteArrayOutputStream responseBody = new ByteArrayOutputStream();
        when(exchange.getRequestBody()).thenReturn(new ByteArrayInputStream(review.getBytes(StandardCharsets.UTF_8)));
        when(exchange.getResponseHeaders()).thenReturn(new Headers());
        when(exchange.getResponseBody()).thenReturn(responseBody);

        // When
        handler.handle(exchange);

        // Then
        verify(exchange).sendResponseHeaders(eq(200), anyLong());
        verify(exchange).close();
        AdmissionReview answer = serialization.unmarshal(responseBody.toString(StandardCharsets.UTF_8), AdmissionReview.class);
        assertThat(answer.getResponse().getUid()).isEqualTo("uid-9");
        assertThat(answer.getResponse().getAllowed()).isFalse();
        assertThat(answer.getResponse().getStatus().getMessage()).isEqualTo("Error admitting OdooInstance: validator unavailable");
    }

    @Test
    void shouldDenyUnreadableBody() throws IOException {
        // Given
        var handler = new AdmissionReviewHandler(serialization, request -> {
            throw new AssertionError("no decision expected");
        });
        ByteArrayOutputStream responseBody = new ByteArrayOutputStream();
        when(exchange.getRequestBody()).thenReturn(new ByteArrayInputStream("{not json".getBytes(StandardCharsets.UTF_8)));
        when(exchange.getResponseHeaders()).thenReturn(new Headers());
        when(exchange.getResponseBody()).thenReturn(responseBody);

        // When
        handler.handle(exchange);

        // Then
        verify(exchange).sendResponseHeaders(eq(400), anyLong());
        AdmissionReview answer = serialization.unmarshal(responseBody.toString(StandardCharsets.UTF_8), AdmissionReview.class);
        assertThat(answer.getResponse().getAllowed()).isFalse();
        assertThat(answer.getResponse().getUid()).isEmpty();
    }
}
