/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.management;

import java.io.IOException;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AllowedMethodsFilterTest {

    @Mock
    private HttpExchange exchange;

    @Mock
    private Filter.Chain chain;

    @ParameterizedTest
    @ValueSource(strings = { "GET", "get" })
    void shouldPassAllowedMethodOnRegardlessOfCase(String method) throws IOException {
        // Given
        when(exchange.getRequestMethod()).thenReturn(method);

        // When
        AllowedMethodsFilter.GET_ONLY.doFilter(exchange, chain);

        // Then
        verify(chain).doFilter(exchange);
        verify(exchange, never()).sendResponseHeaders(anyInt(), anyLong());
    }

    @ParameterizedTest
    @ValueSource(strings = { "HEAD", "POST", "PUT", "PATCH", "DELETE", "OPTIONS" })
    void shouldAnswer405ToManagementRequestsOtherThanGet(String method) throws IOException {
        // Given
        Headers responseHeaders = new Headers();
        when(exchange.getRequestMethod()).thenReturn(method);
        when(exchange.getResponseHeaders()).thenReturn(responseHeaders);

        // When
        AllowedMethodsFilter.GET_ONLY.doFilter(exchange, chain);

        // Then
        verify(exchange).sendResponseHeaders(405, -1);
        verify(exchange).close();
        verify(chain, never()).doFilter(any(HttpExchange.class));
        assertThat(responseHeaders.getFirst("Allow")).isEqualTo("GET");
    }

    @Test
    void shouldAnswer405ToAdmissionRequestsOtherThanPost() throws IOException {
        // Given
        Headers responseHeaders = new Headers();
        when(exchange.getRequestMethod()).thenReturn("GET");
        when(exchange.getResponseHeaders()).thenReturn(responseHeaders);

        // When
        AllowedMethodsFilter.POST_ONLY.doFilter(exchange, chain);

        // Then
        verify(exchange).sendResponseHeaders(405, -1);
        assertThat(responseHeaders.getFirst("Allow")).isEqualTo("POST");
    }

    @Test
    void shouldListEveryAllowedMethodInAllowHeader() throws IOException {
        // Given
        var filter = new AllowedMethodsFilter(Set.of("POST", "GET"));
        Headers responseHeaders = new Headers();
        when(exchange.getRequestMethod()).thenReturn("DELETE");
        when(exchange.getResponseHeaders()).thenReturn(responseHeaders);

        // When
        filter.doFilter(exchange, chain);

        // Then
        assertThat(responseHeaders.getFirst("Allow")).isEqualTo("GET, POST");
        assertThat(filter.description()).isEqualTo("Allows GET, POST");
    }

    @Test
    void shouldRequireAtLeastOneMethod() {
        // Given
        Set<String> none = Set.of();

        // When / Then
        assertThatThrownBy(() -> new AllowedMethodsFilter(none))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
