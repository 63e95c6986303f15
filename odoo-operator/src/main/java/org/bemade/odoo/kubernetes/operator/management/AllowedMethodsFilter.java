/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.management;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

/**
 * Answers {@code 405 Method Not Allowed} to requests whose method a context does not serve.
 * The management endpoints take {@link #GET_ONLY}, the admission endpoints {@link #POST_ONLY}.
 */
public final class AllowedMethodsFilter extends Filter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AllowedMethodsFilter.class);

    public static final AllowedMethodsFilter GET_ONLY = new AllowedMethodsFilter(Set.of("GET"));
    public static final AllowedMethodsFilter POST_ONLY = new AllowedMethodsFilter(Set.of("POST"));

    private final Set<String> methods;
    private final String allowHeader;

    AllowedMethodsFilter(Set<String> methods) {
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("at least one method must be allowed");
        }
        this.methods = new TreeSet<>(methods);
        this.allowHeader = String.join(", ", this.methods);
    }

    public Set<String> methods() {
        return Set.copyOf(methods);
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        if (methods.contains(method)) {
            chain.doFilter(exchange);
            return;
        }
        LOGGER.debug("Refusing {} {}", method, exchange.getRequestURI());
        try (exchange) {
            exchange.getResponseHeaders().set("Allow", allowHeader);
            exchange.sendResponseHeaders(405, -1);
        }
    }

    @Override
    public String description() {
        return "Allows " + allowHeader;
    }
}
