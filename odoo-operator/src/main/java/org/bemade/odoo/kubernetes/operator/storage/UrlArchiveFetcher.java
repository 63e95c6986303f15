/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.storage;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches an archive from an HTTP(S) URL, such as a pre-signed link.
 */
public class UrlArchiveFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(UrlArchiveFetcher.class);

    private final HttpClient client;
    private final Duration timeout;

    public UrlArchiveFetcher(Duration connectTimeout, Duration timeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), timeout);
    }

    UrlArchiveFetcher(HttpClient client, Duration timeout) {
        this.client = Objects.requireNonNull(client);
        this.timeout = Objects.requireNonNull(timeout);
    }

    /**
     * @param url http or https URL
     * @param target file to write, replaced if it exists
     */
    public void fetch(String url, Path target) throws IOException, InterruptedException {
        URI uri = URI.create(url);
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Only http and https URLs are supported, got '" + scheme + "'");
        }
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        HttpResponse<Path> response = client.send(request, HttpResponse.BodyHandlers.ofFile(target,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
        if (response.statusCode() / 100 != 2) {
            Files.deleteIfExists(target);
            throw new IOException("GET " + redacted(uri) + " returned HTTP " + response.statusCode());
        }
        LOGGER.info("Fetched {} ({} bytes)", redacted(uri), Files.size(target));
    }

    // pre-signed URLs carry credentials in the query
    static String redacted(URI uri) {
        return uri.getScheme() + "://" + uri.getAuthority() + uri.getPath();
    }
}
