/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Fetches key/value Avro schemas from the Pulsar admin REST API.
 */
public final class PulsarSchemaClient {

    private static final Logger log = LoggerFactory.getLogger(PulsarSchemaClient.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private final HttpClient http;
    private final Duration timeout;

    public PulsarSchemaClient() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build(), DEFAULT_TIMEOUT);
    }

    public PulsarSchemaClient(HttpClient http, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * @param schemaUrl e.g. {@code https://host/admin/v2/schemas/tenant/ns/topic/schema}
     * @param token bearer token; blank sends no Authorization header
     * @throws IOException on a non-2xx response or an unparseable body
     */
    public KeyValueSchema fetch(String schemaUrl, String token) throws IOException, InterruptedException {
        Objects.requireNonNull(schemaUrl, "schemaUrl");

        HttpRequest.Builder req = HttpRequest.newBuilder(URI.create(schemaUrl))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (token != null && !token.isBlank()) {
            req.header("Authorization", "Bearer " + token);
        }

        log.info("Fetching Avro schema from {}", schemaUrl);
        HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new IOException("Schema request to " + schemaUrl + " failed with HTTP " + resp.statusCode());
        }

        KeyValueSchema schema = KeyValueSchema.parse(resp.body());
        log.info("Loaded schemas key='{}' value='{}'", schema.key().getFullName(), schema.value().getFullName());
        return schema;
    }
}
