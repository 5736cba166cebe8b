/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.plugins;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.streamwatch.codec.PulsarSchemaClient;
import com.intuitivedesigns.streamwatch.config.SourceSettings;
import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.core.EventDecoder;
import com.intuitivedesigns.streamwatch.core.EventSource;
import com.intuitivedesigns.streamwatch.core.StreamEvent;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import com.intuitivedesigns.streamwatch.source.ResilientSource;
import com.intuitivedesigns.streamwatch.sources.websocket.MessageAcknowledger;
import com.intuitivedesigns.streamwatch.sources.websocket.PulsarPayloadConverter;
import com.intuitivedesigns.streamwatch.sources.websocket.PulsarWebSocketMessage;
import com.intuitivedesigns.streamwatch.sources.websocket.TwoStageDecoder;
import com.intuitivedesigns.streamwatch.sources.websocket.WebSocketFactory;
import com.intuitivedesigns.streamwatch.sources.websocket.WebSocketFailureClassifier;
import com.intuitivedesigns.streamwatch.sources.websocket.WebSocketOpener;
import com.intuitivedesigns.streamwatch.spi.SourcePlugin;
import org.apache.avro.Schema;
import org.apache.avro.SchemaParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Subscribes to a WebSocket feed.
 *
 * <p>Formats:</p>
 * <ul>
 * <li>{@code PULSAR}: Pulsar WebSocket consumer messages with a base64 Avro payload, decoded to
 * JSON with the value schema given inline ({@code source.websocket.schema}) or fetched from
 * the admin API ({@code source.websocket.schema.url}).</li>
 * <li>{@code TEXT}: each message is emitted as a UTF-8 string.</li>
 * </ul>
 *
 * <p>The handshake carries {@code <WSS_HEADER>: <WSS_TOKEN>} from the application's domain
 * environment; the header defaults to {@code Authorization}.</p>
 */
public final class WebSocketSourcePlugin implements SourcePlugin {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSourcePlugin.class);

    public static final String ID = "WEBSOCKET";

    // Config Keys
    static final String CFG_URL = "source.websocket.url";
    static final String CFG_FORMAT = "source.websocket.format";
    static final String CFG_SCHEMA = "source.websocket.schema";
    static final String CFG_SCHEMA_URL = "source.websocket.schema.url";
    static final String CFG_ACK = "source.websocket.ack";
    static final String CFG_CONNECT_TIMEOUT = "source.websocket.connect.timeout.ms";

    static final String ENV_TOKEN = "WSS_TOKEN";
    static final String ENV_HEADER = "WSS_HEADER";

    // Defaults
    private static final String DEFAULT_FORMAT = "PULSAR";
    private static final String DEFAULT_HEADER = "Authorization";
    static final Duration DEFAULT_WATCHDOG = Duration.ofSeconds(15);
    private static final Duration DEFAULT_IDLE = Duration.ofSeconds(1);
    private static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventSource<?> create(WatchConfig config, MetricsRuntime metrics) throws IOException, InterruptedException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final URI uri = URI.create(config.require(CFG_URL));
        final Duration connectTimeout = Duration.ofMillis(config.getLong(CFG_CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT_MS));
        final String token = config.getDomainEnv(ENV_TOKEN);
        final String header = config.getDomainEnv(ENV_HEADER).isBlank() ? DEFAULT_HEADER : config.getDomainEnv(ENV_HEADER);

        HttpClient http = HttpClient.newBuilder().connectTimeout(connectTimeout).build();
        WebSocketOpener opener = listener -> {
            WebSocket.Builder b = http.newWebSocketBuilder().connectTimeout(connectTimeout);
            if (!token.isBlank()) b.header(header, token);
            return b.buildAsync(uri, listener);
        };

        String format = config.getString(CFG_FORMAT, DEFAULT_FORMAT).trim().toUpperCase(Locale.ROOT);
        switch (format) {
            case "PULSAR":
                return buildPulsar(config, metrics, uri.toString(), opener, valueSchema(config, token));
            case "TEXT":
                return buildText(config, metrics, uri.toString(), opener);
            default:
                throw new IllegalArgumentException("Unknown " + CFG_FORMAT + " '" + format + "'. Expected PULSAR or TEXT");
        }
    }

    static ResilientSource<byte[], StreamEvent<JsonNode>> buildPulsar(WatchConfig config,
                                                                     MetricsRuntime metrics,
                                                                     String url,
                                                                     WebSocketOpener opener,
                                                                     Schema valueSchema) {
        MessageAcknowledger acks = config.getBoolean(CFG_ACK, false)
                ? PulsarWebSocketMessage::ackFrame
                : MessageAcknowledger.NONE;
        return build(config, metrics, url, opener, acks,
                new TwoStageDecoder<>(PulsarWebSocketMessage::parse, new PulsarPayloadConverter(valueSchema)));
    }

    static ResilientSource<byte[], StreamEvent<String>> buildText(WatchConfig config,
                                                                 MetricsRuntime metrics,
                                                                 String url,
                                                                 WebSocketOpener opener) {
        return build(config, metrics, url, opener, MessageAcknowledger.NONE,
                new TwoStageDecoder<String, StreamEvent<String>>(
                        bytes -> new String(bytes, StandardCharsets.UTF_8),
                        StreamEvent::of));
    }

    private static <E> ResilientSource<byte[], E> build(WatchConfig config,
                                                        MetricsRuntime metrics,
                                                        String url,
                                                        WebSocketOpener opener,
                                                        MessageAcknowledger acks,
                                                        EventDecoder<byte[], E> decoder) {
        SourceSettings settings = SourceSettings.fromConfig(config, DEFAULT_WATCHDOG, DEFAULT_IDLE);
        Duration connectTimeout = Duration.ofMillis(config.getLong(CFG_CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT_MS));
        return ResilientSource.<byte[], E>builder()
                .name(url)
                .connectionFactory(new WebSocketFactory(url, opener, acks, connectTimeout))
                .decoder(decoder)
                .classifier(new WebSocketFailureClassifier())
                .settings(settings)
                .metrics(metrics)
                .build();
    }

    static Schema valueSchema(WatchConfig config, String token) throws IOException, InterruptedException {
        String inline = config.getString(CFG_SCHEMA, "");
        if (!inline.isBlank()) {
            try {
                return new Schema.Parser().parse(inline);
            } catch (SchemaParseException e) {
                throw new IllegalArgumentException("Invalid Avro schema in " + CFG_SCHEMA + ": " + e.getMessage(), e);
            }
        }
        String schemaUrl = config.getString(CFG_SCHEMA_URL, "");
        if (schemaUrl.isBlank()) {
            throw new IllegalArgumentException("Format PULSAR needs " + CFG_SCHEMA + " or " + CFG_SCHEMA_URL);
        }
        log.info("Loading value schema for WebSocket feed from {}", schemaUrl);
        return new PulsarSchemaClient().fetch(schemaUrl, token).value();
    }
}
