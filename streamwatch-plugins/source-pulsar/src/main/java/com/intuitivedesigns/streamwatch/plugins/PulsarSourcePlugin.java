/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.plugins;

import com.intuitivedesigns.streamwatch.codec.PulsarSchemaClient;
import com.intuitivedesigns.streamwatch.config.SourceSettings;
import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import com.intuitivedesigns.streamwatch.source.ResilientSource;
import com.intuitivedesigns.streamwatch.sources.pulsar.ConsumerOpener;
import com.intuitivedesigns.streamwatch.sources.pulsar.PulsarConsumerFactory;
import com.intuitivedesigns.streamwatch.sources.pulsar.PulsarEvent;
import com.intuitivedesigns.streamwatch.sources.pulsar.PulsarEventDecoder;
import com.intuitivedesigns.streamwatch.sources.pulsar.PulsarFailureClassifier;
import com.intuitivedesigns.streamwatch.sources.pulsar.PulsarSource;
import com.intuitivedesigns.streamwatch.sources.pulsar.SchemaLoader;
import com.intuitivedesigns.streamwatch.spi.SourcePlugin;
import org.apache.pulsar.client.api.AuthenticationFactory;
import org.apache.pulsar.client.api.ClientBuilder;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.Schema;
import org.apache.pulsar.client.api.SubscriptionInitialPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Consumes one persistent topic with Avro key/value schemas.
 *
 * <p>The bearer token comes from the {@code <APP_NAME>__PULSAR_TOKEN} environment variable and
 * is used both for the broker and for the schema request.</p>
 */
public final class PulsarSourcePlugin implements SourcePlugin {

    private static final Logger log = LoggerFactory.getLogger(PulsarSourcePlugin.class);

    public static final String ID = "PULSAR";

    // Config Keys
    static final String CFG_SERVICE_URL = "source.pulsar.service.url";
    static final String CFG_TENANT = "source.pulsar.tenant";
    static final String CFG_NAMESPACE = "source.pulsar.namespace";
    static final String CFG_TOPIC = "source.pulsar.topic";
    static final String CFG_SUBSCRIPTION = "source.pulsar.subscription";
    static final String CFG_CONSUMER_NAME = "source.pulsar.consumer.name";
    static final String CFG_SCHEMA_URL = "source.pulsar.schema.url";
    static final String CFG_AUTO_ACK = "source.pulsar.auto.ack";
    static final String CFG_POLL_TIMEOUT = "source.pulsar.poll.timeout.ms";

    static final String ENV_TOKEN = "PULSAR_TOKEN";

    // Defaults
    static final Duration DEFAULT_WATCHDOG = Duration.ofSeconds(30);
    // Change-capture interval: how long an exhausted topic waits before polling again
    static final Duration DEFAULT_IDLE = Duration.ofSeconds(5);
    private static final long DEFAULT_POLL_TIMEOUT_MS = 1_000L;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public PulsarSource create(WatchConfig config, MetricsRuntime metrics) throws PulsarClientException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String token = config.getDomainEnv(ENV_TOKEN);
        ClientBuilder builder = PulsarClient.builder().serviceUrl(config.require(CFG_SERVICE_URL));
        if (!token.isBlank()) {
            builder.authentication(AuthenticationFactory.token(token));
        }
        PulsarClient client = builder.build();

        try {
            final String topic = topicOf(config);
            final String subscription = config.require(CFG_SUBSCRIPTION);
            final String consumerName = config.getString(CFG_CONSUMER_NAME, defaultConsumerName(config));

            ConsumerOpener opener = () -> client.newConsumer(Schema.BYTES)
                    .topic(topic)
                    .subscriptionName(subscription)
                    .consumerName(consumerName)
                    .subscriptionInitialPosition(SubscriptionInitialPosition.Earliest)
                    .subscribe();

            final String schemaUrl = config.require(CFG_SCHEMA_URL);
            PulsarSchemaClient schemaClient = new PulsarSchemaClient();
            SchemaLoader schemaLoader = () -> schemaClient.fetch(schemaUrl, token);

            log.info("Pulsar source: topic={} subscription={} consumer={}", topic, subscription, consumerName);
            return build(config, metrics, topic, opener, schemaLoader, client);
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
    }

    static PulsarSource build(WatchConfig config,
                              MetricsRuntime metrics,
                              String topic,
                              ConsumerOpener opener,
                              SchemaLoader schemaLoader,
                              AutoCloseable client) {
        SourceSettings settings = SourceSettings.fromConfig(config, DEFAULT_WATCHDOG, DEFAULT_IDLE);
        PulsarConsumerFactory factory = new PulsarConsumerFactory(
                topic,
                opener,
                schemaLoader,
                Duration.ofMillis(config.getLong(CFG_POLL_TIMEOUT, DEFAULT_POLL_TIMEOUT_MS)),
                config.getBoolean(CFG_AUTO_ACK, false));

        ResilientSource<Message<byte[]>, PulsarEvent> source = ResilientSource.<Message<byte[]>, PulsarEvent>builder()
                .name(topic)
                .connectionFactory(factory)
                .decoder(new PulsarEventDecoder(factory::schema))
                .classifier(new PulsarFailureClassifier())
                .settings(settings)
                .metrics(metrics)
                .closeOnTermination(client)
                .build();
        return new PulsarSource(source, factory);
    }

    static String topicOf(WatchConfig config) {
        return "persistent://" + config.require(CFG_TENANT)
                + "/" + config.require(CFG_NAMESPACE)
                + "/" + config.require(CFG_TOPIC);
    }

    private static String defaultConsumerName(WatchConfig config) {
        return config.appName().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID();
    }
}
