/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.plugins;

import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.core.SourceFailedException;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import com.intuitivedesigns.streamwatch.source.ConnectionConstructionException;
import com.intuitivedesigns.streamwatch.sources.pulsar.PulsarEvent;
import com.intuitivedesigns.streamwatch.sources.pulsar.PulsarFixtures;
import com.intuitivedesigns.streamwatch.sources.pulsar.PulsarSource;
import com.intuitivedesigns.streamwatch.spi.ServicePluginRegistry;
import com.intuitivedesigns.streamwatch.spi.SourcePlugin;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.MessageId;
import org.apache.pulsar.client.api.PulsarClientException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class PulsarSourcePluginTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final List<Consumer<byte[]>> consumers = new CopyOnWriteArrayList<>();
    private PulsarSource source;

    @AfterEach
    void tearDown() {
        if (source != null) source.cancel();
    }

    private static WatchConfig config(boolean autoAck) {
        return config(autoAck, Map.of());
    }

    private static WatchConfig config(boolean autoAck, Map<String, String> overrides) {
        Map<String, String> m = new HashMap<>();
        m.put("source.pulsar.tenant", "t");
        m.put("source.pulsar.namespace", "ns");
        m.put("source.pulsar.topic", "orders");
        m.put("source.pulsar.auto.ack", String.valueOf(autoAck));
        m.put("source.pulsar.poll.timeout.ms", "20");
        m.put("source.idle.interval.ms", "10");
        m.put("source.backoff.type", "FIXED");
        m.put("source.backoff.base.ms", "10");
        m.putAll(overrides);
        return WatchConfig.of(m);
    }

    @SuppressWarnings("unchecked")
    private Consumer<byte[]> nextConsumer() {
        Consumer<byte[]> c = mock(Consumer.class);
        consumers.add(c);
        return c;
    }

    @Test
    void isDiscoveredThroughServiceLoader() {
        ServicePluginRegistry<SourcePlugin> registry = new ServicePluginRegistry<>(SourcePlugin.class);
        assertTrue(registry.get("PULSAR").isPresent());
    }

    @Test
    void topicIsPersistentTenantNamespaceTopic() {
        assertEquals("persistent://t/ns/orders", PulsarSourcePlugin.topicOf(config(false)));
    }

    @Test
    void retriableReceiveFailureResubscribes() throws Exception {
        Message<byte[]> msg = PulsarFixtures.message("o-1", PulsarFixtures.order("sku", 2), 5L);
        AutoCloseable client = mock(AutoCloseable.class);

        source = PulsarSourcePlugin.build(config(false), MetricsRuntime.NOOP, "persistent://t/ns/orders",
                () -> {
                    Consumer<byte[]> c = nextConsumer();
                    if (consumers.size() == 1) {
                        when(c.receive(anyInt(), any(TimeUnit.class)))
                                .thenThrow(new PulsarClientException.TimeoutException("broker unavailable"));
                    } else {
                        when(c.receive(anyInt(), any(TimeUnit.class))).thenReturn(msg, (Message<byte[]>) null);
                    }
                    return c;
                },
                PulsarFixtures::schema,
                client);
        source.start();

        PulsarEvent event = source.events().poll(WAIT).orElseThrow();
        assertEquals("o-1", event.key().get("id").asText());
        assertEquals(2, consumers.size());
        verify(consumers.get(0)).close();

        source.cancel();
        assertTrue(source.awaitTermination(WAIT));
        verify(client).close();
    }

    @Test
    void watchdogIsOnByDefault() {
        assertTrue(PulsarSourcePlugin.DEFAULT_WATCHDOG.compareTo(Duration.ZERO) > 0);
    }

    @Test
    void disconnectedConsumerIsReplacedByTheWatchdog() throws Exception {
        source = PulsarSourcePlugin.build(config(false, Map.of("source.watchdog.interval.ms", "50")),
                MetricsRuntime.NOOP, "persistent://t/ns/orders",
                () -> {
                    Consumer<byte[]> c = nextConsumer();
                    when(c.isConnected()).thenReturn(consumers.size() > 1);
                    return c;
                },
                PulsarFixtures::schema,
                mock(AutoCloseable.class));
        source.start();

        await().atMost(WAIT).until(() -> consumers.size() >= 2);
        verify(consumers.get(0), timeout(WAIT.toMillis())).close();
        verify(consumers.get(0), never()).unsubscribe();
        assertFalse(source.awaitTermination(Duration.ofMillis(200)));
        assertEquals(2, consumers.size());
    }

    @Test
    void cancelUnsubscribesBeforeClosing() throws Exception {
        source = PulsarSourcePlugin.build(config(false), MetricsRuntime.NOOP, "persistent://t/ns/orders",
                this::nextConsumer, PulsarFixtures::schema, mock(AutoCloseable.class));
        source.start();
        await().atMost(WAIT).until(() -> consumers.size() == 1);

        source.cancel();
        assertTrue(source.awaitTermination(WAIT));

        Consumer<byte[]> consumer = consumers.get(0);
        InOrder order = inOrder(consumer);
        order.verify(consumer).unsubscribe();
        order.verify(consumer).close();
    }

    @Test
    void acknowledgeGoesToTheCurrentConsumer() throws Exception {
        source = PulsarSourcePlugin.build(config(false), MetricsRuntime.NOOP, "persistent://t/ns/orders",
                this::nextConsumer, PulsarFixtures::schema, mock(AutoCloseable.class));
        source.start();
        await().atMost(WAIT).until(() -> consumers.size() == 1);

        MessageId id = mock(MessageId.class);
        source.acknowledge(id);

        verify(consumers.get(0)).acknowledge(id);
    }

    @Test
    void acknowledgeIsRejectedWithAutoAck() {
        source = PulsarSourcePlugin.build(config(true), MetricsRuntime.NOOP, "persistent://t/ns/orders",
                this::nextConsumer, PulsarFixtures::schema, mock(AutoCloseable.class));

        assertThrows(IllegalStateException.class, () -> source.acknowledge(mock(MessageId.class)));
    }

    @Test
    void missingSchemaFailsAtStartup() throws Exception {
        AutoCloseable client = mock(AutoCloseable.class);
        source = PulsarSourcePlugin.build(config(false), MetricsRuntime.NOOP, "persistent://t/ns/orders",
                this::nextConsumer,
                () -> {
                    throw new IOException("Schema request failed with HTTP 404");
                },
                client);
        source.start();

        assertTrue(source.awaitTermination(WAIT));
        SourceFailedException e = assertThrows(SourceFailedException.class, () -> source.events().poll(WAIT));
        assertInstanceOf(ConnectionConstructionException.class, e.getCause());
        assertTrue(consumers.isEmpty());
        verify(client).close();
    }
}
