/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.plugins;

import com.intuitivedesigns.streamwatch.config.WatchConfig;
import com.intuitivedesigns.streamwatch.core.SourceFailedException;
import com.intuitivedesigns.streamwatch.core.StreamEvent;
import com.intuitivedesigns.streamwatch.metrics.MetricsRuntime;
import com.intuitivedesigns.streamwatch.source.ResilientSource;
import com.intuitivedesigns.streamwatch.source.SourceState;
import com.intuitivedesigns.streamwatch.spi.ServicePluginRegistry;
import com.intuitivedesigns.streamwatch.spi.SourcePlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.StreamEntryID;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.params.XReadParams;
import redis.clients.jedis.resps.StreamEntry;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

class RedisStreamSourcePluginTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final List<Jedis> connections = new CopyOnWriteArrayList<>();
    private ResilientSource<StreamEntry, StreamEvent<Map<String, String>>> source;

    @AfterEach
    void tearDown() {
        if (source != null) source.cancel();
    }

    private static WatchConfig config() {
        Map<String, String> m = new HashMap<>();
        m.put("source.redis.stream", "orders");
        m.put("source.idle.interval.ms", "10");
        m.put("source.backoff.type", "FIXED");
        m.put("source.backoff.base.ms", "10");
        return WatchConfig.of(m);
    }

    private static StreamEntry entry(long time, String sku) {
        return new StreamEntry(new StreamEntryID(time, 0), Map.of("sku", sku));
    }

    private static List<Map.Entry<String, List<StreamEntry>>> reply(StreamEntry e) {
        return List.of(Map.entry("orders", List.of(e)));
    }

    private Jedis connection() {
        Jedis jedis = mock(Jedis.class);
        connections.add(jedis);
        return jedis;
    }

    @Test
    void isDiscoveredThroughServiceLoader() {
        ServicePluginRegistry<SourcePlugin> registry = new ServicePluginRegistry<>(SourcePlugin.class);
        assertTrue(registry.get("redis_stream").isPresent());
    }

    @Test
    void reconnectResumesAfterTheLastDeliveredEntry() throws Exception {
        AutoCloseable pool = mock(AutoCloseable.class);
        source = RedisStreamSourcePlugin.build(config(), MetricsRuntime.NOOP, () -> {
            Jedis jedis = connection();
            if (connections.size() == 1) {
                when(jedis.xread(any(XReadParams.class), anyMap()))
                        .thenReturn(reply(entry(1, "A-1")))
                        .thenThrow(new JedisConnectionException("Unexpected end of stream."));
            } else {
                when(jedis.xread(any(XReadParams.class), anyMap()))
                        .thenReturn(reply(entry(2, "A-2")))
                        .thenReturn(null);
            }
            return jedis;
        }, pool);
        source.start();

        assertEquals("1-0", source.events().poll(WAIT).orElseThrow().id());
        StreamEvent<Map<String, String>> second = source.events().poll(WAIT).orElseThrow();
        assertEquals("2-0", second.id());
        assertEquals("A-2", second.data().get("sku"));
        assertEquals("redis:orders", source.name());

        verify(connections.get(0)).close();
        verify(connections.get(1)).xread(any(XReadParams.class), eq(Map.of("orders", new StreamEntryID(1, 0))));

        source.cancel();
        assertTrue(source.awaitTermination(WAIT));
        verify(pool).close();
    }

    @Test
    void serverErrorReplyFailsTheSource() throws Exception {
        source = RedisStreamSourcePlugin.build(config(), MetricsRuntime.NOOP, () -> {
            Jedis jedis = connection();
            when(jedis.xread(any(XReadParams.class), anyMap()))
                    .thenThrow(new JedisDataException("WRONGTYPE Operation against a key holding the wrong kind of value"));
            return jedis;
        }, mock(AutoCloseable.class));
        source.start();

        assertTrue(source.awaitTermination(WAIT));
        assertEquals(SourceState.FAILED, source.state());
        SourceFailedException e = assertThrows(SourceFailedException.class, () -> source.events().poll(WAIT));
        assertInstanceOf(JedisDataException.class, e.getCause());
        assertEquals(1, connections.size());
    }

    @Test
    void streamKeyIsRequired() {
        WatchConfig empty = WatchConfig.of(Map.of());
        assertThrows(IllegalArgumentException.class,
                () -> RedisStreamSourcePlugin.build(empty, MetricsRuntime.NOOP, this::connection, mock(AutoCloseable.class)));
    }
}
