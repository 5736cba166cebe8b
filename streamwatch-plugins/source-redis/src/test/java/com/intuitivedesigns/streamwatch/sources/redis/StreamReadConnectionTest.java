/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.redis;

import com.intuitivedesigns.streamwatch.core.ConnectionHandle;
import com.intuitivedesigns.streamwatch.core.ConnectionListener;
import com.intuitivedesigns.streamwatch.core.DeliveryMode;
import com.intuitivedesigns.streamwatch.core.ReceiveResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.StreamEntryID;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.params.XReadParams;
import redis.clients.jedis.resps.StreamEntry;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StreamReadConnectionTest {

    @Mock
    Jedis jedis;

    @Mock
    ConnectionListener<StreamEntry> listener;

    static StreamEntry entry(long time, String value) {
        return new StreamEntry(new StreamEntryID(time, 0), Map.of("value", value));
    }

    static List<Map.Entry<String, List<StreamEntry>>> reply(StreamEntry... entries) {
        return List.of(Map.entry("orders", Arrays.asList(entries)));
    }

    private ConnectionHandle<StreamEntry> open(StreamCursor cursor) {
        return new RedisStreamFactory("orders", () -> jedis, cursor, 3, Duration.ofMillis(100)).open(listener);
    }

    @Test
    void readsAreBufferedAndHandedOutOnePerPull() throws Exception {
        StreamCursor cursor = StreamCursor.from("0-0");
        when(jedis.xread(any(XReadParams.class), anyMap()))
                .thenReturn(reply(entry(1, "a"), entry(2, "b"), entry(3, "c")));
        ConnectionHandle<StreamEntry> handle = open(cursor);

        assertEquals(DeliveryMode.PULL, handle.mode());
        assertEquals("a", handle.receive().value().getFields().get("value"));
        assertEquals(new StreamEntryID(1, 0), cursor.position());
        assertEquals("b", handle.receive().value().getFields().get("value"));
        assertEquals("c", handle.receive().value().getFields().get("value"));
        assertEquals(new StreamEntryID(3, 0), cursor.position());

        verify(jedis, times(1)).xread(any(XReadParams.class), anyMap());
    }

    @Test
    void readStartsAfterTheCursor() throws Exception {
        StreamCursor cursor = StreamCursor.from("1700000000000-4");
        when(jedis.xread(any(XReadParams.class), anyMap())).thenReturn(null);

        assertTrue(open(cursor).receive().isEmpty());

        verify(jedis).xread(any(XReadParams.class), eq(Map.of("orders", new StreamEntryID(1700000000000L, 4))));
    }

    @Test
    void dollarStartsFromNewEntriesThenResumesFromTheLastSeenId() throws Exception {
        StreamCursor cursor = StreamCursor.from("$");
        assertEquals(StreamEntryID.LAST_ENTRY, cursor.position());
        when(jedis.xread(any(XReadParams.class), anyMap())).thenReturn(reply(entry(5, "new")), (List<Map.Entry<String, List<StreamEntry>>>) null);
        ConnectionHandle<StreamEntry> handle = open(cursor);

        assertEquals("new", handle.receive().value().getFields().get("value"));
        assertTrue(handle.receive().isEmpty());

        verify(jedis).xread(any(XReadParams.class), eq(Map.of("orders", StreamEntryID.LAST_ENTRY)));
        verify(jedis).xread(any(XReadParams.class), eq(Map.of("orders", new StreamEntryID(5, 0))));
    }

    @Test
    void malformedStartIdIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> StreamCursor.from("latest"));
        assertTrue(e.getMessage().contains("latest"));
    }

    @Test
    void expiredBlockIsEmpty() throws Exception {
        when(jedis.xread(any(XReadParams.class), anyMap())).thenReturn(null);
        ReceiveResult<StreamEntry> r = open(StreamCursor.from("0-0")).receive();
        assertTrue(r.isEmpty());
    }

    @Test
    void readFailurePropagates() throws Exception {
        when(jedis.xread(any(XReadParams.class), anyMap())).thenThrow(new JedisConnectionException("Unexpected end of stream."));
        ConnectionHandle<StreamEntry> handle = open(StreamCursor.from("0-0"));
        assertThrows(JedisConnectionException.class, handle::receive);
    }

    @Test
    void livenessNeedsAConnectedUnbrokenClient() throws Exception {
        when(jedis.isConnected()).thenReturn(true, true, false);
        when(jedis.isBroken()).thenReturn(false, true);
        ConnectionHandle<StreamEntry> handle = open(StreamCursor.from("0-0"));

        assertTrue(handle.isActive());
        assertFalse(handle.isActive());
        assertFalse(handle.isActive());
    }

    @Test
    void closeReturnsTheConnectionAndNeverThrows() throws Exception {
        doThrow(new JedisConnectionException("pool closed")).when(jedis).close();
        ConnectionHandle<StreamEntry> handle = open(StreamCursor.from("0-0"));

        assertDoesNotThrow(handle::close);
        verify(jedis).close();
    }

    @Test
    void nullFromOpenerIsRejected() {
        RedisStreamFactory factory = new RedisStreamFactory("orders", () -> null, StreamCursor.from("0-0"), 1, Duration.ZERO);
        assertThrows(IllegalStateException.class, () -> factory.open(listener));
    }

    @Test
    void countMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new RedisStreamFactory("orders", () -> jedis, StreamCursor.from("0-0"), 0, Duration.ZERO));
    }
}
