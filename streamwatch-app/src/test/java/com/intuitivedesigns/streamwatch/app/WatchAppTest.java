/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.app;

import com.intuitivedesigns.streamwatch.core.EventSource;
import com.intuitivedesigns.streamwatch.core.EventStream;
import com.intuitivedesigns.streamwatch.core.SourceFailedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WatchAppTest {

    @Mock
    EventSource<String> source;

    @Mock
    EventStream<String> events;

    @Test
    void completedSourceExitsCleanly() throws Exception {
        when(source.name()).thenReturn("redis:orders");
        when(source.events()).thenReturn(events);
        when(events.take()).thenReturn(Optional.of("a"), Optional.of("b"), Optional.empty());

        assertEquals(0, WatchApp.consume(source));

        verify(source).start();
        verify(events, times(3)).take();
    }

    @Test
    void failedSourceExitsWithOne() throws Exception {
        when(source.name()).thenReturn("redis:orders");
        when(source.events()).thenReturn(events);
        when(events.take())
                .thenReturn(Optional.of("a"))
                .thenThrow(new SourceFailedException("redis:orders", new IOException("refused")));

        assertEquals(1, WatchApp.consume(source));
    }

    @Test
    void shutdownHookCancelsAndWaitsOnce() throws Exception {
        when(source.name()).thenReturn("redis:orders");
        when(source.awaitTermination(any(Duration.class))).thenReturn(true);

        Thread hook = WatchApp.shutdownHook(source, Duration.ofSeconds(1));
        hook.run();
        hook.run();

        InOrder order = inOrder(source);
        order.verify(source).cancel();
        order.verify(source).awaitTermination(Duration.ofSeconds(1));
        verify(source, times(1)).cancel();
    }
}
