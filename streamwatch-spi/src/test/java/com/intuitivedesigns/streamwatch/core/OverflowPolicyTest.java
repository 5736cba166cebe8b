/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OverflowPolicyTest {

    @Test
    void parsesKnownPolicies() {
        assertEquals(OverflowPolicy.FAIL, OverflowPolicy.parse("fail"));
        assertEquals(OverflowPolicy.DROP_OLDEST, OverflowPolicy.parse(" drop-oldest "));
        assertEquals(OverflowPolicy.DROP_NEWEST, OverflowPolicy.parse("DROP_NEWEST"));
    }

    @Test
    void backpressureIsUnsupported() {
        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> OverflowPolicy.parse("backpressure"));
        assertEquals("Overflow policy BACKPRESSURE is not supported", e.getMessage());
    }

    @Test
    void unknownIsIllegal() {
        assertThrows(IllegalArgumentException.class, () -> OverflowPolicy.parse("spill"));
        assertThrows(IllegalArgumentException.class, () -> OverflowPolicy.parse(null));
    }
}
