/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logshipper.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ShipperConfigTest {

    private final ShipperConfig config = ShipperConfig.fromMap(Map.of(
            "listen.port", " 5000 ",
            "backoff.factor", "1.5",
            "verbose", "TRUE",
            "amqp.host", "   ",
            "rpc.batch.size", "lots"));

    @Test
    void testTypedGettersWithDefaults() {
        assertEquals(5000, config.getInt("listen.port", 1));
        assertEquals(1.5, config.getDouble("backoff.factor", 2.0));
        assertTrue(config.getBoolean("verbose", false));
        assertEquals(42L, config.getLong("missing", 42L));
        assertEquals("x", config.getString("missing", "x"));
    }

    @Test
    void testMalformedNumberFallsBackToDefault() {
        assertEquals(100, config.getInt("rpc.batch.size", 100));
    }

    @Test
    void testBlankValueDoesNotCountAsPresent() {
        assertFalse(config.hasPath("amqp.host"));
        assertTrue(config.hasPath("listen.port"));
        assertTrue(config.keys().contains("amqp.host"));
    }
}
