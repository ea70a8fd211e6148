package com.routermon.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterOsValueParserTest
{

    @Test
    void latencyUnitsConvertToWholeMilliseconds()
    {
        assertEquals(1, RouterOsValueParser.parseLatencyMs("956us"));

        assertEquals(10, RouterOsValueParser.parseLatencyMs("10ms"));

        assertEquals(1000, RouterOsValueParser.parseLatencyMs("1s"));

        assertEquals(23, RouterOsValueParser.parseLatencyMs("23"));

        assertEquals(12, RouterOsValueParser.parseLatencyMs("12ms340us"));
    }

    @Test
    void microsecondsAreFlooredButNeverBelowOne()
    {
        assertEquals(1, RouterOsValueParser.parseLatencyMs("1µs"));

        assertEquals(2, RouterOsValueParser.parseLatencyMs("2999us"));

        assertEquals(13, RouterOsValueParser.parseLatencyMs("12ms1500us"));
    }

    @Test
    void unparseableLatencyIsNull()
    {
        assertNull(RouterOsValueParser.parseLatencyMs(null));

        assertNull(RouterOsValueParser.parseLatencyMs(""));

        assertNull(RouterOsValueParser.parseLatencyMs("timeout"));

        assertNull(RouterOsValueParser.parseLatencyMs("10ms lost"));
    }

    @Test
    void durationsInEveryRouterOsForm()
    {
        assertEquals(788645L, RouterOsValueParser.parseDurationSeconds("1w2d3h4m5s"));

        assertEquals(90L, RouterOsValueParser.parseDurationSeconds("1m30s"));

        assertEquals(90L, RouterOsValueParser.parseDurationSeconds("00:01:30"));

        assertEquals(93784L, RouterOsValueParser.parseDurationSeconds("1d02:03:04"));

        assertEquals(45L, RouterOsValueParser.parseDurationSeconds("45"));

        assertEquals(1L, RouterOsValueParser.parseDurationSeconds("500ms"));

        assertNull(RouterOsValueParser.parseDurationSeconds("soon"));
    }

    @Test
    void intervalFallsBackToDefaultWhenUnparseable()
    {
        assertNull(RouterOsValueParser.parseIntervalSeconds(null));

        assertEquals(10, RouterOsValueParser.parseIntervalSeconds("10s"));

        assertEquals(60, RouterOsValueParser.parseIntervalSeconds("00:01:00"));

        assertEquals(RouterOsValueParser.DEFAULT_INTERVAL_SECONDS, RouterOsValueParser.parseIntervalSeconds("often"));
    }

    @Test
    void flagsAndNumbers()
    {
        assertTrue(RouterOsValueParser.parseBoolean("true"));

        assertTrue(RouterOsValueParser.parseBoolean("yes"));

        assertFalse(RouterOsValueParser.parseBoolean("false"));

        assertFalse(RouterOsValueParser.parseBoolean(null));

        assertEquals(47.0, RouterOsValueParser.parseDouble("47C"));

        assertEquals(24.1, RouterOsValueParser.parseDouble("24.1V"));

        assertEquals(7L, RouterOsValueParser.parseLong("oops", 7));

        assertEquals(3, RouterOsValueParser.parseInt("2.6", 0));
    }

}
