package com.routermon.models;

import io.vertx.core.json.JsonObject;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertFalse;

import static org.junit.jupiter.api.Assertions.assertTrue;

class RefreshRequestTest
{

    @Test
    void missingFlagsDefaultToLightCycleWithAllFeatures()
    {
        var request = RefreshRequest.fromJson(new JsonObject().put("device_id", "abc"));

        assertEquals("abc", request.deviceId);

        assertFalse(request.fullSync);

        assertTrue(request.includeNetwatch);

        assertTrue(request.includeProbes);

        assertTrue(request.includeSessions);
    }

    @Test
    void reportListsErrorsPerFeature()
    {
        var report = new RefreshReport("abc");

        report.outcome = RefreshOutcome.PARTIAL;

        report.addError("netwatch", "no such command prefix");

        var json = report.toJson();

        assertEquals("PARTIAL", json.getString("outcome"));

        assertEquals("netwatch: no such command prefix", json.getJsonArray("errors").getString(0));
    }

}
