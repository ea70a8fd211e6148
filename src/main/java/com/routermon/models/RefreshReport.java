package com.routermon.models;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;

import java.util.List;

/**
 * Result of a refresh cycle. errors holds one "feature: message" line per isolated failure.
 */
public class RefreshReport
{

    public final String deviceId;

    public RefreshOutcome outcome = RefreshOutcome.NOT_PROCESSED;

    public final List<String> errors = new ArrayList<>();

    public long durationMs;

    public RefreshReport(String deviceId)
    {
        this.deviceId = deviceId;
    }

    public static RefreshReport of(String deviceId, RefreshOutcome outcome)
    {
        var report = new RefreshReport(deviceId);

        report.outcome = outcome;

        return report;
    }

    public void addError(String feature, String message)
    {
        errors.add(feature + ": " + message);
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("device_id", deviceId)
            .put("outcome", outcome.name())
            .put("errors", new JsonArray(new ArrayList<>(errors)))
            .put("duration_ms", durationMs);
    }

}
