package com.routermon.models;

import io.vertx.core.json.JsonObject;

/**
 * Which parts of a refresh cycle to run for one device.
 */
public class RefreshRequest
{

    public String deviceId;

    public boolean fullSync;

    public boolean includeNetwatch;

    public boolean includeProbes;

    public boolean includeSessions;

    public RefreshRequest(String deviceId, boolean fullSync, boolean includeNetwatch,
                          boolean includeProbes, boolean includeSessions)
    {
        this.deviceId = deviceId;

        this.fullSync = fullSync;

        this.includeNetwatch = includeNetwatch;

        this.includeProbes = includeProbes;

        this.includeSessions = includeSessions;
    }

    /**
     * Parses a device.refresh message body. Missing flags default to true, except full_sync.
     *
     * @param data request JSON
     * @return RefreshRequest
     */
    public static RefreshRequest fromJson(JsonObject data)
    {
        return new RefreshRequest(
            data.getString("device_id"),
            data.getBoolean("full_sync", false),
            data.getBoolean("include_netwatch", true),
            data.getBoolean("include_probes", true),
            data.getBoolean("include_sessions", true));
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("device_id", deviceId)
            .put("full_sync", fullSync)
            .put("include_netwatch", includeNetwatch)
            .put("include_probes", includeProbes)
            .put("include_sessions", includeSessions);
    }

}
