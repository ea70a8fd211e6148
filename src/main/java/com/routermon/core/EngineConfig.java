package com.routermon.core;

import com.routermon.models.AlertType;

import io.vertx.core.json.JsonObject;

import java.time.Duration;

import java.time.ZoneId;

/**
 * EngineConfig - Typed view over the monitoring sections of application.conf

 * HOCON parses dotted keys as nested objects (connect.timeout.ms becomes
 * connect -> timeout -> ms), so every value is read through its nested path.

 * Sections:
 * - routeros: port, connect/command timeouts, device time zone
 * - polling: periodic trigger interval, full sync cadence, feature toggles
 * - probe: concurrency, per-probe timeout, ping count, latency threshold
 * - alerts: global switch, dedup window, notifier, category toggles, thresholds
 * - security: key used to decrypt device secrets
 */
public class EngineConfig
{

    private final int routerOsPort;

    private final long connectTimeoutMs;

    private final long commandTimeoutMs;

    private final ZoneId deviceZone;

    private final int pollingIntervalSeconds;

    private final int fullSyncEvery;

    private final int refreshInstances;

    private final boolean netwatchEnabled;

    private final boolean probesEnabled;

    private final boolean sessionsEnabled;

    private final int probeConcurrency;

    private final long probeTimeoutMs;

    private final int probeCount;

    private final int latencyThresholdMs;

    private final boolean alertsEnabled;

    private final Duration dedupWindow;

    private final String notifyAddress;

    private final long notifyTimeoutMs;

    private final JsonObject alertsConfig;

    private final int cpuWarning;

    private final int cpuCritical;

    private final int memoryWarning;

    private final int memoryCritical;

    private final String secretKey;

    /**
     * @param config full application configuration (missing sections fall back to defaults)
     */
    public EngineConfig(JsonObject config)
    {
        var routerOs = config.getJsonObject("routeros", new JsonObject());

        var polling = config.getJsonObject("polling", new JsonObject());

        var probe = config.getJsonObject("probe", new JsonObject());

        alertsConfig = config.getJsonObject("alerts", new JsonObject());

        var security = config.getJsonObject("security", new JsonObject());

        routerOsPort = routerOs.getInteger("port", 8728);

        connectTimeoutMs = nested(routerOs, "connect", "timeout").getLong("ms", 5000L);

        commandTimeoutMs = nested(routerOs, "command", "timeout").getLong("ms", 15000L);

        deviceZone = ZoneId.of(routerOs.getString("timezone", "UTC"));

        pollingIntervalSeconds = nested(polling, "interval").getInteger("seconds", 60);

        fullSyncEvery = Math.max(1, nested(polling, "full", "sync").getInteger("every", 5));

        refreshInstances = Math.max(1, polling.getInteger("instances", Runtime.getRuntime().availableProcessors()));

        netwatchEnabled = nested(polling, "netwatch").getBoolean("enabled", true);

        probesEnabled = nested(polling, "probes").getBoolean("enabled", true);

        sessionsEnabled = nested(polling, "sessions").getBoolean("enabled", true);

        probeConcurrency = Math.max(1, probe.getInteger("concurrency", 5));

        probeTimeoutMs = nested(probe, "timeout").getLong("ms", 5000L);

        probeCount = probe.getInteger("count", 3);

        latencyThresholdMs = nested(probe, "latency", "threshold").getInteger("ms", 100);

        alertsEnabled = alertsConfig.getBoolean("enabled", true);

        dedupWindow = Duration.ofMinutes(nested(alertsConfig, "dedup", "window").getLong("minutes", 30L));

        notifyAddress = nested(alertsConfig, "notify").getString("address", "alert.notify");

        notifyTimeoutMs = nested(alertsConfig, "notify", "timeout").getLong("ms", 5000L);

        cpuWarning = nested(alertsConfig, "cpu").getInteger("warning", 70);

        cpuCritical = nested(alertsConfig, "cpu").getInteger("critical", 90);

        memoryWarning = nested(alertsConfig, "memory").getInteger("warning", 80);

        memoryCritical = nested(alertsConfig, "memory").getInteger("critical", 95);

        secretKey = nested(security, "secret").getString("key", "routermon-default-secret-change-me");
    }

    private static JsonObject nested(JsonObject root, String... keys)
    {
        var current = root;

        for (var key : keys)
        {
            var value = current.getValue(key);

            if (!(value instanceof JsonObject child))
            {
                return new JsonObject();
            }

            current = child;
        }

        return current;
    }

    /**
     * Per-category alert switch (alerts.status.change, alerts.high.cpu, ...). Defaults to enabled.
     *
     * @param type alert category
     * @return true when alerts of this category may be emitted
     */
    public boolean isAlertCategoryEnabled(AlertType type)
    {
        if (type == AlertType.STATUS_CHANGE)
        {
            return nested(alertsConfig, "status").getBoolean("change", true);
        }
        else if (type == AlertType.HIGH_CPU)
        {
            return nested(alertsConfig, "high").getBoolean("cpu", true);
        }
        else if (type == AlertType.HIGH_MEMORY)
        {
            return nested(alertsConfig, "high").getBoolean("memory", true);
        }
        else if (type == AlertType.WATCH_STATUS)
        {
            return nested(alertsConfig, "watch").getBoolean("status", true);
        }
        else if (type == AlertType.PERFORMANCE)
        {
            return alertsConfig.getBoolean("performance", true);
        }
        else
        {
            return alertsConfig.getBoolean("session", true);
        }
    }

    public int getRouterOsPort()
    {
        return routerOsPort;
    }

    public long getConnectTimeoutMs()
    {
        return connectTimeoutMs;
    }

    public long getCommandTimeoutMs()
    {
        return commandTimeoutMs;
    }

    public ZoneId getDeviceZone()
    {
        return deviceZone;
    }

    public int getPollingIntervalSeconds()
    {
        return pollingIntervalSeconds;
    }

    public int getFullSyncEvery()
    {
        return fullSyncEvery;
    }

    /**
     * Number of RefreshVerticle instances; each owns an event loop and a shard of the devices.
     */
    public int getRefreshInstances()
    {
        return refreshInstances;
    }

    public boolean isNetwatchEnabled()
    {
        return netwatchEnabled;
    }

    public boolean isProbesEnabled()
    {
        return probesEnabled;
    }

    public boolean isSessionsEnabled()
    {
        return sessionsEnabled;
    }

    public int getProbeConcurrency()
    {
        return probeConcurrency;
    }

    public long getProbeTimeoutMs()
    {
        return probeTimeoutMs;
    }

    public int getProbeCount()
    {
        return probeCount;
    }

    public int getLatencyThresholdMs()
    {
        return latencyThresholdMs;
    }

    public boolean isAlertsEnabled()
    {
        return alertsEnabled;
    }

    public Duration getDedupWindow()
    {
        return dedupWindow;
    }

    public String getNotifyAddress()
    {
        return notifyAddress;
    }

    public long getNotifyTimeoutMs()
    {
        return notifyTimeoutMs;
    }

    public int getCpuWarning()
    {
        return cpuWarning;
    }

    public int getCpuCritical()
    {
        return cpuCritical;
    }

    public int getMemoryWarning()
    {
        return memoryWarning;
    }

    public int getMemoryCritical()
    {
        return memoryCritical;
    }

    public String getSecretKey()
    {
        return secretKey;
    }

}
