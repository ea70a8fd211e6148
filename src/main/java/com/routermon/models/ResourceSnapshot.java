package com.routermon.models;

import io.vertx.core.json.JsonObject;

/**
 * System resources sampled during a full sync.
 * Missing optional values stay at 0 (counters) or null (health sensors).
 */
public class ResourceSnapshot
{

    public int cpuLoad;

    public int cpuCount;

    public int cpuFrequency;

    public long totalMemory;

    public long freeMemory;

    public long totalDisk;

    public long freeDisk;

    public long uptimeSeconds;

    public Double boardTemp;

    public Double voltage;

    public long usedMemory()
    {
        return Math.max(0, totalMemory - freeMemory);
    }

    public long usedDisk()
    {
        return Math.max(0, totalDisk - freeDisk);
    }

    /**
     * @return used memory as a whole percentage, 0 when total memory is unknown
     */
    public int memoryUsagePercent()
    {
        if (totalMemory <= 0)
        {
            return 0;
        }

        return (int) Math.round(usedMemory() * 100.0 / totalMemory);
    }

    /**
     * Converts to the metricsCreate payload.
     *
     * @param deviceId owning device
     * @return metrics JSON
     */
    public JsonObject toMetricsJson(String deviceId)
    {
        return new JsonObject()
            .put("device_id", deviceId)
            .put("cpu_load", cpuLoad)
            .put("cpu_count", cpuCount)
            .put("cpu_frequency", cpuFrequency)
            .put("total_memory", totalMemory)
            .put("used_memory", usedMemory())
            .put("free_memory", freeMemory)
            .put("total_disk", totalDisk)
            .put("used_disk", usedDisk())
            .put("free_disk", freeDisk)
            .put("uptime_seconds", uptimeSeconds)
            .put("board_temp", boardTemp)
            .put("voltage", voltage);
    }

}
