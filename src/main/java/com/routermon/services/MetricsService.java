package com.routermon.services;

import io.vertx.core.Future;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

/**
 * MetricsService - Metric snapshots and interface state

 * This interface provides:
 * - Append-only metric snapshot creation and retrieval
 * - Interface state listing and upsert keyed by (device, interface name)
 */
public interface MetricsService
{

    /**
     * Store a metric snapshot.
     *
     * @param metricsData device_id, cpu_load, cpu_count, cpu_frequency, total/used/free memory and disk, uptime_seconds, board_temp, voltage
     * @return Future containing JsonObject with creation result
     */
    Future<JsonObject> metricsCreate(JsonObject metricsData);

    /**
     * All persisted interfaces of a device.
     *
     * @param deviceId Device ID
     * @return Future containing JsonArray of interface JSON
     */
    Future<JsonArray> interfaceListByDevice(String deviceId);

    /**
     * Insert or update one interface row by (device_id, name).
     *
     * @param deviceId Device ID
     * @param interfaceData interface JSON including counters, derived rates and last_updated
     * @return Future containing JsonObject with upsert result
     */
    Future<JsonObject> interfaceUpsert(String deviceId, JsonObject interfaceData);

}
