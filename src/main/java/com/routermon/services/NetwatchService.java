package com.routermon.services;

import io.vertx.core.Future;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

/**
 * NetwatchService - Watch target persistence keyed by (device, host)
 */
public interface NetwatchService
{

    /**
     * @param deviceId Device ID
     * @return Future containing JsonArray of watch target JSON
     */
    Future<JsonArray> netwatchListByDevice(String deviceId);

    /**
     * Insert or update a watch target by host. Every column in targetData is written as given.
     *
     * @param deviceId Device ID
     * @param targetData host, name, disabled, status, last_up, last_down, last_check, interval_seconds
     * @return Future containing JsonObject with upsert result
     */
    Future<JsonObject> netwatchUpsert(String deviceId, JsonObject targetData);

    /**
     * Record the latest probe result for a target.
     *
     * @param deviceId Device ID
     * @param host watched host
     * @param latencyMs latency, null when unmeasured
     * @param packetLoss loss percentage
     * @return Future containing JsonObject with update result
     */
    Future<JsonObject> netwatchUpdateProbe(String deviceId, String host, Integer latencyMs, int packetLoss);

    /**
     * @param deviceId Device ID
     * @param host watched host
     * @return Future containing JsonObject with deletion result
     */
    Future<JsonObject> netwatchDelete(String deviceId, String host);

}
