package com.routermon.services;

import io.vertx.core.Future;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * AlertService - Append-only alert storage

 * This interface provides:
 * - Alert creation
 * - Latest-alert lookup by dedup key (device, target, type) within a time window
 * - Alert listing per device
 */
public interface AlertService
{

    /**
     * @param alertData device_id, type, target, state, severity, title, message
     * @return Future containing the created alert JSON
     */
    Future<JsonObject> alertCreate(JsonObject alertData);

    /**
     * Most recent alert with the given key created at or after since.
     *
     * @param deviceId Device ID
     * @param target dedup target
     * @param type alert type value
     * @param since window start
     * @return Future containing the alert JSON, or {"found": false}
     */
    Future<JsonObject> alertFindLatest(String deviceId, String target, String type, Instant since);

}
