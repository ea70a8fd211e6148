package com.routermon.services;

import io.vertx.core.Future;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

/**
 * DeviceService - Read access to the device registry plus the status columns this engine owns

 * This interface provides:
 * - Device lookup by id and listing of monitored devices
 * - Online/offline transitions with last_seen and identity refresh
 */
public interface DeviceService
{

    /**
     * Get a device by id.
     *
     * @param deviceId Device ID
     * @return Future containing the device JSON, or {"found": false}
     */
    Future<JsonObject> deviceGetById(String deviceId);

    /**
     * List every device with monitoring enabled, including those in maintenance.
     *
     * @return Future containing JsonArray of device JSON
     */
    Future<JsonArray> deviceListMonitored();

    /**
     * Mark a device online, stamp last_seen and store identity fields.
     * Null identity fields keep the stored value.
     *
     * @param deviceId Device ID
     * @param identity identity JSON (identity, version, model, serial_number, board_name, architecture)
     * @return Future containing JsonObject with update result
     */
    Future<JsonObject> deviceMarkOnline(String deviceId, JsonObject identity);

    /**
     * Mark a device offline. last_seen is left untouched.
     *
     * @param deviceId Device ID
     * @return Future containing JsonObject with update result
     */
    Future<JsonObject> deviceMarkOffline(String deviceId);

}
