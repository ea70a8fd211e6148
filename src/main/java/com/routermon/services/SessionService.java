package com.routermon.services;

import io.vertx.core.Future;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

/**
 * SessionService - Active subscriber sessions keyed by (device, session_key)
 */
public interface SessionService
{

    /**
     * @param deviceId Device ID
     * @return Future containing JsonArray of persisted sessions
     */
    Future<JsonArray> sessionListByDevice(String deviceId);

    /**
     * Replace the persisted set with exactly the given sessions, in one transaction.
     * Retained sessions keep connected_at and get last_seen refreshed.
     *
     * @param deviceId Device ID
     * @param sessions current sessions (session_key, service, caller_id, address, remote_id, uptime)
     * @return Future containing JsonObject with inserted/updated/deleted counts
     */
    Future<JsonObject> sessionReplaceAll(String deviceId, JsonArray sessions);

}
