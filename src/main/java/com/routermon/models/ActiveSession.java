package com.routermon.models;

import io.vertx.core.json.JsonObject;

/**
 * A subscriber session from /ppp/active/print, keyed by the remote username.
 */
public class ActiveSession
{

    public String sessionKey;            // ppp name

    public String service;

    public String callerId;

    public String address;

    public String remoteId;              // ppp session-id

    public String uptime;

    public String connectedAt;           // ISO-8601, only for persisted sessions

    public static ActiveSession fromJson(JsonObject data)
    {
        var session = new ActiveSession();

        session.sessionKey = data.getString("session_key");

        session.service = data.getString("service");

        session.callerId = data.getString("caller_id");

        session.address = data.getString("address");

        session.remoteId = data.getString("remote_id");

        session.uptime = data.getString("uptime");

        session.connectedAt = data.getString("connected_at");

        return session;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("session_key", sessionKey)
            .put("service", service)
            .put("caller_id", callerId)
            .put("address", address)
            .put("remote_id", remoteId)
            .put("uptime", uptime)
            .put("connected_at", connectedAt);
    }

}
