package com.routermon.models;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;

import java.util.List;

/**
 * Sessions that appeared and disappeared between two snapshots.
 */
public class SessionDiff
{

    public final List<ActiveSession> connected = new ArrayList<>();

    public final List<ActiveSession> disconnected = new ArrayList<>();

    public List<String> connectedKeys()
    {
        return connected.stream().map(session -> session.sessionKey).toList();
    }

    public List<String> disconnectedKeys()
    {
        return disconnected.stream().map(session -> session.sessionKey).toList();
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("connected", new JsonArray(connectedKeys()))
            .put("disconnected", new JsonArray(disconnectedKeys()));
    }

}
