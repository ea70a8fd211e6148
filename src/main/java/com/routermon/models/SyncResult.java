package com.routermon.models;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;

import java.util.List;

/**
 * Outcome of a netwatch reconciliation: entries persisted plus per-entry error strings.
 */
public class SyncResult
{

    public int synced;

    public final List<String> errors = new ArrayList<>();

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("synced", synced)
            .put("errors", new JsonArray(new ArrayList<>(errors)));
    }

}
