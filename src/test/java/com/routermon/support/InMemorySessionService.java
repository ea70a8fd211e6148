package com.routermon.support;

import com.routermon.services.SessionService;

import io.vertx.core.Future;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import java.time.Clock;

import java.util.LinkedHashMap;

import java.util.Map;

public class InMemorySessionService implements SessionService
{

    private final Map<String, Map<String, JsonObject>> sessions = new LinkedHashMap<>();

    private final Clock clock;

    public InMemorySessionService(Clock clock)
    {
        this.clock = clock;
    }

    public Map<String, JsonObject> sessions(String deviceId)
    {
        return sessions.getOrDefault(deviceId, Map.of());
    }

    @Override
    public synchronized Future<JsonArray> sessionListByDevice(String deviceId)
    {
        var rows = new JsonArray();

        sessions(deviceId).values().forEach(row -> rows.add(row.copy()));

        return Future.succeededFuture(rows);
    }

    @Override
    public synchronized Future<JsonObject> sessionReplaceAll(String deviceId, JsonArray current)
    {
        var previous = sessions(deviceId);

        var replaced = new LinkedHashMap<String, JsonObject>();

        var now = clock.instant().toString();

        for (var entry : current)
        {
            var session = ((JsonObject) entry).copy();

            var key = session.getString("session_key");

            var existing = previous.get(key);

            session.put("connected_at", existing != null ? existing.getString("connected_at") : now);

            session.put("last_seen", now);

            replaced.put(key, session);
        }

        var deleted = previous.keySet().stream().filter(key -> !replaced.containsKey(key)).count();

        sessions.put(deviceId, replaced);

        return Future.succeededFuture(new JsonObject()
            .put("success", true)
            .put("deleted", deleted)
            .put("upserted", replaced.size()));
    }

}
