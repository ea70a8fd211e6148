package com.routermon.support;

import com.routermon.services.NotificationDispatcher;

import io.vertx.core.Future;

import io.vertx.core.json.JsonObject;

import java.util.ArrayList;

import java.util.List;

public class RecordingNotificationDispatcher implements NotificationDispatcher
{

    private final List<JsonObject> payloads = new ArrayList<>();

    private boolean failing;

    public RecordingNotificationDispatcher failing()
    {
        this.failing = true;

        return this;
    }

    public List<JsonObject> payloads()
    {
        return payloads;
    }

    @Override
    public synchronized Future<Void> dispatch(JsonObject payload)
    {
        payloads.add(payload);

        if (failing)
        {
            return Future.failedFuture("notifier unavailable");
        }

        return Future.succeededFuture();
    }

}
