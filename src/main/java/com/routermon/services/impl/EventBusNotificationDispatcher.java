package com.routermon.services.impl;

import com.routermon.services.NotificationDispatcher;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.core.eventbus.DeliveryOptions;

import io.vertx.core.json.JsonObject;

/**
 * Sends alert notifications as event bus requests to the configured address
 * (alerts.notify.address). The consumer owns templating and delivery.
 */
public class EventBusNotificationDispatcher implements NotificationDispatcher
{

    private final Vertx vertx;

    private final String address;

    private final long timeoutMs;

    public EventBusNotificationDispatcher(Vertx vertx, String address, long timeoutMs)
    {
        this.vertx = vertx;

        this.address = address;

        this.timeoutMs = timeoutMs;
    }

    @Override
    public Future<Void> dispatch(JsonObject payload)
    {
        return vertx.eventBus()
            .request(address, payload, new DeliveryOptions().setSendTimeout(timeoutMs))
            .mapEmpty();
    }

}
