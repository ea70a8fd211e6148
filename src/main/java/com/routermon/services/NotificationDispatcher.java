package com.routermon.services;

import io.vertx.core.Future;

import io.vertx.core.json.JsonObject;

/**
 * Hands persisted alerts to the external notification channel.
 * Delivery is best effort; callers log and discard failures.
 */
public interface NotificationDispatcher
{

    /**
     * @param payload device_id, device_name, target_host, target_name, type, severity, message, timestamp
     * @return Future completed when the channel accepted the notification
     */
    Future<Void> dispatch(JsonObject payload);

}
