package com.routermon.models;

import io.vertx.core.json.JsonObject;

/**
 * Result of probing one host.

 * completed = false means the probe itself failed (timeout, device error);
 * such results always carry latency null and 100% loss.
 */
public class PingResult
{

    public final String host;

    public final Integer latencyMs;

    public final int packetLoss;

    public final boolean completed;

    public PingResult(String host, Integer latencyMs, int packetLoss, boolean completed)
    {
        this.host = host;

        this.latencyMs = latencyMs;

        this.packetLoss = packetLoss;

        this.completed = completed;
    }

    public static PingResult failed(String host)
    {
        return new PingResult(host, null, 100, false);
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("host", host)
            .put("latency_ms", latencyMs)
            .put("packet_loss", packetLoss)
            .put("completed", completed);
    }

}
