package com.routermon.models;

import com.routermon.utils.TimestampUtil;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * One interface as sampled from the device, or as last persisted.

 * Counters are raw monotonic values from /interface/print.
 * txRate/rxRate are derived bits per second and only meaningful after
 * MetricsCollector.applyInterfaceRates has compared two samples.
 */
public class InterfaceCounters
{

    public String name;

    public String defaultName;

    public String type;

    public String macAddress;

    public boolean running;

    public boolean disabled;

    public String speed;

    public String comment;

    public long txBytes;

    public long rxBytes;

    public long txPackets;

    public long rxPackets;

    public long txDrops;

    public long rxDrops;

    public long txErrors;

    public long rxErrors;

    public long txRate;

    public long rxRate;

    public Instant lastUpdated;

    public String status()
    {
        return running && !disabled ? "up" : "down";
    }

    /**
     * Maps a persisted interface_states row.
     *
     * @param data interface JSON from MetricsService
     * @return InterfaceCounters instance
     */
    public static InterfaceCounters fromJson(JsonObject data)
    {
        var counters = new InterfaceCounters();

        counters.name = data.getString("name");

        counters.defaultName = data.getString("default_name");

        counters.type = data.getString("type");

        counters.macAddress = data.getString("mac_address");

        counters.running = data.getBoolean("running", false);

        counters.disabled = data.getBoolean("disabled", false);

        counters.speed = data.getString("speed");

        counters.comment = data.getString("comment");

        counters.txBytes = data.getLong("tx_bytes", 0L);

        counters.rxBytes = data.getLong("rx_bytes", 0L);

        counters.txPackets = data.getLong("tx_packets", 0L);

        counters.rxPackets = data.getLong("rx_packets", 0L);

        counters.txDrops = data.getLong("tx_drops", 0L);

        counters.rxDrops = data.getLong("rx_drops", 0L);

        counters.txErrors = data.getLong("tx_errors", 0L);

        counters.rxErrors = data.getLong("rx_errors", 0L);

        counters.txRate = data.getLong("tx_rate", 0L);

        counters.rxRate = data.getLong("rx_rate", 0L);

        counters.lastUpdated = TimestampUtil.parse(data.getString("last_updated"));

        return counters;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("name", name)
            .put("default_name", defaultName)
            .put("type", type)
            .put("mac_address", macAddress)
            .put("running", running)
            .put("disabled", disabled)
            .put("status", status())
            .put("speed", speed)
            .put("comment", comment)
            .put("tx_bytes", txBytes)
            .put("rx_bytes", rxBytes)
            .put("tx_packets", txPackets)
            .put("rx_packets", rxPackets)
            .put("tx_drops", txDrops)
            .put("rx_drops", rxDrops)
            .put("tx_errors", txErrors)
            .put("rx_errors", rxErrors)
            .put("tx_rate", txRate)
            .put("rx_rate", rxRate)
            .put("last_updated", TimestampUtil.format(lastUpdated));
    }

}
