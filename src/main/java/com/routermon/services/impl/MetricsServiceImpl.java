package com.routermon.services.impl;

import com.routermon.exceptions.PersistenceException;

import com.routermon.services.MetricsService;

import com.routermon.utils.TimestampUtil;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.UUID;

/**
 * MetricsServiceImpl - Implementation of MetricsService

 * Provides metrics operations including:
 * - Metric snapshot creation and retrieval
 * - Interface state listing and upsert
 */
public class MetricsServiceImpl implements MetricsService
{

    private static final Logger logger = LoggerFactory.getLogger(MetricsServiceImpl.class);

    private final Pool pgPool;

    private final Clock clock;

    /**
     * Constructor for MetricsServiceImpl
     *
     * @param pgPool PostgresSQL connection pool
     * @param clock time source for default timestamps
     */
    public MetricsServiceImpl(Pool pgPool, Clock clock)
    {
        this.pgPool = pgPool;

        this.clock = clock;
    }

    @Override
    public Future<JsonObject> metricsCreate(JsonObject metricsData)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = """
                    INSERT INTO metric_snapshots (device_id, cpu_load, cpu_count, cpu_frequency,
                                                  total_memory, used_memory, free_memory,
                                                  total_disk, used_disk, free_disk,
                                                  uptime_seconds, board_temp, voltage)
                    VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $10, $11, $12, $13)
                    RETURNING metric_id, recorded_at
                    """;

            var deviceId = metricsData.getString("device_id");

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(deviceId),
                            metricsData.getInteger("cpu_load"),
                            metricsData.getInteger("cpu_count"),
                            metricsData.getInteger("cpu_frequency"),
                            metricsData.getLong("total_memory"),
                            metricsData.getLong("used_memory"),
                            metricsData.getLong("free_memory"),
                            metricsData.getLong("total_disk"),
                            metricsData.getLong("used_disk"),
                            metricsData.getLong("free_disk"),
                            metricsData.getLong("uptime_seconds"),
                            metricsData.getDouble("board_temp"),
                            metricsData.getDouble("voltage")))
                    .onSuccess(rows ->
                    {
                        var row = rows.iterator().next();

                        promise.complete(new JsonObject()
                                .put("success", true)
                                .put("metric_id", row.getUUID("metric_id").toString())
                                .put("device_id", deviceId)
                                .put("recorded_at", TimestampUtil.format(row.getOffsetDateTime("recorded_at"))));
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Failed to create metrics for device {}: {}", deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("metricsCreate", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in metricsCreate service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonArray> interfaceListByDevice(String deviceId)
    {
        var promise = Promise.<JsonArray>promise();

        try
        {
            var sql = """
                    SELECT name, default_name, type, mac_address, running, disabled, status, speed, comment,
                           tx_bytes, rx_bytes, tx_packets, rx_packets, tx_drops, rx_drops, tx_errors, rx_errors,
                           tx_rate, rx_rate, last_updated
                    FROM interface_states
                    WHERE device_id = $1
                    ORDER BY name
                    """;

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(deviceId)))
                    .onSuccess(rows ->
                    {
                        var interfaces = new JsonArray();

                        for (var row : rows)
                        {
                            interfaces.add(new JsonObject()
                                    .put("name", row.getString("name"))
                                    .put("default_name", row.getString("default_name"))
                                    .put("type", row.getString("type"))
                                    .put("mac_address", row.getString("mac_address"))
                                    .put("running", row.getBoolean("running"))
                                    .put("disabled", row.getBoolean("disabled"))
                                    .put("status", row.getString("status"))
                                    .put("speed", row.getString("speed"))
                                    .put("comment", row.getString("comment"))
                                    .put("tx_bytes", row.getLong("tx_bytes"))
                                    .put("rx_bytes", row.getLong("rx_bytes"))
                                    .put("tx_packets", row.getLong("tx_packets"))
                                    .put("rx_packets", row.getLong("rx_packets"))
                                    .put("tx_drops", row.getLong("tx_drops"))
                                    .put("rx_drops", row.getLong("rx_drops"))
                                    .put("tx_errors", row.getLong("tx_errors"))
                                    .put("rx_errors", row.getLong("rx_errors"))
                                    .put("tx_rate", row.getLong("tx_rate"))
                                    .put("rx_rate", row.getLong("rx_rate"))
                                    .put("last_updated", TimestampUtil.format(row.getOffsetDateTime("last_updated"))));
                        }

                        promise.complete(interfaces);
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Failed to list interfaces for device {}: {}", deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("interfaceListByDevice", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in interfaceListByDevice service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonObject> interfaceUpsert(String deviceId, JsonObject interfaceData)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = """
                    INSERT INTO interface_states (device_id, name, default_name, type, mac_address, running, disabled,
                                                  status, speed, comment, tx_bytes, rx_bytes, tx_packets, rx_packets,
                                                  tx_drops, rx_drops, tx_errors, rx_errors, tx_rate, rx_rate, last_updated)
                    VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9, $10, $11, $12, $13, $14, $15, $16, $17, $18, $19, $20, $21)
                    ON CONFLICT (device_id, name) DO UPDATE
                    SET default_name = EXCLUDED.default_name,
                        type = EXCLUDED.type,
                        mac_address = EXCLUDED.mac_address,
                        running = EXCLUDED.running,
                        disabled = EXCLUDED.disabled,
                        status = EXCLUDED.status,
                        speed = EXCLUDED.speed,
                        comment = EXCLUDED.comment,
                        tx_bytes = EXCLUDED.tx_bytes,
                        rx_bytes = EXCLUDED.rx_bytes,
                        tx_packets = EXCLUDED.tx_packets,
                        rx_packets = EXCLUDED.rx_packets,
                        tx_drops = EXCLUDED.tx_drops,
                        rx_drops = EXCLUDED.rx_drops,
                        tx_errors = EXCLUDED.tx_errors,
                        rx_errors = EXCLUDED.rx_errors,
                        tx_rate = EXCLUDED.tx_rate,
                        rx_rate = EXCLUDED.rx_rate,
                        last_updated = EXCLUDED.last_updated
                    RETURNING (xmax = 0) AS inserted
                    """;

            var lastUpdated = TimestampUtil.toOffset(interfaceData.getString("last_updated"));

            var params = Tuple.tuple()
                    .addUUID(UUID.fromString(deviceId))
                    .addString(interfaceData.getString("name"))
                    .addString(interfaceData.getString("default_name"))
                    .addString(interfaceData.getString("type"))
                    .addString(interfaceData.getString("mac_address"))
                    .addBoolean(interfaceData.getBoolean("running", false))
                    .addBoolean(interfaceData.getBoolean("disabled", false))
                    .addString(interfaceData.getString("status", "down"))
                    .addString(interfaceData.getString("speed"))
                    .addString(interfaceData.getString("comment"))
                    .addLong(interfaceData.getLong("tx_bytes", 0L))
                    .addLong(interfaceData.getLong("rx_bytes", 0L))
                    .addLong(interfaceData.getLong("tx_packets", 0L))
                    .addLong(interfaceData.getLong("rx_packets", 0L))
                    .addLong(interfaceData.getLong("tx_drops", 0L))
                    .addLong(interfaceData.getLong("rx_drops", 0L))
                    .addLong(interfaceData.getLong("tx_errors", 0L))
                    .addLong(interfaceData.getLong("rx_errors", 0L))
                    .addLong(interfaceData.getLong("tx_rate", 0L))
                    .addLong(interfaceData.getLong("rx_rate", 0L))
                    .addOffsetDateTime(lastUpdated != null ? lastUpdated : TimestampUtil.toOffset(clock.instant()));

            pgPool.preparedQuery(sql)
                    .execute(params)
                    .onSuccess(rows -> promise.complete(new JsonObject()
                            .put("success", true)
                            .put("device_id", deviceId)
                            .put("name", interfaceData.getString("name"))
                            .put("inserted", rows.iterator().next().getBoolean("inserted"))))
                    .onFailure(cause ->
                    {
                        logger.error("Failed to upsert interface {} for device {}: {}",
                                interfaceData.getString("name"), deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("interfaceUpsert", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in interfaceUpsert service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

}
