package com.routermon.services.impl;

import com.routermon.exceptions.PersistenceException;

import com.routermon.services.NetwatchService;

import com.routermon.utils.TimestampUtil;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Row;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.UUID;

/**
 * NetwatchServiceImpl - Implementation of NetwatchService

 * Watch targets are unique per (device_id, host); netwatchUpsert relies on that
 * constraint so concurrent reconciliations of the same device cannot duplicate hosts.
 */
public class NetwatchServiceImpl implements NetwatchService
{

    private static final Logger logger = LoggerFactory.getLogger(NetwatchServiceImpl.class);

    private final Pool pgPool;

    private final Clock clock;

    public NetwatchServiceImpl(Pool pgPool, Clock clock)
    {
        this.pgPool = pgPool;

        this.clock = clock;
    }

    @Override
    public Future<JsonArray> netwatchListByDevice(String deviceId)
    {
        var promise = Promise.<JsonArray>promise();

        try
        {
            var sql = """
                    SELECT host, name, disabled, status, last_up, last_down, last_check,
                           latency_ms, packet_loss, interval_seconds
                    FROM watch_targets
                    WHERE device_id = $1
                    ORDER BY host
                    """;

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(deviceId)))
                    .onSuccess(rows ->
                    {
                        var targets = new JsonArray();

                        for (var row : rows)
                        {
                            targets.add(toJson(row));
                        }

                        promise.complete(targets);
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Failed to list watch targets for device {}: {}", deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("netwatchListByDevice", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in netwatchListByDevice service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonObject> netwatchUpsert(String deviceId, JsonObject targetData)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = """
                    INSERT INTO watch_targets (device_id, host, name, disabled, status,
                                               last_up, last_down, last_check, interval_seconds)
                    VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $9)
                    ON CONFLICT (device_id, host) DO UPDATE
                    SET name = EXCLUDED.name,
                        disabled = EXCLUDED.disabled,
                        status = EXCLUDED.status,
                        last_up = EXCLUDED.last_up,
                        last_down = EXCLUDED.last_down,
                        last_check = EXCLUDED.last_check,
                        interval_seconds = EXCLUDED.interval_seconds
                    RETURNING (xmax = 0) AS inserted
                    """;

            var host = targetData.getString("host");

            var lastCheck = TimestampUtil.toOffset(targetData.getString("last_check"));

            var params = Tuple.tuple()
                    .addUUID(UUID.fromString(deviceId))
                    .addString(host)
                    .addString(targetData.getString("name"))
                    .addBoolean(targetData.getBoolean("disabled", false))
                    .addString(targetData.getString("status", "unknown"))
                    .addOffsetDateTime(TimestampUtil.toOffset(targetData.getString("last_up")))
                    .addOffsetDateTime(TimestampUtil.toOffset(targetData.getString("last_down")))
                    .addOffsetDateTime(lastCheck != null ? lastCheck : TimestampUtil.toOffset(clock.instant()))
                    .addInteger(targetData.getInteger("interval_seconds", 30));

            pgPool.preparedQuery(sql)
                    .execute(params)
                    .onSuccess(rows -> promise.complete(new JsonObject()
                            .put("success", true)
                            .put("device_id", deviceId)
                            .put("host", host)
                            .put("inserted", rows.iterator().next().getBoolean("inserted"))))
                    .onFailure(cause ->
                    {
                        logger.error("Failed to upsert watch target {} for device {}: {}", host, deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("netwatchUpsert", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in netwatchUpsert service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonObject> netwatchUpdateProbe(String deviceId, String host, Integer latencyMs, int packetLoss)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = """
                    UPDATE watch_targets
                    SET latency_ms = $3, packet_loss = $4
                    WHERE device_id = $1 AND host = $2
                    """;

            pgPool.preparedQuery(sql)
                    .execute(Tuple.tuple()
                            .addUUID(UUID.fromString(deviceId))
                            .addString(host)
                            .addInteger(latencyMs)
                            .addInteger(packetLoss))
                    .onSuccess(rows -> promise.complete(new JsonObject()
                            .put("success", rows.rowCount() > 0)
                            .put("host", host)
                            .put("latency_ms", latencyMs)
                            .put("packet_loss", packetLoss)))
                    .onFailure(cause ->
                    {
                        logger.error("Failed to record probe for {} on device {}: {}", host, deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("netwatchUpdateProbe", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in netwatchUpdateProbe service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonObject> netwatchDelete(String deviceId, String host)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = """
                    DELETE FROM watch_targets
                    WHERE device_id = $1 AND host = $2
                    """;

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(deviceId), host))
                    .onSuccess(rows -> promise.complete(new JsonObject()
                            .put("success", true)
                            .put("host", host)
                            .put("deleted_count", rows.rowCount())))
                    .onFailure(cause ->
                    {
                        logger.error("Failed to delete watch target {} for device {}: {}", host, deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("netwatchDelete", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in netwatchDelete service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    private static JsonObject toJson(Row row)
    {
        return new JsonObject()
                .put("host", row.getString("host"))
                .put("name", row.getString("name"))
                .put("disabled", row.getBoolean("disabled"))
                .put("status", row.getString("status"))
                .put("last_up", TimestampUtil.format(row.getOffsetDateTime("last_up")))
                .put("last_down", TimestampUtil.format(row.getOffsetDateTime("last_down")))
                .put("last_check", TimestampUtil.format(row.getOffsetDateTime("last_check")))
                .put("latency_ms", row.getInteger("latency_ms"))
                .put("packet_loss", row.getInteger("packet_loss"))
                .put("interval_seconds", row.getInteger("interval_seconds"));
    }

}
