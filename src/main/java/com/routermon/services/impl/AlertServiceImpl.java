package com.routermon.services.impl;

import com.routermon.exceptions.PersistenceException;

import com.routermon.services.AlertService;

import com.routermon.utils.TimestampUtil;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonObject;

import io.vertx.sqlclient.Pool;

import io.vertx.sqlclient.Row;

import io.vertx.sqlclient.Tuple;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Instant;

import java.util.UUID;

/**
 * AlertServiceImpl - Implementation of AlertService

 * Alerts are never updated or deleted here; dedup lookups use the
 * (device_id, target, type, created_at) index.
 */
public class AlertServiceImpl implements AlertService
{

    private static final Logger logger = LoggerFactory.getLogger(AlertServiceImpl.class);

    private static final String ALERT_COLUMNS = """
            alert_id, device_id, type, target, state, severity, title, message, created_at
            """;

    private final Pool pgPool;

    public AlertServiceImpl(Pool pgPool)
    {
        this.pgPool = pgPool;
    }

    @Override
    public Future<JsonObject> alertCreate(JsonObject alertData)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = """
                    INSERT INTO alerts (device_id, type, target, state, severity, title, message)
                    VALUES ($1, $2, $3, $4, $5, $6, $7)
                    RETURNING\s""" + ALERT_COLUMNS;

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(alertData.getString("device_id")),
                            alertData.getString("type"),
                            alertData.getString("target"),
                            alertData.getString("state"),
                            alertData.getString("severity"),
                            alertData.getString("title"),
                            alertData.getString("message")))
                    .onSuccess(rows -> promise.complete(toJson(rows.iterator().next())))
                    .onFailure(cause ->
                    {
                        logger.error("Failed to create alert: {}", cause.getMessage());

                        promise.fail(new PersistenceException("alertCreate", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in alertCreate service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonObject> alertFindLatest(String deviceId, String target, String type, Instant since)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = "SELECT " + ALERT_COLUMNS + """
                    FROM alerts
                    WHERE device_id = $1 AND target = $2 AND type = $3 AND created_at >= $4
                    ORDER BY created_at DESC
                    LIMIT 1
                    """;

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(deviceId), target, type, TimestampUtil.toOffset(since)))
                    .onSuccess(rows ->
                    {
                        if (rows.size() == 0)
                        {
                            promise.complete(new JsonObject().put("found", false));

                            return;
                        }

                        promise.complete(toJson(rows.iterator().next()).put("found", true));
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Failed to look up latest alert: {}", cause.getMessage());

                        promise.fail(new PersistenceException("alertFindLatest", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in alertFindLatest service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    private static JsonObject toJson(Row row)
    {
        return new JsonObject()
                .put("alert_id", row.getUUID("alert_id").toString())
                .put("device_id", row.getUUID("device_id").toString())
                .put("type", row.getString("type"))
                .put("target", row.getString("target"))
                .put("state", row.getString("state"))
                .put("severity", row.getString("severity"))
                .put("title", row.getString("title"))
                .put("message", row.getString("message"))
                .put("created_at", TimestampUtil.format(row.getOffsetDateTime("created_at")));
    }

}
