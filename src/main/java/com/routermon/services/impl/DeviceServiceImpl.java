package com.routermon.services.impl;

import com.routermon.exceptions.PersistenceException;

import com.routermon.services.DeviceService;

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
 * DeviceServiceImpl - Implementation of DeviceService

 * Provides device operations including:
 * - Lookup by id and monitored-device listing
 * - Status transitions written by the refresh cycle
 */
public class DeviceServiceImpl implements DeviceService
{

    private static final Logger logger = LoggerFactory.getLogger(DeviceServiceImpl.class);

    private static final String DEVICE_COLUMNS = """
            device_id, name, address, port, username, secret_encrypted, status, last_seen,
            identity, version, model, serial_number, board_name, architecture, is_monitored
            """;

    private final Pool pgPool;

    private final Clock clock;

    /**
     * Constructor for DeviceServiceImpl
     *
     * @param pgPool PostgresSQL connection pool
     * @param clock time source for default timestamps
     */
    public DeviceServiceImpl(Pool pgPool, Clock clock)
    {
        this.pgPool = pgPool;

        this.clock = clock;
    }

    @Override
    public Future<JsonObject> deviceGetById(String deviceId)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE device_id = $1";

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(deviceId)))
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
                        logger.error("Failed to get device by ID: {}", cause.getMessage());

                        promise.fail(new PersistenceException("deviceGetById", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in deviceGetById service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonArray> deviceListMonitored()
    {
        var promise = Promise.<JsonArray>promise();

        try
        {
            var sql = "SELECT " + DEVICE_COLUMNS + " FROM devices WHERE is_monitored = true ORDER BY name";

            pgPool.query(sql)
                    .execute()
                    .onSuccess(rows ->
                    {
                        var devices = new JsonArray();

                        for (var row : rows)
                        {
                            devices.add(toJson(row));
                        }

                        promise.complete(devices);
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Failed to list monitored devices: {}", cause.getMessage());

                        promise.fail(new PersistenceException("deviceListMonitored", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in deviceListMonitored service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonObject> deviceMarkOnline(String deviceId, JsonObject identity)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = """
                    UPDATE devices
                    SET status = 'online',
                        last_seen = $2,
                        identity = COALESCE($3, identity),
                        version = COALESCE($4, version),
                        model = COALESCE($5, model),
                        serial_number = COALESCE($6, serial_number),
                        board_name = COALESCE($7, board_name),
                        architecture = COALESCE($8, architecture)
                    WHERE device_id = $1
                    """;

            var now = TimestampUtil.toOffset(clock.instant());

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(deviceId), now,
                            identity.getString("identity"),
                            identity.getString("version"),
                            identity.getString("model"),
                            identity.getString("serial_number"),
                            identity.getString("board_name"),
                            identity.getString("architecture")))
                    .onSuccess(rows -> promise.complete(new JsonObject()
                            .put("success", rows.rowCount() > 0)
                            .put("device_id", deviceId)
                            .put("status", "online")
                            .put("last_seen", TimestampUtil.format(now))))
                    .onFailure(cause ->
                    {
                        logger.error("Failed to mark device {} online: {}", deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("deviceMarkOnline", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in deviceMarkOnline service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonObject> deviceMarkOffline(String deviceId)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var sql = """
                    UPDATE devices
                    SET status = 'offline'
                    WHERE device_id = $1
                    """;

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(deviceId)))
                    .onSuccess(rows -> promise.complete(new JsonObject()
                            .put("success", rows.rowCount() > 0)
                            .put("device_id", deviceId)
                            .put("status", "offline")))
                    .onFailure(cause ->
                    {
                        logger.error("Failed to mark device {} offline: {}", deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("deviceMarkOffline", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in deviceMarkOffline service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    private static JsonObject toJson(Row row)
    {
        return new JsonObject()
                .put("device_id", row.getUUID("device_id").toString())
                .put("name", row.getString("name"))
                .put("address", row.getString("address"))
                .put("port", row.getInteger("port"))
                .put("username", row.getString("username"))
                .put("secret_encrypted", row.getString("secret_encrypted"))
                .put("status", row.getString("status"))
                .put("last_seen", TimestampUtil.format(row.getOffsetDateTime("last_seen")))
                .put("identity", row.getString("identity"))
                .put("version", row.getString("version"))
                .put("model", row.getString("model"))
                .put("serial_number", row.getString("serial_number"))
                .put("board_name", row.getString("board_name"))
                .put("architecture", row.getString("architecture"))
                .put("is_monitored", row.getBoolean("is_monitored"));
    }

}
