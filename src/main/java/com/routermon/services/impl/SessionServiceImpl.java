package com.routermon.services.impl;

import com.routermon.exceptions.PersistenceException;

import com.routermon.services.SessionService;

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

import java.util.ArrayList;

import java.util.List;

import java.util.UUID;

/**
 * SessionServiceImpl - Implementation of SessionService

 * sessionReplaceAll runs delete + upserts in one transaction so readers never observe
 * a half-replaced snapshot.
 */
public class SessionServiceImpl implements SessionService
{

    private static final Logger logger = LoggerFactory.getLogger(SessionServiceImpl.class);

    private final Pool pgPool;

    private final Clock clock;

    public SessionServiceImpl(Pool pgPool, Clock clock)
    {
        this.pgPool = pgPool;

        this.clock = clock;
    }

    @Override
    public Future<JsonArray> sessionListByDevice(String deviceId)
    {
        var promise = Promise.<JsonArray>promise();

        try
        {
            var sql = """
                    SELECT session_key, service, caller_id, address, remote_id, uptime, connected_at, last_seen
                    FROM active_sessions
                    WHERE device_id = $1
                    ORDER BY session_key
                    """;

            pgPool.preparedQuery(sql)
                    .execute(Tuple.of(UUID.fromString(deviceId)))
                    .onSuccess(rows ->
                    {
                        var sessions = new JsonArray();

                        for (var row : rows)
                        {
                            sessions.add(new JsonObject()
                                    .put("session_key", row.getString("session_key"))
                                    .put("service", row.getString("service"))
                                    .put("caller_id", row.getString("caller_id"))
                                    .put("address", row.getString("address"))
                                    .put("remote_id", row.getString("remote_id"))
                                    .put("uptime", row.getString("uptime"))
                                    .put("connected_at", TimestampUtil.format(row.getOffsetDateTime("connected_at")))
                                    .put("last_seen", TimestampUtil.format(row.getOffsetDateTime("last_seen"))));
                        }

                        promise.complete(sessions);
                    })
                    .onFailure(cause ->
                    {
                        logger.error("Failed to list sessions for device {}: {}", deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("sessionListByDevice", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in sessionListByDevice service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    @Override
    public Future<JsonObject> sessionReplaceAll(String deviceId, JsonArray sessions)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            var deleteSql = """
                    DELETE FROM active_sessions
                    WHERE device_id = $1 AND NOT (session_key = ANY($2))
                    """;

            var upsertSql = """
                    INSERT INTO active_sessions (device_id, session_key, service, caller_id, address, remote_id,
                                                 uptime, connected_at, last_seen)
                    VALUES ($1, $2, $3, $4, $5, $6, $7, $8, $8)
                    ON CONFLICT (device_id, session_key) DO UPDATE
                    SET service = EXCLUDED.service,
                        caller_id = EXCLUDED.caller_id,
                        address = EXCLUDED.address,
                        remote_id = EXCLUDED.remote_id,
                        uptime = EXCLUDED.uptime,
                        last_seen = EXCLUDED.last_seen
                    """;

            var uuid = UUID.fromString(deviceId);

            var keys = new ArrayList<String>();

            for (var entry : sessions)
            {
                keys.add(((JsonObject) entry).getString("session_key"));
            }

            var batch = upsertRows(uuid, sessions);

            pgPool.withTransaction(connection -> connection.preparedQuery(deleteSql)
                            .execute(Tuple.of(uuid, keys.toArray(new String[0])))
                            .compose(deleted ->
                            {
                                if (batch.isEmpty())
                                {
                                    return Future.succeededFuture(new JsonObject()
                                            .put("deleted", deleted.rowCount())
                                            .put("upserted", 0));
                                }

                                return connection.preparedQuery(upsertSql)
                                        .executeBatch(batch)
                                        .map(upserted -> new JsonObject()
                                                .put("deleted", deleted.rowCount())
                                                .put("upserted", batch.size()));
                            }))
                    .onSuccess(result -> promise.complete(result.put("success", true).put("device_id", deviceId)))
                    .onFailure(cause ->
                    {
                        logger.error("Failed to replace sessions for device {}: {}", deviceId, cause.getMessage());

                        promise.fail(new PersistenceException("sessionReplaceAll", cause));
                    });
        }
        catch (Exception exception)
        {
            logger.error("Error in sessionReplaceAll service: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    /**
     * Upsert parameters for the current sessions; connected_at and last_seen both carry the
     * clock's now, and the conflict clause keeps the stored connected_at.
     */
    List<Tuple> upsertRows(UUID uuid, JsonArray sessions)
    {
        var now = TimestampUtil.toOffset(clock.instant());

        var batch = new ArrayList<Tuple>();

        for (var entry : sessions)
        {
            var session = (JsonObject) entry;

            batch.add(Tuple.tuple()
                    .addUUID(uuid)
                    .addString(session.getString("session_key"))
                    .addString(session.getString("service"))
                    .addString(session.getString("caller_id"))
                    .addString(session.getString("address"))
                    .addString(session.getString("remote_id"))
                    .addString(session.getString("uptime"))
                    .addOffsetDateTime(now));
        }

        return batch;
    }

}
