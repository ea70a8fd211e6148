package com.routermon.monitoring;

import com.routermon.core.DeviceClient;

import com.routermon.core.DeviceSession;

import com.routermon.core.EngineConfig;

import com.routermon.models.AlertCandidate;

import com.routermon.models.AlertSeverity;

import com.routermon.models.AlertType;

import com.routermon.models.Device;

import com.routermon.models.SyncResult;

import com.routermon.models.WatchEntry;

import com.routermon.models.WatchStatus;

import com.routermon.services.NetwatchService;

import com.routermon.utils.DeviceTimeParser;

import com.routermon.utils.ExceptionUtil;

import com.routermon.utils.RouterOsValueParser;

import com.routermon.utils.TimestampUtil;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.HashMap;

import java.util.List;

import java.util.Map;

/**
 * NetwatchReconciler - Mirrors the device's /tool/netwatch table into watch_targets

 * Per remote entry (sequentially, keyed by host):
 * - Build the display name: "[DISABLED] " prefix + comment, else name, else the stored name
 * - If the stored and the new status are both settled and differ, raise a WATCH_STATUS alert
 * - Upsert status, last up/down (remote "since" wins, else stored), interval and last check

 * Rows whose host no longer exists on the device are kept; deleteTarget() is the only
 * removal path. A failure on one entry is recorded and the remaining entries continue.
 */
public class NetwatchReconciler
{

    private static final Logger logger = LoggerFactory.getLogger(NetwatchReconciler.class);

    private static final String DISABLED_PREFIX = "[DISABLED] ";

    private static final int DEFAULT_INTERVAL_SECONDS = 30;

    private final DeviceClient deviceClient;

    private final NetwatchService netwatchService;

    private final AlertEmitter alertEmitter;

    private final EngineConfig config;

    private final Clock clock;

    private final DeviceTimeParser timeParser;

    public NetwatchReconciler(DeviceClient deviceClient, NetwatchService netwatchService, AlertEmitter alertEmitter,
                              EngineConfig config, Clock clock)
    {
        this.deviceClient = deviceClient;

        this.netwatchService = netwatchService;

        this.alertEmitter = alertEmitter;

        this.config = config;

        this.clock = clock;

        this.timeParser = new DeviceTimeParser(config.getDeviceZone(), clock);
    }

    /**
     * Opens a dedicated session, reconciles and closes it. Never fails: a device-level
     * failure is reported as "Failed to sync netwatch: ..." and leaves the rows untouched.
     *
     * @param device device to synchronise
     * @return Future with {synced, errors}
     */
    public Future<SyncResult> syncOne(Device device)
    {
        var promise = Promise.<SyncResult>promise();

        try
        {
            var credentials = device.toCredentials(config.getSecretKey(), config.getRouterOsPort());

            deviceClient.open(credentials)
                .compose(session -> reconcile(device, session)
                    .eventually(() -> session.close()))
                .onSuccess(promise::complete)
                .onFailure(cause ->
                {
                    logger.warn("Netwatch sync for {} failed: {}", device.name, cause.getMessage());

                    promise.complete(failedSync(cause));
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in syncOne: {}", exception.getMessage());

            promise.complete(failedSync(exception));
        }

        return promise.future();
    }

    private static SyncResult failedSync(Throwable cause)
    {
        var result = new SyncResult();

        result.errors.add("Failed to sync netwatch: " + ExceptionUtil.getMessage(cause));

        return result;
    }

    /**
     * Reconciles on an already open session. Connectivity failures propagate so the
     * caller can mark the device offline; everything else is recorded per entry.
     *
     * @param device device being synchronised
     * @param session open session to the device
     * @return Future with {synced, errors}
     */
    public Future<SyncResult> reconcile(Device device, DeviceSession session)
    {
        var result = new SyncResult();

        return session.execute("/tool/netwatch/print")
            .compose(rows -> netwatchService.netwatchListByDevice(device.deviceId)
                .map(existingRows ->
                {
                    var existing = new HashMap<String, JsonObject>();

                    for (var row : existingRows)
                    {
                        var target = (JsonObject) row;

                        existing.put(target.getString("host"), target);
                    }

                    return existing;
                })
                .compose(existing -> processEntries(device, toEntries(rows), existing, result)))
            .map(v ->
            {
                logger.debug("Netwatch sync for {}: {} synced, {} errors", device.name, result.synced, result.errors.size());

                return result;
            });
    }

    private List<WatchEntry> toEntries(List<JsonObject> rows)
    {
        var entries = new ArrayList<WatchEntry>();

        for (var row : rows)
        {
            var host = row.getString("host");

            if (host == null || host.isBlank())
            {
                continue;
            }

            var entry = new WatchEntry();

            entry.host = host;

            entry.name = row.getString("name");

            entry.comment = row.getString("comment");

            entry.status = WatchStatus.fromValue(row.getString("status"));

            entry.disabled = RouterOsValueParser.parseBoolean(row.getString("disabled"));

            entry.since = timeParser.parse(row.getString("since"));

            entry.intervalSeconds = RouterOsValueParser.parseIntervalSeconds(row.getString("interval"));

            entries.add(entry);
        }

        return entries;
    }

    /**
     * Entries are processed one after another so each upsert sees a consistent previous row.
     */
    private Future<Void> processEntries(Device device, List<WatchEntry> entries, Map<String, JsonObject> existing,
                                        SyncResult result)
    {
        Future<Void> chain = Future.succeededFuture();

        for (var entry : entries)
        {
            chain = chain.compose(v -> processEntry(device, entry, existing.get(entry.host))
                .map(upserted ->
                {
                    result.synced++;

                    return (Void) null;
                })
                .recover(cause ->
                {
                    if (ExceptionUtil.isConnectivityFailure(cause))
                    {
                        return Future.failedFuture(cause);
                    }

                    logger.warn("Netwatch entry {} on {} not synced: {}", entry.host, device.name, cause.getMessage());

                    result.errors.add(entry.host + ": " + ExceptionUtil.getMessage(cause));

                    return Future.succeededFuture();
                }));
        }

        return chain;
    }

    private Future<JsonObject> processEntry(Device device, WatchEntry entry, JsonObject previous)
    {
        var displayName = displayName(entry, previous);

        var previousStatus = previous != null ? WatchStatus.fromValue(previous.getString("status")) : WatchStatus.UNKNOWN;

        Future<Boolean> alert = Future.succeededFuture(false);

        if (previousStatus.isSettled() && entry.status.isSettled() && previousStatus != entry.status)
        {
            alert = raiseStatusAlert(device, entry, displayName)
                .recover(cause ->
                {
                    logger.error("Failed to raise netwatch alert for {} on {}: {}", entry.host, device.name, cause.getMessage());

                    return Future.succeededFuture(false);
                });
        }

        return alert.compose(v -> netwatchService.netwatchUpsert(device.deviceId, toTargetData(entry, displayName, previous)));
    }

    private Future<Boolean> raiseStatusAlert(Device device, WatchEntry entry, String displayName)
    {
        var down = entry.status == WatchStatus.DOWN;

        var label = displayName.isEmpty() ? entry.host : displayName;

        var candidate = new AlertCandidate(device, AlertType.WATCH_STATUS, entry.host, entry.status.value())
            .severity(down ? AlertSeverity.WARNING : AlertSeverity.INFO)
            .targetName(displayName)
            .text("[" + device.name + "] " + label + " is " + (down ? "DOWN" : "UP"),
                "Netwatch host " + entry.host + " (" + label + ") on " + device.name + " changed to " + entry.status.value());

        return alertEmitter.emit(candidate);
    }

    private JsonObject toTargetData(WatchEntry entry, String displayName, JsonObject previous)
    {
        var lastUp = previous != null ? previous.getString("last_up") : null;

        var lastDown = previous != null ? previous.getString("last_down") : null;

        if (entry.since != null && entry.status == WatchStatus.UP)
        {
            lastUp = TimestampUtil.format(entry.since);
        }
        else if (entry.since != null && entry.status == WatchStatus.DOWN)
        {
            lastDown = TimestampUtil.format(entry.since);
        }

        Integer interval = entry.intervalSeconds;

        if (interval == null)
        {
            interval = previous != null ? previous.getInteger("interval_seconds", DEFAULT_INTERVAL_SECONDS)
                : DEFAULT_INTERVAL_SECONDS;
        }

        return new JsonObject()
            .put("host", entry.host)
            .put("name", displayName)
            .put("disabled", entry.disabled)
            .put("status", entry.status.value())
            .put("last_up", lastUp)
            .put("last_down", lastDown)
            .put("last_check", TimestampUtil.format(clock.instant()))
            .put("interval_seconds", interval);
    }

    static String displayName(WatchEntry entry, JsonObject previous)
    {
        var prefix = entry.disabled ? DISABLED_PREFIX : "";

        var baseName = entry.comment;

        if (baseName == null || baseName.isEmpty())
        {
            baseName = entry.name;
        }

        if ((baseName == null || baseName.isEmpty()) && previous != null)
        {
            var previousName = previous.getString("name");

            baseName = previousName != null ? previousName.replaceFirst("^\\[DISABLED\\]\\s*", "") : "";
        }

        return prefix + (baseName != null ? baseName : "");
    }

    /**
     * Removes a watch target from the device (best effort) and then from the database.
     *
     * @param device owning device
     * @param host watched host to remove
     * @return Future with the netwatchDelete result
     */
    public Future<JsonObject> deleteTarget(Device device, String host)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            removeRemote(device, host)
                .compose(v -> netwatchService.netwatchDelete(device.deviceId, host))
                .onSuccess(deleted ->
                {
                    logger.info("Watch target {} deleted from {}", host, device.name);

                    promise.complete(deleted);
                })
                .onFailure(promise::fail);
        }
        catch (Exception exception)
        {
            logger.error("Error in deleteTarget: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    private Future<Void> removeRemote(Device device, String host)
    {
        try
        {
            var credentials = device.toCredentials(config.getSecretKey(), config.getRouterOsPort());

            return deviceClient.open(credentials)
                .compose(session -> session.execute("/tool/netwatch/print", Map.of("?host", host))
                    .compose(rows ->
                    {
                        var ids = rows.stream()
                            .map(row -> row.getString(".id"))
                            .filter(id -> id != null && !id.isEmpty())
                            .toList();

                        if (ids.isEmpty())
                        {
                            logger.info("Watch target {} not present on {}", host, device.name);

                            return Future.<Void>succeededFuture();
                        }

                        Future<Void> chain = Future.succeededFuture();

                        for (var id : ids)
                        {
                            chain = chain.compose(v -> session.execute("/tool/netwatch/remove", Map.of(".id", id)).<Void>mapEmpty());
                        }

                        return chain;
                    })
                    .eventually(() -> session.close()))
                .recover(cause ->
                {
                    logger.warn("Could not remove watch target {} from {}: {}", host, device.name, cause.getMessage());

                    return Future.succeededFuture();
                });
        }
        catch (Exception exception)
        {
            logger.warn("Could not remove watch target {} from {}: {}", host, device.name, exception.getMessage());

            return Future.succeededFuture();
        }
    }

}
