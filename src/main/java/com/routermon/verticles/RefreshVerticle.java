package com.routermon.verticles;

import com.routermon.core.EngineConfig;

import com.routermon.exceptions.DeviceBusyException;

import com.routermon.models.Device;

import com.routermon.models.RefreshRequest;

import com.routermon.monitoring.RefreshOrchestrator;

import com.routermon.services.DeviceService;

import io.vertx.core.AbstractVerticle;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.eventbus.Message;

import io.vertx.core.eventbus.MessageConsumer;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.List;

/**
 * RefreshVerticle - Trigger surface of the refresh engine

 * Event bus consumers:
 * - device.refresh   {device_id, full_sync?, include_netwatch?, include_probes?, include_sessions?} → report
 * - netwatch.sync    {device_id} → {synced, errors}
 * - netwatch.delete  {device_id, host} → delete result
 * Sync and delete fail with 409 while the device is being refreshed.

 * Periodic tick (polling.interval.seconds, 0 disables): refreshes the monitored devices
 * of this instance's shard concurrently; every polling.full.sync.every-th tick is a full
 * sync, starting with the first. Instances are deployed with {shard, shards} in their
 * config and each runs on its own event loop.
 */
public class RefreshVerticle extends AbstractVerticle
{

    private static final Logger logger = LoggerFactory.getLogger(RefreshVerticle.class);

    public static final String ADDRESS_REFRESH = "device.refresh";

    public static final String ADDRESS_NETWATCH_SYNC = "netwatch.sync";

    public static final String ADDRESS_NETWATCH_DELETE = "netwatch.delete";

    private final RefreshOrchestrator orchestrator;

    private final DeviceService deviceService;

    private final EngineConfig config;

    private final List<MessageConsumer<JsonObject>> consumers = new ArrayList<>();

    private long pollingTimerId = -1;

    private long tickCount;

    private int shard;

    private int shards = 1;

    public RefreshVerticle(RefreshOrchestrator orchestrator, DeviceService deviceService, EngineConfig config)
    {
        this.orchestrator = orchestrator;

        this.deviceService = deviceService;

        this.config = config;
    }

    @Override
    public void start(Promise<Void> startPromise)
    {
        try
        {
            shards = Math.max(1, config().getInteger("shards", 1));

            shard = Math.floorMod(config().getInteger("shard", 0), shards);

            logger.info("Starting RefreshVerticle (shard {} of {})", shard, shards);

            setupEventBusConsumers();

            startPeriodicRefresh();

            logger.info("RefreshVerticle started successfully");

            startPromise.complete();
        }
        catch (Exception exception)
        {
            logger.error("Error in start: {}", exception.getMessage());

            startPromise.fail(exception);
        }
    }

    @Override
    public void stop(Promise<Void> stopPromise)
    {
        if (pollingTimerId >= 0)
        {
            vertx.cancelTimer(pollingTimerId);

            pollingTimerId = -1;
        }

        var unregistered = new ArrayList<Future<Void>>();

        consumers.forEach(consumer -> unregistered.add(consumer.unregister()));

        Future.join(unregistered)
            .onComplete(result ->
            {
                logger.info("RefreshVerticle stopped");

                stopPromise.complete();
            });
    }

    private void setupEventBusConsumers()
    {
        consumers.add(vertx.eventBus().<JsonObject>consumer(ADDRESS_REFRESH, this::onRefresh));

        consumers.add(vertx.eventBus().<JsonObject>consumer(ADDRESS_NETWATCH_SYNC, this::onNetwatchSync));

        consumers.add(vertx.eventBus().<JsonObject>consumer(ADDRESS_NETWATCH_DELETE, this::onNetwatchDelete));
    }

    private void onRefresh(Message<JsonObject> message)
    {
        var body = message.body() != null ? message.body() : new JsonObject();

        if (body.getString("device_id") == null)
        {
            message.fail(400, "device_id is required");

            return;
        }

        orchestrator.refresh(RefreshRequest.fromJson(body))
            .onSuccess(report -> message.reply(report.toJson()))
            .onFailure(cause -> message.fail(500, cause.getMessage()));
    }

    private void onNetwatchSync(Message<JsonObject> message)
    {
        var body = message.body() != null ? message.body() : new JsonObject();

        loadDevice(message, body.getString("device_id"))
            .compose(device -> orchestrator.syncNetwatch(device)
                .onFailure(cause -> failBusyOrError(message, cause)))
            .onSuccess(result -> message.reply(result.toJson()))
            .onFailure(cause -> logger.debug("netwatch.sync rejected: {}", cause.getMessage()));
    }

    private void onNetwatchDelete(Message<JsonObject> message)
    {
        var body = message.body() != null ? message.body() : new JsonObject();

        var host = body.getString("host");

        if (host == null || host.isBlank())
        {
            message.fail(400, "host is required");

            return;
        }

        loadDevice(message, body.getString("device_id"))
            .compose(device -> orchestrator.deleteNetwatchTarget(device, host)
                .onFailure(cause -> failBusyOrError(message, cause)))
            .onSuccess(message::reply)
            .onFailure(cause -> logger.debug("netwatch.delete rejected: {}", cause.getMessage()));
    }

    private static void failBusyOrError(Message<JsonObject> message, Throwable cause)
    {
        message.fail(cause instanceof DeviceBusyException ? 409 : 500, cause.getMessage());
    }

    /**
     * Looks up the device for a request; replies with a failure code itself when it cannot.
     */
    private Future<Device> loadDevice(Message<JsonObject> message, String deviceId)
    {
        if (deviceId == null)
        {
            message.fail(400, "device_id is required");

            return Future.failedFuture("device_id is required");
        }

        return deviceService.deviceGetById(deviceId)
            .recover(cause ->
            {
                message.fail(500, cause.getMessage());

                return Future.failedFuture(cause);
            })
            .compose(deviceData ->
            {
                if (!deviceData.getBoolean("found", false))
                {
                    message.fail(404, "Device not found: " + deviceId);

                    return Future.failedFuture("Device not found: " + deviceId);
                }

                return Future.succeededFuture(Device.fromJson(deviceData));
            });
    }

    private void startPeriodicRefresh()
    {
        var intervalSeconds = config.getPollingIntervalSeconds();

        if (intervalSeconds <= 0)
        {
            logger.info("Periodic refresh disabled");

            return;
        }

        pollingTimerId = vertx.setPeriodic(intervalSeconds * 1000L, id -> onTick());

        logger.info("Periodic refresh every {}s, full sync every {} ticks", intervalSeconds, config.getFullSyncEvery());
    }

    void onTick()
    {
        var fullSync = tickCount % config.getFullSyncEvery() == 0;

        tickCount++;

        logger.debug("Refresh tick {} (full sync: {})", tickCount, fullSync);

        orchestrator.refreshAll(fullSync, shard, shards)
            .onSuccess(reports ->
            {
                var summary = new JsonArray();

                reports.forEach(report -> summary.add(report.outcome.name()));

                logger.info("Refresh tick {} completed for {} devices: {}", tickCount, reports.size(), summary.encode());
            })
            .onFailure(cause -> logger.error("Refresh tick {} failed: {}", tickCount, cause.getMessage()));
    }

}
