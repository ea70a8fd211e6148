package com.routermon.monitoring;

import com.routermon.core.DeviceClient;

import com.routermon.core.DeviceCredentials;

import com.routermon.core.DeviceSession;

import com.routermon.core.EngineConfig;

import com.routermon.exceptions.DeviceBusyException;

import com.routermon.models.AlertCandidate;

import com.routermon.models.AlertSeverity;

import com.routermon.models.AlertType;

import com.routermon.models.Device;

import com.routermon.models.DeviceIdentity;

import com.routermon.models.DeviceStatus;

import com.routermon.models.RefreshOutcome;

import com.routermon.models.RefreshReport;

import com.routermon.models.RefreshRequest;

import com.routermon.models.SyncResult;

import com.routermon.services.DeviceService;

import com.routermon.utils.ExceptionUtil;

import io.vertx.core.Future;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.ArrayList;

import java.util.List;

import java.util.Set;

import java.util.concurrent.ConcurrentHashMap;

import java.util.concurrent.atomic.AtomicReference;

import java.util.function.Supplier;

/**
 * RefreshOrchestrator - One refresh cycle per device

 * Cycle:
 * 1. Reject a second cycle for a device already in flight (SKIPPED_BUSY)
 * 2. Load the device; skip maintenance devices; decrypt credentials
 * 3. Open a session, fetch identity and mark the device online
 * 4. Full sync only: resources + metric snapshot, interfaces + rates
 * 5. Netwatch reconciliation, then probing, then session tracking (as requested)
 * 6. Close the session, whatever happened

 * Failure classification:
 * - ConnectivityException anywhere → device offline, STATUS_CHANGE alert if it was online,
 *   outcome CONNECTIVITY_FAILED
 * - Any other feature failure → recorded in the report, remaining features continue,
 *   outcome PARTIAL, device status untouched

 * refresh() never fails; every outcome is carried by the report.

 * Netwatch sync and delete requests share the in-flight set, so at most one operation
 * talks to a device at a time.
 */
public class RefreshOrchestrator
{

    private static final Logger logger = LoggerFactory.getLogger(RefreshOrchestrator.class);

    private final DeviceClient deviceClient;

    private final DeviceService deviceService;

    private final MetricsCollector metricsCollector;

    private final NetwatchReconciler netwatchReconciler;

    private final LatencyProber latencyProber;

    private final SessionTracker sessionTracker;

    private final AlertEmitter alertEmitter;

    private final EngineConfig config;

    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public RefreshOrchestrator(DeviceClient deviceClient, DeviceService deviceService, MetricsCollector metricsCollector,
                               NetwatchReconciler netwatchReconciler, LatencyProber latencyProber,
                               SessionTracker sessionTracker, AlertEmitter alertEmitter, EngineConfig config, Clock clock)
    {
        this.deviceClient = deviceClient;

        this.deviceService = deviceService;

        this.metricsCollector = metricsCollector;

        this.netwatchReconciler = netwatchReconciler;

        this.latencyProber = latencyProber;

        this.sessionTracker = sessionTracker;

        this.alertEmitter = alertEmitter;

        this.config = config;

        this.clock = clock;
    }

    /**
     * Runs one refresh cycle.
     *
     * @param request device and features to refresh
     * @return Future with the cycle report; never failed
     */
    public Future<RefreshReport> refresh(RefreshRequest request)
    {
        var deviceId = request.deviceId;

        if (!inFlight.add(deviceId))
        {
            logger.warn("Refresh of device {} skipped: previous cycle still running", deviceId);

            return Future.succeededFuture(RefreshReport.of(deviceId, RefreshOutcome.SKIPPED_BUSY));
        }

        var startedAt = clock.millis();

        Future<RefreshReport> cycle;

        try
        {
            cycle = loadAndRun(request);
        }
        catch (Exception exception)
        {
            cycle = Future.failedFuture(exception);
        }

        return cycle
            .recover(cause ->
            {
                logger.error("Refresh of device {} failed: {}", deviceId, cause.getMessage());

                var report = RefreshReport.of(deviceId, RefreshOutcome.FAILED);

                report.addError("refresh", ExceptionUtil.getMessage(cause));

                return Future.succeededFuture(report);
            })
            .map(report ->
            {
                inFlight.remove(deviceId);

                report.durationMs = clock.millis() - startedAt;

                logger.info("Refresh of device {} finished: {} in {}ms ({} errors)", deviceId, report.outcome,
                    report.durationMs, report.errors.size());

                return report;
            });
    }

    private Future<RefreshReport> loadAndRun(RefreshRequest request)
    {
        return deviceService.deviceGetById(request.deviceId)
            .compose(deviceData ->
            {
                if (!deviceData.getBoolean("found", false))
                {
                    return Future.succeededFuture(RefreshReport.of(request.deviceId, RefreshOutcome.NOT_FOUND));
                }

                var device = Device.fromJson(deviceData);

                if (device.isMaintenance())
                {
                    logger.debug("Device {} in maintenance, not refreshed", device.name);

                    return Future.succeededFuture(RefreshReport.of(device.deviceId, RefreshOutcome.SKIPPED_MAINTENANCE));
                }

                DeviceCredentials credentials;

                try
                {
                    credentials = device.toCredentials(config.getSecretKey(), config.getRouterOsPort());
                }
                catch (Exception exception)
                {
                    logger.error("Cannot refresh {}: {}", device.name, exception.getMessage());

                    var report = RefreshReport.of(device.deviceId, RefreshOutcome.FAILED);

                    report.addError("credentials", exception.getMessage());

                    return Future.succeededFuture(report);
                }

                return runCycle(device, credentials, request);
            });
    }

    private Future<RefreshReport> runCycle(Device device, DeviceCredentials credentials, RefreshRequest request)
    {
        var report = new RefreshReport(device.deviceId);

        return deviceClient.open(credentials)
            .compose(session -> runFeatures(device, session, request, report)
                .eventually(() -> session.close()))
            .map(v ->
            {
                report.outcome = report.errors.isEmpty() ? RefreshOutcome.SUCCESS : RefreshOutcome.PARTIAL;

                device.outcome = report.outcome;

                return report;
            })
            .recover(cause ->
            {
                if (!ExceptionUtil.isConnectivityFailure(cause))
                {
                    return Future.failedFuture(cause);
                }

                logger.warn("Device {} unreachable: {}", device.name, cause.getMessage());

                report.outcome = RefreshOutcome.CONNECTIVITY_FAILED;

                report.addError("connectivity", ExceptionUtil.getMessage(cause));

                device.outcome = report.outcome;

                return markOffline(device, cause).map(v -> report);
            });
    }

    private Future<Void> runFeatures(Device device, DeviceSession session, RefreshRequest request, RefreshReport report)
    {
        var fullSync = request.fullSync;

        var netwatch = request.includeNetwatch && config.isNetwatchEnabled();

        var probes = request.includeProbes && config.isProbesEnabled();

        var sessions = request.includeSessions && config.isSessionsEnabled();

        // identity and resources share one /system/resource/print
        var resourceRow = new AtomicReference<JsonObject>();

        return runFeature("identity", report, () -> metricsCollector.readResourceRow(session)
                .compose(row ->
                {
                    resourceRow.set(row);

                    return metricsCollector.fetchIdentity(session, row);
                })
                .compose(identity -> markOnline(device, identity)))
            .compose(v -> !fullSync ? Future.<Void>succeededFuture() : runFeature("resources", report,
                () -> (resourceRow.get() != null
                    ? metricsCollector.fetchResources(session, resourceRow.get())
                    : metricsCollector.fetchResources(session))
                    .compose(resources -> metricsCollector.recordMetrics(device, resources))))
            .compose(v -> !fullSync ? Future.<Void>succeededFuture() : runFeature("interfaces", report,
                () -> metricsCollector.fetchInterfaces(session)
                    .compose(samples -> metricsCollector.applyInterfaceRates(device.deviceId, samples, clock.instant()))))
            .compose(v -> !netwatch ? Future.<Void>succeededFuture() : runFeature("netwatch", report,
                () -> netwatchReconciler.reconcile(device, session)
                    .map(result ->
                    {
                        result.errors.forEach(error -> report.addError("netwatch", error));

                        return result;
                    })))
            .compose(v -> !probes ? Future.<Void>succeededFuture() : runFeature("probes", report,
                () -> latencyProber.probeAndRecord(device, session)))
            .compose(v -> !sessions ? Future.<Void>succeededFuture() : runFeature("sessions", report,
                () -> sessionTracker.fetchSessions(session)
                    .compose(current -> sessionTracker.track(device, current))));
    }

    /**
     * Runs one feature. Non-connectivity failures are recorded and swallowed so the
     * next feature still runs; connectivity failures abort the cycle.
     */
    private Future<Void> runFeature(String feature, RefreshReport report, Supplier<Future<?>> body)
    {
        Future<?> result;

        try
        {
            result = body.get();
        }
        catch (Exception exception)
        {
            result = Future.failedFuture(exception);
        }

        return result.<Void>mapEmpty()
            .recover(cause ->
            {
                if (ExceptionUtil.isConnectivityFailure(cause))
                {
                    return Future.failedFuture(cause);
                }

                logger.warn("Feature {} failed for device {}: {}", feature, report.deviceId, cause.getMessage());

                report.addError(feature, ExceptionUtil.getMessage(cause));

                return Future.succeededFuture();
            });
    }

    private Future<Void> markOnline(Device device, DeviceIdentity identity)
    {
        var previousStatus = device.status;

        return deviceService.deviceMarkOnline(device.deviceId, identity.toJson())
            .compose(updated ->
            {
                device.status = DeviceStatus.ONLINE;

                if (previousStatus != DeviceStatus.OFFLINE)
                {
                    return Future.<Void>succeededFuture();
                }

                logger.info("Device {} is back online", device.name);

                return alertEmitter.emit(statusAlert(device, DeviceStatus.ONLINE)).<Void>mapEmpty();
            });
    }

    private Future<Void> markOffline(Device device, Throwable cause)
    {
        var previousStatus = device.status;

        return deviceService.deviceMarkOffline(device.deviceId)
            .compose(updated ->
            {
                device.status = DeviceStatus.OFFLINE;

                if (previousStatus != DeviceStatus.ONLINE)
                {
                    return Future.<Void>succeededFuture();
                }

                var candidate = statusAlert(device, DeviceStatus.OFFLINE);

                candidate.message = candidate.message + ": " + ExceptionUtil.getMessage(cause);

                return alertEmitter.emit(candidate).<Void>mapEmpty();
            })
            .recover(error ->
            {
                logger.error("Failed to mark device {} offline: {}", device.name, error.getMessage());

                return Future.succeededFuture();
            });
    }

    private static AlertCandidate statusAlert(Device device, DeviceStatus status)
    {
        var online = status == DeviceStatus.ONLINE;

        return new AlertCandidate(device, AlertType.STATUS_CHANGE, device.address, status.value())
            .severity(online ? AlertSeverity.INFO : AlertSeverity.CRITICAL)
            .targetName(device.name)
            .text("[" + device.name + "] device " + (online ? "online" : "offline"),
                "Device " + device.name + " (" + device.address + ") is " + status.value());
    }

    public Future<List<RefreshReport>> refreshAll(boolean fullSync)
    {
        return refreshAll(fullSync, 0, 1);
    }

    /**
     * Refreshes the monitored devices of one shard concurrently. A device belongs to
     * shard floorMod(deviceId.hashCode(), shards).
     *
     * @param fullSync whether this tick includes resources and interfaces
     * @param shard shard handled by the caller
     * @param shards total number of shards
     * @return Future with one report per device of the shard
     */
    public Future<List<RefreshReport>> refreshAll(boolean fullSync, int shard, int shards)
    {
        return deviceService.deviceListMonitored()
            .compose(devices ->
            {
                var cycles = new ArrayList<Future<RefreshReport>>();

                for (var entry : devices)
                {
                    var deviceId = ((JsonObject) entry).getString("device_id");

                    if (shardOf(deviceId, shards) != shard)
                    {
                        continue;
                    }

                    cycles.add(refresh(new RefreshRequest(deviceId, fullSync, true, true, true)));
                }

                return Future.join(cycles).map(all -> cycles.stream().map(Future::result).toList());
            });
    }

    public static int shardOf(String deviceId, int shards)
    {
        return Math.floorMod(deviceId.hashCode(), Math.max(1, shards));
    }

    /**
     * Netwatch sync on a dedicated session, serialised with the device's refresh cycles.
     *
     * @param device device to synchronise
     * @return Future with {synced, errors}; fails with DeviceBusyException while the device is in flight
     */
    public Future<SyncResult> syncNetwatch(Device device)
    {
        return exclusive(device.deviceId, "netwatch sync", () -> netwatchReconciler.syncOne(device));
    }

    /**
     * Watch target removal, serialised with the device's refresh cycles.
     *
     * @param device owning device
     * @param host watched host to remove
     * @return Future with the delete result; fails with DeviceBusyException while the device is in flight
     */
    public Future<JsonObject> deleteNetwatchTarget(Device device, String host)
    {
        return exclusive(device.deviceId, "netwatch delete", () -> netwatchReconciler.deleteTarget(device, host));
    }

    private <T> Future<T> exclusive(String deviceId, String operation, Supplier<Future<T>> body)
    {
        if (!inFlight.add(deviceId))
        {
            logger.warn("{} for device {} rejected: device busy", operation, deviceId);

            return Future.failedFuture(new DeviceBusyException(deviceId, operation));
        }

        Future<T> result;

        try
        {
            result = body.get();
        }
        catch (Exception exception)
        {
            result = Future.failedFuture(exception);
        }

        return result.eventually(() ->
        {
            inFlight.remove(deviceId);

            return Future.<Void>succeededFuture();
        });
    }

    public boolean isInFlight(String deviceId)
    {
        return inFlight.contains(deviceId);
    }

}
