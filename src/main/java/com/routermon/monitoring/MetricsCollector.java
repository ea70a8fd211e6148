package com.routermon.monitoring;

import com.routermon.core.DeviceSession;

import com.routermon.core.EngineConfig;

import com.routermon.models.AlertCandidate;

import com.routermon.models.AlertSeverity;

import com.routermon.models.AlertType;

import com.routermon.models.Device;

import com.routermon.models.DeviceIdentity;

import com.routermon.models.InterfaceCounters;

import com.routermon.models.ResourceSnapshot;

import com.routermon.services.MetricsService;

import com.routermon.utils.ExceptionUtil;

import com.routermon.utils.RouterOsValueParser;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.HashMap;

import java.util.List;

/**
 * MetricsCollector - Identity, resource and interface sampling

 * Responsibilities:
 * - Read identity, system resources and interface counters from an open session
 * - Append metric snapshots and raise HIGH_CPU / HIGH_MEMORY alerts on thresholds
 * - Derive interface tx/rx rates (bits per second) from consecutive counter samples

 * Secondary commands (/system/routerboard, /system/health, /interface/ethernet) are
 * optional: a device-side error leaves the dependent fields at their defaults.
 * Connectivity failures are never masked.
 */
public class MetricsCollector
{

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private final MetricsService metricsService;

    private final AlertEmitter alertEmitter;

    private final EngineConfig config;

    private final Clock clock;

    public MetricsCollector(MetricsService metricsService, AlertEmitter alertEmitter, EngineConfig config, Clock clock)
    {
        this.metricsService = metricsService;

        this.alertEmitter = alertEmitter;

        this.config = config;

        this.clock = clock;
    }

    /**
     * Reads identity, resources and interfaces in one pass. Optional menus that fail
     * leave their fields at the defaults.
     *
     * @param session open device session
     * @return Future with {identity, resources, interfaces}
     */
    public Future<JsonObject> fetchSnapshot(DeviceSession session)
    {
        var snapshot = new JsonObject();

        return readResourceRow(session)
            .compose(resourceRow -> fetchIdentity(session, resourceRow)
                .compose(identity ->
                {
                    snapshot.put("identity", identity.toJson());

                    return fetchResources(session, resourceRow);
                }))
            .compose(resources ->
            {
                snapshot.put("resources", resources.toMetricsJson(null));

                return fetchInterfaces(session);
            })
            .map(interfaces ->
            {
                var interfaceArray = new JsonArray();

                interfaces.forEach(counters -> interfaceArray.add(counters.toJson()));

                return snapshot.put("interfaces", interfaceArray);
            });
    }

    /**
     * Reads the /system/resource/print row that both identity and resources are built from.
     */
    public Future<JsonObject> readResourceRow(DeviceSession session)
    {
        return session.execute("/system/resource/print").map(MetricsCollector::firstRow);
    }

    public Future<DeviceIdentity> fetchIdentity(DeviceSession session)
    {
        return readResourceRow(session).compose(resourceRow -> fetchIdentity(session, resourceRow));
    }

    public Future<DeviceIdentity> fetchIdentity(DeviceSession session, JsonObject resourceRow)
    {
        var identity = new DeviceIdentity();

        identity.version = resourceRow.getString("version");

        identity.boardName = resourceRow.getString("board-name");

        identity.architecture = resourceRow.getString("architecture-name");

        return session.execute("/system/identity/print")
            .compose(rows ->
            {
                identity.identity = firstRow(rows).getString("name");

                return optional(session, "/system/routerboard/print");
            })
            .map(rows ->
            {
                var routerboard = firstRow(rows);

                identity.model = routerboard.getString("model", identity.boardName);

                identity.serialNumber = routerboard.getString("serial-number");

                return identity;
            });
    }

    public Future<ResourceSnapshot> fetchResources(DeviceSession session)
    {
        return readResourceRow(session).compose(resourceRow -> fetchResources(session, resourceRow));
    }

    public Future<ResourceSnapshot> fetchResources(DeviceSession session, JsonObject resourceRow)
    {
        var resources = new ResourceSnapshot();

        resources.cpuLoad = RouterOsValueParser.parseInt(resourceRow.getString("cpu-load"), 0);

        resources.cpuCount = RouterOsValueParser.parseInt(resourceRow.getString("cpu-count"), 0);

        resources.cpuFrequency = RouterOsValueParser.parseInt(resourceRow.getString("cpu-frequency"), 0);

        resources.totalMemory = RouterOsValueParser.parseLong(resourceRow.getString("total-memory"), 0);

        resources.freeMemory = RouterOsValueParser.parseLong(resourceRow.getString("free-memory"), 0);

        resources.totalDisk = RouterOsValueParser.parseLong(resourceRow.getString("total-hdd-space"), 0);

        resources.freeDisk = RouterOsValueParser.parseLong(resourceRow.getString("free-hdd-space"), 0);

        var uptime = RouterOsValueParser.parseDurationSeconds(resourceRow.getString("uptime"));

        resources.uptimeSeconds = uptime != null ? uptime : 0;

        return optional(session, "/system/health/print")
            .map(rows ->
            {
                applyHealth(resources, rows);

                return resources;
            });
    }

    /**
     * Health replies come in two shapes: a single row of named columns (v6) or
     * one {name, value} row per sensor (v7).
     */
    private static void applyHealth(ResourceSnapshot resources, List<JsonObject> rows)
    {
        for (var row : rows)
        {
            var sensor = row.getString("name");

            if (sensor != null)
            {
                var value = RouterOsValueParser.parseDouble(row.getString("value"));

                if (sensor.equals("voltage"))
                {
                    resources.voltage = value;
                }
                else if (sensor.contains("temperature") && (resources.boardTemp == null || sensor.equals("temperature")
                    || sensor.startsWith("board-temperature")))
                {
                    resources.boardTemp = value;
                }
            }
            else
            {
                if (row.containsKey("temperature"))
                {
                    resources.boardTemp = RouterOsValueParser.parseDouble(row.getString("temperature"));
                }

                if (row.containsKey("voltage"))
                {
                    resources.voltage = RouterOsValueParser.parseDouble(row.getString("voltage"));
                }
            }
        }
    }

    public Future<List<InterfaceCounters>> fetchInterfaces(DeviceSession session)
    {
        var interfaces = new ArrayList<InterfaceCounters>();

        return session.execute("/interface/print")
            .compose(rows ->
            {
                for (var row : rows)
                {
                    var name = row.getString("name");

                    if (name == null || name.isEmpty())
                    {
                        continue;
                    }

                    interfaces.add(toCounters(row));
                }

                return optional(session, "/interface/ethernet/print");
            })
            .map(rows ->
            {
                var speeds = new HashMap<String, String>();

                for (var row : rows)
                {
                    var speed = row.getString("speed", row.getString("rate"));

                    if (row.getString("name") != null && speed != null)
                    {
                        speeds.put(row.getString("name"), speed);
                    }
                }

                interfaces.forEach(counters -> counters.speed = speeds.get(counters.name));

                return interfaces;
            });
    }

    private static InterfaceCounters toCounters(JsonObject row)
    {
        var counters = new InterfaceCounters();

        counters.name = row.getString("name");

        counters.defaultName = row.getString("default-name");

        counters.type = row.getString("type");

        counters.macAddress = row.getString("mac-address");

        counters.running = RouterOsValueParser.parseBoolean(row.getString("running"));

        counters.disabled = RouterOsValueParser.parseBoolean(row.getString("disabled"));

        counters.comment = row.getString("comment");

        counters.txBytes = RouterOsValueParser.parseLong(row.getString("tx-byte"), 0);

        counters.rxBytes = RouterOsValueParser.parseLong(row.getString("rx-byte"), 0);

        counters.txPackets = RouterOsValueParser.parseLong(row.getString("tx-packet"), 0);

        counters.rxPackets = RouterOsValueParser.parseLong(row.getString("rx-packet"), 0);

        counters.txDrops = RouterOsValueParser.parseLong(row.getString("tx-drop"), 0);

        counters.rxDrops = RouterOsValueParser.parseLong(row.getString("rx-drop"), 0);

        counters.txErrors = RouterOsValueParser.parseLong(row.getString("tx-error"), 0);

        counters.rxErrors = RouterOsValueParser.parseLong(row.getString("rx-error"), 0);

        return counters;
    }

    /**
     * Appends a metric snapshot and evaluates the CPU and memory thresholds.
     *
     * @param device device the snapshot belongs to
     * @param resources sampled resources
     * @return Future with the created snapshot row
     */
    public Future<JsonObject> recordMetrics(Device device, ResourceSnapshot resources)
    {
        var promise = Promise.<JsonObject>promise();

        try
        {
            metricsService.metricsCreate(resources.toMetricsJson(device.deviceId))
                .compose(created -> checkThreshold(device, AlertType.HIGH_CPU, "CPU", resources.cpuLoad,
                        config.getCpuWarning(), config.getCpuCritical())
                    .compose(v -> checkThreshold(device, AlertType.HIGH_MEMORY, "Memory", resources.memoryUsagePercent(),
                        config.getMemoryWarning(), config.getMemoryCritical()))
                    .map(v -> created))
                .onSuccess(promise::complete)
                .onFailure(cause ->
                {
                    logger.error("Failed to record metrics for {}: {}", device.name, cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in recordMetrics: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    private Future<Boolean> checkThreshold(Device device, AlertType type, String label, int usage, int warning, int critical)
    {
        AlertSeverity severity;

        if (usage >= critical)
        {
            severity = AlertSeverity.CRITICAL;
        }
        else if (usage >= warning)
        {
            severity = AlertSeverity.WARNING;
        }
        else
        {
            return Future.succeededFuture(false);
        }

        var threshold = severity == AlertSeverity.CRITICAL ? critical : warning;

        var candidate = new AlertCandidate(device, type, device.address, severity.value())
            .severity(severity)
            .targetName(device.name)
            .text(label + " usage high on " + device.name,
                label + " usage is " + usage + "% (threshold " + threshold + "%)");

        return alertEmitter.emit(candidate);
    }

    /**
     * Derives tx/rx rates against the persisted previous sample and upserts every interface.
     *
     * @param deviceId owning device
     * @param samples freshly fetched counters
     * @param now sampling time
     * @return Future with the samples, rates filled in
     */
    public Future<List<InterfaceCounters>> applyInterfaceRates(String deviceId, List<InterfaceCounters> samples, Instant now)
    {
        var promise = Promise.<List<InterfaceCounters>>promise();

        try
        {
            metricsService.interfaceListByDevice(deviceId)
                .compose(previousRows ->
                {
                    var previous = new HashMap<String, InterfaceCounters>();

                    for (var row : previousRows)
                    {
                        var counters = InterfaceCounters.fromJson((JsonObject) row);

                        previous.put(counters.name, counters);
                    }

                    var upserts = new ArrayList<Future<JsonObject>>();

                    for (var sample : samples)
                    {
                        applyRates(sample, previous.get(sample.name), now);

                        upserts.add(metricsService.interfaceUpsert(deviceId, sample.toJson()));
                    }

                    return Future.all(upserts);
                })
                .onSuccess(result ->
                {
                    logger.debug("Updated {} interfaces for device {}", samples.size(), deviceId);

                    promise.complete(samples);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to apply interface rates for device {}: {}", deviceId, cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in applyInterfaceRates: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    /**
     * Convenience for callers without an explicit sampling time.
     */
    public Future<List<InterfaceCounters>> applyInterfaceRates(String deviceId, List<InterfaceCounters> samples)
    {
        return applyInterfaceRates(deviceId, samples, clock.instant());
    }

    private static void applyRates(InterfaceCounters sample, InterfaceCounters previous, Instant now)
    {
        sample.lastUpdated = now;

        if (previous == null || previous.lastUpdated == null)
        {
            sample.txRate = 0;

            sample.rxRate = 0;

            return;
        }

        sample.txRate = computeRate(previous.txBytes, sample.txBytes, previous.lastUpdated, now);

        sample.rxRate = computeRate(previous.rxBytes, sample.rxBytes, previous.lastUpdated, now);
    }

    /**
     * Bits per second between two byte counter readings.
     * A non-positive interval or a counter that went backwards (reset, wrap) yields 0.
     *
     * @param previous earlier counter value
     * @param current later counter value
     * @param previousAt time of the earlier reading
     * @param now time of the later reading
     * @return rate in bits per second
     */
    static long computeRate(long previous, long current, Instant previousAt, Instant now)
    {
        if (previousAt == null)
        {
            return 0;
        }

        var elapsedMillis = Duration.between(previousAt, now).toMillis();

        if (elapsedMillis <= 0)
        {
            return 0;
        }

        var delta = current - previous;

        if (delta < 0)
        {
            return 0;
        }

        return Math.round(delta * 8 * 1000.0 / elapsedMillis);
    }

    /**
     * Runs a secondary command; device-side errors yield no rows, connectivity failures propagate.
     */
    private static Future<List<JsonObject>> optional(DeviceSession session, String command)
    {
        return session.execute(command)
            .recover(cause ->
            {
                if (ExceptionUtil.isConnectivityFailure(cause))
                {
                    return Future.failedFuture(cause);
                }

                logger.debug("Optional command {} unavailable: {}", command, cause.getMessage());

                return Future.succeededFuture(List.of());
            });
    }

    private static JsonObject firstRow(List<JsonObject> rows)
    {
        return rows.isEmpty() ? new JsonObject() : rows.get(0);
    }

}
