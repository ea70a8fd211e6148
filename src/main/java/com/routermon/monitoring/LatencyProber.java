package com.routermon.monitoring;

import com.routermon.core.BoundedWorkerPool;

import com.routermon.core.DeviceSession;

import com.routermon.core.EngineConfig;

import com.routermon.exceptions.ProbeException;

import com.routermon.models.AlertCandidate;

import com.routermon.models.AlertSeverity;

import com.routermon.models.AlertType;

import com.routermon.models.Device;

import com.routermon.models.PingResult;

import com.routermon.models.WatchStatus;

import com.routermon.services.NetwatchService;

import com.routermon.utils.RouterOsValueParser;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayList;

import java.util.HashMap;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.Map;

/**
 * LatencyProber - Ping watch targets from the device itself

 * Each target gets one /ping command on the shared session. Probes run through a
 * BoundedWorkerPool so at most probe.concurrency pings are in flight; each probe
 * races its own timer; a timeout fails only that probe and cancels its /ping.

 * A failed probe is reported as latency null / 100% loss and never propagates.
 */
public class LatencyProber
{

    private static final Logger logger = LoggerFactory.getLogger(LatencyProber.class);

    private final Vertx vertx;

    private final NetwatchService netwatchService;

    private final AlertEmitter alertEmitter;

    private final EngineConfig config;

    public LatencyProber(Vertx vertx, NetwatchService netwatchService, AlertEmitter alertEmitter, EngineConfig config)
    {
        this.vertx = vertx;

        this.netwatchService = netwatchService;

        this.alertEmitter = alertEmitter;

        this.config = config;
    }

    /**
     * Worker pool running one ping per host.
     */
    private class ProbePool extends BoundedWorkerPool<String, PingResult>
    {

        private final DeviceSession session;

        ProbePool(DeviceSession session, List<String> hosts, int concurrency)
        {
            super(hosts, concurrency);

            this.session = session;
        }

        @Override
        protected Future<PingResult> processItem(String host)
        {
            return probeOne(session, host);
        }

        @Override
        protected PingResult handleItemFailure(String host, Throwable cause)
        {
            logger.debug("Probe of {} failed: {}", host, cause.getMessage());

            return PingResult.failed(host);
        }

    }

    public Future<List<PingResult>> probe(DeviceSession session, List<String> hosts)
    {
        return probe(session, hosts, config.getProbeConcurrency());
    }

    /**
     * @param session open session shared by all probes
     * @param hosts hosts to ping
     * @param concurrency maximum pings in flight
     * @return Future with one result per host, in input order; never fails
     */
    public Future<List<PingResult>> probe(DeviceSession session, List<String> hosts, int concurrency)
    {
        return new ProbePool(session, hosts, concurrency).run();
    }

    private Future<PingResult> probeOne(DeviceSession session, String host)
    {
        var promise = Promise.<PingResult>promise();

        var timeoutMs = config.getProbeTimeoutMs();

        var expired = Promise.<Void>promise();

        var timerId = vertx.setTimer(timeoutMs, id ->
        {
            expired.tryComplete();

            promise.tryFail(timedOut(host, timeoutMs));
        });

        var params = new HashMap<String, String>();

        params.put("address", host);

        params.put("count", String.valueOf(config.getProbeCount()));

        // a timed-out ping is cancelled on the device so it stops holding the connection
        session.execute("/ping", params, expired.future())
            .onComplete(reply ->
            {
                vertx.cancelTimer(timerId);

                if (reply.succeeded())
                {
                    promise.tryComplete(summarize(host, reply.result()));
                }
                else if (expired.future().isComplete())
                {
                    promise.tryFail(timedOut(host, timeoutMs));
                }
                else
                {
                    promise.tryFail(new ProbeException(host, reply.cause().getMessage()));
                }
            });

        return promise.future();
    }

    private static ProbeException timedOut(String host, long timeoutMs)
    {
        return new ProbeException(host, "timed out after " + timeoutMs + "ms");
    }

    /**
     * Reduces /ping reply rows to one result.

     * Latency: avg-rtt when reported, else the mean of per-packet time values, else null.
     * Loss: packet-loss when reported, else derived from sent/received, else the share of
     * rows without a time.
     *
     * @param host probed host
     * @param rows reply rows
     * @return completed PingResult
     */
    static PingResult summarize(String host, List<JsonObject> rows)
    {
        if (rows.isEmpty())
        {
            return new PingResult(host, null, 100, true);
        }

        Integer averageRtt = null;

        Integer reportedLoss = null;

        Long sent = null;

        Long received = null;

        var times = new ArrayList<Integer>();

        var rowsWithoutTime = 0;

        for (var row : rows)
        {
            var rtt = RouterOsValueParser.parseLatencyMs(row.getString("avg-rtt"));

            if (rtt != null)
            {
                averageRtt = rtt;
            }

            if (row.getString("packet-loss") != null)
            {
                reportedLoss = RouterOsValueParser.parseInt(row.getString("packet-loss"), 100);
            }

            if (row.getString("sent") != null && row.getString("received") != null)
            {
                sent = RouterOsValueParser.parseLong(row.getString("sent"), 0);

                received = RouterOsValueParser.parseLong(row.getString("received"), 0);
            }

            var time = RouterOsValueParser.parseLatencyMs(row.getString("time"));

            if (time != null)
            {
                times.add(time);
            }
            else
            {
                rowsWithoutTime++;
            }
        }

        var latency = averageRtt;

        if (latency == null && !times.isEmpty())
        {
            latency = (int) Math.round(times.stream().mapToInt(Integer::intValue).average().orElse(0));
        }

        int loss;

        if (reportedLoss != null)
        {
            loss = reportedLoss;
        }
        else if (sent != null && sent > 0)
        {
            loss = (int) Math.round((sent - received) * 100.0 / sent);
        }
        else
        {
            loss = (int) Math.round(rowsWithoutTime * 100.0 / rows.size());
        }

        return new PingResult(host, latency, Math.max(0, Math.min(100, loss)), true);
    }

    /**
     * Probes the device's enabled watch targets, stores latency and loss per target and
     * raises PERFORMANCE alerts for completed probes of targets not already down.
     *
     * @param device device being refreshed
     * @param session open session
     * @return Future with the probe results
     */
    public Future<List<PingResult>> probeAndRecord(Device device, DeviceSession session)
    {
        var promise = Promise.<List<PingResult>>promise();

        try
        {
            netwatchService.netwatchListByDevice(device.deviceId)
                .compose(targets ->
                {
                    var statuses = new LinkedHashMap<String, WatchStatus>();

                    for (var row : targets)
                    {
                        var target = (JsonObject) row;

                        if (!target.getBoolean("disabled", false))
                        {
                            statuses.put(target.getString("host"), WatchStatus.fromValue(target.getString("status")));
                        }
                    }

                    return probe(session, new ArrayList<>(statuses.keySet()))
                        .compose(results -> record(device, results, statuses).map(v -> results));
                })
                .onSuccess(results ->
                {
                    logger.debug("Probed {} targets on {}", results.size(), device.name);

                    promise.complete(results);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to probe targets on {}: {}", device.name, cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in probeAndRecord: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    private Future<Void> record(Device device, List<PingResult> results, Map<String, WatchStatus> statuses)
    {
        var writes = new ArrayList<Future<Boolean>>();

        for (var result : results)
        {
            writes.add(netwatchService.netwatchUpdateProbe(device.deviceId, result.host, result.latencyMs, result.packetLoss)
                .compose(updated -> evaluate(device, result, statuses.get(result.host))));
        }

        return Future.all(writes).mapEmpty();
    }

    private Future<Boolean> evaluate(Device device, PingResult result, WatchStatus status)
    {
        if (!result.completed || status == WatchStatus.DOWN)
        {
            return Future.succeededFuture(false);
        }

        var slow = result.latencyMs != null && result.latencyMs > config.getLatencyThresholdMs();

        if (!slow && result.packetLoss <= 0)
        {
            return Future.succeededFuture(false);
        }

        var latencyText = result.latencyMs != null ? result.latencyMs + "ms" : "n/a";

        var candidate = new AlertCandidate(device, AlertType.PERFORMANCE, result.host, "degraded")
            .severity(AlertSeverity.WARNING)
            .text("[" + device.name + "] " + result.host + " degraded",
                "Latency " + latencyText + ", packet loss " + result.packetLoss + "% (threshold "
                    + config.getLatencyThresholdMs() + "ms)");

        return alertEmitter.emit(candidate);
    }

}
