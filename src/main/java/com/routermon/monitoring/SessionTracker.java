package com.routermon.monitoring;

import com.routermon.core.DeviceSession;

import com.routermon.models.ActiveSession;

import com.routermon.models.AlertCandidate;

import com.routermon.models.AlertSeverity;

import com.routermon.models.AlertType;

import com.routermon.models.Device;

import com.routermon.models.SessionDiff;

import com.routermon.services.SessionService;

import com.routermon.utils.TimestampUtil;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.json.JsonArray;

import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.time.Duration;

import java.util.ArrayList;

import java.util.LinkedHashMap;

import java.util.List;

import java.util.Map;

/**
 * SessionTracker - Connect/disconnect detection for PPP subscriber sessions

 * Sessions are keyed by remote username. Each cycle the observed set is diffed against
 * the persisted set, one SESSION alert is raised per transition, and the persisted set
 * is replaced to match the observation exactly.
 */
public class SessionTracker
{

    private static final Logger logger = LoggerFactory.getLogger(SessionTracker.class);

    private final SessionService sessionService;

    private final AlertEmitter alertEmitter;

    private final Clock clock;

    public SessionTracker(SessionService sessionService, AlertEmitter alertEmitter, Clock clock)
    {
        this.sessionService = sessionService;

        this.alertEmitter = alertEmitter;

        this.clock = clock;
    }

    /**
     * Reads the active PPP sessions. Rows without a name are skipped; a repeated name keeps the last row.
     *
     * @param session open device session
     * @return Future with the observed sessions
     */
    public Future<List<ActiveSession>> fetchSessions(DeviceSession session)
    {
        return session.execute("/ppp/active/print")
            .map(rows ->
            {
                var sessions = new LinkedHashMap<String, ActiveSession>();

                for (var row : rows)
                {
                    var name = row.getString("name");

                    if (name == null || name.isEmpty())
                    {
                        continue;
                    }

                    var active = new ActiveSession();

                    active.sessionKey = name;

                    active.service = row.getString("service");

                    active.callerId = row.getString("caller-id");

                    active.address = row.getString("address");

                    active.remoteId = row.getString("session-id");

                    active.uptime = row.getString("uptime");

                    sessions.put(name, active);
                }

                return new ArrayList<>(sessions.values());
            });
    }

    /**
     * @param device device the sessions belong to
     * @param current sessions observed this cycle
     * @return Future with the connected / disconnected sessions
     */
    public Future<SessionDiff> track(Device device, List<ActiveSession> current)
    {
        var promise = Promise.<SessionDiff>promise();

        try
        {
            sessionService.sessionListByDevice(device.deviceId)
                .compose(previousRows ->
                {
                    var previous = new ArrayList<ActiveSession>();

                    for (var row : previousRows)
                    {
                        previous.add(ActiveSession.fromJson((JsonObject) row));
                    }

                    var diff = diff(previous, current);

                    var snapshot = new JsonArray();

                    current.forEach(active -> snapshot.add(active.toJson()));

                    return raiseAlerts(device, diff)
                        .compose(v -> sessionService.sessionReplaceAll(device.deviceId, snapshot))
                        .map(replaced -> diff);
                })
                .onSuccess(diff ->
                {
                    if (!diff.connected.isEmpty() || !diff.disconnected.isEmpty())
                    {
                        logger.info("Sessions on {}: {} connected, {} disconnected", device.name,
                            diff.connected.size(), diff.disconnected.size());
                    }

                    promise.complete(diff);
                })
                .onFailure(cause ->
                {
                    logger.error("Failed to track sessions on {}: {}", device.name, cause.getMessage());

                    promise.fail(cause);
                });
        }
        catch (Exception exception)
        {
            logger.error("Error in track: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    /**
     * connected = current - previous, disconnected = previous - current, by session key.
     *
     * @param previous persisted sessions
     * @param current observed sessions
     * @return diff preserving the input order
     */
    public static SessionDiff diff(List<ActiveSession> previous, List<ActiveSession> current)
    {
        var diff = new SessionDiff();

        Map<String, ActiveSession> previousByKey = new LinkedHashMap<>();

        previous.forEach(active -> previousByKey.put(active.sessionKey, active));

        Map<String, ActiveSession> currentByKey = new LinkedHashMap<>();

        current.forEach(active -> currentByKey.put(active.sessionKey, active));

        for (var active : currentByKey.values())
        {
            if (!previousByKey.containsKey(active.sessionKey))
            {
                diff.connected.add(active);
            }
        }

        for (var active : previousByKey.values())
        {
            if (!currentByKey.containsKey(active.sessionKey))
            {
                diff.disconnected.add(active);
            }
        }

        return diff;
    }

    private Future<Void> raiseAlerts(Device device, SessionDiff diff)
    {
        var candidates = new ArrayList<AlertCandidate>();

        for (var active : diff.connected)
        {
            candidates.add(new AlertCandidate(device, AlertType.SESSION, active.sessionKey, "connected")
                .severity(AlertSeverity.INFO)
                .text("[" + device.name + "] " + active.sessionKey + " connected",
                    "Session " + active.sessionKey + " connected via " + active.service
                        + describeAddress(active) + " on " + device.name));
        }

        for (var active : diff.disconnected)
        {
            candidates.add(new AlertCandidate(device, AlertType.SESSION, active.sessionKey, "disconnected")
                .severity(AlertSeverity.WARNING)
                .text("[" + device.name + "] " + active.sessionKey + " disconnected",
                    "Session " + active.sessionKey + " disconnected from " + device.name
                        + " after " + sessionDuration(active)));
        }

        Future<Void> chain = Future.succeededFuture();

        for (var candidate : candidates)
        {
            chain = chain.compose(v -> alertEmitter.emit(candidate)
                .recover(cause ->
                {
                    logger.error("Failed to raise session alert for {} on {}: {}", candidate.target, device.name,
                        cause.getMessage());

                    return Future.succeededFuture(false);
                })
                .<Void>mapEmpty());
        }

        return chain;
    }

    private static String describeAddress(ActiveSession active)
    {
        return active.address != null ? " (" + active.address + ")" : "";
    }

    private String sessionDuration(ActiveSession active)
    {
        var connectedAt = TimestampUtil.parse(active.connectedAt);

        if (connectedAt == null)
        {
            return active.uptime != null ? active.uptime : "unknown duration";
        }

        return formatDuration(Duration.between(connectedAt, clock.instant()));
    }

    static String formatDuration(Duration duration)
    {
        if (duration.isNegative())
        {
            duration = Duration.ZERO;
        }

        var days = duration.toDays();

        var hours = duration.toHoursPart();

        var minutes = duration.toMinutesPart();

        var seconds = duration.toSecondsPart();

        var text = new StringBuilder();

        if (days > 0)
        {
            text.append(days).append("d ");
        }

        if (days > 0 || hours > 0)
        {
            text.append(hours).append("h ");
        }

        if (days > 0 || hours > 0 || minutes > 0)
        {
            text.append(minutes).append("m ");
        }

        return text.append(seconds).append("s").toString();
    }

}
