package com.routermon.monitoring;

import com.routermon.models.ActiveSession;

import com.routermon.models.DeviceStatus;

import com.routermon.support.InMemoryAlertService;

import com.routermon.support.InMemorySessionService;

import com.routermon.support.MutableClock;

import com.routermon.support.RecordingNotificationDispatcher;

import com.routermon.support.ScriptedDeviceSession;

import com.routermon.support.TestDevices;

import io.vertx.core.json.JsonObject;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import java.time.Instant;

import java.util.List;

import java.util.Set;

import static com.routermon.support.TestFutures.await;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionTrackerTest
{

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));

    private final InMemorySessionService sessions = new InMemorySessionService(clock);

    private final InMemoryAlertService alerts = new InMemoryAlertService(clock);

    private final SessionTracker tracker = new SessionTracker(sessions,
        new AlertEmitter(alerts, new RecordingNotificationDispatcher(), TestDevices.config(), clock), clock);

    private static ActiveSession active(String name)
    {
        var session = new ActiveSession();

        session.sessionKey = name;

        session.service = "pppoe";

        session.address = "100.64.0." + name.length();

        session.uptime = "5m";

        return session;
    }

    private static JsonObject pppRow(String name, String address)
    {
        return new JsonObject()
            .put(".id", "*" + name)
            .put("name", name)
            .put("service", "pppoe")
            .put("caller-id", "AA:BB:CC:00:00:01")
            .put("address", address)
            .put("session-id", "0x81")
            .put("uptime", "1h2m");
    }

    @Test
    void fetchSessionsSkipsNamelessRowsAndKeepsLastDuplicate() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/ppp/active/print", pppRow("alice", "100.64.0.1"), new JsonObject().put("service", "pppoe"),
                pppRow("bob", "100.64.0.2"), pppRow("alice", "100.64.0.9"));

        var current = await(tracker.fetchSessions(session));

        assertEquals(2, current.size());

        assertEquals("alice", current.get(0).sessionKey);

        assertEquals("100.64.0.9", current.get(0).address);

        assertEquals("AA:BB:CC:00:00:01", current.get(0).callerId);

        assertEquals("0x81", current.get(0).remoteId);
    }

    @Test
    void diffIsComputedBySessionKey()
    {
        var diff = SessionTracker.diff(List.of(active("A"), active("B")), List.of(active("B"), active("C")));

        assertEquals(List.of("C"), diff.connectedKeys());

        assertEquals(List.of("A"), diff.disconnectedKeys());
    }

    @Test
    void trackRaisesOneAlertPerTransitionAndReplacesTheSet() throws Exception
    {
        var device = TestDevices.device(DeviceStatus.ONLINE);

        await(tracker.track(device, List.of(active("A"), active("B"))));

        assertEquals(2, alerts.alerts().size());

        clock.advance(Duration.ofMinutes(61).plusSeconds(5));

        var diff = await(tracker.track(device, List.of(active("B"), active("C"))));

        assertEquals(List.of("C"), diff.connectedKeys());

        assertEquals(List.of("A"), diff.disconnectedKeys());

        assertEquals(Set.of("B", "C"), sessions.sessions(TestDevices.DEVICE_ID).keySet());

        var latest = alerts.alerts().subList(2, alerts.alerts().size());

        assertEquals(2, latest.size());

        var connected = latest.get(0);

        assertEquals("C", connected.getString("target"));

        assertEquals("connected", connected.getString("state"));

        assertEquals("info", connected.getString("severity"));

        var disconnected = latest.get(1);

        assertEquals("A", disconnected.getString("target"));

        assertEquals("disconnected", disconnected.getString("state"));

        assertEquals("warning", disconnected.getString("severity"));

        assertTrue(disconnected.getString("message").endsWith("after 1h 1m 5s"));
    }

    @Test
    void unchangedSetRaisesNothingAndKeepsConnectedAt() throws Exception
    {
        var device = TestDevices.device(DeviceStatus.ONLINE);

        await(tracker.track(device, List.of(active("A"))));

        clock.advance(Duration.ofMinutes(5));

        var diff = await(tracker.track(device, List.of(active("A"))));

        assertTrue(diff.connected.isEmpty());

        assertTrue(diff.disconnected.isEmpty());

        assertEquals(1, alerts.alerts().size());

        var stored = sessions.sessions(TestDevices.DEVICE_ID).get("A");

        assertEquals("2024-06-01T12:00:00Z", stored.getString("connected_at"));

        assertEquals("2024-06-01T12:05:00Z", stored.getString("last_seen"));
    }

    @Test
    void alertFailureDoesNotBlockReplace() throws Exception
    {
        alerts.failCreate(new IllegalStateException("alerts table unavailable"));

        await(tracker.track(TestDevices.device(DeviceStatus.ONLINE), List.of(active("A"))));

        assertEquals(Set.of("A"), sessions.sessions(TestDevices.DEVICE_ID).keySet());
    }

    @Test
    void durationFormatting()
    {
        assertEquals("0s", SessionTracker.formatDuration(Duration.ZERO));

        assertEquals("2m 0s", SessionTracker.formatDuration(Duration.ofMinutes(2)));

        assertEquals("1d 0h 0m 1s", SessionTracker.formatDuration(Duration.ofDays(1).plusSeconds(1)));

        assertEquals("0s", SessionTracker.formatDuration(Duration.ofSeconds(-3)));
    }

}
