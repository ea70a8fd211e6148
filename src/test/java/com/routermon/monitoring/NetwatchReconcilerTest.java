package com.routermon.monitoring;

import com.routermon.exceptions.ConnectivityException;

import com.routermon.models.DeviceStatus;

import com.routermon.models.WatchEntry;

import com.routermon.support.InMemoryAlertService;

import com.routermon.support.InMemoryNetwatchService;

import com.routermon.support.MutableClock;

import com.routermon.support.RecordingNotificationDispatcher;

import com.routermon.support.ScriptedDeviceClient;

import com.routermon.support.ScriptedDeviceSession;

import com.routermon.support.TestDevices;

import io.vertx.core.Future;

import io.vertx.core.Vertx;

import io.vertx.core.json.JsonObject;

import io.vertx.junit5.VertxExtension;

import org.junit.jupiter.api.Test;

import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;

import java.time.Instant;

import java.util.ArrayList;

import java.util.List;

import static com.routermon.support.TestFutures.await;

import static com.routermon.support.TestFutures.awaitFailure;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(VertxExtension.class)
class NetwatchReconcilerTest
{

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));

    private final InMemoryNetwatchService netwatch = new InMemoryNetwatchService();

    private final InMemoryAlertService alerts = new InMemoryAlertService(clock);

    private final RecordingNotificationDispatcher dispatcher = new RecordingNotificationDispatcher();

    private final ScriptedDeviceSession session = new ScriptedDeviceSession();

    private final ScriptedDeviceClient client = new ScriptedDeviceClient(session);

    private final NetwatchReconciler reconciler = new NetwatchReconciler(client, netwatch,
        new AlertEmitter(alerts, dispatcher, TestDevices.config(), clock), TestDevices.config(), clock);

    private static JsonObject remote(String host, String status)
    {
        return new JsonObject()
            .put(".id", "*1")
            .put("host", host)
            .put("status", status)
            .put("interval", "30s")
            .put("disabled", "false");
    }

    private static JsonObject stored(String host, String status)
    {
        return new JsonObject()
            .put("host", host)
            .put("name", "Google DNS")
            .put("status", status)
            .put("disabled", false)
            .put("last_up", "2024-06-01T09:00:00Z")
            .put("interval_seconds", 30);
    }

    @Test
    void hostGoingDownRaisesOneAlertAndPersistsDown() throws Exception
    {
        netwatch.put(TestDevices.DEVICE_ID, stored("8.8.8.8", "up"));

        session.reply("/tool/netwatch/print",
            remote("8.8.8.8", "down").put("comment", "Google DNS").put("since", "jun/01/2024 11:58:00"));

        var result = await(reconciler.syncOne(TestDevices.device(DeviceStatus.ONLINE)));

        assertEquals(1, result.synced);

        assertTrue(result.errors.isEmpty());

        var watchAlerts = alerts.alertsOfType("watch_status");

        assertEquals(1, watchAlerts.size());

        assertEquals("8.8.8.8", watchAlerts.get(0).getString("target"));

        assertEquals("down", watchAlerts.get(0).getString("state"));

        assertEquals("warning", watchAlerts.get(0).getString("severity"));

        var row = netwatch.get(TestDevices.DEVICE_ID, "8.8.8.8");

        assertEquals("down", row.getString("status"));

        assertEquals("2024-06-01T11:58:00Z", row.getString("last_down"));

        assertEquals("2024-06-01T09:00:00Z", row.getString("last_up"));

        assertEquals("2024-06-01T12:00:00Z", row.getString("last_check"));

        assertEquals(1, session.closeCount());

        assertEquals(1, dispatcher.payloads().size());

        assertEquals("Google DNS", dispatcher.payloads().get(0).getString("target_name"));
    }

    @Test
    void watchedHostLifecycleFromInsertToRepeatedDown() throws Exception
    {
        var device = TestDevices.device(DeviceStatus.ONLINE);

        session.reply("/tool/netwatch/print", remote("8.8.8.8", "up").put("since", "jan/05 10:00:00"));

        await(reconciler.syncOne(device));

        var inserted = netwatch.get(TestDevices.DEVICE_ID, "8.8.8.8");

        assertEquals("up", inserted.getString("status"));

        assertEquals("2024-01-05T10:00:00Z", inserted.getString("last_up"));

        assertTrue(alerts.alerts().isEmpty());

        clock.advance(Duration.ofMinutes(5));

        session.reply("/tool/netwatch/print", remote("8.8.8.8", "down").put("since", "jun/01 12:04:00"));

        await(reconciler.syncOne(device));

        assertEquals(1, alerts.alertsOfType("watch_status").size());

        assertEquals("down", alerts.alertsOfType("watch_status").get(0).getString("state"));

        clock.advance(Duration.ofMinutes(5));

        await(reconciler.syncOne(device));

        assertEquals(1, alerts.alerts().size());

        var row = netwatch.get(TestDevices.DEVICE_ID, "8.8.8.8");

        assertEquals("down", row.getString("status"));

        assertEquals("2024-01-05T10:00:00Z", row.getString("last_up"));

        assertEquals("2024-06-01T12:04:00Z", row.getString("last_down"));

        assertEquals("2024-06-01T12:10:00Z", row.getString("last_check"));
    }

    @Test
    void overlappingSyncsOfOneTransitionRaiseOneAlert(Vertx vertx) throws Exception
    {
        alerts.delayed(vertx, 20);

        netwatch.put(TestDevices.DEVICE_ID, stored("8.8.8.8", "up"));

        session.reply("/tool/netwatch/print", remote("8.8.8.8", "down"));

        var device = TestDevices.device(DeviceStatus.ONLINE);

        var first = reconciler.syncOne(device);

        var second = reconciler.syncOne(device);

        assertTrue(await(first).errors.isEmpty());

        assertTrue(await(second).errors.isEmpty());

        assertEquals(1, alerts.alertsOfType("watch_status").size());

        assertEquals(1, dispatcher.payloads().size());
    }

    @Test
    void repeatedSyncOfUnchangedTableRaisesNothingNew() throws Exception
    {
        netwatch.put(TestDevices.DEVICE_ID, stored("8.8.8.8", "up"));

        session.reply("/tool/netwatch/print", remote("8.8.8.8", "down"));

        var device = TestDevices.device(DeviceStatus.ONLINE);

        await(reconciler.syncOne(device));

        clock.advance(Duration.ofHours(2));

        await(reconciler.syncOne(device));

        assertEquals(1, alerts.alerts().size());

        assertEquals("2024-06-01T14:00:00Z", netwatch.get(TestDevices.DEVICE_ID, "8.8.8.8").getString("last_check"));
    }

    @Test
    void recoveryRaisesInfoAlert() throws Exception
    {
        netwatch.put(TestDevices.DEVICE_ID, stored("8.8.8.8", "down"));

        session.reply("/tool/netwatch/print", remote("8.8.8.8", "up"));

        await(reconciler.syncOne(TestDevices.device(DeviceStatus.ONLINE)));

        var watchAlerts = alerts.alertsOfType("watch_status");

        assertEquals(1, watchAlerts.size());

        assertEquals("info", watchAlerts.get(0).getString("severity"));

        assertEquals("up", watchAlerts.get(0).getString("state"));
    }

    @Test
    void transitionsThroughUnknownNeverAlert() throws Exception
    {
        var device = TestDevices.device(DeviceStatus.ONLINE);

        netwatch.put(TestDevices.DEVICE_ID, stored("8.8.8.8", "up"));

        session.reply("/tool/netwatch/print", remote("8.8.8.8", "unknown"));

        await(reconciler.syncOne(device));

        session.reply("/tool/netwatch/print", remote("8.8.8.8", "down"));

        await(reconciler.syncOne(device));

        assertTrue(alerts.alerts().isEmpty());

        assertEquals("down", netwatch.get(TestDevices.DEVICE_ID, "8.8.8.8").getString("status"));
    }

    @Test
    void newHostIsInsertedWithoutAlert() throws Exception
    {
        var row = remote("1.1.1.1", "up").put("name", "cloudflare");

        row.remove("interval");

        session.reply("/tool/netwatch/print", row);

        await(reconciler.syncOne(TestDevices.device(DeviceStatus.ONLINE)));

        var target = netwatch.get(TestDevices.DEVICE_ID, "1.1.1.1");

        assertEquals("cloudflare", target.getString("name"));

        assertEquals(30, target.getInteger("interval_seconds"));

        assertNull(target.getString("last_up"));

        assertTrue(alerts.alerts().isEmpty());
    }

    @Test
    void vanishedHostsAreKept() throws Exception
    {
        netwatch.put(TestDevices.DEVICE_ID, stored("9.9.9.9", "up"));

        session.reply("/tool/netwatch/print", remote("8.8.8.8", "up"));

        await(reconciler.syncOne(TestDevices.device(DeviceStatus.ONLINE)));

        assertEquals(2, netwatch.size(TestDevices.DEVICE_ID));
    }

    @Test
    void failingEntryIsRecordedAndOthersContinue() throws Exception
    {
        netwatch.failUpsertFor("1.1.1.1");

        session.reply("/tool/netwatch/print", remote("1.1.1.1", "up"), remote("8.8.8.8", "up"), new JsonObject().put("status", "up"));

        var result = await(reconciler.syncOne(TestDevices.device(DeviceStatus.ONLINE)));

        assertEquals(1, result.synced);

        assertEquals(List.of("1.1.1.1: netwatchUpsert failed: constraint violated"), result.errors);

        assertEquals("up", netwatch.get(TestDevices.DEVICE_ID, "8.8.8.8").getString("status"));
    }

    @Test
    void unreachableDeviceIsReportedAndRowsUntouched() throws Exception
    {
        netwatch.put(TestDevices.DEVICE_ID, stored("8.8.8.8", "up"));

        client.failOpen(new ConnectivityException(ConnectivityException.Reason.REFUSED, "Connection refused"));

        var result = await(reconciler.syncOne(TestDevices.device(DeviceStatus.ONLINE)));

        assertEquals(0, result.synced);

        assertEquals(List.of("Failed to sync netwatch: Connection refused"), result.errors);

        assertEquals("up", netwatch.get(TestDevices.DEVICE_ID, "8.8.8.8").getString("status"));

        assertEquals(0, netwatch.upsertCount());
    }

    @Test
    void reconcilePropagatesConnectivityLoss() throws Exception
    {
        session.fail("/tool/netwatch/print", new ConnectivityException(ConnectivityException.Reason.TIMEOUT, "timed out"));

        var cause = awaitFailure(reconciler.reconcile(TestDevices.device(DeviceStatus.ONLINE), session));

        assertInstanceOf(ConnectivityException.class, cause);
    }

    @Test
    void displayNamePrefersCommentAndMarksDisabled()
    {
        var entry = new WatchEntry();

        entry.host = "8.8.8.8";

        entry.name = "dns";

        entry.comment = "Google DNS";

        entry.disabled = true;

        assertEquals("[DISABLED] Google DNS", NetwatchReconciler.displayName(entry, null));

        entry.comment = "";

        entry.disabled = false;

        assertEquals("dns", NetwatchReconciler.displayName(entry, null));

        entry.name = null;

        assertEquals("Old name", NetwatchReconciler.displayName(entry, new JsonObject().put("name", "[DISABLED] Old name")));

        assertEquals("", NetwatchReconciler.displayName(entry, null));
    }

    @Test
    void deleteTargetRemovesFromDeviceThenDatabase() throws Exception
    {
        netwatch.put(TestDevices.DEVICE_ID, stored("8.8.8.8", "up"));

        var removed = new ArrayList<String>();

        session
            .handle("/tool/netwatch/print", params -> Future.succeededFuture(
                "8.8.8.8".equals(params.get("?host")) ? List.of(new JsonObject().put(".id", "*A")) : List.of()))
            .handle("/tool/netwatch/remove", params ->
            {
                removed.add(params.get(".id"));

                return Future.succeededFuture(List.of());
            });

        var deleted = await(reconciler.deleteTarget(TestDevices.device(DeviceStatus.ONLINE), "8.8.8.8"));

        assertEquals(1, deleted.getInteger("deleted_count"));

        assertEquals(List.of("*A"), removed);

        assertEquals(0, netwatch.size(TestDevices.DEVICE_ID));

        assertEquals(1, session.closeCount());
    }

    @Test
    void deleteTargetStillDeletesRowWhenDeviceIsUnreachable() throws Exception
    {
        netwatch.put(TestDevices.DEVICE_ID, stored("8.8.8.8", "up"));

        client.failOpen(new ConnectivityException(ConnectivityException.Reason.TIMEOUT, "timed out"));

        var deleted = await(reconciler.deleteTarget(TestDevices.device(DeviceStatus.ONLINE), "8.8.8.8"));

        assertEquals(1, deleted.getInteger("deleted_count"));

        assertEquals(0, netwatch.size(TestDevices.DEVICE_ID));
    }

}
