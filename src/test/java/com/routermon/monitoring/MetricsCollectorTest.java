package com.routermon.monitoring;

import com.routermon.exceptions.ConnectivityException;

import com.routermon.exceptions.ProtocolException;

import com.routermon.models.DeviceStatus;

import com.routermon.models.ResourceSnapshot;

import com.routermon.support.InMemoryAlertService;

import com.routermon.support.InMemoryMetricsService;

import com.routermon.support.MutableClock;

import com.routermon.support.RecordingNotificationDispatcher;

import com.routermon.support.ScriptedDeviceSession;

import com.routermon.support.TestDevices;

import io.vertx.core.json.JsonObject;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import java.time.Instant;

import static com.routermon.support.TestFutures.await;

import static com.routermon.support.TestFutures.awaitFailure;

import static org.junit.jupiter.api.Assertions.assertEquals;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import static org.junit.jupiter.api.Assertions.assertNull;

import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsCollectorTest
{

    private static final Instant START = Instant.parse("2024-06-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(START);

    private final InMemoryMetricsService metrics = new InMemoryMetricsService();

    private final InMemoryAlertService alerts = new InMemoryAlertService(clock);

    private final MetricsCollector collector = new MetricsCollector(metrics,
        new AlertEmitter(alerts, new RecordingNotificationDispatcher(), TestDevices.config(), clock),
        TestDevices.config(), clock);

    private static JsonObject resourceRow()
    {
        return new JsonObject()
            .put("version", "7.14.2 (stable)")
            .put("board-name", "RB5009UG+S+")
            .put("architecture-name", "arm64")
            .put("cpu-load", "12")
            .put("cpu-count", "4")
            .put("cpu-frequency", "1400")
            .put("total-memory", "1073741824")
            .put("free-memory", "805306368")
            .put("total-hdd-space", "1073741824")
            .put("free-hdd-space", "973741824")
            .put("uptime", "1w2d3h4m5s");
    }

    private static JsonObject interfaceRow(String name, long txBytes, long rxBytes)
    {
        return new JsonObject()
            .put("name", name)
            .put("type", "ether")
            .put("running", "true")
            .put("disabled", "false")
            .put("tx-byte", String.valueOf(txBytes))
            .put("rx-byte", String.valueOf(rxBytes));
    }

    @Test
    void computeRateConvertsByteDeltaToBitsPerSecond()
    {
        assertEquals(8000, MetricsCollector.computeRate(1000, 2000, START, START.plusSeconds(1)));

        assertEquals(1600, MetricsCollector.computeRate(0, 10000, START, START.plusSeconds(50)));
    }

    @Test
    void computeRateIsZeroWithoutUsablePreviousSample()
    {
        assertEquals(0, MetricsCollector.computeRate(0, 5000, null, START));

        assertEquals(0, MetricsCollector.computeRate(0, 5000, START, START));

        assertEquals(0, MetricsCollector.computeRate(0, 5000, START.plusSeconds(5), START));

        // counter reset
        assertEquals(0, MetricsCollector.computeRate(900000, 1000, START, START.plusSeconds(10)));
    }

    @Test
    void identityFallsBackToBoardNameWithoutRouterboard() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/system/identity/print", new JsonObject().put("name", "edge-01"))
            .reply("/system/resource/print", resourceRow())
            .fail("/system/routerboard/print", new ProtocolException("/system/routerboard/print", "no such command"));

        var identity = await(collector.fetchIdentity(session));

        assertEquals("edge-01", identity.identity);

        assertEquals("7.14.2 (stable)", identity.version);

        assertEquals("RB5009UG+S+", identity.model);

        assertEquals("arm64", identity.architecture);

        assertNull(identity.serialNumber);
    }

    @Test
    void identityReadsRouterboardModelAndSerial() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/system/identity/print", new JsonObject().put("name", "edge-01"))
            .reply("/system/resource/print", resourceRow())
            .reply("/system/routerboard/print", new JsonObject().put("model", "RB5009UG+S+IN").put("serial-number", "HD1234567"));

        var identity = await(collector.fetchIdentity(session));

        assertEquals("RB5009UG+S+IN", identity.model);

        assertEquals("HD1234567", identity.serialNumber);
    }

    @Test
    void optionalCommandDoesNotMaskConnectivityLoss() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/system/identity/print", new JsonObject().put("name", "edge-01"))
            .reply("/system/resource/print", resourceRow())
            .fail("/system/routerboard/print", new ConnectivityException(ConnectivityException.Reason.TIMEOUT, "timed out"));

        assertInstanceOf(ConnectivityException.class, awaitFailure(collector.fetchIdentity(session)));
    }

    @Test
    void resourcesWithPerSensorHealthRows() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/system/resource/print", resourceRow())
            .reply("/system/health/print",
                new JsonObject().put("name", "cpu-temperature").put("value", "51"),
                new JsonObject().put("name", "board-temperature1").put("value", "38"),
                new JsonObject().put("name", "voltage").put("value", "24.1"));

        var resources = await(collector.fetchResources(session));

        assertEquals(12, resources.cpuLoad);

        assertEquals(4, resources.cpuCount);

        assertEquals(268435456L, resources.usedMemory());

        assertEquals(25, resources.memoryUsagePercent());

        assertEquals(100000000L, resources.usedDisk());

        assertEquals(9 * 86400 + 3 * 3600 + 4 * 60 + 5, resources.uptimeSeconds);

        assertEquals(38.0, resources.boardTemp);

        assertEquals(24.1, resources.voltage);
    }

    @Test
    void resourcesWithSingleRowHealth() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/system/resource/print", resourceRow())
            .reply("/system/health/print", new JsonObject().put("temperature", "44").put("voltage", "12.3"));

        var resources = await(collector.fetchResources(session));

        assertEquals(44.0, resources.boardTemp);

        assertEquals(12.3, resources.voltage);
    }

    @Test
    void resourcesWithoutHealthMenu() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/system/resource/print", resourceRow());

        var resources = await(collector.fetchResources(session));

        assertEquals(12, resources.cpuLoad);

        assertNull(resources.boardTemp);

        assertNull(resources.voltage);
    }

    @Test
    void interfacesPickUpEthernetSpeed() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/interface/print", interfaceRow("ether1", 100, 200), interfaceRow("bridge", 0, 0), new JsonObject())
            .reply("/interface/ethernet/print", new JsonObject().put("name", "ether1").put("speed", "1Gbps"));

        var interfaces = await(collector.fetchInterfaces(session));

        assertEquals(2, interfaces.size());

        assertEquals("1Gbps", interfaces.get(0).speed);

        assertEquals("up", interfaces.get(0).status());

        assertNull(interfaces.get(1).speed);
    }

    @Test
    void snapshotIsCompleteWhenOptionalMenusFail() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/system/identity/print", new JsonObject().put("name", "edge-01"))
            .reply("/system/resource/print", resourceRow())
            .fail("/system/routerboard/print", new ProtocolException("/system/routerboard/print", "no such command"))
            .fail("/system/health/print", new ProtocolException("/system/health/print", "no such command"))
            .reply("/interface/print", interfaceRow("ether1", 100, 200))
            .fail("/interface/ethernet/print", new ProtocolException("/interface/ethernet/print", "no such command"));

        var snapshot = await(collector.fetchSnapshot(session));

        var identity = snapshot.getJsonObject("identity");

        assertEquals("edge-01", identity.getString("identity"));

        assertEquals("RB5009UG+S+", identity.getString("model"));

        assertNull(identity.getString("serial_number"));

        var resources = snapshot.getJsonObject("resources");

        assertEquals(12, resources.getInteger("cpu_load"));

        assertEquals(788645L, resources.getLong("uptime_seconds"));

        assertNull(resources.getValue("board_temp"));

        assertNull(resources.getValue("voltage"));

        var interfaces = snapshot.getJsonArray("interfaces");

        assertEquals(1, interfaces.size());

        assertEquals("ether1", interfaces.getJsonObject(0).getString("name"));

        assertNull(interfaces.getJsonObject(0).getValue("speed"));

        assertEquals(1L, session.executed().stream().filter("/system/resource/print"::equals).count());
    }

    @Test
    void snapshotFailsWhenTheConnectionDropsInAnOptionalMenu() throws Exception
    {
        var session = new ScriptedDeviceSession()
            .reply("/system/identity/print", new JsonObject().put("name", "edge-01"))
            .reply("/system/resource/print", resourceRow())
            .reply("/system/routerboard/print")
            .fail("/system/health/print", new ConnectivityException(ConnectivityException.Reason.UNREACHABLE, "connection reset"));

        assertInstanceOf(ConnectivityException.class, awaitFailure(collector.fetchSnapshot(session)));
    }

    @Test
    void counterResetGivesZeroOnceThenCleanRates() throws Exception
    {
        var first = new ScriptedDeviceSession().reply("/interface/print", interfaceRow("ether1", 1000, 900000));

        await(collector.applyInterfaceRates(TestDevices.DEVICE_ID, await(collector.fetchInterfaces(first))));

        clock.advance(Duration.ofSeconds(10));

        var reset = new ScriptedDeviceSession().reply("/interface/print", interfaceRow("ether1", 2000, 4000));

        var afterReset = await(collector.applyInterfaceRates(TestDevices.DEVICE_ID, await(collector.fetchInterfaces(reset))));

        assertEquals(0L, afterReset.get(0).rxRate);

        assertEquals(4000L, metrics.interfaceRow(TestDevices.DEVICE_ID, "ether1").getLong("rx_bytes"));

        clock.advance(Duration.ofSeconds(10));

        var next = new ScriptedDeviceSession().reply("/interface/print", interfaceRow("ether1", 3000, 14000));

        var clean = await(collector.applyInterfaceRates(TestDevices.DEVICE_ID, await(collector.fetchInterfaces(next))));

        assertEquals(8000L, clean.get(0).rxRate);

        assertEquals(800L, clean.get(0).txRate);

        assertEquals(14000L, metrics.interfaceRow(TestDevices.DEVICE_ID, "ether1").getLong("rx_bytes"));
    }

    @Test
    void firstObservationHasZeroRateThenRatesFollowCounters() throws Exception
    {
        var first = new ScriptedDeviceSession().reply("/interface/print", interfaceRow("ether1", 1000, 5000));

        await(collector.applyInterfaceRates(TestDevices.DEVICE_ID, await(collector.fetchInterfaces(first))));

        var stored = metrics.interfaceRow(TestDevices.DEVICE_ID, "ether1");

        assertEquals(0L, stored.getLong("tx_rate"));

        assertEquals(0L, stored.getLong("rx_rate"));

        clock.advance(Duration.ofSeconds(10));

        var second = new ScriptedDeviceSession().reply("/interface/print", interfaceRow("ether1", 11000, 4000));

        var samples = await(collector.applyInterfaceRates(TestDevices.DEVICE_ID, await(collector.fetchInterfaces(second))));

        assertEquals(8000L, samples.get(0).txRate);

        assertEquals(0L, samples.get(0).rxRate);

        assertEquals("2024-06-01T12:00:10Z", metrics.interfaceRow(TestDevices.DEVICE_ID, "ether1").getString("last_updated"));
    }

    @Test
    void recordMetricsStoresSnapshotWithoutAlertsBelowThreshold() throws Exception
    {
        var resources = new ResourceSnapshot();

        resources.cpuLoad = 20;

        resources.totalMemory = 1000;

        resources.freeMemory = 600;

        await(collector.recordMetrics(TestDevices.device(DeviceStatus.ONLINE), resources));

        assertEquals(1, metrics.snapshots().size());

        assertEquals(400L, metrics.snapshots().get(0).getLong("used_memory"));

        assertTrue(alerts.alerts().isEmpty());
    }

    @Test
    void recordMetricsRaisesThresholdAlertsOnce() throws Exception
    {
        var device = TestDevices.device(DeviceStatus.ONLINE);

        var resources = new ResourceSnapshot();

        resources.cpuLoad = 93;

        resources.totalMemory = 1000;

        resources.freeMemory = 150;

        await(collector.recordMetrics(device, resources));

        clock.advance(Duration.ofMinutes(1));

        await(collector.recordMetrics(device, resources));

        assertEquals(2, metrics.snapshots().size());

        var cpu = alerts.alertsOfType("high_cpu");

        assertEquals(1, cpu.size());

        assertEquals("critical", cpu.get(0).getString("severity"));

        assertEquals("10.0.0.1", cpu.get(0).getString("target"));

        var memory = alerts.alertsOfType("high_memory");

        assertEquals(1, memory.size());

        assertEquals("warning", memory.get(0).getString("severity"));
    }

}
