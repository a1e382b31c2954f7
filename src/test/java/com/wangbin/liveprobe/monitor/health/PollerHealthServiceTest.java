package com.wangbin.liveprobe.monitor.health;

import com.alibaba.fastjson2.JSONObject;
import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.common.domain.enums.FailureKind;
import com.wangbin.liveprobe.core.client.FetchResult;
import com.wangbin.liveprobe.core.client.TelemetryClient;
import com.wangbin.liveprobe.core.config.ProbeProperties;
import com.wangbin.liveprobe.core.processor.SampleNormalizer;
import com.wangbin.liveprobe.core.registry.InMemoryDeviceRegistry;
import com.wangbin.liveprobe.core.scheduler.DeviceRuntimeSnapshot;
import com.wangbin.liveprobe.core.scheduler.PollerScheduler;
import com.wangbin.liveprobe.core.store.InMemoryTimeSeriesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class PollerHealthServiceTest {

    private InMemoryDeviceRegistry registry;
    private InMemoryTimeSeriesStore store;
    private PollerScheduler scheduler;
    private PollerHealthService healthService;
    private SystemHealthService systemHealthService;

    @BeforeEach
    void setUp() {
        ProbeProperties properties = new ProbeProperties();
        properties.getPoller().setDefaultIntervalMs(50);
        properties.getPoller().setSilenceThreshold(3);
        properties.getPoller().setFailureAlertThreshold(2);

        registry = new InMemoryDeviceRegistry(properties);
        store = new InMemoryTimeSeriesStore();
        TelemetryClient client = (device, timeout) -> "live".equals(device.getDeviceId())
                ? FetchResult.success(livePayload())
                : FetchResult.failure(FailureKind.UNREACHABLE, "no route to host");
        Clock clock = Clock.systemUTC();
        scheduler = new PollerScheduler(properties, registry, client, new SampleNormalizer(), store, clock);
        healthService = new PollerHealthService(scheduler, store, registry, clock);
        systemHealthService = new SystemHealthService(healthService, store, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.destroy();
    }

    @Test
    void stoppedPollerIsDown() {
        HealthSnapshot snapshot = healthService.snapshot();
        assertFalse(snapshot.isPollerRunning());
        assertFalse(snapshot.isAllLoopsAlive());
        assertTrue(snapshot.getDevices().isEmpty());

        HealthStatus status = systemHealthService.getSystemHealth();
        assertEquals(HealthStatus.Status.DOWN, status.getStatus());
        assertEquals(503, status.getStatus().httpStatus());
    }

    @Test
    void snapshotReflectsLiveAndAlertingDevices() {
        registry.register(device("live"));
        registry.register(device("dead"));
        scheduler.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> {
            HealthSnapshot s = healthService.snapshot();
            return s.getLiveDeviceCount() == 1 && s.getAlertingDeviceCount() == 1;
        });

        HealthSnapshot snapshot = healthService.snapshot();
        assertTrue(snapshot.isPollerRunning());
        assertTrue(snapshot.isAllLoopsAlive());
        assertEquals(1, snapshot.getOpenSessionCount());
        assertTrue(snapshot.getMissingLoops().isEmpty());

        DeviceHealth live = snapshot.getDevices().stream()
                .filter(d -> "live".equals(d.getDeviceId())).findFirst().orElseThrow();
        assertNotNull(live.getCurrentSessionId());
        assertNotNull(live.getLastSampleAgeMs());
        assertFalse(live.getAgeHistory().isEmpty());

        DeviceHealth dead = snapshot.getDevices().stream()
                .filter(d -> "dead".equals(d.getDeviceId())).findFirst().orElseThrow();
        assertNull(dead.getLastSuccessfulPollAgeMs());
        assertEquals(FailureKind.UNREACHABLE, dead.getLastFailureKind());

        HealthStatus status = systemHealthService.getSystemHealth();
        assertEquals(HealthStatus.Status.DEGRADED, status.getStatus());
        assertEquals(HealthStatus.Status.UP, status.getComponents().get("poller").getStatus());
        assertEquals(HealthStatus.Status.DEGRADED, status.getComponents().get("devices").getStatus());
    }

    @Test
    void stallDetectionUsesIntervalPlusTimeoutPlusGrace() {
        Instant cycle = Instant.parse("2024-05-01T10:00:00Z");
        DeviceRuntimeSnapshot runtime = DeviceRuntimeSnapshot.builder()
                .deviceId("dev")
                .loopAlive(true)
                .intervalMs(2000)
                .fetchTimeoutMs(1500)
                .loopStartedAt(cycle.minusSeconds(60))
                .lastCycleStartedAt(cycle)
                .build();

        assertFalse(PollerHealthService.isStalled(runtime, cycle.plusMillis(4500)));
        assertTrue(PollerHealthService.isStalled(runtime, cycle.plusMillis(4501)));
        assertFalse(PollerHealthService.isStalled(runtime.toBuilder().loopAlive(false).build(),
                cycle.plusSeconds(60)));
    }

    private static DeviceInfo device(String id) {
        DeviceInfo device = new DeviceInfo();
        device.setDeviceId(id);
        device.setHost("192.0.2.10");
        device.setToken("t");
        return device;
    }

    private static JSONObject livePayload() {
        JSONObject link = new JSONObject();
        link.put("rx_bitrate", 1800);
        JSONObject input = new JSONObject();
        input.put("channelStatus", "on");
        input.put("links", List.of(link));
        JSONObject payload = new JSONObject();
        payload.put("timestamp", System.currentTimeMillis());
        payload.put("input", input);
        return payload;
    }
}
