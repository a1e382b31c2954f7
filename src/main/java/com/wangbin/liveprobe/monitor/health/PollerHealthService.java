package com.wangbin.liveprobe.monitor.health;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.common.domain.enums.SessionState;
import com.wangbin.liveprobe.core.registry.DeviceRegistry;
import com.wangbin.liveprobe.core.scheduler.DeviceRuntimeSnapshot;
import com.wangbin.liveprobe.core.scheduler.PollerScheduler;
import com.wangbin.liveprobe.core.store.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 轮询健康聚合，只读，无副作用
 */
@Service
@RequiredArgsConstructor
public class PollerHealthService {

    /** 判定停滞时在 间隔+超时 之外额外容忍的时间 */
    static final long STALL_GRACE_MS = 1000;

    private final PollerScheduler pollerScheduler;
    private final TimeSeriesStore store;
    private final DeviceRegistry deviceRegistry;
    private final Clock clock;

    public HealthSnapshot snapshot() {
        Instant now = clock.instant();
        List<DeviceRuntimeSnapshot> runtimes = pollerScheduler.getRuntimeSnapshots();
        boolean running = pollerScheduler.isRunning();

        List<DeviceHealth> devices = new ArrayList<>(runtimes.size());
        Set<String> polled = new HashSet<>();
        boolean allAlive = running;
        int live = 0;
        int stalledCount = 0;
        int alerting = 0;
        for (DeviceRuntimeSnapshot runtime : runtimes) {
            polled.add(runtime.getDeviceId());
            DeviceHealth health = toDeviceHealth(runtime, now);
            devices.add(health);
            if (!health.isLoopAlive()) {
                allAlive = false;
            }
            if (health.getState() == SessionState.LIVE) {
                live++;
            }
            if (health.isStalled()) {
                stalledCount++;
            }
            if (health.isAlerting()) {
                alerting++;
            }
        }

        List<String> missing = new ArrayList<>();
        if (running) {
            for (DeviceInfo device : deviceRegistry.getEnabledDevices()) {
                if (!polled.contains(device.getDeviceId())) {
                    missing.add(device.getDeviceId());
                }
            }
        }
        if (!missing.isEmpty()) {
            allAlive = false;
        }

        return HealthSnapshot.builder()
                .pollerRunning(running)
                .allLoopsAlive(allAlive)
                .generatedAt(now)
                .liveDeviceCount(live)
                .openSessionCount(store.countOpenSessions())
                .stalledDeviceCount(stalledCount)
                .alertingDeviceCount(alerting)
                .missingLoops(missing)
                .devices(devices)
                .build();
    }

    DeviceHealth toDeviceHealth(DeviceRuntimeSnapshot runtime, Instant now) {
        return DeviceHealth.builder()
                .deviceId(runtime.getDeviceId())
                .deviceName(runtime.getDeviceName())
                .loopAlive(runtime.isLoopAlive())
                .stalled(isStalled(runtime, now))
                .state(runtime.getState())
                .currentSessionId(runtime.getCurrentSessionId())
                .lastSuccessfulPollAgeMs(ageMs(runtime.getLastSuccessfulPollTime(), now))
                .lastSampleAgeMs(ageMs(runtime.getLastSampleTime(), now))
                .consecutiveFailures(runtime.getConsecutiveFailures())
                .alerting(runtime.isAlerting())
                .lastFailureKind(runtime.getLastFailureKind())
                .lastError(runtime.getLastError())
                .ageHistory(runtime.getAgeHistory())
                .build();
    }

    /**
     * 循环存活但超过 间隔+超时+1秒 没有开始新周期
     */
    static boolean isStalled(DeviceRuntimeSnapshot runtime, Instant now) {
        if (!runtime.isLoopAlive()) {
            return false;
        }
        Instant reference = runtime.getLastCycleStartedAt() != null
                ? runtime.getLastCycleStartedAt() : runtime.getLoopStartedAt();
        if (reference == null) {
            return false;
        }
        long budget = runtime.getIntervalMs() + runtime.getFetchTimeoutMs() + STALL_GRACE_MS;
        return Duration.between(reference, now).toMillis() > budget;
    }

    private static Long ageMs(Instant time, Instant now) {
        if (time == null) {
            return null;
        }
        return Math.max(0L, Duration.between(time, now).toMillis());
    }
}
