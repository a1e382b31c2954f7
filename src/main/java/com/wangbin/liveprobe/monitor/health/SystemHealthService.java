package com.wangbin.liveprobe.monitor.health;

import com.wangbin.liveprobe.core.store.TimeSeriesStore;
import com.wangbin.liveprobe.monitor.health.HealthStatus.Status;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 把轮询健康快照映射为组件健康模型
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SystemHealthService {

    private final PollerHealthService pollerHealthService;
    private final TimeSeriesStore store;
    private final Clock clock;

    public HealthStatus getSystemHealth() {
        HealthSnapshot snapshot = pollerHealthService.snapshot();

        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        components.put("poller", buildPollerHealth(snapshot));
        components.put("devices", buildDeviceHealth(snapshot));
        components.put("sessionStore", buildStoreHealth(snapshot));

        Status overall = HealthStatus.aggregate(components.values());
        return HealthStatus.builder()
                .status(overall)
                .timestamp(clock.millis())
                .components(components)
                .build();
    }

    private ComponentHealth buildPollerHealth(HealthSnapshot snapshot) {
        Status status;
        String message;
        if (!snapshot.isPollerRunning()) {
            status = Status.DOWN;
            message = "Poller is stopped";
        } else if (!snapshot.isAllLoopsAlive() || snapshot.getStalledDeviceCount() > 0) {
            status = Status.DEGRADED;
            message = "Some polling loops are dead or stalled";
        } else {
            status = Status.UP;
            message = "All polling loops are running";
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("running", snapshot.isPollerRunning());
        details.put("loops", snapshot.getDevices().size());
        details.put("stalledDevices", snapshot.getStalledDeviceCount());
        details.put("missingLoops", snapshot.getMissingLoops());

        return ComponentHealth.of("poller", status, message, details);
    }

    private ComponentHealth buildDeviceHealth(HealthSnapshot snapshot) {
        List<DeviceHealth> devices = snapshot.getDevices();
        List<String> alertingDevices = devices.stream()
                .filter(DeviceHealth::isAlerting)
                .map(DeviceHealth::getDeviceId)
                .collect(Collectors.toList());

        int total = devices.size();
        int alerting = alertingDevices.size();

        Status status;
        if (total == 0) {
            status = Status.UNKNOWN;
        } else if (alerting == 0) {
            status = Status.UP;
        } else if (alerting == total) {
            status = Status.DOWN;
        } else {
            status = Status.DEGRADED;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("totalDevices", total);
        details.put("liveDevices", snapshot.getLiveDeviceCount());
        details.put("alertingDevices", alertingDevices);

        return ComponentHealth.of("devices", status, "Device reachability snapshot", details);
    }

    private ComponentHealth buildStoreHealth(HealthSnapshot snapshot) {
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("openSessions", snapshot.getOpenSessionCount());
            details.put("totalSessions", store.listSessions().size());
            return ComponentHealth.of("sessionStore", Status.UP, "In-memory session store", details);
        } catch (Exception e) {
            log.warn("获取会话存储状态失败", e);
            return ComponentHealth.unknown("sessionStore", "Failed to read session store: " + e.getMessage());
        }
    }
}
