package com.wangbin.liveprobe.monitor.health;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个组件（轮询器、设备、会话存储）的健康状态
 */
@Data
@Builder
public class ComponentHealth {

    private final String name;
    private final HealthStatus.Status status;
    private final String message;

    @Builder.Default
    private final Map<String, Object> details = new LinkedHashMap<>();

    public static ComponentHealth of(String name, HealthStatus.Status status, String message,
                                     Map<String, Object> details) {
        return ComponentHealth.builder()
                .name(name)
                .status(status)
                .message(message)
                .details(details)
                .build();
    }

    public static ComponentHealth unknown(String name, String message) {
        return ComponentHealth.builder()
                .name(name)
                .status(HealthStatus.Status.UNKNOWN)
                .message(message)
                .build();
    }

    public boolean isDown() {
        return status == HealthStatus.Status.DOWN;
    }
}
