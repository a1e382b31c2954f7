package com.wangbin.liveprobe.monitor.health;

import lombok.Builder;
import lombok.Data;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 服务整体健康状态
 */
@Data
@Builder
public class HealthStatus {

    private final Status status;

    private final long timestamp;

    @Builder.Default
    private final Map<String, ComponentHealth> components = new LinkedHashMap<>();

    public enum Status {
        UP,
        DEGRADED,
        UNKNOWN,
        DOWN;

        /**
         * 降级仍可对外服务，只有DOWN返回503
         */
        public int httpStatus() {
            return this == DOWN ? 503 : 200;
        }
    }

    /**
     * 由组件状态推导整体状态：DOWN > DEGRADED > UNKNOWN > UP
     */
    public static Status aggregate(Collection<ComponentHealth> componentHealths) {
        Status worst = Status.UP;
        for (ComponentHealth component : componentHealths) {
            if (component == null || component.getStatus() == null) {
                continue;
            }
            if (component.isDown()) {
                return Status.DOWN;
            }
            if (component.getStatus() == Status.DEGRADED
                    || (component.getStatus() == Status.UNKNOWN && worst == Status.UP)) {
                worst = component.getStatus();
            }
        }
        return worst;
    }
}
