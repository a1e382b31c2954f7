package com.wangbin.liveprobe.common.domain.dto;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.core.scheduler.DeviceRuntimeSnapshot;
import lombok.Builder;
import lombok.Data;

/**
 * 设备状态视图，不包含API令牌
 */
@Data
@Builder
public class DeviceStatusView {

    private String deviceId;
    private String deviceName;
    private String protocol;
    private String host;
    private int port;
    private Integer inputIndex;
    private long pollIntervalMs;
    private boolean enabled;

    /** 未在轮询时为null */
    private DeviceRuntimeSnapshot runtime;

    public static DeviceStatusView of(DeviceInfo device, long defaultIntervalMs, DeviceRuntimeSnapshot runtime) {
        return DeviceStatusView.builder()
                .deviceId(device.getDeviceId())
                .deviceName(device.getDisplayName())
                .protocol(device.isHttps() ? "https" : "http")
                .host(device.getHost())
                .port(device.getEffectivePort())
                .inputIndex(device.getInputIndex())
                .pollIntervalMs(device.getEffectivePollInterval(defaultIntervalMs))
                .enabled(device.isEnabled())
                .runtime(runtime)
                .build();
    }
}
