package com.wangbin.liveprobe.core.registry;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import lombok.Builder;
import lombok.Value;

import java.util.Date;

/**
 * 设备变更事件
 *
 * 设备新增、更新或移除时由注册中心发布，轮询调度器据此启停对应设备的轮询循环
 */
@Value
@Builder
public class DeviceChangeEvent {

    public enum Type {
        ADDED,
        UPDATED,
        REMOVED
    }

    Type type;

    String deviceId;

    /** 变更后的设备信息，REMOVED时为移除前的设备信息 */
    DeviceInfo device;

    /** 轮询相关配置是否变化 */
    boolean configChanged;

    /**
     * 事件源
     * 可选值: "config", "api", "system"
     */
    String source;

    @Builder.Default
    Date createTime = new Date();

    public static DeviceChangeEvent added(DeviceInfo device, String source) {
        return DeviceChangeEvent.builder()
                .type(Type.ADDED)
                .deviceId(device.getDeviceId())
                .device(device)
                .configChanged(true)
                .source(source)
                .build();
    }

    public static DeviceChangeEvent updated(DeviceInfo device, boolean configChanged, String source) {
        return DeviceChangeEvent.builder()
                .type(Type.UPDATED)
                .deviceId(device.getDeviceId())
                .device(device)
                .configChanged(configChanged)
                .source(source)
                .build();
    }

    public static DeviceChangeEvent removed(DeviceInfo device, String source) {
        return DeviceChangeEvent.builder()
                .type(Type.REMOVED)
                .deviceId(device.getDeviceId())
                .device(device)
                .configChanged(true)
                .source(source)
                .build();
    }
}
