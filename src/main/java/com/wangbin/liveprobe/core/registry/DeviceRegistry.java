package com.wangbin.liveprobe.core.registry;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;

import java.util.List;
import java.util.function.Consumer;

/**
 * 设备注册中心
 *
 * 对外只提供设备信息副本，变更通过事件通知
 */
public interface DeviceRegistry {

    List<DeviceInfo> getEnabledDevices();

    List<DeviceInfo> getAllDevices();

    /**
     * 获取设备，不存在时返回null
     */
    DeviceInfo getDevice(String deviceId);

    void registerListener(Consumer<DeviceChangeEvent> listener);

    void removeListener(Consumer<DeviceChangeEvent> listener);
}
