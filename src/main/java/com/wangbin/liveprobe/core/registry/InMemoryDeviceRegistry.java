package com.wangbin.liveprobe.core.registry;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.common.exception.BusinessException;
import com.wangbin.liveprobe.common.web.result.ResultCode;
import com.wangbin.liveprobe.core.config.ProbeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 基于内存的设备注册中心，启动时从配置导入设备
 */
@Slf4j
@Component
public class InMemoryDeviceRegistry implements DeviceRegistry {

    private final Map<String, DeviceInfo> devices = new ConcurrentHashMap<>();

    private final List<Consumer<DeviceChangeEvent>> listeners = new CopyOnWriteArrayList<>();

    public InMemoryDeviceRegistry(ProbeProperties properties) {
        for (DeviceInfo device : properties.getDevices()) {
            if (!device.validateRequiredFields()) {
                log.warn("忽略无效的设备配置: {}", device);
                continue;
            }
            devices.put(device.getDeviceId(), device.copy());
        }
        log.info("设备注册中心初始化完成，共加载 {} 台设备", devices.size());
    }

    @Override
    public List<DeviceInfo> getEnabledDevices() {
        return devices.values().stream()
                .filter(DeviceInfo::isEnabled)
                .sorted(Comparator.comparing(DeviceInfo::getDeviceId))
                .map(DeviceInfo::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<DeviceInfo> getAllDevices() {
        return devices.values().stream()
                .sorted(Comparator.comparing(DeviceInfo::getDeviceId))
                .map(DeviceInfo::copy)
                .collect(Collectors.toList());
    }

    @Override
    public DeviceInfo getDevice(String deviceId) {
        DeviceInfo device = devices.get(deviceId);
        return device == null ? null : device.copy();
    }

    /**
     * 注册新设备
     */
    public DeviceInfo register(DeviceInfo device) {
        validate(device);
        DeviceInfo copy = device.copy();
        if (devices.putIfAbsent(copy.getDeviceId(), copy) != null) {
            throw new BusinessException(ResultCode.DEVICE_INVALID, "设备已存在: " + copy.getDeviceId());
        }
        log.info("注册设备: {}", copy.getDisplayName());
        notifyListeners(DeviceChangeEvent.added(copy.copy(), "api"));
        return copy.copy();
    }

    /**
     * 更新设备配置
     */
    public DeviceInfo update(DeviceInfo device) {
        validate(device);
        DeviceInfo copy = device.copy();
        DeviceInfo[] previous = new DeviceInfo[1];
        devices.computeIfPresent(copy.getDeviceId(), (id, old) -> {
            previous[0] = old;
            return copy;
        });
        if (previous[0] == null) {
            throw new BusinessException(ResultCode.DEVICE_NOT_FOUND, "设备不存在: " + copy.getDeviceId());
        }
        boolean configChanged = copy.isConfigChanged(previous[0]);
        notifyListeners(DeviceChangeEvent.updated(copy.copy(), configChanged, "api"));
        log.info("更新设备: {}", copy.getDisplayName());
        return copy.copy();
    }

    /**
     * 移除设备
     */
    public boolean remove(String deviceId) {
        DeviceInfo removed = devices.remove(deviceId);
        if (removed == null) {
            return false;
        }
        log.info("移除设备: {}", removed.getDisplayName());
        notifyListeners(DeviceChangeEvent.removed(removed.copy(), "api"));
        return true;
    }

    /**
     * 启用或禁用设备轮询
     */
    public DeviceInfo setEnabled(String deviceId, boolean enabled) {
        DeviceInfo current = devices.get(deviceId);
        if (current == null) {
            throw new BusinessException(ResultCode.DEVICE_NOT_FOUND, "设备不存在: " + deviceId);
        }
        DeviceInfo updated = current.copy();
        updated.setEnabled(enabled);
        return update(updated);
    }

    @Override
    public void registerListener(Consumer<DeviceChangeEvent> listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(Consumer<DeviceChangeEvent> listener) {
        listeners.remove(listener);
    }

    private void validate(DeviceInfo device) {
        if (device == null || !device.validateRequiredFields()) {
            throw new BusinessException(ResultCode.DEVICE_INVALID, "设备ID和地址不能为空");
        }
    }

    private void notifyListeners(DeviceChangeEvent event) {
        for (Consumer<DeviceChangeEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("设备变更事件处理失败: {} {}", event.getType(), event.getDeviceId(), e);
            }
        }
    }
}
