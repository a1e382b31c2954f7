package com.wangbin.liveprobe.api.controller;

import com.wangbin.liveprobe.common.domain.dto.DeviceStatusView;
import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.common.exception.BusinessException;
import com.wangbin.liveprobe.common.web.result.ApiResult;
import com.wangbin.liveprobe.common.web.result.ResultCode;
import com.wangbin.liveprobe.core.config.ProbeProperties;
import com.wangbin.liveprobe.core.registry.DeviceRegistry;
import com.wangbin.liveprobe.core.scheduler.PollerScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 设备与轮询控制器
 * 提供设备运行状态查询以及轮询器的启动、停止接口
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceRegistry deviceRegistry;
    private final PollerScheduler pollerScheduler;
    private final ProbeProperties properties;

    @GetMapping("/devices")
    public ApiResult<List<DeviceStatusView>> listDevices() {
        long defaultInterval = properties.getPoller().getDefaultIntervalMs();
        List<DeviceStatusView> devices = deviceRegistry.getAllDevices().stream()
                .map(device -> DeviceStatusView.of(device, defaultInterval,
                        pollerScheduler.getRuntimeSnapshot(device.getDeviceId())))
                .collect(Collectors.toList());
        return ApiResult.success(devices);
    }

    @GetMapping("/devices/{deviceId}")
    public ApiResult<DeviceStatusView> getDevice(@PathVariable String deviceId) {
        DeviceInfo device = deviceRegistry.getDevice(deviceId);
        if (device == null) {
            throw new BusinessException(ResultCode.DEVICE_NOT_FOUND, "设备不存在: " + deviceId);
        }
        return ApiResult.success(DeviceStatusView.of(device, properties.getPoller().getDefaultIntervalMs(),
                pollerScheduler.getRuntimeSnapshot(deviceId)));
    }

    @PostMapping("/poller/start")
    public ApiResult<Map<String, Object>> startPoller() {
        boolean changed = pollerScheduler.start();
        log.info("通过接口启动轮询器: changed={}", changed);
        return ApiResult.success(changed ? "轮询器已启动" : "轮询器已在运行", pollerState(changed));
    }

    @PostMapping("/poller/stop")
    public ApiResult<Map<String, Object>> stopPoller() {
        boolean changed = pollerScheduler.stop();
        log.info("通过接口停止轮询器: changed={}", changed);
        return ApiResult.success(changed ? "轮询器已停止" : "轮询器未运行", pollerState(changed));
    }

    private Map<String, Object> pollerState(boolean changed) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("running", pollerScheduler.isRunning());
        state.put("changed", changed);
        state.put("loops", pollerScheduler.getActiveLoopCount());
        return state;
    }
}
