package com.wangbin.liveprobe.monitor.health;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 轮询健康快照，每次读取时重新计算，不缓存
 */
@Value
@Builder
public class HealthSnapshot {

    boolean pollerRunning;

    /** 所有启用设备的轮询循环都在运行 */
    boolean allLoopsAlive;

    Instant generatedAt;

    /** 处于直播状态的设备数 */
    int liveDeviceCount;

    int openSessionCount;

    int stalledDeviceCount;

    int alertingDeviceCount;

    /** 已启用但没有轮询循环的设备 */
    @Builder.Default
    List<String> missingLoops = List.of();

    @Builder.Default
    List<DeviceHealth> devices = List.of();
}
