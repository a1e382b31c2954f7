package com.wangbin.liveprobe.core.scheduler;

import com.wangbin.liveprobe.common.domain.enums.FailureKind;
import com.wangbin.liveprobe.common.domain.enums.SessionState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 设备运行状态快照（不可变）
 *
 * 由设备自己的轮询循环在每个周期结束时整体发布，外部读取不会看到更新到一半的状态
 */
@Value
@Builder(toBuilder = true)
public class DeviceRuntimeSnapshot {

    String deviceId;
    String deviceName;

    /** 轮询循环是否仍在运行 */
    boolean loopAlive;

    long intervalMs;
    long fetchTimeoutMs;

    SessionState state;
    Long currentSessionId;

    Instant loopStartedAt;

    /** 最近一个周期的开始时间 */
    Instant lastCycleStartedAt;
    Instant lastPollTime;
    Instant lastSuccessfulPollTime;

    /** 最近一次成功归一化的样本时间，与直播状态无关 */
    Instant lastSampleTime;

    int consecutiveFailures;
    int silenceCount;
    FailureKind lastFailureKind;
    String lastError;
    boolean alerting;
    long cycles;

    @Builder.Default
    List<AgePoint> ageHistory = List.of();
}
