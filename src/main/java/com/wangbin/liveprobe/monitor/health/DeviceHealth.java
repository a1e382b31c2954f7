package com.wangbin.liveprobe.monitor.health;

import com.wangbin.liveprobe.common.domain.enums.FailureKind;
import com.wangbin.liveprobe.common.domain.enums.SessionState;
import com.wangbin.liveprobe.core.scheduler.AgePoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 单个设备的健康状态
 */
@Value
@Builder
public class DeviceHealth {

    String deviceId;
    String deviceName;

    boolean loopAlive;

    /** 超过 间隔+超时+1秒 没有开始新周期 */
    boolean stalled;

    SessionState state;

    /** 进行中的会话，没有时为null */
    Long currentSessionId;

    /** 距最近一次成功轮询的毫秒数，从未成功时为null */
    Long lastSuccessfulPollAgeMs;

    /** 距最近一个样本的毫秒数（与直播状态无关），从未收到时为null */
    Long lastSampleAgeMs;

    int consecutiveFailures;
    boolean alerting;
    FailureKind lastFailureKind;
    String lastError;

    @Builder.Default
    List<AgePoint> ageHistory = List.of();
}
