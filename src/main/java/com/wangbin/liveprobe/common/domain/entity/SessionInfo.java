package com.wangbin.liveprobe.common.domain.entity;

import com.wangbin.liveprobe.common.domain.enums.ClosureReason;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * 直播会话元数据快照
 */
@Value
@Builder
public class SessionInfo {

    long sessionId;
    String deviceId;
    String deviceName;
    String inputIdentifier;
    String title;
    Instant startTime;

    /** 会话未结束时为null */
    Instant endTime;

    ClosureReason closureReason;
    int sampleCount;
    Instant lastSampleTime;

    public boolean isOpen() {
        return endTime == null;
    }

    /**
     * 会话时长，未结束的会话以最后一个样本时间计算
     */
    public Duration getDuration() {
        Instant end = endTime != null ? endTime : lastSampleTime;
        if (startTime == null || end == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, end);
    }
}
