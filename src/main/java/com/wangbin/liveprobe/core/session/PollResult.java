package com.wangbin.liveprobe.core.session;

import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.enums.FailureKind;
import com.wangbin.liveprobe.common.domain.enums.LiveState;
import com.wangbin.liveprobe.core.processor.NormalizationResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 一次轮询的结果，按时间顺序交给设备状态机，不持久化
 */
@Value
@Builder
public class PollResult {

    String deviceId;

    /** 轮询时间 */
    Instant timestamp;

    boolean success;

    /** 失败类型，成功时为null */
    FailureKind failureKind;

    @Builder.Default
    LiveState liveState = LiveState.UNKNOWN;

    /** 归一化样本，失败时可能是部分样本或null */
    Sample sample;

    String inputIdentifier;

    String message;

    /**
     * 由归一化结果构建，解析失败按不可达处理但保留部分样本
     */
    public static PollResult fromNormalization(String deviceId, Instant polledAt, NormalizationResult result) {
        return PollResult.builder()
                .deviceId(deviceId)
                .timestamp(polledAt)
                .success(result.isSuccess())
                .failureKind(result.isSuccess() ? null : FailureKind.PARSE_ERROR)
                .liveState(result.getLiveState())
                .sample(result.getSample())
                .inputIdentifier(result.getInputIdentifier())
                .message(result.getMessage())
                .build();
    }

    /**
     * 拉取失败时的合成结果
     */
    public static PollResult unreachable(String deviceId, Instant polledAt, FailureKind kind, String message) {
        return PollResult.builder()
                .deviceId(deviceId)
                .timestamp(polledAt)
                .success(false)
                .failureKind(kind)
                .message(message)
                .build();
    }

    public boolean isLive() {
        return success && liveState.isLive();
    }

    /**
     * 设备明确上报非直播
     */
    public boolean isExplicitlyIdle() {
        return success && liveState == LiveState.NOT_LIVE;
    }
}
