package com.wangbin.liveprobe.core.processor;

import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.enums.LiveState;
import lombok.Getter;

import java.util.List;

/**
 * 归一化结果
 *
 * 成功时携带完整样本；失败时可能携带部分样本（缺失字段已登记），
 * 时间戳缺失时没有样本
 */
@Getter
public class NormalizationResult {

    private final boolean success;
    private final Sample sample;
    private final LiveState liveState;
    private final String inputIdentifier;
    private final List<String> missingRequired;
    private final String message;

    private NormalizationResult(boolean success, Sample sample, LiveState liveState, String inputIdentifier,
                                List<String> missingRequired, String message) {
        this.success = success;
        this.sample = sample;
        this.liveState = liveState;
        this.inputIdentifier = inputIdentifier;
        this.missingRequired = missingRequired;
        this.message = message;
    }

    public static NormalizationResult success(Sample sample, LiveState liveState, String inputIdentifier) {
        return new NormalizationResult(true, sample, liveState, inputIdentifier, List.of(), null);
    }

    public static NormalizationResult failure(Sample partialSample, LiveState liveState, String inputIdentifier,
                                              List<String> missingRequired) {
        String message = "缺少必填字段: " + String.join(", ", missingRequired);
        return new NormalizationResult(false, partialSample, liveState, inputIdentifier,
                List.copyOf(missingRequired), message);
    }

    public boolean hasSample() {
        return sample != null;
    }
}
