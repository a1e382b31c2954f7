package com.wangbin.liveprobe.core.client;

import com.alibaba.fastjson2.JSONObject;
import com.wangbin.liveprobe.common.domain.enums.FailureKind;
import lombok.Getter;

/**
 * 一次拉取的结果：原始报文或失败类型
 */
@Getter
public class FetchResult {

    private final JSONObject payload;
    private final FailureKind failureKind;
    private final String message;

    private FetchResult(JSONObject payload, FailureKind failureKind, String message) {
        this.payload = payload;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static FetchResult success(JSONObject payload) {
        return new FetchResult(payload, null, null);
    }

    public static FetchResult failure(FailureKind kind, String message) {
        return new FetchResult(null, kind, message);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "FetchResult(success)" : "FetchResult(" + failureKind + ": " + message + ")";
    }
}
