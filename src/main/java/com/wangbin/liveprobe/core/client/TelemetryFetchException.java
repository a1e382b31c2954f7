package com.wangbin.liveprobe.core.client;

import com.wangbin.liveprobe.common.domain.enums.FailureKind;
import lombok.Getter;

/**
 * 单次HTTP请求失败，只在客户端内部使用，对外转换为FetchResult
 */
@Getter
public class TelemetryFetchException extends Exception {

    private final FailureKind failureKind;

    public TelemetryFetchException(FailureKind failureKind, String message) {
        super(message);
        this.failureKind = failureKind;
    }

    public TelemetryFetchException(FailureKind failureKind, String message, Throwable cause) {
        super(message, cause);
        this.failureKind = failureKind;
    }
}
