package com.wangbin.liveprobe.common.domain.enums;

import lombok.Getter;

/**
 * 轮询失败类型
 */
@Getter
public enum FailureKind {

    TIMEOUT("TIMEOUT", "请求超时"),
    UNREACHABLE("UNREACHABLE", "设备不可达"),
    PROTOCOL_ERROR("PROTOCOL_ERROR", "协议错误"),
    PARSE_ERROR("PARSE_ERROR", "报文解析失败");

    private final String code;
    private final String description;

    FailureKind(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * 是否为网络层面的失败（解析失败单独统计）
     */
    public boolean isNetworkFailure() {
        return this != PARSE_ERROR;
    }
}
