package com.wangbin.liveprobe.common.domain.enums;

import lombok.Getter;

/**
 * 会话关闭原因枚举
 */
@Getter
public enum ClosureReason {

    GRACEFUL("GRACEFUL", "正常结束", "设备明确上报空闲状态"),
    TIMEOUT("TIMEOUT", "静默超时", "连续不可达次数达到静默阈值"),
    POLLER_SHUTDOWN("POLLER_SHUTDOWN", "轮询停止", "轮询器或设备轮询循环停止"),
    MANUAL("MANUAL", "手动停止", "运维人员通过管理接口停止");

    private final String code;
    private final String description;
    private final String detail;

    ClosureReason(String code, String description, String detail) {
        this.code = code;
        this.description = description;
        this.detail = detail;
    }
}
