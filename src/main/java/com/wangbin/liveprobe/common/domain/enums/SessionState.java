package com.wangbin.liveprobe.common.domain.enums;

/**
 * 设备会话状态机状态
 */
public enum SessionState {
    IDLE,
    LIVE
}
