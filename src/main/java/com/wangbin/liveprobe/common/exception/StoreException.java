package com.wangbin.liveprobe.common.exception;

import com.wangbin.liveprobe.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 会话存储异常
 *
 * 写入不存在或已结束的会话时抛出，只影响当次写入
 */
@Getter
public class StoreException extends BusinessException {

    private final long sessionId;

    public StoreException(ResultCode resultCode, long sessionId, String message) {
        super(resultCode, message);
        this.sessionId = sessionId;
    }

    // 会话不存在
    public static StoreException sessionNotFound(long sessionId) {
        return new StoreException(ResultCode.SESSION_NOT_FOUND, sessionId, "会话不存在: " + sessionId);
    }

    // 会话已结束
    public static StoreException sessionClosed(long sessionId) {
        return new StoreException(ResultCode.SESSION_CLOSED, sessionId, "会话已结束: " + sessionId);
    }

    // 设备已有进行中的会话
    public static StoreException sessionAlreadyOpen(String deviceId, long openSessionId) {
        return new StoreException(ResultCode.SESSION_ALREADY_OPEN, openSessionId,
                "设备 " + deviceId + " 已有进行中的会话: " + openSessionId);
    }

    public boolean isNotFound() {
        return getResultCode() == ResultCode.SESSION_NOT_FOUND;
    }
}
