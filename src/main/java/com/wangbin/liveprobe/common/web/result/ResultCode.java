package com.wangbin.liveprobe.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    SUCCESS(200, "成功"),

    // 请求参数
    PARAM_ERROR(1000, "参数错误"),

    // 会话存储
    SESSION_NOT_FOUND(2100, "会话不存在"),
    SESSION_CLOSED(2101, "会话已结束"),
    SESSION_ALREADY_OPEN(2102, "设备已有进行中的会话"),

    // 设备
    DEVICE_NOT_FOUND(2200, "设备不存在"),
    DEVICE_INVALID(2201, "设备配置无效"),

    SYSTEM_ERROR(5000, "系统内部错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
