package com.wangbin.liveprobe.common.domain.enums;

import com.wangbin.liveprobe.common.utils.NumberUtil;

import java.util.Locale;

/**
 * 设备输入通道的直播状态
 *
 * 厂商接口的通道状态可能是整数、数字字符串或文字标签：
 * 0=off, 1=idle, 2=on, 3/4=error
 */
public enum LiveState {

    /** 正在直播 */
    LIVE,

    /** 明确上报非直播（off/idle/error） */
    NOT_LIVE,

    /** 状态缺失或无法识别 */
    UNKNOWN;

    private static final int CODE_ON = 2;

    /**
     * 解析厂商上报的原始状态值
     *
     * @param raw 原始值，可以为null
     * @return 直播状态
     */
    public static LiveState fromStatus(Object raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        if (raw instanceof Boolean flag) {
            return flag ? LIVE : NOT_LIVE;
        }
        if (raw instanceof Number number) {
            return fromNumber(number.doubleValue());
        }
        String value = raw.toString().trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return UNKNOWN;
        }
        switch (value) {
            case "on":
            case "live":
            case "running":
            case "true":
                return LIVE;
            case "off":
            case "idle":
            case "error":
            case "false":
                return NOT_LIVE;
            default:
                Double number = NumberUtil.toDouble(value);
                return number == null ? UNKNOWN : fromNumber(number);
        }
    }

    /**
     * 状态码必须是整数，"2.0"按2处理，2.9视为无法识别
     */
    private static LiveState fromNumber(double number) {
        if (!Double.isFinite(number) || number != Math.rint(number)) {
            return UNKNOWN;
        }
        if (number == CODE_ON) {
            return LIVE;
        }
        return number >= 0 && number <= 4 ? NOT_LIVE : UNKNOWN;
    }

    public boolean isLive() {
        return this == LIVE;
    }
}
