package com.wangbin.liveprobe.common.domain.enums;

/**
 * 链路质量等级，按单向时延划分
 */
public enum LinkQuality {
    GOOD,
    FAIR,
    POOR,
    UNKNOWN;

    private static final long FAIR_DELAY_MS = 100;
    private static final long POOR_DELAY_MS = 200;

    public static LinkQuality ofOneWayDelay(Long delayMs) {
        if (delayMs == null) {
            return UNKNOWN;
        }
        if (delayMs >= POOR_DELAY_MS) {
            return POOR;
        }
        if (delayMs > FAIR_DELAY_MS) {
            return FAIR;
        }
        return GOOD;
    }

    /**
     * 取两者中较差的一个，UNKNOWN不参与比较
     */
    public LinkQuality worst(LinkQuality other) {
        if (other == null || other == UNKNOWN) {
            return this;
        }
        if (this == UNKNOWN) {
            return other;
        }
        return this.ordinal() >= other.ordinal() ? this : other;
    }
}
