package com.wangbin.liveprobe.common.domain.entity;

import com.wangbin.liveprobe.common.domain.enums.InterfaceType;
import com.wangbin.liveprobe.common.domain.enums.LinkQuality;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * 单个传输接口的链路指标
 *
 * 指标缺失时值为null，并在missingFields中登记，不会以0代替
 */
@Value
@Builder
public class InterfaceReading {

    public static final String FIELD_BITRATE = "bitrate";
    public static final String FIELD_ONE_WAY_DELAY = "oneWayDelay";
    public static final String FIELD_PACKET_LOSS = "packetLoss";
    public static final String FIELD_DROPPED_PACKETS = "droppedPackets";
    public static final String FIELD_LINK_UP = "linkUp";

    String name;
    InterfaceType type;

    /** 接收码率 kb/s */
    Long bitrateKbps;

    /** 单向时延 ms */
    Long oneWayDelayMs;

    /** 丢包率 % */
    Double packetLossPercent;

    /** 丢包数 */
    Long droppedPackets;

    Boolean linkUp;

    @Builder.Default
    Set<String> missingFields = Set.of();

    public boolean isMissing(String field) {
        return missingFields.contains(field);
    }

    public LinkQuality getQuality() {
        return LinkQuality.ofOneWayDelay(oneWayDelayMs);
    }
}
