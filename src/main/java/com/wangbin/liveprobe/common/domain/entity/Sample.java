package com.wangbin.liveprobe.common.domain.entity;

import com.wangbin.liveprobe.common.domain.enums.LinkQuality;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * 遥测样本（不可变）
 *
 * 由归一化器根据一次轮询结果创建，写入存储时由存储分配会话内序号。
 * 可选字段缺失时为null并登记在missingFields中。
 */
@Value
@Builder(toBuilder = true)
public class Sample {

    /** 尚未写入会话的样本序号 */
    public static final int UNASSIGNED = -1;

    public static final String FIELD_GPS = "gps";
    public static final String FIELD_INTERFACES = "interfaces";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_VIDEO_DROPS = "videoDroppedPackets";
    public static final String FIELD_TS_DROPS = "tsDroppedPackets";

    /** 总接收码率低于该值视为低码率 kb/s */
    public static final long LOW_RX_BITRATE_KBPS = 1500;

    String deviceId;
    Instant timestamp;

    @With
    @Builder.Default
    int sequenceIndex = UNASSIGNED;

    GpsFix gps;

    @Builder.Default
    List<InterfaceReading> interfaces = List.of();

    /** 视频流累计丢包 */
    Long videoDroppedPackets;

    /** TS流累计丢包 */
    Long tsDroppedPackets;

    @Builder.Default
    Set<String> missingFields = Set.of();

    /** 报文未能完整解析时为false */
    @Builder.Default
    boolean complete = true;

    public boolean hasGps() {
        return gps != null;
    }

    public boolean isMissing(String field) {
        return missingFields.contains(field);
    }

    /**
     * 汇总各接口的接收码率，全部缺失时返回null
     */
    public Long getTotalRxBitrateKbps() {
        Long total = null;
        for (InterfaceReading reading : interfaces) {
            if (reading.getBitrateKbps() != null) {
                total = (total == null ? 0L : total) + reading.getBitrateKbps();
            }
        }
        return total;
    }

    public boolean isLowRxBitrate() {
        Long total = getTotalRxBitrateKbps();
        return total != null && total < LOW_RX_BITRATE_KBPS;
    }

    /**
     * 所有接口中最差的链路质量
     */
    public LinkQuality getWorstLinkQuality() {
        LinkQuality worst = LinkQuality.UNKNOWN;
        for (InterfaceReading reading : interfaces) {
            worst = worst.worst(reading.getQuality());
        }
        return worst;
    }
}
