package com.wangbin.liveprobe.core.processor;

import com.wangbin.liveprobe.common.domain.entity.GpsFix;
import com.wangbin.liveprobe.common.domain.entity.InterfaceReading;
import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.enums.InterfaceType;
import com.wangbin.liveprobe.common.domain.enums.LiveState;
import com.wangbin.liveprobe.common.utils.NumberUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.wangbin.liveprobe.core.processor.GpsExtractor.asMap;

/**
 * 样本归一化器
 *
 * 把设备原始状态报文转换为统一的样本。必填字段：时间戳、通道状态，
 * 直播中还要求至少一个接口指标；可选字段缺失时置null并登记，不用0代替。
 */
@Slf4j
@Component
public class SampleNormalizer {

    public static final String FIELD_TIMESTAMP = "timestamp";

    private static final String[] STATUS_KEYS = {"channelStatus", "channelState", "status"};
    private static final String[] LINK_NAME_KEYS = {"name", "itf_name"};
    private static final String[] BITRATE_KEYS = {"rx_bitrate", "rxBitrate", "rx_kbits", "bitrate"};
    private static final String[] DELAY_KEYS = {"owdR", "owd_r", "owd", "oneway", "rtt"};
    private static final String[] LOSS_KEYS = {"rx_percent_lost", "rx_percent_loss", "rx_loss_percent"};
    private static final String[] DROPPED_KEYS = {"rx_lost_nb_packets", "rx_lost_packets", "rx_lost_nb", "rx_lost"};
    private static final String[] LINK_UP_KEYS = {"connected", "up", "state", "status"};
    private static final String[] IDENTIFIER_KEYS = {"identifier", "name"};

    private final GpsExtractor gpsExtractor = new GpsExtractor();

    /**
     * 归一化一次轮询报文
     *
     * @param deviceId 设备ID
     * @param payload  原始报文，input/linkStats/streamStats为可选子对象，缺少input时直接读取顶层字段
     * @return 归一化结果
     */
    public NormalizationResult normalize(String deviceId, Map<String, Object> payload) {
        if (payload == null) {
            return NormalizationResult.failure(null, LiveState.UNKNOWN, null, List.of(FIELD_TIMESTAMP, Sample.FIELD_STATUS));
        }
        Map<String, Object> input = childMap(payload, "input");
        if (input == null) {
            input = payload;
        }

        List<String> missingRequired = new ArrayList<>();
        Set<String> missing = new HashSet<>();

        Instant timestamp = NumberUtil.toInstant(payload.get(FIELD_TIMESTAMP));
        if (timestamp == null) {
            missingRequired.add(FIELD_TIMESTAMP);
        }

        LiveState liveState = LiveState.fromStatus(firstPresent(input, STATUS_KEYS));
        if (liveState == LiveState.UNKNOWN) {
            missingRequired.add(Sample.FIELD_STATUS);
            missing.add(Sample.FIELD_STATUS);
        }

        String inputIdentifier = stringValue(firstPresent(input, IDENTIFIER_KEYS));

        GpsFix gps = gpsExtractor.extract(input);
        if (gps == null) {
            missing.add(Sample.FIELD_GPS);
        }

        List<InterfaceReading> interfaces = readInterfaces(payload, input);
        if (interfaces.isEmpty()) {
            missing.add(Sample.FIELD_INTERFACES);
            if (liveState.isLive()) {
                missingRequired.add(Sample.FIELD_INTERFACES);
            }
        }

        Map<String, Object> streamStats = childMap(payload, "streamStats");
        Long videoDrops = sumDrops(streamStats, "video");
        if (videoDrops == null) {
            missing.add(Sample.FIELD_VIDEO_DROPS);
        }
        Long tsDrops = sumDrops(streamStats, "mpegts-up", "mpegts_up");
        if (tsDrops == null) {
            missing.add(Sample.FIELD_TS_DROPS);
        }

        if (timestamp == null) {
            log.warn("报文解析失败，缺少时间戳: deviceId={}", deviceId);
            return NormalizationResult.failure(null, liveState, inputIdentifier, missingRequired);
        }

        Sample sample = Sample.builder()
                .deviceId(deviceId)
                .timestamp(timestamp)
                .gps(gps)
                .interfaces(List.copyOf(interfaces))
                .videoDroppedPackets(videoDrops)
                .tsDroppedPackets(tsDrops)
                .missingFields(Set.copyOf(missing))
                .complete(missingRequired.isEmpty())
                .build();

        if (!missingRequired.isEmpty()) {
            log.warn("报文解析不完整: deviceId={}, 缺少必填字段={}", deviceId, missingRequired);
            return NormalizationResult.failure(sample, liveState, inputIdentifier, missingRequired);
        }
        return NormalizationResult.success(sample, liveState, inputIdentifier);
    }

    // ==================== 接口指标 ====================

    private List<InterfaceReading> readInterfaces(Map<String, Object> payload, Map<String, Object> input) {
        Object source = null;
        Map<String, Object> linkStats = childMap(payload, "linkStats");
        if (linkStats != null) {
            source = linkStats.get("links_stats");
            if (source == null) {
                source = linkStats.get("links");
            }
        }
        if (source == null) {
            source = input.get("links");
        }

        List<InterfaceReading> readings = new ArrayList<>();
        if (source instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                readings.add(readInterface("link" + i, list.get(i)));
            }
        } else if (source instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                // 汇总字段不是接口
                if (key.startsWith("total_")) {
                    continue;
                }
                readings.add(readInterface(key, entry.getValue()));
            }
        }
        return readings;
    }

    private InterfaceReading readInterface(String fallbackName, Object raw) {
        Set<String> missing = new HashSet<>();
        if (!(raw instanceof Map<?, ?> rawMap)) {
            missing.add(InterfaceReading.FIELD_BITRATE);
            missing.add(InterfaceReading.FIELD_ONE_WAY_DELAY);
            missing.add(InterfaceReading.FIELD_PACKET_LOSS);
            missing.add(InterfaceReading.FIELD_DROPPED_PACKETS);
            missing.add(InterfaceReading.FIELD_LINK_UP);
            return InterfaceReading.builder()
                    .name(fallbackName)
                    .type(InterfaceType.classify(fallbackName))
                    .missingFields(Set.copyOf(missing))
                    .build();
        }
        Map<String, Object> link = asMap(rawMap);

        String name = stringValue(firstPresent(link, LINK_NAME_KEYS));
        if (name == null) {
            name = fallbackName;
        }
        String typeHint = stringValue(link.get("type"));
        InterfaceType type = InterfaceType.classify(typeHint);
        if (type == InterfaceType.OTHER) {
            type = InterfaceType.classify(name);
        }

        Long bitrate = NumberUtil.toLong(unwrapBitrate(firstPresent(link, BITRATE_KEYS)));
        if (bitrate == null) {
            missing.add(InterfaceReading.FIELD_BITRATE);
        }
        Long delay = NumberUtil.toLong(firstPresent(link, DELAY_KEYS));
        if (delay == null) {
            missing.add(InterfaceReading.FIELD_ONE_WAY_DELAY);
        }
        Double loss = NumberUtil.toDouble(firstPresent(link, LOSS_KEYS));
        if (loss == null) {
            missing.add(InterfaceReading.FIELD_PACKET_LOSS);
        }
        Long dropped = NumberUtil.toLong(firstPresent(link, DROPPED_KEYS));
        if (dropped == null) {
            missing.add(InterfaceReading.FIELD_DROPPED_PACKETS);
        }
        Boolean linkUp = toLinkUp(firstPresent(link, LINK_UP_KEYS));
        if (linkUp == null) {
            missing.add(InterfaceReading.FIELD_LINK_UP);
        }

        return InterfaceReading.builder()
                .name(name)
                .type(type)
                .bitrateKbps(bitrate)
                .oneWayDelayMs(delay)
                .packetLossPercent(loss)
                .droppedPackets(dropped)
                .linkUp(linkUp)
                .missingFields(Set.copyOf(missing))
                .build();
    }

    /**
     * 部分固件的码率是 {"kbits": 123} 形式
     */
    private Object unwrapBitrate(Object value) {
        if (value instanceof Map<?, ?> map) {
            Object kbits = map.get("kbits");
            return kbits != null ? kbits : map.get("value");
        }
        return value;
    }

    private Boolean toLinkUp(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "up":
            case "on":
            case "connected":
            case "true":
            case "1":
                return Boolean.TRUE;
            case "down":
            case "off":
            case "disconnected":
            case "false":
            case "0":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    // ==================== 流统计 ====================

    private Long sumDrops(Map<String, Object> streamStats, String... keys) {
        if (streamStats == null) {
            return null;
        }
        Object entries = null;
        for (String key : keys) {
            entries = streamStats.get(key);
            if (entries != null) {
                break;
            }
        }
        if (!(entries instanceof List<?> list)) {
            return null;
        }
        Long total = null;
        for (Object entry : list) {
            if (entry instanceof Map<?, ?> map) {
                Long value = NumberUtil.toLong(map.get("rx_lost_packets"));
                if (value != null) {
                    total = (total == null ? 0L : total) + value;
                }
            }
        }
        return total;
    }

    // ==================== 工具方法 ====================

    private static Map<String, Object> childMap(Map<String, Object> parent, String key) {
        Object value = parent.get(key);
        return value instanceof Map<?, ?> map ? asMap(map) : null;
    }

    private static Object firstPresent(Map<String, Object> map, String[] keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String stringValue(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }
}
