package com.wangbin.liveprobe.common.domain.entity;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * GPS定位
 * 经纬度必有；海拔与定位质量可选，缺失时为null并记录在missingFields中
 */
@Value
@Builder
public class GpsFix {

    public static final String FIELD_ALTITUDE = "altitude";
    public static final String FIELD_FIX_QUALITY = "fixQuality";

    double latitude;
    double longitude;
    Double altitude;
    String fixQuality;

    @Builder.Default
    Set<String> missingFields = Set.of();

    public boolean isMissing(String field) {
        return missingFields.contains(field);
    }
}
