package com.wangbin.liveprobe.core.processor;

import com.wangbin.liveprobe.common.domain.entity.GpsFix;
import com.wangbin.liveprobe.common.utils.NumberUtil;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GPS坐标提取器
 *
 * 不同固件版本的坐标位置和字段名不统一，按以下顺序查找：
 * 顶层字段、常见容器（含[lat, lng]数组和下一层对象）、最后已知位置容器
 */
public class GpsExtractor {

    private static final String[] LAT_KEYS = {"latitude", "lat", "Latitude", "Lat", "gps_lat", "y"};
    private static final String[] LNG_KEYS = {"longitude", "lng", "lon", "long", "Longitude", "Lng", "Lon", "Long",
            "gps_lng", "gps_lon", "x"};
    private static final String[] ALT_KEYS = {"altitude", "alt", "Altitude", "elevation"};
    private static final String[] FIX_KEYS = {"locationStatus", "fixQuality", "fix_quality", "fix", "gpsStatus"};

    private static final String[] CONTAINERS = {"gps", "GPS", "location", "position", "geo", "coordinates",
            "geolocation", "coord", "metadata", "meta", "state", "extra", "status", "status_details"};
    private static final String[] LAST_KNOWN_CONTAINERS = {"last_gps", "lastGps", "last_position", "lastPosition",
            "last_location", "lastLocation"};

    /**
     * 提取GPS定位，找不到有效坐标时返回null
     */
    public GpsFix extract(Map<String, Object> input) {
        if (input == null) {
            return null;
        }
        GpsFix fix = fromMap(input, input);
        if (fix != null) {
            return fix;
        }
        for (String key : CONTAINERS) {
            fix = fromContainer(input.get(key), input);
            if (fix != null) {
                return fix;
            }
        }
        for (String key : LAST_KNOWN_CONTAINERS) {
            Object container = input.get(key);
            if (container instanceof Map<?, ?> map) {
                fix = fromMap(asMap(map), input);
                if (fix != null) {
                    return fix;
                }
            }
        }
        return null;
    }

    private GpsFix fromContainer(Object container, Map<String, Object> root) {
        if (container instanceof Map<?, ?> raw) {
            Map<String, Object> map = asMap(raw);
            GpsFix fix = fromMap(map, root);
            if (fix != null) {
                return fix;
            }
            for (Object value : map.values()) {
                if (value instanceof List<?> list) {
                    fix = fromPair(list, map, root);
                } else if (value instanceof Map<?, ?> nested) {
                    fix = fromMap(asMap(nested), root);
                }
                if (fix != null) {
                    return fix;
                }
            }
            return null;
        }
        if (container instanceof List<?> list) {
            return fromPair(list, root, root);
        }
        return null;
    }

    private GpsFix fromMap(Map<String, Object> map, Map<String, Object> root) {
        for (String latKey : LAT_KEYS) {
            if (!map.containsKey(latKey)) {
                continue;
            }
            for (String lngKey : LNG_KEYS) {
                if (map.containsKey(lngKey)) {
                    GpsFix fix = build(map.get(latKey), map.get(lngKey), map, root);
                    if (fix != null) {
                        return fix;
                    }
                }
            }
        }
        return null;
    }

    private GpsFix fromPair(List<?> pair, Map<String, Object> owner, Map<String, Object> root) {
        if (pair.size() < 2) {
            return null;
        }
        return build(pair.get(0), pair.get(1), owner, root);
    }

    private GpsFix build(Object latValue, Object lngValue, Map<String, Object> owner, Map<String, Object> root) {
        Double lat = NumberUtil.toCoordinate(latValue);
        Double lng = NumberUtil.toCoordinate(lngValue);
        if (lat == null || lng == null || Math.abs(lat) > 90 || Math.abs(lng) > 180) {
            return null;
        }
        Set<String> missing = new HashSet<>();
        Double altitude = NumberUtil.toDouble(firstPresent(owner, root, ALT_KEYS));
        if (altitude == null) {
            missing.add(GpsFix.FIELD_ALTITUDE);
        }
        Object fixValue = firstPresent(owner, root, FIX_KEYS);
        String fixQuality = fixValue == null || fixValue instanceof Map || fixValue instanceof List
                ? null : fixValue.toString();
        if (fixQuality == null) {
            missing.add(GpsFix.FIELD_FIX_QUALITY);
        }
        return GpsFix.builder()
                .latitude(lat)
                .longitude(lng)
                .altitude(altitude)
                .fixQuality(fixQuality)
                .missingFields(Set.copyOf(missing))
                .build();
    }

    private Object firstPresent(Map<String, Object> owner, Map<String, Object> root, String[] keys) {
        for (String key : keys) {
            Object value = owner.get(key);
            if (value != null) {
                return value;
            }
        }
        if (owner != root) {
            for (String key : keys) {
                Object value = root.get(key);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }
}
