package com.wangbin.liveprobe.common.utils;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 数值转换工具类
 *
 * 厂商接口的数值可能是数字、带单位的字符串（"123 kb/s"）或逗号小数（"48,85"），
 * 无法识别时统一返回null，调用方据此登记缺失字段
 */
public class NumberUtil {

    /** 小于该值的时间戳按秒处理 */
    private static final long EPOCH_SECONDS_LIMIT = 100_000_000_000L;

    private static final Pattern LEADING_NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private NumberUtil() {
        // 工具类，防止实例化
    }

    /**
     * 转换为Long，支持去除单位
     */
    public static Long toLong(Object value) {
        Double d = toDouble(value);
        return d == null ? null : (long) d.doubleValue();
    }

    /**
     * 转换为Double，支持逗号小数和去除单位
     * 只识别开头的数值，如"12 kb/s (avg 10)"得到12，开头不是数值时返回null
     */
    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        // 只取开头的数值部分，其后的单位或说明忽略
        Matcher matcher = LEADING_NUMBER.matcher(value.toString().trim().replace(',', '.'));
        return matcher.lookingAt() ? parse(matcher.group()) : null;
    }

    /**
     * 转换经纬度坐标
     * 支持末尾方位字母（N/E/S/W），S和W表示负值
     */
    public static Double toCoordinate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        String s = value.toString().trim();
        if (s.isEmpty()) {
            return null;
        }
        double sign = 1.0;
        char last = Character.toUpperCase(s.charAt(s.length() - 1));
        if (last == 'N' || last == 'E' || last == 'S' || last == 'W') {
            if (last == 'S' || last == 'W') {
                sign = -1.0;
            }
            s = s.substring(0, s.length() - 1).trim();
        }
        Double d = parse(s.replace(',', '.'));
        return d == null ? null : d * sign;
    }

    /**
     * 转换时间戳
     * 支持毫秒/秒级时间戳数值以及ISO-8601字符串
     */
    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number number) {
            return fromEpoch(number.longValue());
        }
        String s = value.toString().trim();
        if (s.isEmpty()) {
            return null;
        }
        if (s.chars().allMatch(Character::isDigit)) {
            try {
                return fromEpoch(Long.parseLong(s));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException ex) {
                return null;
            }
        }
    }

    private static Instant fromEpoch(long epoch) {
        if (epoch <= 0) {
            return null;
        }
        return epoch < EPOCH_SECONDS_LIMIT ? Instant.ofEpochSecond(epoch) : Instant.ofEpochMilli(epoch);
    }

    private static Double parse(String s) {
        if (s.isEmpty() || "-".equals(s) || ".".equals(s)) {
            return null;
        }
        try {
            return new BigDecimal(s).doubleValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
