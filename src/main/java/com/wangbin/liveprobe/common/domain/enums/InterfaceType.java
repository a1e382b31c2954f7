package com.wangbin.liveprobe.common.domain.enums;

import java.util.Locale;

/**
 * 传输接口类型
 */
public enum InterfaceType {
    CELLULAR,
    ETHERNET,
    WIFI,
    USB,
    OTHER;

    private static final String[] CELLULAR_HINTS = {"cell", "modem", "lte", "5g", "4g", "3g", "wwan", "sim", "ppp"};
    private static final String[] WIFI_HINTS = {"wlan", "wifi", "wi-fi", "wireless"};
    private static final String[] ETHERNET_HINTS = {"eth", "lan", "enp", "eno", "ens"};

    /**
     * 根据接口名称或类型描述推断接口类型
     *
     * @param hint 接口名称、类型字段等
     * @return 接口类型，无法识别时返回OTHER
     */
    public static InterfaceType classify(String hint) {
        if (hint == null || hint.isBlank()) {
            return OTHER;
        }
        String value = hint.trim().toLowerCase(Locale.ROOT);
        if (containsAny(value, CELLULAR_HINTS)) {
            return CELLULAR;
        }
        if (containsAny(value, WIFI_HINTS) || value.startsWith("wl")) {
            return WIFI;
        }
        if (value.contains("usb")) {
            return USB;
        }
        if (containsAny(value, ETHERNET_HINTS)) {
            return ETHERNET;
        }
        return OTHER;
    }

    private static boolean containsAny(String value, String[] hints) {
        for (String hint : hints) {
            if (value.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
