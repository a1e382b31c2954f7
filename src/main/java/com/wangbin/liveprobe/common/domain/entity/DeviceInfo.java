package com.wangbin.liveprobe.common.domain.entity;

import lombok.Data;

import java.util.Objects;

/**
 * 设备信息实体类
 *
 * 由设备注册中心维护，轮询核心只持有其只读副本
 */
@Data
public class DeviceInfo {

    private static final int HTTP_API_PORT = 8893;
    private static final int HTTPS_API_PORT = 8896;

    // ==================== 基本信息 ====================

    /** 设备唯一标识 */
    private String deviceId;

    /** 设备名称 */
    private String deviceName;

    // ==================== 连接配置 ====================

    /** 协议: http / https */
    private String protocol = "https";

    /** 设备地址 */
    private String host;

    /** 端口，0/80/443时使用厂商API默认端口 */
    private Integer port;

    /** REST API路径前缀 */
    private String apiPath = "/rest-api/";

    /** API令牌 */
    private String token;

    /** 采集的输入通道（从0开始），为空时自动选择正在直播的通道 */
    private Integer inputIndex;

    // ==================== 轮询配置 ====================

    /** 轮询间隔（毫秒），为空时使用全局默认值 */
    private Integer pollIntervalMs;

    /** 是否启用轮询 */
    private boolean enabled = true;

    // ==================== 业务方法 ====================

    /**
     * 获取有效的轮询间隔
     *
     * @param defaultIntervalMs 全局默认间隔
     * @return 轮询间隔（毫秒）
     */
    public long getEffectivePollInterval(long defaultIntervalMs) {
        return pollIntervalMs != null && pollIntervalMs > 0 ? pollIntervalMs : defaultIntervalMs;
    }

    /**
     * 获取有效端口
     * 厂商API不监听标准端口，http映射到8893，https映射到8896
     */
    public int getEffectivePort() {
        int p = port != null ? port : 0;
        if (p == 0 || p == 80 || p == 443) {
            return isHttps() ? HTTPS_API_PORT : HTTP_API_PORT;
        }
        return p;
    }

    public boolean isHttps() {
        return !"http".equalsIgnoreCase(protocol);
    }

    /**
     * 构建API基础地址，如 https://10.0.0.8:8896/rest-api
     */
    public String getBaseUrl() {
        String scheme = isHttps() ? "https" : "http";
        String path = apiPath == null ? "" : apiPath.trim();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (!path.isEmpty() && !path.startsWith("/")) {
            path = "/" + path;
        }
        return String.format("%s://%s:%d%s", scheme, host, getEffectivePort(), path);
    }

    /**
     * 获取设备显示名称
     */
    public String getDisplayName() {
        if (deviceName != null && !deviceName.trim().isEmpty()) {
            return deviceName.trim();
        }
        return deviceId != null ? deviceId : "未知设备";
    }

    /**
     * 验证设备信息的必填字段
     */
    public boolean validateRequiredFields() {
        return deviceId != null && !deviceId.trim().isEmpty()
                && host != null && !host.trim().isEmpty();
    }

    /**
     * 判断轮询相关配置是否发生变化
     */
    public boolean isConfigChanged(DeviceInfo other) {
        if (other == null) {
            return true;
        }
        return !Objects.equals(this.host, other.host)
                || !Objects.equals(this.port, other.port)
                || !Objects.equals(this.protocol, other.protocol)
                || !Objects.equals(this.apiPath, other.apiPath)
                || !Objects.equals(this.token, other.token)
                || !Objects.equals(this.inputIndex, other.inputIndex)
                || !Objects.equals(this.pollIntervalMs, other.pollIntervalMs)
                || this.enabled != other.enabled;
    }

    /**
     * 复制一份，注册中心对外只提供副本
     */
    public DeviceInfo copy() {
        DeviceInfo copy = new DeviceInfo();
        copy.setDeviceId(deviceId);
        copy.setDeviceName(deviceName);
        copy.setProtocol(protocol);
        copy.setHost(host);
        copy.setPort(port);
        copy.setApiPath(apiPath);
        copy.setToken(token);
        copy.setInputIndex(inputIndex);
        copy.setPollIntervalMs(pollIntervalMs);
        copy.setEnabled(enabled);
        return copy;
    }

    @Override
    public String toString() {
        return "DeviceInfo(deviceId=" + deviceId + ", deviceName=" + deviceName
                + ", host=" + host + ", port=" + port + ", enabled=" + enabled + ")";
    }
}
