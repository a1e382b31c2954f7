package com.wangbin.liveprobe.core.config;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 直播探针配置类
 */
@Data
@Component
@ConfigurationProperties(prefix = "probe")
public class ProbeProperties {

    /**
     * 轮询配置
     */
    private PollerConfig poller = new PollerConfig();

    /**
     * 厂商HTTP接口配置
     */
    private HttpConfig http = new HttpConfig();

    /**
     * 初始设备列表，启动时导入设备注册中心
     */
    private List<DeviceInfo> devices = new ArrayList<>();

    // =============== 配置类定义 ===============

    @Data
    public static class PollerConfig {
        /** 默认轮询间隔（毫秒） */
        private long defaultIntervalMs = 2000;
        /** 单次拉取超时（毫秒），实际值始终小于设备轮询间隔 */
        private long fetchTimeoutMs = 1500;
        /** 连续不可达多少次后关闭会话 */
        private int silenceThreshold = 5;
        /** 停止时等待各轮询循环退出的最长时间（毫秒） */
        private long shutdownTimeoutMs = 5000;
        /** 连续失败告警阈值 */
        private int failureAlertThreshold = 3;
        /** 应用就绪后自动启动轮询 */
        private boolean autoStart = true;
        /** IO线程池核心线程数 */
        private int ioThreads = 8;
        /** 样本时延历史窗口（秒） */
        private int ageHistoryWindowSeconds = 120;
    }

    @Data
    public static class HttpConfig {
        private long connectTimeoutMs = 2000;
        private String userAgent = "StreamPilot/1.0";
        /** 设备多为自签名证书 */
        private boolean trustAllCertificates = true;
        /** 设备特征信息缓存时间（秒） */
        private long characteristicsTtlSeconds = 60;
    }
}
