package com.wangbin.liveprobe.core.client;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;

import java.time.Duration;

/**
 * 设备遥测客户端
 *
 * 每次轮询调用一次，不做内部重试，调用不得超过给定超时
 */
public interface TelemetryClient {

    /**
     * 拉取设备当前状态
     *
     * @param device  设备信息
     * @param timeout 本次拉取的总超时
     * @return 原始报文或失败类型，不抛出异常
     */
    FetchResult fetch(DeviceInfo device, Duration timeout);

    /**
     * 设备配置变更或移除时清理客户端缓存
     */
    default void evict(String deviceId) {
    }
}
