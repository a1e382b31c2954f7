package com.wangbin.liveprobe.core.scheduler;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.core.client.TelemetryClient;
import com.wangbin.liveprobe.core.config.ProbeProperties;
import com.wangbin.liveprobe.core.processor.SampleNormalizer;
import com.wangbin.liveprobe.core.registry.DeviceChangeEvent;
import com.wangbin.liveprobe.core.registry.DeviceRegistry;
import com.wangbin.liveprobe.core.store.TimeSeriesStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 轮询调度器
 *
 * 为每个启用的设备维护一个独立的轮询循环，设备增删时只启停对应循环
 */
@Slf4j
@Service
public class PollerScheduler {

    private final ProbeProperties properties;
    private final DeviceRegistry deviceRegistry;
    private final TelemetryClient telemetryClient;
    private final SampleNormalizer normalizer;
    private final TimeSeriesStore store;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private final AtomicInteger runCounter = new AtomicInteger();
    private final Consumer<DeviceChangeEvent> registryListener = this::onDeviceChange;

    // 运行中时不为null
    private volatile PollerContext context;
    private boolean listenerRegistered;

    public PollerScheduler(ProbeProperties properties, DeviceRegistry deviceRegistry, TelemetryClient telemetryClient,
                           SampleNormalizer normalizer, TimeSeriesStore store, Clock clock) {
        this.properties = properties;
        this.deviceRegistry = deviceRegistry;
        this.telemetryClient = telemetryClient;
        this.normalizer = normalizer;
        this.store = store;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getPoller().isAutoStart()) {
            start();
        } else {
            log.info("轮询自动启动已关闭，等待手动启动");
        }
    }

    /**
     * 为当前启用的每个设备启动轮询循环，已在运行时不做任何事
     *
     * @return 是否本次启动
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (context != null) {
                log.debug("轮询调度器已在运行");
                return false;
            }
            if (!listenerRegistered) {
                deviceRegistry.registerListener(registryListener);
                listenerRegistered = true;
            }
            PollerContext ctx = new PollerContext(runCounter.incrementAndGet(), properties.getPoller(),
                    telemetryClient, normalizer, store, clock);
            List<DeviceInfo> devices = deviceRegistry.getEnabledDevices();
            for (DeviceInfo device : devices) {
                ctx.startLoop(device);
            }
            context = ctx;
            log.info("轮询调度器已启动 (运行 #{})，设备数={}", ctx.getRunId(), devices.size());
            return true;
        }
    }

    /**
     * 停止全部轮询循环，阻塞到循环退出（有超时），进行中的会话以POLLER_SHUTDOWN结束
     *
     * @return 是否本次停止
     */
    public boolean stop() {
        synchronized (lifecycleLock) {
            PollerContext ctx = context;
            if (ctx == null) {
                return false;
            }
            context = null;
            ctx.shutdown(shutdownTimeout());
            log.info("轮询调度器已停止 (运行 #{})", ctx.getRunId());
            return true;
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
        synchronized (lifecycleLock) {
            if (listenerRegistered) {
                deviceRegistry.removeListener(registryListener);
                listenerRegistered = false;
            }
        }
    }

    /**
     * 处理注册中心的设备变更
     */
    void onDeviceChange(DeviceChangeEvent event) {
        synchronized (lifecycleLock) {
            PollerContext ctx = context;
            if (ctx == null) {
                return;
            }
            DeviceInfo device = event.getDevice();
            switch (event.getType()) {
                case ADDED:
                    if (device.isEnabled()) {
                        ctx.startLoop(device);
                    }
                    break;
                case REMOVED:
                    ctx.stopLoop(event.getDeviceId(), shutdownTimeout());
                    telemetryClient.evict(event.getDeviceId());
                    break;
                case UPDATED:
                    if (!device.isEnabled()) {
                        ctx.stopLoop(event.getDeviceId(), shutdownTimeout());
                        break;
                    }
                    if (event.isConfigChanged()) {
                        telemetryClient.evict(event.getDeviceId());
                    }
                    DeviceLoop loop = ctx.getLoop(event.getDeviceId());
                    if (loop == null) {
                        ctx.startLoop(device);
                    } else {
                        loop.updateDevice(device);
                        log.info("设备 {} 配置已更新，下个周期生效", event.getDeviceId());
                    }
                    break;
                default:
                    log.warn("未知的设备变更类型: {}", event.getType());
            }
        }
    }

    // ==================== 查询 ====================

    public boolean isRunning() {
        return context != null;
    }

    /**
     * 各设备运行状态快照，按设备ID排序
     */
    public List<DeviceRuntimeSnapshot> getRuntimeSnapshots() {
        PollerContext ctx = context;
        if (ctx == null) {
            return List.of();
        }
        return ctx.getAllLoops().stream()
                .map(DeviceLoop::snapshot)
                .sorted(Comparator.comparing(DeviceRuntimeSnapshot::getDeviceId))
                .collect(Collectors.toList());
    }

    /**
     * 单个设备的运行状态，未在轮询时返回null
     */
    public DeviceRuntimeSnapshot getRuntimeSnapshot(String deviceId) {
        PollerContext ctx = context;
        if (ctx == null) {
            return null;
        }
        DeviceLoop loop = ctx.getLoop(deviceId);
        return loop == null ? null : loop.snapshot();
    }

    public int getActiveLoopCount() {
        PollerContext ctx = context;
        return ctx == null ? 0 : ctx.getAllLoops().size();
    }

    private Duration shutdownTimeout() {
        return Duration.ofMillis(properties.getPoller().getShutdownTimeoutMs());
    }
}
