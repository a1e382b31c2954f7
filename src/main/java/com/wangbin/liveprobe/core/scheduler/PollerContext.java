package com.wangbin.liveprobe.core.scheduler;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.common.domain.enums.ClosureReason;
import com.wangbin.liveprobe.core.client.TelemetryClient;
import com.wangbin.liveprobe.core.config.ProbeProperties;
import com.wangbin.liveprobe.core.processor.SampleNormalizer;
import com.wangbin.liveprobe.core.session.SessionTransition;
import com.wangbin.liveprobe.core.store.TimeSeriesStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 一次轮询运行的上下文
 *
 * start()时创建，stop()时整体销毁，持有本次运行的定时器、IO线程池和全部设备循环。
 * 多个调度器实例各自拥有独立的上下文，互不干扰。
 */
@Slf4j
@Getter
class PollerContext {

    private final int runId;
    private final ProbeProperties.PollerConfig pollerConfig;
    private final TelemetryClient client;
    private final SampleNormalizer normalizer;
    private final TimeSeriesStore store;
    private final Clock clock;

    // 1. 定时器：只负责触发周期，不执行IO
    private final ScheduledThreadPoolExecutor timer;

    // 2. IO线程池：执行拉取、归一化和写入
    private final ThreadPoolExecutor ioExecutor;

    // deviceId -> 轮询循环
    private final Map<String, DeviceLoop> loops = new ConcurrentHashMap<>();

    PollerContext(int runId, ProbeProperties.PollerConfig pollerConfig, TelemetryClient client,
                  SampleNormalizer normalizer, TimeSeriesStore store, Clock clock) {
        this.runId = runId;
        this.pollerConfig = pollerConfig;
        this.client = client;
        this.normalizer = normalizer;
        this.store = store;
        this.clock = clock;

        this.timer = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
                .setNameFormat("poller-" + runId + "-timer-%d")
                .setDaemon(true)
                .build());
        this.timer.setRemoveOnCancelPolicy(true);

        // 设备数量不固定，线程按需创建，空闲回收
        this.ioExecutor = new ThreadPoolExecutor(
                Math.max(1, pollerConfig.getIoThreads()),
                Integer.MAX_VALUE,
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("poller-" + runId + "-io-%d")
                        .setDaemon(true)
                        .build());
    }

    /**
     * 启动设备轮询循环，已存在时返回原循环
     */
    DeviceLoop startLoop(DeviceInfo device) {
        DeviceLoop[] created = new DeviceLoop[1];
        DeviceLoop loop = loops.computeIfAbsent(device.getDeviceId(), id -> {
            created[0] = new DeviceLoop(this, device);
            return created[0];
        });
        if (created[0] != null) {
            created[0].start();
        }
        return loop;
    }

    /**
     * 停止单个设备的轮询循环并关闭其会话
     *
     * @return 设备循环是否存在
     */
    boolean stopLoop(String deviceId, Duration timeout) {
        DeviceLoop loop = loops.remove(deviceId);
        if (loop == null) {
            return false;
        }
        loop.requestStop();
        try {
            if (!loop.awaitTermination(timeout)) {
                log.warn("设备 {} 轮询循环未在 {}ms 内退出", deviceId, timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待设备 {} 轮询循环退出时被中断", deviceId);
        }
        closeSessionQuietly(loop);
        return true;
    }

    DeviceLoop getLoop(String deviceId) {
        return loops.get(deviceId);
    }

    Collection<DeviceLoop> getAllLoops() {
        return loops.values();
    }

    /**
     * 停止全部循环：先请求停止并等待退出（有超时），再关闭进行中的会话，最后销毁线程池
     */
    void shutdown(Duration timeout) {
        List<DeviceLoop> all = new ArrayList<>(loops.values());
        log.info("停止轮询运行 #{}，设备数={}", runId, all.size());
        for (DeviceLoop loop : all) {
            loop.requestStop();
        }

        CompletableFuture<?>[] futures = all.stream()
                .map(DeviceLoop::terminationFuture)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            long remaining = all.stream().filter(DeviceLoop::isAlive).count();
            log.warn("等待轮询循环退出超时（{}ms），仍有 {} 个循环未退出", timeout.toMillis(), remaining);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待轮询循环退出时被中断");
        } catch (ExecutionException e) {
            log.warn("轮询循环退出异常", e);
        }

        for (DeviceLoop loop : all) {
            closeSessionQuietly(loop);
        }
        loops.clear();

        shutdownExecutor(timer, "timer");
        shutdownExecutor(ioExecutor, "io");
    }

    /**
     * 关闭会话失败只记录日志，不影响停止流程
     */
    private void closeSessionQuietly(DeviceLoop loop) {
        try {
            SessionTransition transition = loop.closeSession(ClosureReason.POLLER_SHUTDOWN);
            if (transition != null) {
                log.info("设备 {} 的会话 {} 因轮询停止而结束", loop.getDeviceId(), transition.sessionId());
            }
        } catch (Exception e) {
            log.error("设备 {} 停止时关闭会话失败", loop.getDeviceId(), e);
        }
    }

    private void shutdownExecutor(ExecutorService executor, String name) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                log.warn("轮询运行 #{} 的 {} 线程池未能及时关闭，强制关闭", runId, name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
