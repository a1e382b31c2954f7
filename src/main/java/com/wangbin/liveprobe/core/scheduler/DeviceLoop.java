package com.wangbin.liveprobe.core.scheduler;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.common.domain.enums.ClosureReason;
import com.wangbin.liveprobe.core.client.FetchResult;
import com.wangbin.liveprobe.core.processor.NormalizationResult;
import com.wangbin.liveprobe.core.session.PollResult;
import com.wangbin.liveprobe.core.session.SessionStateMachine;
import com.wangbin.liveprobe.core.session.SessionTransition;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 单个设备的轮询循环
 *
 * 定时器只负责触发，拉取/归一化/状态机在IO线程池执行；一个周期结束后才安排下一个周期，
 * 因此同一设备的结果严格按时间顺序进入状态机，慢设备也不会影响其他设备的节奏。
 */
@Slf4j
class DeviceLoop {

    /** 周期耗时超过间隔时的最小间歇 */
    static final long MIN_BREATHER_MS = 50;

    /** 启动抖动上限，避免所有设备同时发起请求 */
    private static final long MAX_START_JITTER_MS = 20;

    private final PollerContext context;
    private final String deviceId;
    private final SessionStateMachine stateMachine;
    private final DeviceRuntime runtime;
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private volatile DeviceInfo device;
    private volatile DeviceRuntimeSnapshot snapshot;

    // 以下字段由this保护
    private boolean stopping;
    private ScheduledFuture<?> pendingTimer;
    private boolean cycleActive;
    private boolean fetching;
    private Thread runner;

    DeviceLoop(PollerContext context, DeviceInfo device) {
        this.context = context;
        this.deviceId = device.getDeviceId();
        this.device = device;
        this.stateMachine = new SessionStateMachine(deviceId, context.getStore(), context.getPollerConfig().getSilenceThreshold());
        this.stateMachine.setDeviceName(device.getDisplayName());
        this.runtime = new DeviceRuntime(deviceId, context.getPollerConfig().getFailureAlertThreshold(),
                ageHistoryCapacity(device), context.getClock().instant());
        publish();
    }

    // ==================== 生命周期 ====================

    void start() {
        long interval = intervalMs();
        long jitterBound = Math.min(MAX_START_JITTER_MS, interval / 10);
        long jitter = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(jitterBound + 1) : 0;
        log.info("启动设备轮询: {} ({}), 间隔={}ms, 超时={}ms", deviceId, device.getDisplayName(),
                interval, fetchTimeoutMs());
        schedule(jitter);
    }

    /**
     * 请求停止：取消待执行的定时任务，中断进行中的拉取。
     * 正在执行的状态机/存储写入会完成后再退出
     */
    synchronized void requestStop() {
        if (stopping) {
            return;
        }
        stopping = true;
        if (pendingTimer != null && pendingTimer.cancel(false)) {
            pendingTimer = null;
        }
        if (fetching && runner != null) {
            runner.interrupt();
        }
        if (!cycleActive && pendingTimer == null) {
            finish();
        }
    }

    /**
     * 等待循环退出
     *
     * @return 是否在超时前退出
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException {
        try {
            terminated.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }

    /**
     * 关闭进行中的会话，之后状态机不再接受结果
     */
    SessionTransition closeSession(ClosureReason reason) {
        SessionTransition transition = stateMachine.shutdown(reason);
        publish();
        return transition;
    }

    CompletableFuture<Void> terminationFuture() {
        return terminated;
    }

    boolean isAlive() {
        return !terminated.isDone();
    }

    /**
     * 设备配置更新，下一个周期生效
     */
    void updateDevice(DeviceInfo updated) {
        this.device = updated;
        stateMachine.setDeviceName(updated.getDisplayName());
        runtime.resizeAgeHistory(ageHistoryCapacity(updated));
        publish();
    }

    // ==================== 调度 ====================

    private synchronized void schedule(long delayMs) {
        if (stopping) {
            finish();
            return;
        }
        try {
            pendingTimer = context.getTimer().schedule(this::dispatch, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("设备 {} 定时器已关闭，轮询循环退出", deviceId);
            finish();
        }
    }

    private void dispatch() {
        synchronized (this) {
            pendingTimer = null;
            if (stopping) {
                finish();
                return;
            }
            cycleActive = true;
        }
        try {
            context.getIoExecutor().execute(this::runCycle);
        } catch (RejectedExecutionException e) {
            log.warn("设备 {} IO线程池已关闭，轮询循环退出", deviceId);
            synchronized (this) {
                cycleActive = false;
                finish();
            }
        }
    }

    private void runCycle() {
        long startNanos = System.nanoTime();
        synchronized (this) {
            runner = Thread.currentThread();
        }
        try {
            cycle();
        } catch (Exception e) {
            // 周期内的任何异常都不能终止循环
            log.error("设备 {} 轮询周期异常", deviceId, e);
        } finally {
            synchronized (this) {
                runner = null;
                fetching = false;
                cycleActive = false;
            }
            // 清除停止时设置的中断标志，线程归还线程池
            Thread.interrupted();
            publish();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            long delay = intervalMs() - elapsedMs;
            schedule(delay > 0 ? delay : MIN_BREATHER_MS);
        }
    }

    private void cycle() {
        DeviceInfo current = device;
        Instant polledAt = context.getClock().instant();
        runtime.onCycleStart(polledAt);

        synchronized (this) {
            if (stopping) {
                return;
            }
            fetching = true;
        }
        FetchResult fetch;
        try {
            fetch = context.getClient().fetch(current, Duration.ofMillis(fetchTimeoutMs(current)));
        } finally {
            synchronized (this) {
                fetching = false;
            }
        }
        if (isStopping()) {
            log.debug("设备 {} 正在停止，丢弃本次拉取结果", deviceId);
            return;
        }

        PollResult result;
        if (fetch.isSuccess()) {
            NormalizationResult normalized = context.getNormalizer().normalize(deviceId, fetch.getPayload());
            result = PollResult.fromNormalization(deviceId, polledAt, normalized);
            if (!normalized.isSuccess()) {
                log.warn("设备 {} 报文解析失败，按不可达处理: {}", deviceId, normalized.getMessage());
            }
        } else {
            result = PollResult.unreachable(deviceId, polledAt, fetch.getFailureKind(), fetch.getMessage());
            log.debug("设备 {} 拉取失败: {} - {}", deviceId, fetch.getFailureKind(), fetch.getMessage());
        }

        SessionTransition transition = stateMachine.onPollResult(result);
        runtime.onResult(result, context.getClock().instant());
        log.debug("设备 {} 周期完成: live={}, 动作={}, 会话={}, 序号={}", deviceId, result.isLive(),
                transition.type(), transition.sessionId(), transition.sequenceIndex());
    }

    private synchronized boolean isStopping() {
        return stopping;
    }

    private void finish() {
        if (terminated.complete(null)) {
            log.info("设备轮询已停止: {}", deviceId);
        }
    }

    // ==================== 状态 ====================

    private void publish() {
        DeviceInfo current = device;
        snapshot = runtime.snapshot(current.getDisplayName(), intervalMs(), fetchTimeoutMs(current),
                stateMachine, true);
    }

    DeviceRuntimeSnapshot snapshot() {
        DeviceRuntimeSnapshot current = snapshot;
        return current.toBuilder().loopAlive(isAlive()).build();
    }

    String getDeviceId() {
        return deviceId;
    }

    DeviceInfo getDevice() {
        return device;
    }

    SessionStateMachine getStateMachine() {
        return stateMachine;
    }

    long intervalMs() {
        return device.getEffectivePollInterval(context.getPollerConfig().getDefaultIntervalMs());
    }

    private long fetchTimeoutMs() {
        return fetchTimeoutMs(device);
    }

    /**
     * 拉取超时始终小于轮询间隔
     */
    private long fetchTimeoutMs(DeviceInfo current) {
        long interval = current.getEffectivePollInterval(context.getPollerConfig().getDefaultIntervalMs());
        long cap = Math.max(1L, interval * 3 / 4);
        long configured = context.getPollerConfig().getFetchTimeoutMs();
        return configured > 0 ? Math.min(configured, cap) : cap;
    }

    private int ageHistoryCapacity(DeviceInfo current) {
        long interval = Math.max(1L, current.getEffectivePollInterval(context.getPollerConfig().getDefaultIntervalMs()));
        long windowMs = context.getPollerConfig().getAgeHistoryWindowSeconds() * 1000L;
        return (int) Math.min(10_000L, windowMs / interval + 5);
    }
}
