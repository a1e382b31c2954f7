package com.wangbin.liveprobe.core.scheduler;

import com.google.common.collect.EvictingQueue;
import com.wangbin.liveprobe.common.domain.enums.FailureKind;
import com.wangbin.liveprobe.core.session.PollResult;
import com.wangbin.liveprobe.core.session.SessionStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 设备运行时统计
 *
 * 只由该设备的轮询循环修改，外部通过快照读取，快照在锁内一次生成
 */
@Slf4j
class DeviceRuntime {

    private final String deviceId;
    private final int failureAlertThreshold;
    private EvictingQueue<AgePoint> ageHistory;
    private int ageHistoryCapacity;

    private final Instant loopStartedAt;

    private Instant lastCycleStartedAt;
    private Instant lastPollTime;
    private Instant lastSuccessfulPollTime;
    private Instant lastSampleTime;
    private int consecutiveFailures;
    private FailureKind lastFailureKind;
    private String lastError;
    private boolean alerting;
    private long cycles;

    DeviceRuntime(String deviceId, int failureAlertThreshold, int ageHistoryCapacity, Instant loopStartedAt) {
        this.deviceId = deviceId;
        this.loopStartedAt = loopStartedAt;
        this.failureAlertThreshold = Math.max(1, failureAlertThreshold);
        this.ageHistoryCapacity = Math.max(1, ageHistoryCapacity);
        this.ageHistory = EvictingQueue.create(this.ageHistoryCapacity);
    }

    /**
     * 轮询间隔变化后按新容量重建历史，保留最近的记录
     */
    synchronized void resizeAgeHistory(int capacity) {
        int target = Math.max(1, capacity);
        if (target == ageHistoryCapacity) {
            return;
        }
        EvictingQueue<AgePoint> resized = EvictingQueue.create(target);
        resized.addAll(ageHistory);
        ageHistory = resized;
        ageHistoryCapacity = target;
    }

    synchronized void onCycleStart(Instant now) {
        lastCycleStartedAt = now;
        cycles++;
    }

    synchronized void onResult(PollResult result, Instant now) {
        lastPollTime = result.getTimestamp();
        if (result.isSuccess()) {
            lastSuccessfulPollTime = result.getTimestamp();
            if (result.getSample() != null) {
                lastSampleTime = result.getSample().getTimestamp();
            }
            if (alerting) {
                log.info("设备 {} 已恢复，之前连续失败 {} 次", deviceId, consecutiveFailures);
                alerting = false;
            }
            consecutiveFailures = 0;
            lastFailureKind = null;
            lastError = null;
        } else {
            consecutiveFailures++;
            lastFailureKind = result.getFailureKind();
            lastError = result.getMessage();
            if (!alerting && consecutiveFailures >= failureAlertThreshold) {
                alerting = true;
                log.warn("设备 {} 连续失败 {} 次: {} - {}", deviceId, consecutiveFailures,
                        lastFailureKind, lastError);
            }
        }
        Long age = lastSampleTime == null ? null : Math.max(0L, Duration.between(lastSampleTime, now).toMillis());
        ageHistory.add(new AgePoint(now, age));
    }

    synchronized DeviceRuntimeSnapshot snapshot(String deviceName, long intervalMs, long fetchTimeoutMs,
                                   SessionStateMachine stateMachine, boolean loopAlive) {
        return DeviceRuntimeSnapshot.builder()
                .deviceId(deviceId)
                .deviceName(deviceName)
                .loopAlive(loopAlive)
                .intervalMs(intervalMs)
                .fetchTimeoutMs(fetchTimeoutMs)
                .state(stateMachine.getState())
                .currentSessionId(stateMachine.getCurrentSessionId())
                .silenceCount(stateMachine.getConsecutiveSilence())
                .loopStartedAt(loopStartedAt)
                .lastCycleStartedAt(lastCycleStartedAt)
                .lastPollTime(lastPollTime)
                .lastSuccessfulPollTime(lastSuccessfulPollTime)
                .lastSampleTime(lastSampleTime)
                .consecutiveFailures(consecutiveFailures)
                .lastFailureKind(lastFailureKind)
                .lastError(lastError)
                .alerting(alerting)
                .cycles(cycles)
                .ageHistory(List.copyOf(ageHistory))
                .build();
    }
}
