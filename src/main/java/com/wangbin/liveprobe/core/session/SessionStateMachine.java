package com.wangbin.liveprobe.core.session;

import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.entity.SessionInfo;
import com.wangbin.liveprobe.common.domain.enums.ClosureReason;
import com.wangbin.liveprobe.common.domain.enums.SessionState;
import com.wangbin.liveprobe.common.exception.StoreException;
import com.wangbin.liveprobe.core.store.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * 设备会话状态机
 *
 * <pre>
 * Idle --直播--> Live          开启会话，写入序号0的样本
 * Live --直播--> Live          追加样本
 * Live --明确空闲--> Idle      关闭会话（GRACEFUL）
 * Live --连续N次不可达--> Idle 关闭会话（TIMEOUT）
 * Idle --空闲/不可达--> Idle   忽略
 * </pre>
 * 会话结束时间取最后一个样本的时间，而不是检测到结束的时间。
 * 未达到静默阈值前恢复直播，继续沿用原会话。
 */
@Slf4j
public class SessionStateMachine {

    private final String deviceId;
    private final TimeSeriesStore store;
    private final int silenceThreshold;

    private String deviceName;
    private SessionState state = SessionState.IDLE;
    private Long currentSessionId;
    private Instant sessionStartTime;
    private Instant lastSampleTime;
    private int consecutiveSilence;

    // 停止后不再接受轮询结果，防止迟到的结果开启新会话
    private boolean halted;

    public SessionStateMachine(String deviceId, TimeSeriesStore store, int silenceThreshold) {
        if (silenceThreshold < 1) {
            throw new IllegalArgumentException("静默阈值必须大于0: " + silenceThreshold);
        }
        this.deviceId = deviceId;
        this.store = store;
        this.silenceThreshold = silenceThreshold;
        this.deviceName = deviceId;
    }

    /**
     * 处理一次轮询结果，调用方保证同一设备的结果按时间顺序送达
     */
    public synchronized SessionTransition onPollResult(PollResult result) {
        if (halted) {
            return SessionTransition.of(SessionTransition.Type.IGNORED, null);
        }
        if (result.isLive()) {
            consecutiveSilence = 0;
            if (state == SessionState.IDLE) {
                return open(result);
            }
            return append(result.getSample(), SessionTransition.Type.APPENDED);
        }

        if (state == SessionState.IDLE) {
            return SessionTransition.of(SessionTransition.Type.IGNORED, null);
        }

        if (result.isExplicitlyIdle()) {
            return close(ClosureReason.GRACEFUL);
        }

        // 不可达或解析失败：保留部分样本，累计静默次数
        if (result.getSample() != null) {
            SessionTransition appended = append(result.getSample(), SessionTransition.Type.APPENDED);
            if (appended.type() == SessionTransition.Type.REJECTED) {
                return appended;
            }
        }
        consecutiveSilence++;
        if (consecutiveSilence >= silenceThreshold) {
            log.info("设备 {} 连续 {} 次未响应，按超时结束会话", deviceId, consecutiveSilence);
            return close(ClosureReason.TIMEOUT);
        }
        log.debug("设备 {} 直播中轮询失败 ({}/{}): {}", deviceId, consecutiveSilence, silenceThreshold,
                result.getMessage());
        return SessionTransition.of(SessionTransition.Type.SILENT, currentSessionId);
    }

    /**
     * 关闭进行中的会话（轮询停止、设备移除），之后的轮询结果一律忽略
     *
     * @return 关闭动作，没有进行中的会话时返回null
     */
    public synchronized SessionTransition shutdown(ClosureReason reason) {
        halted = true;
        if (state != SessionState.LIVE) {
            return null;
        }
        return close(reason);
    }

    private SessionTransition open(PollResult result) {
        Sample sample = result.getSample();
        SessionInfo session;
        try {
            session = store.openSession(deviceId, deviceName, result.getInputIdentifier(), sample.getTimestamp());
        } catch (StoreException e) {
            log.error("设备 {} 开启会话失败: {}", deviceId, e.getMessage());
            reset();
            return SessionTransition.of(SessionTransition.Type.REJECTED, e.getSessionId());
        }
        state = SessionState.LIVE;
        currentSessionId = session.getSessionId();
        sessionStartTime = session.getStartTime();
        lastSampleTime = null;
        log.info("设备 {} 开始直播，开启会话 {} (输入: {})", deviceId, currentSessionId, result.getInputIdentifier());
        return append(sample, SessionTransition.Type.OPENED);
    }

    private SessionTransition append(Sample sample, SessionTransition.Type type) {
        long sessionId = currentSessionId;
        try {
            Sample stored = store.append(sessionId, sample);
            lastSampleTime = stored.getTimestamp();
            return SessionTransition.appended(type, sessionId, stored.getSequenceIndex());
        } catch (StoreException e) {
            // 会话被手动停止或删除，下一次直播结果会开启新会话
            log.warn("设备 {} 写入会话 {} 被拒绝: {}，状态机回到空闲", deviceId, sessionId, e.getMessage());
            reset();
            return SessionTransition.of(SessionTransition.Type.REJECTED, sessionId);
        }
    }

    private SessionTransition close(ClosureReason reason) {
        long sessionId = currentSessionId;
        Instant endTime = lastSampleTime != null ? lastSampleTime : sessionStartTime;
        try {
            SessionInfo info = store.closeSession(sessionId, endTime, reason);
            log.info("设备 {} 会话 {} 已结束: 原因={}, 样本数={}", deviceId, sessionId,
                    reason.getDescription(), info.getSampleCount());
        } catch (StoreException e) {
            log.warn("设备 {} 关闭会话 {} 失败: {}", deviceId, sessionId, e.getMessage());
        } finally {
            reset();
        }
        return SessionTransition.closed(sessionId, reason);
    }

    private void reset() {
        state = SessionState.IDLE;
        currentSessionId = null;
        sessionStartTime = null;
        lastSampleTime = null;
        consecutiveSilence = 0;
    }

    public synchronized void setDeviceName(String deviceName) {
        this.deviceName = deviceName;
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized Long getCurrentSessionId() {
        return currentSessionId;
    }

    public synchronized int getConsecutiveSilence() {
        return consecutiveSilence;
    }

    public synchronized Instant getLastSampleTime() {
        return lastSampleTime;
    }

    public synchronized boolean isHalted() {
        return halted;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public int getSilenceThreshold() {
        return silenceThreshold;
    }
}
