package com.wangbin.liveprobe.core.store;

import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.entity.SessionInfo;
import com.wangbin.liveprobe.common.domain.enums.ClosureReason;
import com.wangbin.liveprobe.common.exception.StoreException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 单个会话的存储记录
 *
 * 样本保存在分块数组中，块一旦分配不再移动。写入在记录监视器内完成，
 * 先写元素再发布size（volatile），读取方先读size再读元素，因此读取无需加锁。
 */
final class SessionRecord {

    static final int CHUNK_SIZE = 256;

    private final long sessionId;
    private final String deviceId;
    private final String deviceName;
    private final String inputIdentifier;
    private final Instant startTime;

    private volatile Sample[][] chunks = new Sample[4][];
    private volatile int size;
    private volatile boolean monotonic = true;
    private volatile Instant lastSampleTime;

    private volatile String title;
    private volatile Instant endTime;
    private volatile ClosureReason closureReason;
    private volatile boolean removed;

    SessionRecord(long sessionId, String deviceId, String deviceName, String inputIdentifier, Instant startTime) {
        this.sessionId = sessionId;
        this.deviceId = deviceId;
        this.deviceName = deviceName;
        this.inputIdentifier = inputIdentifier;
        this.startTime = startTime;
    }

    // ==================== 写入 ====================

    synchronized Sample append(Sample sample) {
        if (removed) {
            throw StoreException.sessionNotFound(sessionId);
        }
        if (endTime != null) {
            throw StoreException.sessionClosed(sessionId);
        }
        int index = size;
        Sample stamped = sample.withSequenceIndex(index);

        int chunk = index / CHUNK_SIZE;
        Sample[][] directory = chunks;
        if (chunk >= directory.length) {
            directory = Arrays.copyOf(directory, directory.length * 2);
        }
        if (directory[chunk] == null) {
            directory[chunk] = new Sample[CHUNK_SIZE];
        }
        directory[chunk][index % CHUNK_SIZE] = stamped;
        chunks = directory;

        Instant timestamp = stamped.getTimestamp();
        if (lastSampleTime != null && timestamp.isBefore(lastSampleTime)) {
            monotonic = false;
        }
        if (lastSampleTime == null || timestamp.isAfter(lastSampleTime)) {
            lastSampleTime = timestamp;
        }
        size = index + 1;
        notifyAll();
        return stamped;
    }

    synchronized SessionInfo close(Instant end, ClosureReason reason) {
        if (removed) {
            throw StoreException.sessionNotFound(sessionId);
        }
        if (endTime != null) {
            throw StoreException.sessionClosed(sessionId);
        }
        Instant effectiveEnd = end;
        if (effectiveEnd == null) {
            effectiveEnd = lastSampleTime != null ? lastSampleTime : startTime;
        }
        closureReason = reason;
        endTime = effectiveEnd;
        notifyAll();
        return snapshot();
    }

    synchronized void markRemoved() {
        removed = true;
        notifyAll();
    }

    void setTitle(String title) {
        this.title = title;
    }

    // ==================== 读取 ====================

    int size() {
        return size;
    }

    boolean isClosed() {
        return endTime != null;
    }

    boolean isRemoved() {
        return removed;
    }

    /**
     * 调用方需保证 index < size()
     */
    Sample get(int index) {
        Sample[][] directory = chunks;
        return directory[index / CHUNK_SIZE][index % CHUNK_SIZE];
    }

    Sample last() {
        int n = size;
        return n == 0 ? null : get(n - 1);
    }

    List<Sample> slice(int fromIndex, int toIndex) {
        int n = size;
        int from = Math.max(0, fromIndex);
        int to = Math.min(n, toIndex);
        if (from >= to) {
            return Collections.emptyList();
        }
        List<Sample> result = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            result.add(get(i));
        }
        return result;
    }

    List<Sample> range(Instant from, Instant to) {
        int n = size;
        List<Sample> result = new ArrayList<>();
        if (monotonic) {
            int start = from == null ? 0 : lowerBound(from, n);
            for (int i = start; i < n; i++) {
                Sample sample = get(i);
                if (to != null && sample.getTimestamp().isAfter(to)) {
                    break;
                }
                result.add(sample);
            }
            return result;
        }
        // 时间戳乱序时退化为线性扫描，结果仍按序号排列
        for (int i = 0; i < n; i++) {
            Sample sample = get(i);
            Instant ts = sample.getTimestamp();
            if ((from == null || !ts.isBefore(from)) && (to == null || !ts.isAfter(to))) {
                result.add(sample);
            }
        }
        return result;
    }

    private int lowerBound(Instant from, int n) {
        int lo = 0;
        int hi = n;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (get(mid).getTimestamp().isBefore(from)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    synchronized SessionInfo snapshot() {
        return SessionInfo.builder()
                .sessionId(sessionId)
                .deviceId(deviceId)
                .deviceName(deviceName)
                .inputIdentifier(inputIdentifier)
                .title(title)
                .startTime(startTime)
                .endTime(endTime)
                .closureReason(closureReason)
                .sampleCount(size)
                .lastSampleTime(lastSampleTime)
                .build();
    }

    long getSessionId() {
        return sessionId;
    }

    String getDeviceId() {
        return deviceId;
    }

    Instant getStartTime() {
        return startTime;
    }

    Instant getLastSampleTime() {
        return lastSampleTime;
    }
}
