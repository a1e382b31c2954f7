package com.wangbin.liveprobe.core.store;

import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.entity.SessionInfo;
import com.wangbin.liveprobe.common.domain.enums.ClosureReason;
import com.wangbin.liveprobe.common.exception.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于内存的会话时序存储
 *
 * 会话以自增ID为键保存，设备只通过ID引用其会话
 */
@Slf4j
@Component
public class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private final AtomicLong idGenerator = new AtomicLong();

    // sessionId -> 会话记录
    private final Map<Long, SessionRecord> sessions = new ConcurrentHashMap<>();

    // deviceId -> 会话ID集合
    private final Map<String, Set<Long>> deviceSessions = new ConcurrentHashMap<>();

    // deviceId -> 进行中的会话ID
    private final Map<String, Long> openSessions = new ConcurrentHashMap<>();

    @Override
    public SessionInfo openSession(String deviceId, String deviceName, String inputIdentifier, Instant startTime) {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(startTime, "startTime");

        SessionRecord[] created = new SessionRecord[1];
        openSessions.compute(deviceId, (key, existingId) -> {
            if (existingId != null) {
                SessionRecord existing = sessions.get(existingId);
                if (existing != null && !existing.isClosed() && !existing.isRemoved()) {
                    throw StoreException.sessionAlreadyOpen(deviceId, existingId);
                }
            }
            long sessionId = idGenerator.incrementAndGet();
            SessionRecord record = new SessionRecord(sessionId, deviceId, deviceName, inputIdentifier, startTime);
            sessions.put(sessionId, record);
            deviceSessions.computeIfAbsent(deviceId, k -> new ConcurrentSkipListSet<>()).add(sessionId);
            created[0] = record;
            return sessionId;
        });
        return created[0].snapshot();
    }

    @Override
    public Sample append(long sessionId, Sample sample) {
        Objects.requireNonNull(sample, "sample");
        return requireRecord(sessionId).append(sample);
    }

    @Override
    public SessionInfo closeSession(long sessionId, Instant endTime, ClosureReason reason) {
        SessionRecord record = requireRecord(sessionId);
        SessionInfo info = record.close(endTime, reason);
        openSessions.remove(record.getDeviceId(), sessionId);
        return info;
    }

    @Override
    public SampleTail tail(long sessionId, int fromIndex) {
        return new SampleTail(requireRecord(sessionId), fromIndex);
    }

    @Override
    public List<Sample> range(long sessionId, Instant from, Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("起始时间不能晚于结束时间");
        }
        return requireRecord(sessionId).range(from, to);
    }

    @Override
    public List<Sample> rangeByIndex(long sessionId, int fromIndex, int toIndex) {
        return requireRecord(sessionId).slice(fromIndex, toIndex);
    }

    @Override
    public TailBatch readFrom(long sessionId, int fromIndex, int maxCount) {
        SessionRecord record = requireRecord(sessionId);
        // 先读关闭标志再读数据，closed=true时本批一定包含全部样本
        boolean closed = record.isClosed();
        int from = Math.max(0, fromIndex);
        int to = (int) Math.min((long) from + Math.max(0, maxCount), record.size());
        List<Sample> samples = record.slice(from, to);
        int nextIndex = from + samples.size();
        return new TailBatch(samples, nextIndex, closed && nextIndex >= record.size());
    }

    @Override
    public Sample lastSample(long sessionId) {
        return requireRecord(sessionId).last();
    }

    @Override
    public SessionInfo getSession(long sessionId) {
        SessionRecord record = sessions.get(sessionId);
        return record == null ? null : record.snapshot();
    }

    @Override
    public List<SessionInfo> listSessions(String deviceId) {
        Set<Long> ids = deviceSessions.get(deviceId);
        if (ids == null) {
            return List.of();
        }
        List<SessionInfo> result = new ArrayList<>(ids.size());
        for (Long id : ids) {
            SessionRecord record = sessions.get(id);
            if (record != null) {
                result.add(record.snapshot());
            }
        }
        return result;
    }

    @Override
    public List<SessionInfo> listSessions() {
        List<SessionInfo> result = new ArrayList<>(sessions.size());
        for (SessionRecord record : sessions.values()) {
            result.add(record.snapshot());
        }
        result.sort(Comparator.comparingLong(SessionInfo::getSessionId));
        return result;
    }

    @Override
    public int countOpenSessions() {
        int count = 0;
        for (Long id : openSessions.values()) {
            SessionRecord record = sessions.get(id);
            if (record != null && !record.isClosed()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public SessionInfo stopSession(long sessionId) {
        SessionInfo info = closeSession(sessionId, null, ClosureReason.MANUAL);
        log.info("会话已手动停止: sessionId={}, deviceId={}, 样本数={}",
                sessionId, info.getDeviceId(), info.getSampleCount());
        return info;
    }

    @Override
    public SessionInfo renameSession(long sessionId, String title) {
        SessionRecord record = requireRecord(sessionId);
        String trimmed = title == null ? null : title.trim();
        record.setTitle(trimmed == null || trimmed.isEmpty() ? null : trimmed);
        return record.snapshot();
    }

    @Override
    public boolean delete(long sessionId) {
        SessionRecord record = sessions.remove(sessionId);
        if (record == null) {
            return false;
        }
        record.markRemoved();
        openSessions.remove(record.getDeviceId(), sessionId);
        Set<Long> ids = deviceSessions.get(record.getDeviceId());
        if (ids != null) {
            ids.remove(sessionId);
        }
        log.info("会话已删除: sessionId={}, deviceId={}", sessionId, record.getDeviceId());
        return true;
    }

    @Override
    public int purgeAll() {
        int count = 0;
        for (Long id : new ArrayList<>(sessions.keySet())) {
            if (delete(id)) {
                count++;
            }
        }
        log.info("已清空全部会话，共删除 {} 个", count);
        return count;
    }

    private SessionRecord requireRecord(long sessionId) {
        SessionRecord record = sessions.get(sessionId);
        if (record == null) {
            throw StoreException.sessionNotFound(sessionId);
        }
        return record;
    }
}
