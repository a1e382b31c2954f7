package com.wangbin.liveprobe.core.store;

import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.entity.SessionInfo;
import com.wangbin.liveprobe.common.domain.enums.ClosureReason;
import com.wangbin.liveprobe.common.exception.StoreException;
import com.wangbin.liveprobe.common.web.result.ResultCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTimeSeriesStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryTimeSeriesStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTimeSeriesStore();
    }

    @Test
    void appendAssignsGaplessIndicesAcrossChunks() {
        long id = open("dev-a");
        int count = SessionRecord.CHUNK_SIZE * 5 + 3;
        for (int i = 0; i < count; i++) {
            Sample stored = store.append(id, sample("dev-a", i));
            assertEquals(i, stored.getSequenceIndex());
        }
        assertEquals(count, store.getSession(id).getSampleCount());
        List<Sample> all = store.rangeByIndex(id, 0, count);
        for (int i = 0; i < all.size(); i++) {
            assertEquals(i, all.get(i).getSequenceIndex());
        }
        assertEquals(count - 1, store.lastSample(id).getSequenceIndex());
    }

    @Test
    void onlyOneOpenSessionPerDevice() {
        long first = open("dev-a");
        StoreException e = assertThrows(StoreException.class, () -> open("dev-a"));
        assertEquals(ResultCode.SESSION_ALREADY_OPEN, e.getResultCode());
        assertEquals(first, e.getSessionId());

        store.closeSession(first, T0, ClosureReason.GRACEFUL);
        long second = open("dev-a");
        assertNotEquals(first, second);
        assertEquals(1, store.countOpenSessions());
        assertEquals(List.of(first, second),
                store.listSessions("dev-a").stream().map(SessionInfo::getSessionId).toList());
    }

    @Test
    void appendAfterCloseFailsWithoutSideEffects() {
        long id = open("dev-a");
        store.append(id, sample("dev-a", 0));
        store.closeSession(id, at(0), ClosureReason.GRACEFUL);

        StoreException e = assertThrows(StoreException.class, () -> store.append(id, sample("dev-a", 1)));
        assertEquals(ResultCode.SESSION_CLOSED, e.getResultCode());
        assertEquals(1, store.getSession(id).getSampleCount());
        assertThrows(StoreException.class, () -> store.closeSession(id, at(1), ClosureReason.TIMEOUT));
        assertEquals(ClosureReason.GRACEFUL, store.getSession(id).getClosureReason());
    }

    @Test
    void unknownSessionIsNotFound() {
        StoreException e = assertThrows(StoreException.class, () -> store.append(99L, sample("dev-a", 0)));
        assertTrue(e.isNotFound());
        assertNull(store.getSession(99L));
    }

    @Test
    void rangeIsInclusiveAndHandlesOpenBounds() {
        long id = open("dev-a");
        for (int i = 0; i < 10; i++) {
            store.append(id, sample("dev-a", i * 5));
        }
        List<Sample> middle = store.range(id, at(10), at(25));
        assertEquals(List.of(2, 3, 4, 5), indices(middle));
        assertEquals(10, store.range(id, null, null).size());
        assertEquals(List.of(8, 9), indices(store.range(id, at(40), null)));
        assertTrue(store.range(id, at(100), at(200)).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.range(id, at(20), at(10)));
    }

    @Test
    void rangeWithOutOfOrderTimestampsScansAll() {
        long id = open("dev-a");
        store.append(id, sample("dev-a", 10));
        store.append(id, sample("dev-a", 0));
        store.append(id, sample("dev-a", 20));

        assertEquals(List.of(0, 1), indices(store.range(id, null, at(10))));
        assertEquals(at(20), store.getSession(id).getLastSampleTime());
    }

    @Test
    void readFromReportsNextIndexAndClosedFlag() {
        long id = open("dev-a");
        for (int i = 0; i < 5; i++) {
            store.append(id, sample("dev-a", i));
        }
        TailBatch first = store.readFrom(id, 0, 3);
        assertEquals(3, first.samples().size());
        assertEquals(3, first.nextIndex());
        assertFalse(first.closed());

        store.closeSession(id, null, ClosureReason.MANUAL);
        TailBatch partial = store.readFrom(id, 3, 1);
        assertEquals(4, partial.nextIndex());
        assertFalse(partial.closed(), "还有未读样本时不能报告结束");

        TailBatch last = store.readFrom(id, 4, 10);
        assertEquals(1, last.samples().size());
        assertTrue(last.closed());
        assertEquals(at(4), store.getSession(id).getEndTime());
    }

    @Test
    void tailFollowsConcurrentWriterUntilClose() throws Exception {
        long id = open("dev-a");
        SampleTail tail = store.tail(id, 0);

        CompletableFuture<List<Integer>> reader = CompletableFuture.supplyAsync(() -> {
            List<Integer> seen = new ArrayList<>();
            while (tail.hasNext()) {
                seen.add(tail.next().getSequenceIndex());
            }
            return seen;
        });

        int count = 600;
        for (int i = 0; i < count; i++) {
            store.append(id, sample("dev-a", i));
        }
        store.closeSession(id, null, ClosureReason.GRACEFUL);

        List<Integer> seen = reader.get(5, TimeUnit.SECONDS);
        assertEquals(count, seen.size());
        for (int i = 0; i < count; i++) {
            assertEquals(i, seen.get(i));
        }
        assertTrue(tail.isFinished());
    }

    @Test
    void tailFromAppendedIndexReturnsSameSample() {
        long id = open("dev-a");
        store.append(id, sample("dev-a", 0));
        Sample stored = store.append(id, sample("dev-a", 5));

        SampleTail tail = store.tail(id, stored.getSequenceIndex());
        assertTrue(tail.hasNext());
        assertSame(stored, tail.next());
    }

    @Test
    void tailPollTimesOutOnIdleSession() throws Exception {
        long id = open("dev-a");
        store.append(id, sample("dev-a", 0));
        SampleTail tail = store.tail(id, 0);

        assertNotNull(tail.poll(Duration.ofMillis(10)));
        assertNull(tail.poll(Duration.ofMillis(20)));
        assertFalse(tail.isFinished());
        assertEquals(1, tail.nextIndex());
    }

    @Test
    void deleteWakesTailAndRemovesSession() throws Exception {
        long id = open("dev-a");
        SampleTail tail = store.tail(id, 0);
        CompletableFuture<Boolean> waiting = CompletableFuture.supplyAsync(tail::hasNext);

        assertTrue(store.delete(id));
        assertFalse(waiting.get(5, TimeUnit.SECONDS));
        assertNull(store.getSession(id));
        assertTrue(store.listSessions("dev-a").isEmpty());
        assertFalse(store.delete(id));
        assertEquals(0, store.countOpenSessions());

        // 删除后设备可以重新开启会话
        open("dev-a");
    }

    @Test
    void renameTrimsAndClearsTitle() {
        long id = open("dev-a");
        assertEquals("Match day", store.renameSession(id, "  Match day ").getTitle());
        assertNull(store.renameSession(id, "   ").getTitle());
    }

    @Test
    void purgeAllRemovesEverything() {
        open("dev-a");
        open("dev-b");
        assertEquals(2, store.purgeAll());
        assertTrue(store.listSessions().isEmpty());
        assertEquals(0, store.countOpenSessions());
    }

    private long open(String deviceId) {
        return store.openSession(deviceId, deviceId, "SST-1", T0).getSessionId();
    }

    private static Sample sample(String deviceId, int seconds) {
        return Sample.builder().deviceId(deviceId).timestamp(at(seconds)).build();
    }

    private static Instant at(int seconds) {
        return T0.plusSeconds(seconds);
    }

    private static List<Integer> indices(List<Sample> samples) {
        return samples.stream().map(Sample::getSequenceIndex).toList();
    }
}
