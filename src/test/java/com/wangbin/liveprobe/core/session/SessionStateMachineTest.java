package com.wangbin.liveprobe.core.session;

import com.wangbin.liveprobe.common.domain.entity.GpsFix;
import com.wangbin.liveprobe.common.domain.entity.InterfaceReading;
import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.entity.SessionInfo;
import com.wangbin.liveprobe.common.domain.enums.ClosureReason;
import com.wangbin.liveprobe.common.domain.enums.FailureKind;
import com.wangbin.liveprobe.common.domain.enums.InterfaceType;
import com.wangbin.liveprobe.common.domain.enums.LiveState;
import com.wangbin.liveprobe.common.domain.enums.SessionState;
import com.wangbin.liveprobe.core.store.InMemoryTimeSeriesStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionStateMachineTest {

    private static final String DEVICE = "dev-1";
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryTimeSeriesStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTimeSeriesStore();
    }

    @Test
    void liveTicksThenIdleProduceOneGracefulSession() {
        SessionStateMachine machine = new SessionStateMachine(DEVICE, store, 5);

        SessionTransition first = machine.onPollResult(live(0, 48.85, 2.35));
        assertEquals(SessionTransition.Type.OPENED, first.type());
        assertEquals(0, first.sequenceIndex());
        assertEquals(SessionTransition.Type.APPENDED, machine.onPollResult(live(5, 48.86, 2.36)).type());
        assertEquals(2, machine.onPollResult(live(10, 48.87, 2.37)).sequenceIndex());

        SessionTransition closed = machine.onPollResult(idle(15));
        assertTrue(closed.isClosed());
        assertEquals(ClosureReason.GRACEFUL, closed.reason());
        assertEquals(SessionState.IDLE, machine.getState());

        List<SessionInfo> sessions = store.listSessions(DEVICE);
        assertEquals(1, sessions.size());
        SessionInfo session = sessions.get(0);
        assertEquals(at(0), session.getStartTime());
        assertEquals(at(10), session.getEndTime());
        assertEquals(3, session.getSampleCount());
        assertEquals(ClosureReason.GRACEFUL, session.getClosureReason());

        List<Sample> samples = store.rangeByIndex(session.getSessionId(), 0, 3);
        assertEquals(List.of(0, 1, 2), samples.stream().map(Sample::getSequenceIndex).toList());
        assertEquals(48.87, samples.get(2).getGps().getLatitude(), 1e-9);
    }

    @Test
    void consecutiveUnreachableClosesWithTimeoutAndLastSampleTime() {
        SessionStateMachine machine = new SessionStateMachine(DEVICE, store, 3);
        machine.onPollResult(live(0, 1.0, 1.0));
        machine.onPollResult(live(5, 1.0, 1.0));
        machine.onPollResult(live(10, 1.0, 1.0));
        Long firstSession = machine.getCurrentSessionId();

        assertEquals(SessionTransition.Type.SILENT, machine.onPollResult(unreachable(15)).type());
        assertEquals(SessionTransition.Type.SILENT, machine.onPollResult(unreachable(20)).type());
        SessionTransition closed = machine.onPollResult(unreachable(25));
        assertTrue(closed.isClosed());
        assertEquals(ClosureReason.TIMEOUT, closed.reason());

        SessionInfo session = store.getSession(firstSession);
        assertEquals(at(10), session.getEndTime());
        assertEquals(3, session.getSampleCount());

        SessionTransition reopened = machine.onPollResult(live(30, 1.0, 1.0));
        assertEquals(SessionTransition.Type.OPENED, reopened.type());
        assertNotEquals(firstSession, reopened.sessionId());
        assertEquals(2, store.listSessions(DEVICE).size());
    }

    @Test
    void recoveryBeforeThresholdKeepsSameSession() {
        SessionStateMachine machine = new SessionStateMachine(DEVICE, store, 3);
        Long sessionId = machine.onPollResult(live(0, 1.0, 1.0)).sessionId();
        machine.onPollResult(unreachable(5));
        machine.onPollResult(unreachable(10));
        assertEquals(2, machine.getConsecutiveSilence());

        SessionTransition resumed = machine.onPollResult(live(15, 1.0, 1.0));
        assertEquals(SessionTransition.Type.APPENDED, resumed.type());
        assertEquals(sessionId, resumed.sessionId());
        assertEquals(1, resumed.sequenceIndex());
        assertEquals(0, machine.getConsecutiveSilence());
    }

    @Test
    void idleResultsWithoutSessionAreIgnored() {
        SessionStateMachine machine = new SessionStateMachine(DEVICE, store, 3);
        assertEquals(SessionTransition.Type.IGNORED, machine.onPollResult(idle(0)).type());
        assertEquals(SessionTransition.Type.IGNORED, machine.onPollResult(unreachable(5)).type());
        assertTrue(store.listSessions(DEVICE).isEmpty());
    }

    @Test
    void partialSampleIsKeptButCountsAsSilence() {
        SessionStateMachine machine = new SessionStateMachine(DEVICE, store, 3);
        long sessionId = machine.onPollResult(live(0, 1.0, 1.0)).sessionId();

        Sample partial = Sample.builder().deviceId(DEVICE).timestamp(at(5)).complete(false).build();
        PollResult parseFailure = PollResult.builder()
                .deviceId(DEVICE)
                .timestamp(at(5))
                .success(false)
                .failureKind(FailureKind.PARSE_ERROR)
                .liveState(LiveState.UNKNOWN)
                .sample(partial)
                .build();

        SessionTransition transition = machine.onPollResult(parseFailure);
        assertEquals(SessionTransition.Type.SILENT, transition.type());
        assertEquals(1, machine.getConsecutiveSilence());
        assertEquals(2, store.getSession(sessionId).getSampleCount());
        assertFalse(store.lastSample(sessionId).isComplete());
    }

    @Test
    void shutdownClosesSessionAndIgnoresLaterResults() {
        SessionStateMachine machine = new SessionStateMachine(DEVICE, store, 3);
        long sessionId = machine.onPollResult(live(0, 1.0, 1.0)).sessionId();
        machine.onPollResult(live(5, 1.0, 1.0));

        SessionTransition closed = machine.shutdown(ClosureReason.POLLER_SHUTDOWN);
        assertNotNull(closed);
        assertEquals(ClosureReason.POLLER_SHUTDOWN, store.getSession(sessionId).getClosureReason());
        assertEquals(at(5), store.getSession(sessionId).getEndTime());

        assertEquals(SessionTransition.Type.IGNORED, machine.onPollResult(live(10, 1.0, 1.0)).type());
        assertEquals(2, store.getSession(sessionId).getSampleCount());
        assertNull(machine.shutdown(ClosureReason.POLLER_SHUTDOWN));
    }

    @Test
    void manualStopRejectsNextAppendThenReopens() {
        SessionStateMachine machine = new SessionStateMachine(DEVICE, store, 3);
        long sessionId = machine.onPollResult(live(0, 1.0, 1.0)).sessionId();
        store.stopSession(sessionId);

        SessionTransition rejected = machine.onPollResult(live(5, 1.0, 1.0));
        assertEquals(SessionTransition.Type.REJECTED, rejected.type());
        assertEquals(SessionState.IDLE, machine.getState());
        assertEquals(ClosureReason.MANUAL, store.getSession(sessionId).getClosureReason());

        SessionTransition reopened = machine.onPollResult(live(10, 1.0, 1.0));
        assertEquals(SessionTransition.Type.OPENED, reopened.type());
        assertNotEquals(sessionId, reopened.sessionId());
    }

    @Test
    void thresholdMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SessionStateMachine(DEVICE, store, 0));
    }

    private static Instant at(int seconds) {
        return T0.plusSeconds(seconds);
    }

    private static PollResult live(int seconds, double lat, double lng) {
        Sample sample = Sample.builder()
                .deviceId(DEVICE)
                .timestamp(at(seconds))
                .gps(GpsFix.builder().latitude(lat).longitude(lng).build())
                .interfaces(List.of(InterfaceReading.builder()
                        .name("modem1")
                        .type(InterfaceType.CELLULAR)
                        .bitrateKbps(2500L)
                        .build()))
                .build();
        return PollResult.builder()
                .deviceId(DEVICE)
                .timestamp(at(seconds))
                .success(true)
                .liveState(LiveState.LIVE)
                .sample(sample)
                .inputIdentifier("SST-1")
                .build();
    }

    private static PollResult idle(int seconds) {
        return PollResult.builder()
                .deviceId(DEVICE)
                .timestamp(at(seconds))
                .success(true)
                .liveState(LiveState.NOT_LIVE)
                .sample(Sample.builder().deviceId(DEVICE).timestamp(at(seconds)).build())
                .build();
    }

    private static PollResult unreachable(int seconds) {
        return PollResult.unreachable(DEVICE, at(seconds), FailureKind.UNREACHABLE, "connection refused");
    }
}
