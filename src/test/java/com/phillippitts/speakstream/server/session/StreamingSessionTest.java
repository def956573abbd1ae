package com.phillippitts.speakstream.server.session;

import com.phillippitts.speakstream.testutil.RecordingResultSink;
import com.phillippitts.speakstream.testutil.SyncExecutor;
import com.phillippitts.speakstream.util.SerialExecutor;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingSessionTest {

    private StreamingSession newSession() {
        return new StreamingSession("s1", new SessionBuffer("s1", 32_000, 16_000),
                new SerialExecutor(new SyncExecutor(), "s1"), new RecordingResultSink());
    }

    @Test
    void tasksRunWithSessionIdInThreadContext() {
        StreamingSession session = newSession();
        AtomicReference<String> seen = new AtomicReference<>();

        session.submit(() -> seen.set(ThreadContext.get(StreamingSession.MDC_SESSION_ID)));

        assertThat(seen.get()).isEqualTo("s1");
        assertThat(ThreadContext.get(StreamingSession.MDC_SESSION_ID)).isNull();
    }

    @Test
    void stateFollowsConfigureAndAppend() {
        StreamingSession session = newSession();
        assertThat(session.state()).isEqualTo(ConnectionState.OPEN);

        session.configure(8_000);
        assertThat(session.state()).isEqualTo(ConnectionState.CONFIGURED);
        assertThat(session.sampleRate()).isEqualTo(8_000);

        session.append(new byte[10]);
        assertThat(session.state()).isEqualTo(ConnectionState.STREAMING);
        assertThat(session.snapshot().bufferedBytes()).isEqualTo(10);
    }

    @Test
    void closeIsIdempotentAndDiscardsBuffer() {
        StreamingSession session = newSession();
        session.append(new byte[100]);

        assertThat(session.close()).isTrue();
        assertThat(session.close()).isFalse();

        assertThat(session.isClosed()).isTrue();
        assertThat(session.state().isTerminal()).isTrue();
        assertThat(session.snapshot().bufferedBytes()).isZero();
    }

    @Test
    void closedSessionRejectsWork() {
        StreamingSession session = newSession();
        session.close();
        AtomicBoolean ran = new AtomicBoolean();

        assertThat(session.submit(() -> ran.set(true))).isFalse();
        assertThat(ran).isFalse();
    }

    @Test
    void closedStateIsNotLeftByLateAppend() {
        StreamingSession session = newSession();
        session.close();

        session.configure(8_000);

        assertThat(session.state()).isEqualTo(ConnectionState.CLOSED);
    }
}
