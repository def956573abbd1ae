package com.phillippitts.speakstream.server.connection;

import com.phillippitts.speakstream.config.ThreadPoolConfig;
import com.phillippitts.speakstream.config.properties.RecognizerProperties;
import com.phillippitts.speakstream.config.properties.SessionProperties;
import com.phillippitts.speakstream.config.properties.ThreadPoolProperties;
import com.phillippitts.speakstream.protocol.ProtocolCodec;
import com.phillippitts.speakstream.server.recognition.RecognitionDispatcher;
import com.phillippitts.speakstream.server.recognition.RecognitionMetrics;
import com.phillippitts.speakstream.testutil.FakeSpeechRecognizer;
import com.phillippitts.speakstream.testutil.RecordingResultSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Runs sessions on the production pools with a recognizer that blocks until released.
 */
class ConnectionManagerConcurrencyTest {

    private static final byte[] FRAME = new byte[3200];
    private static final int WAITING_SESSIONS = 12;

    private final CountDownLatch release = new CountDownLatch(1);
    private ThreadPoolTaskExecutor sessionPool;
    private ThreadPoolTaskExecutor recognitionWorker;
    private FakeSpeechRecognizer recognizer;
    private SessionRegistry registry;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        sessionPool = (ThreadPoolTaskExecutor) config.sessionExecutor();
        recognitionWorker = (ThreadPoolTaskExecutor) config.recognitionExecutor();
        recognizer = new FakeSpeechRecognizer().answering((samples, rate) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "{\"text\":\"done\",\"timestamp\":[]}";
        });
        registry = new SessionRegistry();
        RecognitionDispatcher dispatcher = new RecognitionDispatcher(recognizer, new RecognizerProperties(),
                new RecognitionMetrics(new SimpleMeterRegistry()), recognitionWorker);
        manager = new ConnectionManager(registry, dispatcher, new SessionProperties(), sessionPool);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        recognitionWorker.shutdown();
        sessionPool.shutdown();
    }

    @Test
    void busyRecognizerDoesNotStallOtherSessions() {
        assertThat(WAITING_SESSIONS).isGreaterThan(sessionPool.getCorePoolSize());
        List<RecordingResultSink> sinks = new ArrayList<>();
        for (int s = 0; s < WAITING_SESSIONS; s++) {
            RecordingResultSink sink = new RecordingResultSink();
            sinks.add(sink);
            manager.onOpen("s" + s, sink);
            for (int i = 0; i < 10; i++) {
                manager.onBinary("s" + s, FRAME);
            }
        }
        await().atMost(5, TimeUnit.SECONDS).until(() -> recognizer.calls().size() == 1);

        RecordingResultSink late = new RecordingResultSink();
        manager.onOpen("late", late);
        manager.onText("late", ProtocolCodec.encodeConfig(8000));
        manager.onBinary("late", FRAME);

        await().atMost(5, TimeUnit.SECONDS).until(() ->
                registry.find("late").map(session -> session.snapshot().bufferedBytes()).orElse(0) == 3200);
        assertThat(registry.find("late")).hasValueSatisfying(session ->
                assertThat(session.sampleRate()).isEqualTo(8000));
        assertThat(recognizer.calls()).hasSize(1);

        release.countDown();

        await().atMost(10, TimeUnit.SECONDS).until(() ->
                sinks.stream().allMatch(sink -> sink.messages().size() == 1));
        assertThat(recognizer.calls()).hasSize(WAITING_SESSIONS);
        assertThat(late.messages()).isEmpty();
    }

    @Test
    void resultsOfOneSessionKeepDispatchOrder() {
        release.countDown();
        RecordingResultSink sink = new RecordingResultSink();
        manager.onOpen("ordered", sink);

        for (int i = 0; i < 30; i++) {
            manager.onBinary("ordered", FRAME);
        }
        manager.onBinary("ordered", new byte[1000]);
        manager.onText("ordered", ProtocolCodec.encodeEof());
        manager.onText("ordered", ProtocolCodec.encodeEof());

        await().atMost(10, TimeUnit.SECONDS).until(() -> sink.messages().size() == 5);
        assertThat(recognizer.calls()).extracting(FakeSpeechRecognizer.Call::sampleCount)
                .containsExactly(16_000, 16_000, 16_000, 500);
        assertThat(ProtocolCodec.decodeResult(sink.messages().get(4)).text()).isEmpty();
    }
}
