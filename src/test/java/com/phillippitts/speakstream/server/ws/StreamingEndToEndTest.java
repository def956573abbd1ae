package com.phillippitts.speakstream.server.ws;

import com.phillippitts.speakstream.client.StreamingAsrClient;
import com.phillippitts.speakstream.client.TranscriptAggregator;
import com.phillippitts.speakstream.client.TranscriptConsole;
import com.phillippitts.speakstream.protocol.ProtocolCodec;
import com.phillippitts.speakstream.server.connection.SessionRegistry;
import com.phillippitts.speakstream.server.recognition.SpeechRecognizer;
import com.phillippitts.speakstream.testutil.FakeSpeechRecognizer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "speakstream.recognizer.engine=stub")
class StreamingEndToEndTest {

    @TestConfiguration
    static class StubRecognizerConfig {
        @Bean(destroyMethod = "close")
        SpeechRecognizer stubRecognizer() {
            return new FakeSpeechRecognizer();
        }
    }

    @LocalServerPort
    int port;

    @Autowired
    SessionRegistry registry;

    @Autowired
    SpeechRecognizer recognizer;

    @Autowired
    TestRestTemplate rest;

    private TranscriptAggregator aggregator;
    private StreamingAsrClient client;

    @BeforeEach
    void connect() {
        ((FakeSpeechRecognizer) recognizer).calls().clear();
        aggregator = new TranscriptAggregator();
        client = new StreamingAsrClient(HttpClient.newHttpClient(), aggregator,
                new TranscriptConsole(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8), false));
        client.connect(URI.create("ws://127.0.0.1:" + port + "/asr"), Duration.ofSeconds(5));
    }

    @AfterEach
    void disconnect() {
        client.close();
        await().atMost(10, TimeUnit.SECONDS).until(() -> registry.size() == 0);
    }

    @Test
    void oneSecondOfAudioYieldsOneResult() {
        client.sendText(ProtocolCodec.encodeConfig(16_000));
        for (int i = 0; i < 10; i++) {
            client.sendBinary(new byte[3200]);
        }

        await().atMost(10, TimeUnit.SECONDS).until(() -> !aggregator.currentText().isEmpty());
        assertThat(aggregator.currentText()).isEqualTo("chunk-1");
        assertThat(((FakeSpeechRecognizer) recognizer).calls()).hasSize(1);
    }

    @Test
    void eofFlushesRemainderAndSessionIsListed() {
        await().atMost(5, TimeUnit.SECONDS).until(() -> registry.size() == 1);
        JSONObject listing = new JSONObject(rest.getForObject("/api/sessions", String.class));
        assertThat(listing.getInt("count")).isEqualTo(1);

        client.sendBinary(new byte[1600]);
        client.sendText(ProtocolCodec.encodeEof());

        await().atMost(10, TimeUnit.SECONDS).until(() -> !aggregator.currentText().isEmpty());
        assertThat(((FakeSpeechRecognizer) recognizer).calls()).singleElement()
                .satisfies(call -> assertThat(call.sampleCount()).isEqualTo(800));
    }

    @Test
    void frameLargerThanContainerBufferKeepsConnectionOpen() {
        await().atMost(5, TimeUnit.SECONDS).until(() -> registry.size() == 1);

        client.sendBinary(new byte[2 * 1024 * 1024 + 2]);

        await().atMost(10, TimeUnit.SECONDS).until(() -> !aggregator.currentText().isEmpty());
        assertThat(client.isOpen()).isTrue();
        assertThat(registry.size()).isEqualTo(1);
        int samples = ((FakeSpeechRecognizer) recognizer).calls().stream()
                .mapToInt(FakeSpeechRecognizer.Call::sampleCount).sum();
        assertThat(samples).isLessThanOrEqualTo(1024 * 1024 + 1).isPositive();
    }

    @Test
    void closingConnectionRemovesSession() {
        await().atMost(5, TimeUnit.SECONDS).until(() -> registry.size() == 1);

        client.sendBinary(new byte[1000]);
        client.close();

        await().atMost(10, TimeUnit.SECONDS).until(() -> registry.size() == 0);
        assertThat(((FakeSpeechRecognizer) recognizer).calls()).isEmpty();
    }

    @Test
    void healthReportsRecognizer() {
        JSONObject health = new JSONObject(rest.getForObject("/actuator/health", String.class));

        assertThat(health.getString("status")).isEqualTo("UP");
        assertThat(health.getJSONObject("components").getJSONObject("recognizer")
                .getJSONObject("details").getString("engine")).isEqualTo("fake");
    }
}
