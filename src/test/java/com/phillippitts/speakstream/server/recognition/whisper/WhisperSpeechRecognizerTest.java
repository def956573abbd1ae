package com.phillippitts.speakstream.server.recognition.whisper;

import com.phillippitts.speakstream.config.stt.WhisperConfig;
import com.phillippitts.speakstream.exception.ModelNotFoundException;
import com.phillippitts.speakstream.exception.RecognizerException;
import com.phillippitts.speakstream.server.recognition.RecognizerOutputParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.phillippitts.speakstream.server.recognition.whisper.WhisperTestDoubles.ProcessBehavior;
import static com.phillippitts.speakstream.server.recognition.whisper.WhisperTestDoubles.StubProcessFactory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhisperSpeechRecognizerTest {

    @TempDir
    Path tmp;

    private WhisperConfig configWithFiles() throws Exception {
        Path binary = Files.createFile(tmp.resolve("main"));
        Path model = Files.createFile(tmp.resolve("ggml-base.bin"));
        return new WhisperConfig(binary.toString(), model.toString(), 5, "auto", 1, 1_048_576);
    }

    @Test
    void missingModelFailsInitialization() {
        WhisperConfig cfg = new WhisperConfig(tmp.resolve("main").toString(),
                tmp.resolve("absent.bin").toString(), 5, "auto", 1, 1_048_576);
        WhisperSpeechRecognizer recognizer = new WhisperSpeechRecognizer(cfg);

        assertThatThrownBy(recognizer::initialize).isInstanceOf(ModelNotFoundException.class);
        assertThat(recognizer.isHealthy()).isFalse();
    }

    @Test
    void recognizeBeforeInitializeFails() throws Exception {
        WhisperSpeechRecognizer recognizer = new WhisperSpeechRecognizer(configWithFiles());

        assertThatThrownBy(() -> recognizer.recognize(new float[160], 16_000))
                .isInstanceOf(RecognizerException.class)
                .hasMessageContaining("not initialized");
    }

    @Test
    void returnsCanonicalOutputAndRemovesTempWav() throws Exception {
        StubProcessFactory factory = new StubProcessFactory(ProcessBehavior.jsonFile(
                "{\"transcription\":[{\"offsets\":{\"from\":0,\"to\":500},\"text\":\" hi\"}]}"));
        WhisperSpeechRecognizer recognizer = new WhisperSpeechRecognizer(configWithFiles(),
                new WhisperProcessManager(factory));
        recognizer.initialize();

        String raw = recognizer.recognize(new float[8000], 8000);

        assertThat(RecognizerOutputParser.parse(raw).text()).isEqualTo("hi");
        String wavArg = factory.commands().get(0).get(factory.commands().get(0).indexOf("-f") + 1);
        assertThat(Path.of(wavArg)).doesNotExist();
        recognizer.close();
        assertThat(recognizer.isHealthy()).isFalse();
    }

    @Test
    void processFailureIsWrappedWithEngineName() throws Exception {
        WhisperSpeechRecognizer recognizer = new WhisperSpeechRecognizer(configWithFiles(),
                new WhisperProcessManager(new StubProcessFactory(new ProcessBehavior("", "boom", 1, 0, null))));
        recognizer.initialize();

        assertThatThrownBy(() -> recognizer.recognize(new float[160], 16_000))
                .isInstanceOf(RecognizerException.class)
                .hasMessageContaining("engine: whisper");
    }
}
