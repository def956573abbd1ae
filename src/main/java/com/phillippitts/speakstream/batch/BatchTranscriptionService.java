package com.phillippitts.speakstream.batch;

import com.phillippitts.speakstream.domain.RecognitionResult;
import com.phillippitts.speakstream.domain.Segment;
import com.phillippitts.speakstream.exception.ConfigurationException;
import com.phillippitts.speakstream.exception.InvalidAudioException;
import com.phillippitts.speakstream.exception.RecognizerException;
import com.phillippitts.speakstream.server.recognition.RecognitionDispatcher;
import com.phillippitts.speakstream.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transcribes audio files one recognizer call per file and writes
 * {@code <basename>_result.json} documents:
 * <pre>
 * {"filename": "a.wav", "text": "...", "timestamps": [{"text": "...", "start": 0, "end": 480}]}
 * </pre>
 *
 * <p>A failing file is logged and skipped; the run continues with the next one.
 */
public class BatchTranscriptionService {

    private static final Logger LOG = LogManager.getLogger(BatchTranscriptionService.class);

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".wav", ".aiff", ".aif", ".au");
    static final String RESULT_SUFFIX = "_result.json";
    private static final int JSON_INDENT = 2;

    private final RecognitionDispatcher dispatcher;
    private final AudioFileLoader loader;

    public BatchTranscriptionService(RecognitionDispatcher dispatcher, AudioFileLoader loader) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Processes a single file or every supported file under a directory, recursively.
     *
     * @return counts of files found and successfully processed
     * @throws ConfigurationException if {@code input} does not exist
     */
    public BatchSummary run(Path input, Path outputDir) {
        LOG.info("Starting batch: input={}, output={}", input, outputDir);
        if (Files.isRegularFile(input)) {
            boolean ok = processFile(input, outputDir).isPresent();
            LOG.info(ok ? "File processed" : "File processing failed");
            return new BatchSummary(1, ok ? 1 : 0);
        }
        if (!Files.isDirectory(input)) {
            throw new ConfigurationException("Invalid input path: " + input);
        }
        List<Path> files = findAudioFiles(input);
        int processed = 0;
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            LOG.info("Found audio file ({}): {}", i + 1, file);
            if (processFile(file, outputDir).isPresent()) {
                processed++;
            }
        }
        LOG.info("Found {} audio files, processed {}", files.size(), processed);
        return new BatchSummary(files.size(), processed);
    }

    /**
     * @return the written result path, or empty if the file could not be transcribed
     */
    public Optional<Path> processFile(Path file, Path outputDir) {
        try {
            LoadedAudio audio = loader.load(file);
            RecognitionResult result = dispatcher.recognize(audio.samples(), audio.sampleRate());
            if (result.isFailure()) {
                LOG.error("Recognition failed for {}: {}", file, result.error());
                return Optional.empty();
            }
            LOG.info("Recognized {}: {}", file.getFileName(), LogSanitizer.preview(result.text()));
            return Optional.of(writeResult(file, result, outputDir));
        } catch (InvalidAudioException | RecognizerException e) {
            LOG.error("Cannot process {}: {}", file, e.getMessage());
            return Optional.empty();
        } catch (UncheckedIOException e) {
            LOG.error("Cannot write result for {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    static List<Path> findAudioFiles(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(BatchTranscriptionService::isSupported)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + dir, e);
        }
    }

    static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SUPPORTED_EXTENSIONS.contains(name.substring(dot));
    }

    static JSONObject toJson(String filename, RecognitionResult result) {
        JSONArray timestamps = new JSONArray();
        for (Segment segment : result.segments()) {
            timestamps.put(new JSONObject()
                    .put("text", segment.text())
                    .put("start", segment.start())
                    .put("end", segment.end()));
        }
        return new JSONObject()
                .put("filename", filename)
                .put("text", result.text())
                .put("timestamps", timestamps);
    }

    private static Path writeResult(Path file, RecognitionResult result, Path outputDir) {
        String filename = file.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        String base = dot > 0 ? filename.substring(0, dot) : filename;
        Path out = outputDir.resolve(base + RESULT_SUFFIX);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(out, toJson(filename, result).toString(JSON_INDENT), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + out, e);
        }
        LOG.info("Result saved to {}", out);
        return out;
    }

    /**
     * @param found     supported files discovered
     * @param processed files whose result was written
     */
    public record BatchSummary(int found, int processed) {}
}
