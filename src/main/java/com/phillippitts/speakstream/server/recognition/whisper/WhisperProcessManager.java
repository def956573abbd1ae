package com.phillippitts.speakstream.server.recognition.whisper;

import com.phillippitts.speakstream.config.stt.WhisperConfig;
import com.phillippitts.speakstream.exception.RecognizerException;
import com.phillippitts.speakstream.server.recognition.RecognizerNames;
import com.phillippitts.speakstream.util.ProcessTimeouts;
import com.phillippitts.speakstream.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external whisper.cpp binary for one WAV file and returns its JSON output.
 *
 * <p>Responsibilities:
 * - Build the CLI from {@link WhisperConfig}
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout and stderr concurrently with size caps
 * - Enforce the timeout and terminate runaway processes
 * - Idempotent {@link #close()} for cleanup
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -m ${model} -f ${wav} -l ${language} -t ${threads} -oj -of ${wav without .wav}
 * </pre>
 * whisper.cpp writes {@code ${wav without .wav}.json}; when that file is missing the captured
 * stdout is returned instead.
 *
 * <p>Temp WAV handling is performed by the caller. Not safe for concurrent calls; the
 * recognizer guard serializes them.
 */
final class WhisperProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    private final ProcessFactory processFactory;

    private volatile Process current;
    private volatile Thread outGobbler;
    private volatile Thread errGobbler;

    WhisperProcessManager() {
        this(new DefaultProcessFactory());
    }

    WhisperProcessManager(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * @param wavPath WAV file created by the caller
     * @param cfg     whisper configuration
     * @return whisper.cpp JSON output (may be empty)
     * @throws RecognizerException on timeout, non-zero exit or I/O error
     */
    String transcribe(Path wavPath, WhisperConfig cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(cfg, "cfg");

        Path outputBase = outputBase(wavPath);
        List<String> command = buildCommand(cfg, wavPath, outputBase);
        long startTime = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        try {
            Process process = processFactory.start(command, wavPath.toAbsolutePath().getParent());
            this.current = process;
            // Start gobblers before waiting to avoid pipe deadlock
            this.outGobbler = startGobbler(process.getInputStream(), stdout, "whisper-out", cfg.maxStdoutBytes());
            this.errGobbler = startGobbler(process.getErrorStream(), stderr, "whisper-err",
                    WhisperConstants.STDERR_MAX_BYTES);

            if (!process.waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS)) {
                destroyProcess(process);
                throw whisperError("Timeout after " + cfg.timeoutSeconds() + "s", stderr, startTime, null);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw whisperError("Non-zero exit: " + exitCode, stderr, startTime, null);
            }
            String output = readJsonOutput(outputBase, stdout);
            LOG.debug("Whisper finished in {} ms (output={} chars)", TimeUtils.elapsedMillis(startTime), output.length());
            return output;
        } catch (IOException e) {
            throw whisperError("I/O failure: " + e.getMessage(), stderr, startTime, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw whisperError("Interrupted while waiting for whisper", stderr, startTime, e);
        } finally {
            close();
        }
    }

    static Path outputBase(Path wavPath) {
        String name = wavPath.getFileName().toString();
        String base = name.endsWith(".wav") ? name.substring(0, name.length() - 4) : name;
        return wavPath.toAbsolutePath().resolveSibling(base);
    }

    static List<String> buildCommand(WhisperConfig cfg, Path wavPath, Path outputBase) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(cfg.language());
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        cmd.add("-oj");
        cmd.add("-of");
        cmd.add(outputBase.toString());
        return cmd;
    }

    private static String readJsonOutput(Path outputBase, StringBuilder stdout) throws IOException {
        Path json = outputBase.resolveSibling(outputBase.getFileName() + WhisperConstants.JSON_SUFFIX);
        if (Files.isRegularFile(json)) {
            try {
                return Files.readString(json, StandardCharsets.UTF_8);
            } finally {
                Files.deleteIfExists(json);
            }
        }
        return stdout.toString();
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a sink until the cap, then keeps draining without accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Whisper process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying whisper process");
        }
    }

    private RecognizerException whisperError(String msg, StringBuilder stderr, long startNano, Throwable cause) {
        String snippet;
        synchronized (stderr) {
            snippet = stderr.substring(0, Math.min(WhisperConstants.ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        }
        String detail = msg + " after " + TimeUtils.elapsedMillis(startNano) + "ms"
                + (snippet.isBlank() ? "" : ", stderr: " + snippet.strip());
        return cause == null
                ? new RecognizerException(detail, RecognizerNames.WHISPER)
                : new RecognizerException(detail, RecognizerNames.WHISPER, cause);
    }

    /**
     * Idempotent cleanup of any running process and gobbler threads.
     */
    @Override
    public void close() {
        Process process = this.current;
        this.current = null;
        if (process != null && process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        outGobbler = null;
        errGobbler = null;
    }
}
