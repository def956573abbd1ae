package com.phillippitts.speakstream.server.recognition.whisper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Fake processes standing in for the whisper.cpp binary.
 */
final class WhisperTestDoubles {

    private WhisperTestDoubles() {}

    /**
     * @param stdout            stdout content
     * @param stderr            stderr content
     * @param exitCode          exit code
     * @param finishAfterMillis delay before the process exits (-1 means never)
     * @param jsonFile          content written to {@code <-of>.json} on start, or null for none
     */
    record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis, String jsonFile) {

        static ProcessBehavior stdoutOnly(String stdout) {
            return new ProcessBehavior(stdout, "", 0, 0, null);
        }

        static ProcessBehavior jsonFile(String json) {
            return new ProcessBehavior("", "", 0, 0, json);
        }
    }

    /**
     * Records each command line and emulates whisper.cpp writing its {@code -oj} output file.
     */
    static final class StubProcessFactory implements ProcessFactory {
        private final ProcessBehavior behavior;
        private final List<List<String>> commands = new CopyOnWriteArrayList<>();
        private volatile TestProcess last;

        StubProcessFactory(ProcessBehavior behavior) {
            this.behavior = behavior;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(List.copyOf(command));
            if (behavior.jsonFile() != null) {
                String base = command.get(command.indexOf("-of") + 1);
                Files.writeString(Path.of(base + ".json"), behavior.jsonFile(), StandardCharsets.UTF_8);
            }
            last = new TestProcess(behavior);
            return last;
        }

        List<List<String>> commands() {
            return commands;
        }

        TestProcess lastProcess() {
            return last;
        }
    }

    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive;
        private volatile boolean destroyCalled;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            this.alive = finishAfterMillis != 0;
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (!alive) {
                return true;
            }
            long ms = unit.toMillis(timeout);
            if (finishAfterMillis >= 0 && finishAfterMillis <= ms) {
                Thread.sleep(finishAfterMillis);
                alive = false;
                return true;
            }
            Thread.sleep(ms);
            return !alive;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
