package com.phillippitts.speakstream.server.recognition.whisper;

import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so the whisper recognizer can be tested hermetically.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub returning a fake
 * {@link Process} with controlled stdout, stderr and exit behavior.
 */
interface ProcessFactory {
    /**
     * @param command    full command line, executable first
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws java.io.IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws java.io.IOException;
}
