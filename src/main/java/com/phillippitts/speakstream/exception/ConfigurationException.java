package com.phillippitts.speakstream.exception;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Fatal startup problem: invalid arguments, unreachable server, missing input path.
 *
 * <p>Only raised while a run mode is starting. Spring Boot picks up the exit code when the
 * exception escapes a runner, so the process terminates with a non-zero status.
 */
public class ConfigurationException extends SpeakStreamException implements ExitCodeGenerator {

    /** Exit status reported to the operator on fatal startup failure. */
    public static final int EXIT_CODE = 2;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
