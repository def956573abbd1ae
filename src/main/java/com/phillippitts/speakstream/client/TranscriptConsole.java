package com.phillippitts.speakstream.client;

import com.phillippitts.speakstream.client.TranscriptAggregator.TranscriptView;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Terminal rendering of the live transcript and client status lines.
 */
public class TranscriptConsole {

    private static final String CLEAR_SCREEN = "\033c";
    static final String COMMAND_HINT = "Commands: 's' start/stop recording, 'q' quit";

    private final PrintStream out;
    private final boolean clearScreen;

    public TranscriptConsole(PrintStream out, boolean clearScreen) {
        this.out = Objects.requireNonNull(out, "out");
        this.clearScreen = clearScreen;
    }

    public void printBanner(String serverUrl) {
        out.println();
        out.println("=== speakStream live transcription ===");
        out.println("Server: " + serverUrl);
        out.println(COMMAND_HINT);
        out.println();
    }

    /** Redraws the transcript; an empty current text leaves the screen as is. */
    public synchronized void render(TranscriptView view) {
        if (view.currentText().isEmpty()) {
            return;
        }
        if (clearScreen) {
            out.print(CLEAR_SCREEN);
        }
        out.println();
        out.println("===== Live transcript =====");
        out.println();
        out.println("[Current]     " + view.currentText());
        if (!view.accumulatedText().isEmpty()) {
            out.println();
            out.println("[Accumulated] " + view.accumulatedText());
        }
        out.println();
        out.printf(Locale.ROOT, "[Session]     %.1fs%n", view.sessionDuration().toMillis() / 1000.0);
        out.println();
        out.println(COMMAND_HINT);
        out.println("===========================");
        out.flush();
    }

    public synchronized void recordingStarted() {
        out.println();
        out.println("[Recording started] Live recognition is running, start speaking...");
        out.flush();
    }

    public synchronized void recordingStopped() {
        out.println();
        out.println("[Recording stopped]");
        out.flush();
    }

    public synchronized void notice(String message) {
        out.println("[!] " + message);
        out.flush();
    }

    public synchronized void prompt() {
        out.print("command> ");
        out.flush();
    }
}
