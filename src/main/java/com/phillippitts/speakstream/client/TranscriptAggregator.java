package com.phillippitts.speakstream.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Merges successive result texts into one running transcript without repeating itself.
 *
 * <p>A non-empty text always becomes {@code currentText}. It is appended to
 * {@code accumulatedText}, separated by one space, only if the accumulated text neither ends
 * with it nor already contains it. This is a cheap overlap filter rather than a diff: a phrase
 * spoken again later in the same recording is dropped, and texts differing only in punctuation
 * are both kept.
 *
 * <p>Thread-safe: results arrive on the WebSocket listener while the command loop resets.
 */
public class TranscriptAggregator {

    private final Clock clock;

    private String currentText = "";
    private String accumulatedText = "";
    private Instant sessionStartTime;

    public TranscriptAggregator() {
        this(Clock.systemUTC());
    }

    public TranscriptAggregator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return true if {@code text} was appended to the accumulated transcript
     */
    public synchronized boolean onResult(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        currentText = text;
        if (accumulatedText.endsWith(text) || accumulatedText.contains(text)) {
            return false;
        }
        accumulatedText = accumulatedText.isEmpty() ? text : accumulatedText + " " + text;
        return true;
    }

    /** Starts a new recording session: clears both texts and restarts the session clock. */
    public synchronized void reset() {
        currentText = "";
        accumulatedText = "";
        sessionStartTime = clock.instant();
    }

    public synchronized String currentText() {
        return currentText;
    }

    public synchronized String accumulatedText() {
        return accumulatedText;
    }

    /** @return null until the first {@link #reset()} */
    public synchronized Instant sessionStartTime() {
        return sessionStartTime;
    }

    /** Time since the last {@link #reset()}, zero before the first one. */
    public synchronized Duration sessionDuration() {
        return sessionStartTime == null ? Duration.ZERO : Duration.between(sessionStartTime, clock.instant());
    }

    public synchronized TranscriptView view() {
        return new TranscriptView(currentText, accumulatedText, sessionDuration());
    }

    /**
     * Consistent copy of the transcript for display.
     */
    public record TranscriptView(String currentText, String accumulatedText, Duration sessionDuration) {}
}
