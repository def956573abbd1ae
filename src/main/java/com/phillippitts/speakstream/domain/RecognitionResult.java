package com.phillippitts.speakstream.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of one dispatch of buffered audio to the recognizer.
 *
 * <p>When {@code error} is present the text is empty and there are no segments; the audio
 * that produced the error has already been dropped from the session buffer and is not retried.
 *
 * @param text     recognized text, possibly empty (never null)
 * @param segments time-aligned fragments in order, possibly empty (never null)
 * @param error    failure description, or null on success
 */
public record RecognitionResult(String text, List<Segment> segments, String error) {

    public RecognitionResult {
        Objects.requireNonNull(text, "Recognition text must not be null");
        segments = segments == null ? List.of() : List.copyOf(segments);
        if (error != null && (!text.isEmpty() || !segments.isEmpty())) {
            throw new IllegalArgumentException("A failed result must not carry text or segments");
        }
    }

    /** Result with empty text and no segments, produced for an empty buffer. */
    public static RecognitionResult empty() {
        return new RecognitionResult("", List.of(), null);
    }

    public static RecognitionResult of(String text, List<Segment> segments) {
        return new RecognitionResult(text, segments, null);
    }

    public static RecognitionResult failure(String error) {
        return new RecognitionResult("", List.of(), error == null || error.isBlank() ? "recognition failed" : error);
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public boolean isFailure() {
        return error != null;
    }
}
