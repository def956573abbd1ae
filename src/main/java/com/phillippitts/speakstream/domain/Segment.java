package com.phillippitts.speakstream.domain;

import java.util.Objects;

/**
 * Time-aligned fragment of recognized text.
 *
 * @param text  fragment text (never null)
 * @param start start offset in milliseconds from the beginning of the submitted audio
 * @param end   end offset in milliseconds from the beginning of the submitted audio
 */
public record Segment(String text, double start, double end) {

    public Segment {
        Objects.requireNonNull(text, "Segment text must not be null");
    }
}
