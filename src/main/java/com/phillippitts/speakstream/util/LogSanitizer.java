package com.phillippitts.speakstream.util;

/** Privacy-safe rendering of transcript text and raw payloads for log lines. */
public final class LogSanitizer {

    /** Default number of characters kept by {@link #preview(String)}. */
    public static final int DEFAULT_PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview for DEBUG logs: control characters become spaces and the text is
     * cut to {@link #DEFAULT_PREVIEW_CHARS} with an ellipsis marker and the full length.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String flat = s.replaceAll("\\p{Cntrl}", " ");
        if (flat.length() <= DEFAULT_PREVIEW_CHARS) {
            return flat;
        }
        return truncate(flat, DEFAULT_PREVIEW_CHARS) + "...(" + flat.length() + " chars)";
    }
}
