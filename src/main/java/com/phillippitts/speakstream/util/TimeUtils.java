package com.phillippitts.speakstream.util;

/**
 * Time conversions used by recognizers and the console display.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    /** Milliseconds in one second. */
    public static final double MILLIS_PER_SECOND = 1000.0;

    private TimeUtils() {
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /** Converts a recognizer offset in seconds to milliseconds. */
    public static double secondsToMillis(double seconds) {
        return seconds * MILLIS_PER_SECOND;
    }

    /** Duration of {@code sampleCount} samples at {@code sampleRate}, in milliseconds. */
    public static long audioMillis(int sampleCount, int sampleRate) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        return (long) sampleCount * 1000L / sampleRate;
    }
}
