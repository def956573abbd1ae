package com.phillippitts.speakstream.server.recognition;

import com.phillippitts.speakstream.domain.RecognitionResult;
import com.phillippitts.speakstream.domain.Segment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the raw structured output of a {@link SpeechRecognizer} to a {@link RecognitionResult}.
 *
 * <p>Input shape: {@code {"text":..., "timestamp":[{"text":..., "timestamp":[start,end]}]}}.
 * Segments missing {@code text} or a two-number {@code timestamp} are skipped with a warning;
 * the rest of the result is kept. Output that is not a JSON object yields a failed result.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
public final class RecognizerOutputParser {

    private static final Logger LOG = LogManager.getLogger(RecognizerOutputParser.class);

    /** Error reported when the recognizer output is not a JSON object. */
    public static final String UNEXPECTED_SHAPE = "unexpected result shape";

    static final String FIELD_TEXT = "text";
    static final String FIELD_TIMESTAMP = "timestamp";

    private RecognizerOutputParser() {
    }

    public static RecognitionResult parse(String raw) {
        Object value;
        try {
            value = raw == null ? null : new JSONTokener(raw).nextValue();
        } catch (JSONException e) {
            LOG.error("Recognizer returned unparseable output: {}", e.getMessage());
            return RecognitionResult.failure(UNEXPECTED_SHAPE);
        }
        if (!(value instanceof JSONObject obj)) {
            LOG.error("Recognizer returned a non-object result: {}",
                    value == null ? "null" : value.getClass().getSimpleName());
            return RecognitionResult.failure(UNEXPECTED_SHAPE);
        }
        String text = obj.optString(FIELD_TEXT, "");
        return RecognitionResult.of(text, parseSegments(obj));
    }

    private static List<Segment> parseSegments(JSONObject obj) {
        List<Segment> segments = new ArrayList<>();
        if (!obj.has(FIELD_TIMESTAMP)) {
            return segments;
        }
        JSONArray array = obj.optJSONArray(FIELD_TIMESTAMP);
        if (array == null) {
            LOG.warn("Recognizer timestamp field is not a list; ignoring it");
            return segments;
        }
        for (int i = 0; i < array.length(); i++) {
            Segment segment = parseSegment(array.opt(i));
            if (segment == null) {
                LOG.warn("Skipping malformed timestamp segment at index {}", i);
            } else {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static Segment parseSegment(Object item) {
        if (!(item instanceof JSONObject seg) || !seg.has(FIELD_TEXT)) {
            return null;
        }
        JSONArray span = seg.optJSONArray(FIELD_TIMESTAMP);
        if (span == null || span.length() < 2) {
            return null;
        }
        double start = span.optDouble(0, Double.NaN);
        double end = span.optDouble(1, Double.NaN);
        if (Double.isNaN(start) || Double.isNaN(end)) {
            return null;
        }
        return new Segment(seg.optString(FIELD_TEXT, ""), start, end);
    }

    /**
     * Builds output in the shape {@link #parse(String)} reads. Used by recognizer adapters.
     */
    public static String format(String text, List<Segment> segments) {
        JSONArray timestamps = new JSONArray();
        for (Segment segment : segments) {
            timestamps.put(new JSONObject()
                    .put(FIELD_TEXT, segment.text())
                    .put(FIELD_TIMESTAMP, new JSONArray().put(segment.start()).put(segment.end())));
        }
        return new JSONObject()
                .put(FIELD_TEXT, text == null ? "" : text)
                .put(FIELD_TIMESTAMP, timestamps)
                .toString();
    }
}
