package com.phillippitts.speakstream.server.recognition.vosk;

import com.phillippitts.speakstream.domain.Segment;
import com.phillippitts.speakstream.server.recognition.RecognizerOutputParser;
import com.phillippitts.speakstream.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps Vosk final-result JSON to the recognizer output shape.
 *
 * <p>Vosk reports words in seconds:
 * <pre>
 * {"result":[{"conf":0.98,"start":0.42,"end":0.81,"word":"hello"}],"text":"hello"}
 * </pre>
 * Each word becomes one segment with offsets in milliseconds. The alternatives format
 * ({@code {"alternatives":[{"text":...,"result":[...]}]}}) is read from its first entry.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
final class VoskResultMapper {

    private static final Logger LOG = LogManager.getLogger(VoskResultMapper.class);

    /**
     * Maximum allowed JSON response size from the Vosk recognizer (1MB).
     */
    private static final int MAX_JSON_SIZE = 1_048_576;

    private VoskResultMapper() {
    }

    /**
     * @param json Vosk final result, may be null or blank for silence
     * @return recognizer output JSON; never null
     */
    static String toRecognizerOutput(String json) {
        if (json == null || json.isBlank()) {
            return RecognizerOutputParser.format("", List.of());
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Vosk JSON response exceeds {}B cap (actual: {}B); dropping it", MAX_JSON_SIZE, json.length());
            return RecognizerOutputParser.format("", List.of());
        }
        JSONObject obj = new JSONObject(json);
        if (obj.has("alternatives")) {
            JSONArray alternatives = obj.optJSONArray("alternatives");
            JSONObject first = alternatives == null ? null : alternatives.optJSONObject(0);
            obj = first == null ? new JSONObject() : first;
        }
        String text = obj.optString("text", "").trim();
        return RecognizerOutputParser.format(text, words(obj.optJSONArray("result")));
    }

    private static List<Segment> words(JSONArray result) {
        List<Segment> segments = new ArrayList<>();
        if (result == null) {
            return segments;
        }
        for (int i = 0; i < result.length(); i++) {
            JSONObject word = result.optJSONObject(i);
            if (word == null || !word.has("word")) {
                continue;
            }
            double start = word.optDouble("start", Double.NaN);
            double end = word.optDouble("end", Double.NaN);
            if (Double.isNaN(start) || Double.isNaN(end)) {
                continue;
            }
            segments.add(new Segment(word.getString("word"),
                    TimeUtils.secondsToMillis(start), TimeUtils.secondsToMillis(end)));
        }
        return segments;
    }
}
