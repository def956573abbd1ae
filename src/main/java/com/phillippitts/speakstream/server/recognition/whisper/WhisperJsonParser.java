package com.phillippitts.speakstream.server.recognition.whisper;

import com.phillippitts.speakstream.domain.Segment;
import com.phillippitts.speakstream.server.recognition.RecognizerOutputParser;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps whisper.cpp {@code -oj} output to the recognizer output shape.
 *
 * <p>whisper.cpp writes
 * <pre>
 * {"transcription":[{"offsets":{"from":0,"to":2040},"text":" Hello world."}]}
 * </pre>
 * with offsets already in milliseconds. Each transcription entry becomes one segment and the
 * full text is the trimmed entries joined by single spaces. Entries without offsets keep their
 * text but produce no segment.
 */
final class WhisperJsonParser {

    private WhisperJsonParser() {}

    /**
     * @throws org.json.JSONException when the output is not JSON
     */
    static String toRecognizerOutput(String json) {
        if (json == null || json.isBlank()) {
            return RecognizerOutputParser.format("", List.of());
        }
        JSONObject obj = new JSONObject(json);
        JSONArray entries = obj.optJSONArray("transcription");
        if (entries == null) {
            // Some builds emit {"text": "..."} only
            return RecognizerOutputParser.format(obj.optString("text", "").trim(), List.of());
        }
        StringBuilder text = new StringBuilder();
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i < entries.length(); i++) {
            JSONObject entry = entries.optJSONObject(i);
            if (entry == null) {
                continue;
            }
            String t = entry.optString("text", "").trim();
            if (t.isEmpty()) {
                continue;
            }
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(t);
            JSONObject offsets = entry.optJSONObject("offsets");
            if (offsets != null && offsets.has("from") && offsets.has("to")) {
                segments.add(new Segment(t, offsets.optDouble("from", 0), offsets.optDouble("to", 0)));
            }
        }
        return RecognizerOutputParser.format(text.toString(), segments);
    }
}
