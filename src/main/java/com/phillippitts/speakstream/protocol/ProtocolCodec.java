package com.phillippitts.speakstream.protocol;

import com.phillippitts.speakstream.domain.RecognitionResult;
import com.phillippitts.speakstream.domain.Segment;
import com.phillippitts.speakstream.exception.ProtocolException;
import com.phillippitts.speakstream.protocol.ControlMessage.ConfigMessage;
import com.phillippitts.speakstream.protocol.ControlMessage.EofMessage;
import com.phillippitts.speakstream.protocol.ControlMessage.UnknownControlMessage;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes and decodes the JSON messages exchanged over the streaming connection.
 *
 * <p>Client to server:
 * <pre>
 * {"type":"config","sample_rate":16000}
 * {"type":"eof"}
 * </pre>
 * Server to client:
 * <pre>
 * {"text":"...","timestamps":[{"text":"...","start":0,"end":480}],"error":"..."}
 * </pre>
 * {@code error} is only written when the dispatch failed. Audio travels as binary frames and
 * never goes through this codec.
 *
 * <p>Thread-safe: stateless.
 */
public final class ProtocolCodec {

    public static final String FIELD_TYPE = "type";
    public static final String FIELD_SAMPLE_RATE = "sample_rate";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_TIMESTAMPS = "timestamps";
    public static final String FIELD_START = "start";
    public static final String FIELD_END = "end";
    public static final String FIELD_ERROR = "error";

    /** Rate used when a config message omits {@code sample_rate}. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;

    private ProtocolCodec() {
    }

    /**
     * Decodes a control message.
     *
     * @param text raw text frame
     * @return decoded message; unrecognized types yield {@link UnknownControlMessage}
     * @throws ProtocolException if the text is not a JSON object, has no {@code type},
     *                           or carries an invalid sample rate
     */
    public static ControlMessage decodeControl(String text) {
        JSONObject obj = parseObject(text);
        String type = obj.optString(FIELD_TYPE, null);
        if (type == null || type.isBlank()) {
            throw new ProtocolException("Control message has no type", text);
        }
        switch (type) {
            case ConfigMessage.TYPE:
                return decodeConfig(obj, text);
            case EofMessage.TYPE:
                return new EofMessage();
            default:
                return new UnknownControlMessage(type);
        }
    }

    private static ConfigMessage decodeConfig(JSONObject obj, String text) {
        if (!obj.has(FIELD_SAMPLE_RATE) || obj.isNull(FIELD_SAMPLE_RATE)) {
            return new ConfigMessage(DEFAULT_SAMPLE_RATE);
        }
        Object raw = obj.get(FIELD_SAMPLE_RATE);
        if (!(raw instanceof Number number)) {
            throw new ProtocolException("sample_rate must be a number", text);
        }
        int rate = number.intValue();
        if (rate <= 0 || rate != number.doubleValue()) {
            throw new ProtocolException("sample_rate must be a positive integer, got: " + raw, text);
        }
        return new ConfigMessage(rate);
    }

    public static String encodeConfig(int sampleRate) {
        return new JSONObject()
                .put(FIELD_TYPE, ConfigMessage.TYPE)
                .put(FIELD_SAMPLE_RATE, sampleRate)
                .toString();
    }

    public static String encodeEof() {
        return new JSONObject().put(FIELD_TYPE, EofMessage.TYPE).toString();
    }

    /**
     * Encodes a dispatch result. {@code timestamps} is always present; {@code error} only on failure.
     */
    public static String encodeResult(RecognitionResult result) {
        JSONArray timestamps = new JSONArray();
        for (Segment segment : result.segments()) {
            timestamps.put(new JSONObject()
                    .put(FIELD_TEXT, segment.text())
                    .put(FIELD_START, segment.start())
                    .put(FIELD_END, segment.end()));
        }
        JSONObject obj = new JSONObject()
                .put(FIELD_TEXT, result.text())
                .put(FIELD_TIMESTAMPS, timestamps);
        if (result.isFailure()) {
            obj.put(FIELD_ERROR, result.error());
        }
        return obj.toString();
    }

    /**
     * Decodes a result message received by the client.
     *
     * <p>Segments lacking a numeric start or end are skipped rather than failing the message.
     *
     * @throws ProtocolException if the text is not a JSON object
     */
    public static RecognitionResult decodeResult(String text) {
        JSONObject obj = parseObject(text);
        if (obj.has(FIELD_ERROR) && !obj.isNull(FIELD_ERROR)) {
            return RecognitionResult.failure(obj.optString(FIELD_ERROR));
        }
        List<Segment> segments = new ArrayList<>();
        JSONArray timestamps = obj.optJSONArray(FIELD_TIMESTAMPS);
        if (timestamps != null) {
            for (int i = 0; i < timestamps.length(); i++) {
                JSONObject ts = timestamps.optJSONObject(i);
                if (ts == null || !ts.has(FIELD_START) || !ts.has(FIELD_END)) {
                    continue;
                }
                double start = ts.optDouble(FIELD_START, Double.NaN);
                double end = ts.optDouble(FIELD_END, Double.NaN);
                if (Double.isNaN(start) || Double.isNaN(end)) {
                    continue;
                }
                segments.add(new Segment(ts.optString(FIELD_TEXT, ""), start, end));
            }
        }
        return RecognitionResult.of(obj.optString(FIELD_TEXT, ""), segments);
    }

    private static JSONObject parseObject(String text) {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("Empty message", text);
        }
        try {
            return new JSONObject(text);
        } catch (JSONException e) {
            throw new ProtocolException("Malformed JSON message: " + e.getMessage(), text, e);
        }
    }
}
