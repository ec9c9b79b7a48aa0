package com.phillippitts.sttpool.worker.vosk;

import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.TranscriptionSegment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.List;

/**
 * Turns a Vosk recognizer JSON response into a {@link TranscriptionResult}.
 *
 * <p>Vosk returns one of two shapes:
 * <ol>
 *   <li>final result: {@code {"text": "...", "result": [{"word","start","end","conf"}, ...]}}</li>
 *   <li>alternatives: {@code {"alternatives": [{"text": "...", "confidence": ...}]}}</li>
 * </ol>
 * Confidence is clamped to [0.0, 1.0]; alternatives report unnormalized scores.
 */
final class VoskJsonParser {

    private static final Logger LOG = LogManager.getLogger(VoskJsonParser.class);

    /** Responses above 1MB are truncated before parsing. */
    static final int MAX_JSON_SIZE = 1_048_576;

    private VoskJsonParser() {
    }

    static TranscriptionResult parse(String json, String language, long processingTimeMs) {
        if (json == null || json.isBlank()) {
            return TranscriptionResult.of("", language, 1.0, processingTimeMs);
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Vosk JSON response exceeds {}B cap (actual: {}B); truncating", MAX_JSON_SIZE, json.length());
            json = json.substring(0, MAX_JSON_SIZE);
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (obj.has("alternatives")) {
                JSONArray alternatives = obj.getJSONArray("alternatives");
                if (alternatives.isEmpty()) {
                    return TranscriptionResult.of("", language, 1.0, processingTimeMs);
                }
                JSONObject first = alternatives.getJSONObject(0);
                return TranscriptionResult.of(first.optString("text", "").trim(), language,
                        clamp(first.optDouble("confidence", 1.0)), processingTimeMs);
            }

            String text = obj.optString("text", "").trim();
            JSONArray words = obj.optJSONArray("result");
            if (words == null || words.isEmpty()) {
                return TranscriptionResult.of(text, language, 1.0, processingTimeMs);
            }

            double sum = 0.0;
            int count = 0;
            for (int i = 0; i < words.length(); i++) {
                JSONObject word = words.getJSONObject(i);
                if (word.has("conf")) {
                    sum += word.getDouble("conf");
                    count++;
                }
            }
            double confidence = clamp(count > 0 ? sum / count : 1.0);
            double start = Math.max(0.0, words.getJSONObject(0).optDouble("start", 0.0));
            double end = Math.max(start, words.getJSONObject(words.length() - 1).optDouble("end", start));
            TranscriptionSegment segment = new TranscriptionSegment(text, start, end, confidence, null, language);
            return new TranscriptionResult(text, language, List.of(segment), null, confidence, processingTimeMs);
        } catch (JSONException e) {
            LOG.warn("Failed to parse Vosk JSON response ({} chars)", json.length(), e);
            return TranscriptionResult.of("", language, 1.0, processingTimeMs);
        }
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 1.0;
        }
        return Math.min(1.0, Math.max(0.0, confidence));
    }
}
