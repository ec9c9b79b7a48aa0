package com.phillippitts.sttpool.protocol;

import com.phillippitts.sttpool.domain.FailureKind;
import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.OutcomeKind;
import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.TranscriptionSegment;
import com.phillippitts.sttpool.domain.WorkPayload;
import com.phillippitts.sttpool.domain.WorkUnit;
import com.phillippitts.sttpool.exception.WorkerProtocolException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Line-delimited JSON codec for the supervisor/worker channels.
 *
 * <p>Every message is a single JSON object on one line, with a {@code type} field naming the
 * {@link WorkerMessage.Type}. Example exchange:
 * <pre>
 * worker  -&gt; {"type":"ready","pid":4242}
 * coord   -&gt; {"type":"work","id":"…","submittedAt":"…","payload":{"audioPath":"/tmp/a.wav","params":{"language":"en"}}}
 * worker  -&gt; {"type":"outcome","id":"…","kind":"SUCCESS","tasksCompleted":1,"result":{…}}
 * coord   -&gt; {"type":"shutdown"}
 * </pre>
 */
public final class WorkerProtocol {

    /** Upper bound for a single decoded line; larger lines are rejected rather than parsed. */
    public static final int MAX_LINE_CHARS = 4 * 1024 * 1024;

    private WorkerProtocol() {
    }

    /**
     * Encodes a message as a single line of JSON (no trailing newline).
     */
    public static String encode(WorkerMessage message) {
        JSONObject obj = new JSONObject();
        obj.put("type", message.type().name().toLowerCase(Locale.ROOT));
        switch (message.type()) {
            case WORK -> encodeWork(obj, message.work());
            case READY -> obj.put("pid", message.pid());
            case OUTCOME -> {
                encodeOutcome(obj, message.outcome());
                obj.put("tasksCompleted", message.tasksCompleted());
            }
            case SHUTDOWN -> {
                // type only
            }
        }
        return obj.toString();
    }

    /**
     * Decodes one line read from a channel.
     *
     * @throws WorkerProtocolException if the line is blank, oversized, not JSON, or misses required fields
     */
    public static WorkerMessage decode(String line) {
        if (line == null || line.isBlank()) {
            throw new WorkerProtocolException("Empty protocol line");
        }
        if (line.length() > MAX_LINE_CHARS) {
            throw new WorkerProtocolException("Protocol line exceeds " + MAX_LINE_CHARS + " chars");
        }
        try {
            JSONObject obj = new JSONObject(line);
            WorkerMessage.Type type = WorkerMessage.Type.valueOf(obj.getString("type").toUpperCase(Locale.ROOT));
            return switch (type) {
                case WORK -> WorkerMessage.work(decodeWork(obj));
                case SHUTDOWN -> WorkerMessage.shutdown();
                case READY -> WorkerMessage.ready(obj.getLong("pid"));
                case OUTCOME -> WorkerMessage.outcome(decodeOutcome(obj), obj.optInt("tasksCompleted", 0));
            };
        } catch (JSONException | IllegalArgumentException | NullPointerException | DateTimeParseException e) {
            throw new WorkerProtocolException("Malformed protocol line: " + e.getMessage(), e);
        }
    }

    private static void encodeWork(JSONObject obj, WorkUnit unit) {
        obj.put("id", unit.id());
        obj.put("submittedAt", unit.submittedAt().toString());
        JSONObject payload = new JSONObject();
        payload.put("audioPath", unit.payload().audioPath());
        payload.put("params", new JSONObject(unit.payload().params()));
        obj.put("payload", payload);
    }

    private static WorkUnit decodeWork(JSONObject obj) {
        JSONObject payload = obj.getJSONObject("payload");
        Map<String, String> params = new LinkedHashMap<>();
        JSONObject rawParams = payload.optJSONObject("params");
        if (rawParams != null) {
            for (String key : rawParams.keySet()) {
                params.put(key, rawParams.optString(key, ""));
            }
        }
        return new WorkUnit(
                obj.getString("id"),
                new WorkPayload(payload.getString("audioPath"), params),
                Instant.parse(obj.getString("submittedAt"))
        );
    }

    private static void encodeOutcome(JSONObject obj, Outcome outcome) {
        obj.put("id", outcome.workId());
        obj.put("kind", outcome.kind().name());
        obj.put("completedAt", outcome.completedAt().toString());
        if (outcome.result() != null) {
            obj.put("result", encodeResult(outcome.result()));
        }
        if (outcome.failureKind() != null) {
            obj.put("failureKind", outcome.failureKind().name());
        }
        obj.putOpt("errorType", outcome.errorType());
        obj.putOpt("message", outcome.message());
    }

    private static Outcome decodeOutcome(JSONObject obj) {
        String id = obj.getString("id");
        OutcomeKind kind = OutcomeKind.valueOf(obj.getString("kind"));
        Instant completedAt = obj.has("completedAt") ? Instant.parse(obj.getString("completedAt")) : Instant.now();
        TranscriptionResult result = obj.has("result") ? decodeResult(obj.getJSONObject("result")) : null;
        FailureKind failureKind = obj.has("failureKind") ? FailureKind.valueOf(obj.getString("failureKind")) : null;
        String errorType = obj.has("errorType") ? obj.getString("errorType") : null;
        String message = obj.has("message") ? obj.getString("message") : null;
        return new Outcome(id, kind, result, failureKind, errorType, message, completedAt);
    }

    private static JSONObject encodeResult(TranscriptionResult result) {
        JSONObject obj = new JSONObject();
        obj.put("text", result.text());
        obj.put("detectedLanguage", result.detectedLanguage());
        obj.put("confidenceAverage", result.confidenceAverage());
        obj.put("processingTimeMs", result.processingTimeMs());
        obj.putOpt("speakerCount", result.speakerCount());
        JSONArray segments = new JSONArray();
        for (TranscriptionSegment segment : result.segments()) {
            JSONObject s = new JSONObject();
            s.put("text", segment.text());
            s.put("start", segment.startSeconds());
            s.put("end", segment.endSeconds());
            s.put("confidence", segment.confidence());
            s.putOpt("speakerId", segment.speakerId());
            s.putOpt("language", segment.language());
            segments.put(s);
        }
        obj.put("segments", segments);
        return obj;
    }

    private static TranscriptionResult decodeResult(JSONObject obj) {
        List<TranscriptionSegment> segments = new ArrayList<>();
        JSONArray rawSegments = obj.optJSONArray("segments");
        if (rawSegments != null) {
            for (int i = 0; i < rawSegments.length(); i++) {
                JSONObject s = rawSegments.getJSONObject(i);
                segments.add(new TranscriptionSegment(
                        s.getString("text"),
                        s.getDouble("start"),
                        s.getDouble("end"),
                        s.getDouble("confidence"),
                        s.has("speakerId") ? s.getString("speakerId") : null,
                        s.has("language") ? s.getString("language") : null
                ));
            }
        }
        return new TranscriptionResult(
                obj.getString("text"),
                obj.getString("detectedLanguage"),
                segments,
                obj.has("speakerCount") ? obj.getInt("speakerCount") : null,
                obj.getDouble("confidenceAverage"),
                obj.getLong("processingTimeMs")
        );
    }
}
