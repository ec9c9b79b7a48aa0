package com.phillippitts.sttpool.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Input reference handed to a worker process: a filesystem path plus a small string parameter set.
 *
 * <p>Only process-transferable data is allowed here. The audio itself never crosses the process
 * boundary; the worker opens {@code audioPath} on its own.
 *
 * @param audioPath absolute or coordinator-relative path to the audio file
 * @param params    work-function parameters (e.g. {@code language}); copied defensively
 */
public record WorkPayload(String audioPath, Map<String, String> params) {

    /** Parameter key for the requested transcription language. */
    public static final String PARAM_LANGUAGE = "language";

    /** Language used when the caller does not request one. */
    public static final String AUTO_LANGUAGE = "auto";

    public WorkPayload {
        Objects.requireNonNull(audioPath, "audioPath must not be null");
        if (audioPath.isBlank()) {
            throw new IllegalArgumentException("audioPath must not be blank");
        }
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static WorkPayload of(String audioPath) {
        return new WorkPayload(audioPath, Map.of());
    }

    public static WorkPayload of(String audioPath, String language) {
        return new WorkPayload(audioPath, Map.of(PARAM_LANGUAGE, language));
    }

    /**
     * Returns the requested language, or {@value #AUTO_LANGUAGE} when none was given.
     */
    public String language() {
        String language = params.get(PARAM_LANGUAGE);
        return language == null || language.isBlank() ? AUTO_LANGUAGE : language;
    }
}
