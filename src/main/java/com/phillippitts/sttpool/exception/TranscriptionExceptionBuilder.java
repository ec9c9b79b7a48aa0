package com.phillippitts.sttpool.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Fluent builder for a {@link TranscriptionException} carrying diagnostic context.
 *
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Failed to load model")
 *         .engine("vosk")
 *         .cause(exception)
 *         .metadata("modelPath", modelPath)
 *         .metadata("sampleRate", sampleRate)
 *         .build();
 * </pre>
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    /**
     * Sets the engine name for the exception.
     *
     * @param engineName STT engine name (e.g., "vosk", "echo")
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    /**
     * Sets the root cause of the exception.
     *
     * @param cause underlying exception
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the operation duration in milliseconds.
     *
     * @param durationMs duration in milliseconds
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * <p>Common metadata keys: modelPath, sampleRate, audioPath.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (engine: {engine})
     * </pre>
     */
    public TranscriptionException build() {
        StringJoiner details = new StringJoiner(", ", " (", ")");
        details.setEmptyValue("");
        if (durationMs != null) {
            details.add("durationMs=" + durationMs);
        }
        metadata.forEach((key, value) -> details.add(key + "=" + value));
        return new TranscriptionException(message + details, engineName, cause);
    }
}
