package com.phillippitts.sttpool.exception;

/**
 * A work function failed while producing a transcript (native engine error, unusable engine output).
 *
 * <p>Workers report it as an {@code ENGINE_ERROR} failure; the worker itself stays usable.
 */
public class TranscriptionException extends SttPoolException {

    private static final String UNKNOWN_ENGINE = "unknown";

    private final String engineName;

    public TranscriptionException(String message, String engineName) {
        this(message, engineName, null);
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + orUnknown(engineName) + ")", cause);
        this.engineName = orUnknown(engineName);
    }

    private static String orUnknown(String engineName) {
        return engineName == null || engineName.isBlank() ? UNKNOWN_ENGINE : engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
