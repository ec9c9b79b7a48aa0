package com.phillippitts.sttpool.exception;

/**
 * Base exception for all stt-pool application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SttPoolException extends RuntimeException {

    public SttPoolException(String message) {
        super(message);
    }

    public SttPoolException(String message, Throwable cause) {
        super(message, cause);
    }

    public SttPoolException(Throwable cause) {
        super(cause);
    }
}
