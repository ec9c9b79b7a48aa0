package com.phillippitts.sttpool.exception;

/**
 * Thrown when a line read from a worker channel is not a valid protocol message.
 */
public class WorkerProtocolException extends SttPoolException {

    public WorkerProtocolException(String message) {
        super(message);
    }

    public WorkerProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
