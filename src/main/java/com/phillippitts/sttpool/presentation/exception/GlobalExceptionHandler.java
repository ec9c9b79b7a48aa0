package com.phillippitts.sttpool.presentation.exception;

import com.phillippitts.sttpool.exception.InvalidAudioException;
import com.phillippitts.sttpool.exception.SttPoolException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.time.Instant;

/**
 * Global exception handler for the REST API boundary.
 *
 * <p>Pool conditions reach clients as outcomes, not exceptions (see {@code OutcomeHttpMapper}).
 * What remains here is request validation, upload handling and anything unexpected. Internal
 * details (paths, stack traces) are logged, never returned.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getSizeBytes(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid audio", ex.getReason());
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleMissingPart(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "MissingParameter", "Malformed request", ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload rejected: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "PayloadTooLarge", "Uploaded file is too large",
                "Maximum upload size exceeded");
    }

    /**
     * Upload could not be staged for a worker (HTTP 500).
     */
    @ExceptionHandler(IOException.class)
    ResponseEntity<ApiError> handleIo(IOException ex) {
        LOG.error("Failed to stage upload", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "UploadStagingFailed", "Could not store the uploaded file",
                "Please retry");
    }

    @ExceptionHandler(SttPoolException.class)
    ResponseEntity<ApiError> handleService(SttPoolException ex) {
        LOG.error("Service error", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Transcription service temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }
}
