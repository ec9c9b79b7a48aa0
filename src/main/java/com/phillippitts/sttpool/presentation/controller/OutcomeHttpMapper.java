package com.phillippitts.sttpool.presentation.controller;

import com.phillippitts.sttpool.domain.FailureKind;
import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.presentation.exception.ApiError;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Maps outcomes to HTTP responses so clients can tell "your input was bad" from "the system was
 * overloaded".
 */
final class OutcomeHttpMapper {

    private OutcomeHttpMapper() {
    }

    static HttpStatus statusFor(Outcome outcome) {
        return switch (outcome.kind()) {
            case SUCCESS -> HttpStatus.OK;
            case FAILURE -> outcome.failureKind() == FailureKind.INVALID_INPUT
                    ? HttpStatus.BAD_REQUEST
                    : HttpStatus.UNPROCESSABLE_ENTITY;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case WORKER_CRASHED, QUEUE_TIMEOUT, POOL_UNAVAILABLE, SHUTTING_DOWN, DISABLED ->
                    HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    /**
     * Error body for a non-success outcome.
     *
     * @param stagedPath  server-side path of the staged upload, masked out of the details
     * @param clientName  name the client knows the file by
     */
    static ApiError errorBody(Outcome outcome, String stagedPath, String clientName) {
        String code = outcome.errorType() != null ? outcome.errorType() : outcome.kind().name();
        String details = outcome.message() == null ? "" : outcome.message();
        if (stagedPath != null && !stagedPath.isEmpty()) {
            details = details.replace(stagedPath, clientName == null ? "upload" : clientName);
        }
        return new ApiError(code, summary(outcome), details, Instant.now());
    }

    private static String summary(Outcome outcome) {
        return switch (outcome.kind()) {
            case FAILURE -> outcome.failureKind() == FailureKind.INVALID_INPUT
                    ? "Invalid audio input"
                    : "Transcription failed";
            case TIMEOUT -> "Transcription timed out";
            case WORKER_CRASHED -> "Transcription worker crashed; please retry";
            case QUEUE_TIMEOUT -> "Service overloaded; please retry later";
            case POOL_UNAVAILABLE -> "Transcription workers unavailable";
            case SHUTTING_DOWN -> "Service is shutting down";
            case DISABLED -> "Transcription is disabled";
            case SUCCESS -> "OK";
        };
    }
}
