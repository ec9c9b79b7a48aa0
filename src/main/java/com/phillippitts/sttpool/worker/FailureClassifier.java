package com.phillippitts.sttpool.worker;

import com.phillippitts.sttpool.domain.FailureKind;
import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.exception.InvalidAudioException;
import com.phillippitts.sttpool.exception.ModelNotFoundException;
import com.phillippitts.sttpool.exception.TranscriptionException;

import java.io.FileNotFoundException;
import java.nio.file.NoSuchFileException;

/**
 * Maps an exception raised by a {@link WorkFunction} to a FAILURE {@link Outcome}.
 *
 * <p>Only {@link Exception}s are classified. {@link Error}s are not work-level failures and are left
 * to terminate the worker process.
 */
public final class FailureClassifier {

    /** Cap for the message carried back to the supervisor. */
    static final int MAX_MESSAGE_CHARS = 1024;

    private FailureClassifier() {
    }

    public static Outcome classify(String workId, Exception e) {
        return Outcome.failure(workId, kindOf(e), e.getClass().getSimpleName(), messageOf(e));
    }

    static FailureKind kindOf(Exception e) {
        if (e instanceof InvalidAudioException
                || e instanceof IllegalArgumentException
                || e instanceof NoSuchFileException
                || e instanceof FileNotFoundException) {
            return FailureKind.INVALID_INPUT;
        }
        if (e instanceof TranscriptionException || e instanceof ModelNotFoundException) {
            return FailureKind.ENGINE_ERROR;
        }
        return FailureKind.UNEXPECTED;
    }

    private static String messageOf(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getName();
        }
        return message.length() <= MAX_MESSAGE_CHARS ? message : message.substring(0, MAX_MESSAGE_CHARS);
    }
}
