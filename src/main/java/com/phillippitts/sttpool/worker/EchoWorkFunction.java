package com.phillippitts.sttpool.worker;

import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.WorkPayload;

/**
 * Diagnostic work function: returns the payload path as the transcript, without touching the file.
 *
 * <p>Useful to verify pool plumbing in a deployment where no model is installed.
 */
public final class EchoWorkFunction implements WorkFunction {

    public static final String NAME = "echo";

    @Override
    public TranscriptionResult execute(WorkPayload payload) {
        return TranscriptionResult.of(payload.audioPath(), payload.language(), 1.0, 0);
    }

    @Override
    public String name() {
        return NAME;
    }
}
