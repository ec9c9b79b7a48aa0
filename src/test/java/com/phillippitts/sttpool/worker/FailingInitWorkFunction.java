package com.phillippitts.sttpool.worker;

import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.WorkPayload;
import com.phillippitts.sttpool.exception.ModelNotFoundException;

/**
 * Work function whose initialization always fails, as with a missing model.
 */
public class FailingInitWorkFunction implements WorkFunction {

    @Override
    public void initialize() {
        throw new ModelNotFoundException("scripted", "/nonexistent/model");
    }

    @Override
    public TranscriptionResult execute(WorkPayload payload) {
        throw new IllegalStateException("never initialized");
    }

    @Override
    public String name() {
        return "failing-init";
    }
}
