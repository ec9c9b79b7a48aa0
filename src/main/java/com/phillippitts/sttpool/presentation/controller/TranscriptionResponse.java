package com.phillippitts.sttpool.presentation.controller;

import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.TranscriptionSegment;

import java.util.List;

/**
 * Successful transcription response body.
 */
record TranscriptionResponse(
        String id,
        String text,
        String detectedLanguage,
        List<TranscriptionSegment> segments,
        Integer speakerCount,
        double confidenceAverage,
        long processingTimeMs
) {

    static TranscriptionResponse from(Outcome outcome) {
        TranscriptionResult result = outcome.result();
        return new TranscriptionResponse(outcome.workId(), result.text(), result.detectedLanguage(),
                result.segments(), result.speakerCount(), result.confidenceAverage(), result.processingTimeMs());
    }
}
