package com.phillippitts.sttpool.domain;

import java.util.Objects;

/**
 * One recognized stretch of speech within a transcription.
 *
 * @param text         recognized text (may be empty)
 * @param startSeconds offset of the segment start within the audio
 * @param endSeconds   offset of the segment end within the audio
 * @param confidence   score between 0.0 and 1.0
 * @param speakerId    diarization label, or null when the engine does not diarize
 * @param language     language of the segment, or null when unknown
 */
public record TranscriptionSegment(
        String text,
        double startSeconds,
        double endSeconds,
        double confidence,
        String speakerId,
        String language
) {

    public TranscriptionSegment {
        Objects.requireNonNull(text, "Segment text must not be null");
        if (startSeconds < 0.0 || endSeconds < startSeconds) {
            throw new IllegalArgumentException(
                    "Invalid segment bounds: start=" + startSeconds + ", end=" + endSeconds);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
