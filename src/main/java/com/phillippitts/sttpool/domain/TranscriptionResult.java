package com.phillippitts.sttpool.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable result of one transcription, as produced by a work function inside a worker process.
 *
 * @param text              the transcribed text (must not be null)
 * @param detectedLanguage  language reported by the engine, or the requested one
 * @param segments          recognized segments in audio order (may be empty)
 * @param speakerCount      number of distinct speakers, or null when the engine does not diarize
 * @param confidenceAverage mean segment confidence between 0.0 and 1.0
 * @param processingTimeMs  wall time spent inside the work function
 */
public record TranscriptionResult(
        String text,
        String detectedLanguage,
        List<TranscriptionSegment> segments,
        Integer speakerCount,
        double confidenceAverage,
        long processingTimeMs
) {

    /**
     * Compact constructor with validation.
     *
     * <p>Note: Empty text is valid (e.g., silence or unclear audio may produce no transcription).
     *
     * @throws IllegalArgumentException if confidence is out of range or processing time is negative
     * @throws NullPointerException if text or detectedLanguage is null
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        Objects.requireNonNull(detectedLanguage, "Detected language must not be null");
        segments = segments == null ? List.of() : List.copyOf(segments);
        if (confidenceAverage < 0.0 || confidenceAverage > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidenceAverage
            );
        }
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("Processing time must not be negative: " + processingTimeMs);
        }
    }

    /**
     * Creates a result without segments, for engines that only report text and confidence.
     *
     * @param text       The transcribed text
     * @param language   Language of the text
     * @param confidence Confidence score between 0.0 and 1.0
     * @param processingTimeMs time spent transcribing
     * @return A new TranscriptionResult instance
     */
    public static TranscriptionResult of(String text, String language, double confidence, long processingTimeMs) {
        return new TranscriptionResult(text, language, List.of(), null, confidence, processingTimeMs);
    }
}
