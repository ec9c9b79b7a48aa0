package com.phillippitts.sttpool.exception;

/**
 * An input file is missing, unreadable, or not audio the work function accepts
 * (RIFF/WAVE, 16-bit signed PCM, mono, at the configured sample rate).
 *
 * <p>Reported as an {@code INVALID_INPUT} failure by workers and as HTTP 400 by the API.
 */
public class InvalidAudioException extends SttPoolException {

    /** Size reported when the file could not be read at all. */
    public static final long UNKNOWN_SIZE = -1L;

    private final long sizeBytes;
    private final String reason;

    public InvalidAudioException(String reason) {
        this(UNKNOWN_SIZE, reason);
    }

    public InvalidAudioException(long sizeBytes, String reason) {
        super(sizeBytes == UNKNOWN_SIZE
                ? "Rejected audio: " + reason
                : "Rejected audio (" + sizeBytes + " bytes): " + reason);
        this.sizeBytes = sizeBytes;
        this.reason = reason;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public String getReason() {
        return reason;
    }
}
