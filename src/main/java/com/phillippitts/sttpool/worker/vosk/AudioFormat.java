package com.phillippitts.sttpool.worker.vosk;

/**
 * Audio format accepted by the Vosk work function.
 * Required: 16-bit signed PCM, mono, little-endian, in a RIFF/WAVE container.
 */
final class AudioFormat {

    /** Required bits per sample. */
    static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    static final int REQUIRED_CHANNELS = 1;
    /** Bytes per PCM frame. */
    static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS;
    /** WAVE_FORMAT_PCM tag. */
    static final int PCM_FORMAT_TAG = 1;

    /** Minimum bytes of a RIFF header plus one chunk header. */
    static final int MIN_WAV_BYTES = 12 + 8;

    private AudioFormat() {
    }
}
