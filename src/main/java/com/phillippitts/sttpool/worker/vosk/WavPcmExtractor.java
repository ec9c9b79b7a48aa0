package com.phillippitts.sttpool.worker.vosk;

import com.phillippitts.sttpool.exception.InvalidAudioException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.phillippitts.sttpool.worker.vosk.AudioFormat.MIN_WAV_BYTES;
import static com.phillippitts.sttpool.worker.vosk.AudioFormat.PCM_FORMAT_TAG;
import static com.phillippitts.sttpool.worker.vosk.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.sttpool.worker.vosk.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.sttpool.worker.vosk.AudioFormat.REQUIRED_CHANNELS;

/**
 * Validates a RIFF/WAVE file and returns its raw PCM payload.
 *
 * <p>Walks the chunk list rather than assuming a 44-byte header, so files with LIST/fact chunks
 * before {@code data} are accepted.
 */
final class WavPcmExtractor {

    private static final int RIFF_HEADER_SIZE = 12;
    private static final int CHUNK_HEADER_SIZE = 8;
    private static final int FMT_CHUNK_MIN_SIZE = 16;

    private WavPcmExtractor() {
    }

    /**
     * Extracts PCM from a WAV file.
     *
     * @param wav         full file contents
     * @param sampleRate  sample rate the recognizer is configured for
     * @return PCM bytes (16-bit LE mono)
     * @throws InvalidAudioException if the container or its format does not match
     */
    static byte[] extractPcm(byte[] wav, int sampleRate) {
        if (wav == null || wav.length < MIN_WAV_BYTES) {
            throw new InvalidAudioException(wav == null ? 0 : wav.length, "File too small to be WAV");
        }
        if (!"RIFF".equals(readChunkId(wav, 0)) || !"WAVE".equals(readChunkId(wav, 8))) {
            throw new InvalidAudioException(wav.length, "Not a RIFF/WAVE file");
        }

        int offset = RIFF_HEADER_SIZE;
        boolean fmtSeen = false;
        while (offset + CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = readChunkId(wav, offset);
            int chunkSize = readLEInt(wav, offset + 4);
            int body = offset + CHUNK_HEADER_SIZE;
            if (chunkSize < 0 || body + chunkSize > wav.length) {
                throw new InvalidAudioException(wav.length, "Invalid chunk size: " + chunkSize + " at offset " + offset);
            }

            if ("fmt ".equals(chunkId)) {
                validateFmtChunk(wav, body, chunkSize, sampleRate);
                fmtSeen = true;
            } else if ("data".equals(chunkId)) {
                if (!fmtSeen) {
                    throw new InvalidAudioException(wav.length, "data chunk precedes fmt chunk");
                }
                if (chunkSize % REQUIRED_BLOCK_ALIGN != 0) {
                    throw new InvalidAudioException(wav.length, "WAV data not aligned to block size ("
                            + REQUIRED_BLOCK_ALIGN + " bytes). Size: " + chunkSize);
                }
                if (chunkSize == 0) {
                    throw new InvalidAudioException(wav.length, "WAV data chunk is empty");
                }
                return Arrays.copyOfRange(wav, body, body + chunkSize);
            }

            offset = body + chunkSize + (chunkSize % 2);
        }
        throw new InvalidAudioException(wav.length, fmtSeen ? "Missing data chunk in WAV file"
                : "Missing fmt chunk in WAV file");
    }

    private static void validateFmtChunk(byte[] wav, int offset, int size, int sampleRate) {
        if (size < FMT_CHUNK_MIN_SIZE) {
            throw new InvalidAudioException(wav.length, "fmt chunk too small: " + size + " bytes");
        }
        int formatTag = readLEShort(wav, offset);
        int channels = readLEShort(wav, offset + 2);
        int rate = readLEInt(wav, offset + 4);
        int blockAlign = readLEShort(wav, offset + 12);
        int bitsPerSample = readLEShort(wav, offset + 14);

        if (formatTag != PCM_FORMAT_TAG) {
            throw new InvalidAudioException(wav.length, "Unsupported audio format: " + formatTag + " (expected PCM)");
        }
        if (channels != REQUIRED_CHANNELS) {
            throw new InvalidAudioException(wav.length, "Invalid channel count: " + channels
                    + ". Expected: " + REQUIRED_CHANNELS);
        }
        if (rate != sampleRate) {
            throw new InvalidAudioException(wav.length, "Invalid sample rate: " + rate + " Hz. Expected: "
                    + sampleRate + " Hz");
        }
        if (bitsPerSample != REQUIRED_BITS_PER_SAMPLE) {
            throw new InvalidAudioException(wav.length, "Invalid bit depth: " + bitsPerSample
                    + "-bit. Expected: " + REQUIRED_BITS_PER_SAMPLE + "-bit");
        }
        if (blockAlign != REQUIRED_BLOCK_ALIGN) {
            throw new InvalidAudioException(wav.length, "Invalid block align: " + blockAlign
                    + ". Expected: " + REQUIRED_BLOCK_ALIGN);
        }
    }

    private static String readChunkId(byte[] wav, int offset) {
        if (offset + 4 > wav.length) {
            return "";
        }
        return new String(wav, offset, 4, StandardCharsets.US_ASCII);
    }

    private static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    private static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }
}
