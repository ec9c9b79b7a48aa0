package com.phillippitts.sttpool.worker.vosk;

import com.phillippitts.sttpool.config.stt.VoskConfig;
import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.WorkPayload;
import com.phillippitts.sttpool.exception.InvalidAudioException;
import com.phillippitts.sttpool.exception.ModelNotFoundException;
import com.phillippitts.sttpool.exception.TranscriptionExceptionBuilder;
import com.phillippitts.sttpool.util.TimeUtils;
import com.phillippitts.sttpool.worker.WorkFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Vosk transcription running inside a worker process.
 *
 * <p>The native model is loaded once per worker in {@link #initialize()}; a recognizer is created per
 * call. Native memory that Vosk fails to return is reclaimed when the supervisor recycles the process.
 *
 * <p>Audio contract: a WAV file holding 16-bit signed PCM, mono, at {@link VoskConfig#sampleRate()}.
 */
public class VoskWorkFunction implements WorkFunction {

    private static final Logger LOG = LogManager.getLogger(VoskWorkFunction.class);

    public static final String NAME = "vosk";

    private final VoskConfig config;

    private org.vosk.Model model;

    public VoskWorkFunction(VoskConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public void initialize() {
        LOG.info("Loading Vosk model: modelPath={}, sampleRate={}, maxAlternatives={}",
                config.modelPath(), config.sampleRate(), config.maxAlternatives());
        if (!Files.isDirectory(Path.of(config.modelPath()))) {
            throw new ModelNotFoundException(NAME, config.modelPath());
        }
        try {
            this.model = new org.vosk.Model(config.modelPath());
        } catch (IOException | RuntimeException e) {
            throw TranscriptionExceptionBuilder.create("Failed to initialize Vosk")
                    .engine(NAME)
                    .cause(e)
                    .metadata("modelPath", config.modelPath())
                    .metadata("sampleRate", config.sampleRate())
                    .build();
        }
        LOG.info("Vosk model loaded");
    }

    @Override
    public TranscriptionResult execute(WorkPayload payload) throws IOException {
        if (model == null) {
            throw TranscriptionExceptionBuilder.create("Vosk model not loaded").engine(NAME).build();
        }
        Path audio = Path.of(payload.audioPath());
        if (!Files.isRegularFile(audio)) {
            throw new InvalidAudioException("File not found or not a regular file: " + payload.audioPath());
        }
        byte[] pcm = WavPcmExtractor.extractPcm(Files.readAllBytes(audio), config.sampleRate());

        long started = System.nanoTime();
        String json;
        try (org.vosk.Recognizer recognizer = new org.vosk.Recognizer(model, config.sampleRate())) {
            configureRecognizer(recognizer);
            recognizer.acceptWaveForm(pcm, pcm.length);
            json = recognizer.getFinalResult();
        } catch (IOException | RuntimeException e) {
            throw TranscriptionExceptionBuilder.create("Vosk recognition failed")
                    .engine(NAME)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(started))
                    .metadata("audioPath", payload.audioPath())
                    .build();
        }
        long elapsedMs = TimeUtils.elapsedMillis(started);
        LOG.debug("Vosk returned {} chars of JSON in {} ms", json.length(), elapsedMs);
        return VoskJsonParser.parse(json, payload.language(), elapsedMs);
    }

    // Some Vosk builds lack these setters.
    private void configureRecognizer(org.vosk.Recognizer recognizer) {
        try {
            recognizer.setWords(true);
            if (config.maxAlternatives() > 1) {
                recognizer.setMaxAlternatives(config.maxAlternatives());
            }
        } catch (NoSuchMethodError e) {
            LOG.debug("Recognizer option not supported by this Vosk build: {}", e.getMessage());
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void close() {
        if (model != null) {
            try {
                model.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing Vosk model", e);
            }
            model = null;
        }
    }
}
