package com.phillippitts.sttpool.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Configuration properties for the Vosk work function.
 * Binds to properties prefixed with "stt.vosk" in the coordinator.
 *
 * <p>Worker processes have no Spring context, so the coordinator forwards these values on the
 * worker command line as {@code -D} system properties ({@link #toSystemProperties()}) and the
 * worker reads them back with {@link #fromSystemProperties()}.
 *
 * <p>Example application.properties:
 * <pre>
 * stt.vosk.model-path=models/vosk-model-small-en-us-0.15
 * stt.vosk.sample-rate=16000
 * stt.vosk.max-alternatives=1
 * </pre>
 *
 * @param modelPath Path to the Vosk model directory (must exist in the worker's working directory)
 * @param sampleRate Audio sample rate in Hz (typically 16000)
 * @param maxAlternatives Maximum number of alternative transcriptions to return
 */
@ConfigurationProperties(prefix = "stt.vosk")
@Validated
public record VoskConfig(
        @NotBlank(message = "Vosk model path must not be blank")
        String modelPath,

        @Positive(message = "Sample rate must be positive")
        int sampleRate,

        @Positive(message = "Max alternatives must be positive")
        int maxAlternatives
) {

    public static final String PROP_MODEL_PATH = "stt.vosk.model-path";
    public static final String PROP_SAMPLE_RATE = "stt.vosk.sample-rate";
    public static final String PROP_MAX_ALTERNATIVES = "stt.vosk.max-alternatives";

    static final String DEFAULT_MODEL_PATH = "models/vosk-model-small-en-us-0.15";
    static final int DEFAULT_SAMPLE_RATE = 16_000;
    static final int DEFAULT_MAX_ALTERNATIVES = 1;

    @ConstructorBinding
    public VoskConfig {
    }

    /**
     * Default constructor with standard values.
     */
    public VoskConfig() {
        this(DEFAULT_MODEL_PATH, DEFAULT_SAMPLE_RATE, DEFAULT_MAX_ALTERNATIVES);
    }

    /**
     * Reads the configuration inside a worker process, falling back to defaults for absent keys.
     *
     * @throws NumberFormatException if a numeric property is present but not an integer
     */
    public static VoskConfig fromSystemProperties() {
        return new VoskConfig(
                System.getProperty(PROP_MODEL_PATH, DEFAULT_MODEL_PATH),
                Integer.parseInt(System.getProperty(PROP_SAMPLE_RATE, String.valueOf(DEFAULT_SAMPLE_RATE))),
                Integer.parseInt(System.getProperty(PROP_MAX_ALTERNATIVES,
                        String.valueOf(DEFAULT_MAX_ALTERNATIVES)))
        );
    }

    /**
     * Renders this configuration as JVM {@code -D} arguments for a worker command line.
     */
    public List<String> toSystemProperties() {
        return List.of(
                "-D" + PROP_MODEL_PATH + "=" + modelPath,
                "-D" + PROP_SAMPLE_RATE + "=" + sampleRate,
                "-D" + PROP_MAX_ALTERNATIVES + "=" + maxAlternatives
        );
    }
}
