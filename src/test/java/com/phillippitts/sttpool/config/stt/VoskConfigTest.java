package com.phillippitts.sttpool.config.stt;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoskConfigTest {

    private Validator validator;

    @BeforeEach
    void setup() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @AfterEach
    void clearProperties() {
        System.clearProperty(VoskConfig.PROP_MODEL_PATH);
        System.clearProperty(VoskConfig.PROP_SAMPLE_RATE);
        System.clearProperty(VoskConfig.PROP_MAX_ALTERNATIVES);
    }

    @Test
    void shouldUseDefaults() {
        VoskConfig config = new VoskConfig();

        assertThat(config.modelPath()).isEqualTo("models/vosk-model-small-en-us-0.15");
        assertThat(config.sampleRate()).isEqualTo(16_000);
        assertThat(config.maxAlternatives()).isEqualTo(1);
        assertThat(validator.validate(config)).isEmpty();
    }

    @Test
    void shouldRejectBlankModelPath() {
        Set<ConstraintViolation<VoskConfig>> violations = validator.validate(new VoskConfig("", 16_000, 1));

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("model path must not be blank");
    }

    @Test
    void shouldRejectNonPositiveNumbers() {
        assertThat(validator.validate(new VoskConfig("models/vosk", -1, 1))).hasSize(1);
        assertThat(validator.validate(new VoskConfig("models/vosk", 16_000, 0))).hasSize(1);
    }

    @Test
    void shouldRenderSystemPropertiesForWorkerCommandLine() {
        VoskConfig config = new VoskConfig("/opt/models/en", 8_000, 3);

        assertThat(config.toSystemProperties()).containsExactly(
                "-Dstt.vosk.model-path=/opt/models/en",
                "-Dstt.vosk.sample-rate=8000",
                "-Dstt.vosk.max-alternatives=3");
    }

    @Test
    void shouldReadBackFromSystemProperties() {
        System.setProperty(VoskConfig.PROP_MODEL_PATH, "/opt/models/en");
        System.setProperty(VoskConfig.PROP_SAMPLE_RATE, "8000");

        VoskConfig config = VoskConfig.fromSystemProperties();

        assertThat(config).isEqualTo(new VoskConfig("/opt/models/en", 8_000, 1));
    }

    @Test
    void shouldFailOnNonNumericSampleRate() {
        System.setProperty(VoskConfig.PROP_SAMPLE_RATE, "fast");

        assertThatThrownBy(VoskConfig::fromSystemProperties).isInstanceOf(NumberFormatException.class);
    }
}
