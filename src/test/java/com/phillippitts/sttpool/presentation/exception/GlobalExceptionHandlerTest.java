package com.phillippitts.sttpool.presentation.exception;

import com.phillippitts.sttpool.exception.InvalidAudioException;
import com.phillippitts.sttpool.exception.ModelNotFoundException;
import com.phillippitts.sttpool.exception.TranscriptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidAudioReturns400WithReason() {
        ResponseEntity<ApiError> response = handler.handleInvalidAudio(new InvalidAudioException(0, "Uploaded file is empty"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidAudioException");
        assertThat(response.getBody().details()).isEqualTo("Uploaded file is empty");
    }

    @Test
    void missingParameterReturns400() {
        ResponseEntity<ApiError> response = handler.handleMissingPart(
                new MissingServletRequestParameterException("file", "MultipartFile"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("MissingParameter");
    }

    @Test
    void oversizedUploadReturns413() {
        ResponseEntity<ApiError> response = handler.handleTooLarge(new MaxUploadSizeExceededException(1024));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @Test
    void stagingFailureDoesNotExposePath() {
        ResponseEntity<ApiError> response = handler.handleIo(new IOException("/var/tmp/secret/stt-upload-1.wav: disk full"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("UploadStagingFailed");
        assertThat(response.getBody().toString()).doesNotContain("/var/tmp/secret");
    }

    @Test
    void serviceErrorsReturn503WithoutInternals() {
        ResponseEntity<ApiError> model = handler.handleService(new ModelNotFoundException("vosk", "/secret/internal/model"));
        ResponseEntity<ApiError> engine = handler.handleService(
                new TranscriptionException("database password: secret123", "vosk"));

        assertThat(model.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(model.getBody().errorCode()).isEqualTo("ModelNotFoundException");
        assertThat(model.getBody().toString()).doesNotContain("/secret/internal");
        assertThat(engine.getBody().toString()).doesNotContain("secret123").contains("retry");
    }

    @Test
    void unexpectedReturns500WithGenericBody() {
        Instant before = Instant.now();

        ResponseEntity<ApiError> response = handler.handleUnexpected(new IllegalStateException("Bad state"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("IllegalStateException").doesNotContain("Bad state");
        assertThat(response.getBody().timestamp()).isAfterOrEqualTo(before);
    }
}
