package com.phillippitts.sttpool.presentation.controller;

import com.phillippitts.sttpool.config.logging.MdcFilter;
import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.WorkPayload;
import com.phillippitts.sttpool.exception.InvalidAudioException;
import com.phillippitts.sttpool.pool.PoolSnapshot;
import com.phillippitts.sttpool.service.dispatch.TranscriptionDispatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Thin HTTP surface over the {@link TranscriptionDispatcher}.
 *
 * <p>Uploads are staged to a temp file because only a path crosses the process boundary; the file
 * is deleted once the outcome is known.
 */
@RestController
@RequestMapping("/stt")
class TranscriptionController {

    private static final Logger LOG = LogManager.getLogger(TranscriptionController.class);

    private final TranscriptionDispatcher dispatcher;

    TranscriptionController(TranscriptionDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping(path = "/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<?> transcribe(@RequestParam("file") MultipartFile file,
                                 @RequestParam(name = "language", required = false) String language)
            throws IOException {
        if (file.isEmpty()) {
            throw new InvalidAudioException(0, "Uploaded file is empty");
        }
        Path staged = Files.createTempFile("stt-upload-", ".wav");
        try {
            file.transferTo(staged);
            LOG.info("Transcription requested: size={} bytes, language={}", file.getSize(),
                    language == null ? WorkPayload.AUTO_LANGUAGE : language);
            WorkPayload payload = language == null || language.isBlank()
                    ? WorkPayload.of(staged.toString())
                    : WorkPayload.of(staged.toString(), language);
            Outcome outcome = dispatcher.submit(payload, null, ThreadContext.get(MdcFilter.MDC_REQUEST_ID));
            if (outcome.isSuccess()) {
                return ResponseEntity.ok(TranscriptionResponse.from(outcome));
            }
            return ResponseEntity.status(OutcomeHttpMapper.statusFor(outcome))
                    .body(OutcomeHttpMapper.errorBody(outcome, staged.toString(), file.getOriginalFilename()));
        } finally {
            deleteQuietly(staged);
        }
    }

    @GetMapping("/pool")
    ResponseEntity<PoolSnapshot> pool() {
        return ResponseEntity.ok(dispatcher.snapshot());
    }

    private static void deleteQuietly(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            LOG.warn("Could not delete staged upload {}: {}", staged, e.getMessage());
        }
    }
}
