package com.example.redaction.interfaces.api;

import com.example.redaction.application.service.RedactionEngine;
import com.example.redaction.domain.exception.DocumentFileRequiredException;
import com.example.redaction.domain.exception.InvalidRedactionRequestException;
import com.example.redaction.domain.model.AcceptedRedactionSet;
import com.example.redaction.domain.model.ContextualMatch;
import com.example.redaction.domain.model.RedactionKind;
import com.example.redaction.domain.model.RedactionRequest;
import com.example.redaction.domain.model.RedactionResult;
import com.example.redaction.infrastructure.exception.FileStoreException;
import com.example.redaction.infrastructure.file.SecureFileStore;
import com.example.redaction.interfaces.api.dto.ContextualMatchRequest;
import com.example.redaction.interfaces.api.dto.PreviewResponse;
import com.example.redaction.interfaces.api.dto.RedactionRequestDto;
import com.example.redaction.interfaces.api.dto.RedactionResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

/**
 * Interfaces-layer REST controller exposing preview, suggestion, contextual search and redaction.
 * Uploads are spooled to owner-only temp files that are securely deleted when the call returns.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class RedactionController {

    private static final Logger log = LoggerFactory.getLogger(RedactionController.class);

    private final RedactionEngine engine;
    private final SecureFileStore fileStore;

    /**
     * @param engine    redaction workflow
     * @param fileStore temp file handling for uploads and output
     */
    public RedactionController(RedactionEngine engine, SecureFileStore fileStore) {
        this.engine = engine;
        this.fileStore = fileStore;
    }

    /**
     * @param file uploaded document
     * @return extracted text and, for PDFs, the layout summary
     */
    @PostMapping("/preview")
    public ResponseEntity<PreviewResponse> preview(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(withUpload(file, path -> PreviewResponse.from(engine.preview(path))));
    }

    /**
     * @param file        uploaded document
     * @param sensitivity 0..100, defaults to 50
     * @return candidate redactions
     */
    @PostMapping("/suggestions")
    public ResponseEntity<List<RedactionRequestDto>> suggestions(@RequestParam("file") MultipartFile file,
                                                                 @RequestParam(value = "sensitivity", defaultValue = "50") int sensitivity) {
        List<RedactionRequest> suggestions = withUpload(file, path -> engine.suggest(path, sensitivity));
        return ResponseEntity.ok(suggestions.stream().map(RedactionRequestDto::from).toList());
    }

    /**
     * @param request document text, seed literal and its kind
     * @return proposals for the operator to accept or ignore
     */
    @PostMapping(value = "/contextual-matches", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ContextualMatch>> contextualMatches(@RequestBody ContextualMatchRequest request) {
        RedactionKind kind = RedactionKind.fromString(request.kind());
        return ResponseEntity.ok(engine.findContextual(request.documentText(), request.seedText(), kind));
    }

    /**
     * @param file       uploaded document
     * @param redactions accepted redactions as a JSON part
     * @return verified redacted content and its audit report
     */
    @PostMapping(value = "/redact", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RedactionResponse> redact(@RequestPart("file") MultipartFile file,
                                                    @RequestPart(value = "redactions", required = false) List<RedactionRequestDto> redactions) {
        AcceptedRedactionSet accepted = toAcceptedSet(redactions);
        RedactionResponse response = withUpload(file, input -> {
            Path outputDirectory = fileStore.createTempDirectory();
            Path output = outputDirectory.resolve("redacted-" + input.getFileName());
            try {
                RedactionResult result = engine.redact(input, accepted, output);
                return RedactionResponse.from(output.getFileName().toString(), result);
            } finally {
                cleanUp(output);
            }
        });
        return ResponseEntity.ok(response);
    }

    private static AcceptedRedactionSet toAcceptedSet(List<RedactionRequestDto> redactions) {
        if (redactions == null) {
            return AcceptedRedactionSet.empty();
        }
        AcceptedRedactionSet accepted = AcceptedRedactionSet.empty();
        for (RedactionRequestDto dto : redactions) {
            if (dto == null) {
                throw new InvalidRedactionRequestException("Redaction entries must not be null.");
            }
            accepted = accepted.accept(dto.toDomain());
        }
        return accepted;
    }

    private <T> T withUpload(MultipartFile file, Function<Path, T> action) {
        if (file == null || file.isEmpty()) {
            throw new DocumentFileRequiredException();
        }
        Path spooled;
        try (InputStream in = file.getInputStream()) {
            spooled = fileStore.spool(in, file.getOriginalFilename());
        } catch (IOException e) {
            throw new FileStoreException("Unable to read the uploaded file.", e);
        }
        try {
            return action.apply(spooled);
        } finally {
            cleanUp(spooled);
        }
    }

    /**
     * Cleanup runs in {@code finally} blocks; a failure here must not hide the outcome of the request.
     */
    private void cleanUp(Path file) {
        try {
            fileStore.deleteSpooled(file);
        } catch (FileStoreException e) {
            log.warn("Unable to securely delete temp file {}", file, e);
        }
    }
}
