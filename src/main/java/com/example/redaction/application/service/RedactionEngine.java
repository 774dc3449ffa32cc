package com.example.redaction.application.service;

import com.example.redaction.application.exception.RedactionVerificationException;
import com.example.redaction.application.exception.UseCaseValidationException;
import com.example.redaction.application.layout.LayoutAnalyzer;
import com.example.redaction.application.match.MatchResolver;
import com.example.redaction.domain.exception.RedactionRequestRequiredException;
import com.example.redaction.domain.model.AcceptedRedactionSet;
import com.example.redaction.domain.model.ContextualMatch;
import com.example.redaction.domain.model.Document;
import com.example.redaction.domain.model.DocumentLayout;
import com.example.redaction.domain.model.DocumentPreview;
import com.example.redaction.domain.model.FormatKind;
import com.example.redaction.domain.model.RedactedArtifact;
import com.example.redaction.domain.model.RedactionKind;
import com.example.redaction.domain.model.RedactionRequest;
import com.example.redaction.domain.model.RedactionResult;
import com.example.redaction.domain.model.VerificationVerdict;
import com.example.redaction.infrastructure.detect.FileTypeResolver;
import com.example.redaction.infrastructure.exception.FileStoreException;
import com.example.redaction.infrastructure.extract.DocumentTextExtractor;
import com.example.redaction.infrastructure.file.SecureFileStore;
import com.example.redaction.infrastructure.report.RedactionReportGenerator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Application-layer entry point of the redaction workflow.
 * <p>
 * {@link #redact(Path, AcceptedRedactionSet, Path)} applies the accepted redactions to a working copy, writes
 * it to an owner-only temp file next to the output, re-extracts and verifies that file, and only then moves it
 * onto the output path. Every failure securely deletes the temp file, so the output path either holds a
 * verified artifact or is left exactly as it was.
 */
@Service
public class RedactionEngine {

    private static final Logger log = LoggerFactory.getLogger(RedactionEngine.class);

    private final FileTypeResolver fileTypeResolver;
    private final DocumentTextExtractor textExtractor;
    private final LayoutAnalyzer layoutAnalyzer;
    private final MatchResolver matchResolver;
    private final RedactionApplier applier;
    private final RedactionVerifier verifier;
    private final SecureFileStore fileStore;
    private final RedactionReportGenerator reportGenerator;

    public RedactionEngine(FileTypeResolver fileTypeResolver,
                           DocumentTextExtractor textExtractor,
                           LayoutAnalyzer layoutAnalyzer,
                           MatchResolver matchResolver,
                           RedactionApplier applier,
                           RedactionVerifier verifier,
                           SecureFileStore fileStore,
                           RedactionReportGenerator reportGenerator) {
        this.fileTypeResolver = fileTypeResolver;
        this.textExtractor = textExtractor;
        this.layoutAnalyzer = layoutAnalyzer;
        this.matchResolver = matchResolver;
        this.applier = applier;
        this.verifier = verifier;
        this.fileStore = fileStore;
        this.reportGenerator = reportGenerator;
    }

    /**
     * Loads a document and extracts the text shown to the operator; PDFs also carry their layout.
     *
     * @param path document to preview
     * @return preview
     */
    public DocumentPreview preview(Path path) {
        Document document = fileTypeResolver.load(path);
        log.info("Previewing {} ({}, {} bytes)", document.fileName(), document.format(), document.size());
        String text = textExtractor.extract(document);
        DocumentLayout layout = document.format() == FormatKind.PDF ? layoutAnalyzer.analyze(document) : null;
        return new DocumentPreview(document.fileName(), document.format(), text, layout);
    }

    /**
     * @param path        document to scan
     * @param sensitivity 0..100
     * @return candidate redactions for the operator to review
     */
    public List<RedactionRequest> suggest(Path path, int sensitivity) {
        Document document = fileTypeResolver.load(path);
        return matchResolver.suggest(textExtractor.extract(document), sensitivity);
    }

    /**
     * @return proposals related to {@code seedText}; none of them is accepted automatically
     */
    public List<ContextualMatch> findContextual(String documentText, String seedText, RedactionKind kind) {
        return matchResolver.findContextual(documentText, seedText, kind);
    }

    /**
     * Applies, verifies and publishes a redaction.
     *
     * @param inputPath  document to redact; opened read-only
     * @param redactions accepted redactions; must not be empty
     * @param outputPath where the verified artifact is published
     * @return published path, verified artifact and audit report
     * @throws RedactionRequestRequiredException when no redaction was accepted
     * @throws UseCaseValidationException        when the output path is missing or equal to the input
     * @throws RedactionVerificationException    when accepted text is still recoverable from the output
     */
    public RedactionResult redact(Path inputPath, AcceptedRedactionSet redactions, Path outputPath) {
        if (redactions == null || redactions.isEmpty()) {
            throw new RedactionRequestRequiredException();
        }
        if (outputPath == null) {
            throw new UseCaseValidationException("An output path is required.");
        }
        Document document = fileTypeResolver.load(inputPath);
        if (inputPath.toAbsolutePath().normalize().equals(outputPath.toAbsolutePath().normalize())) {
            throw new UseCaseValidationException("The output path must differ from the input path.");
        }
        log.info("Redacting {} ({}) with {} accepted redaction(s)", document.fileName(), document.format(), redactions.size());

        byte[] redacted = applier.apply(document, redactions);
        RedactedArtifact artifact = verifyAndPublish(document, redacted, redactions, outputPath);

        String report = reportGenerator.createReport(inputPath, outputPath, redactions);
        log.info("Published verified redaction of {} ({} bytes)", document.fileName(), artifact.size());
        return new RedactionResult(outputPath, artifact, report);
    }

    private RedactedArtifact verifyAndPublish(Document document,
                                              byte[] redacted,
                                              AcceptedRedactionSet redactions,
                                              Path outputPath) {
        Path temp = fileStore.createTempFileNextTo(outputPath);
        try {
            fileStore.write(temp, redacted);
            byte[] written = fileStore.read(temp);
            VerificationVerdict verdict = verifier.verify(written, document.format(), redactions, document.fileName());
            if (!verdict.isVerified()) {
                throw new RedactionVerificationException(document.fileName(), verdict.survivingTexts());
            }
            fileStore.publish(temp, outputPath);
            return new RedactedArtifact(written, document.format(), redactions, verdict);
        } catch (RuntimeException e) {
            discard(temp, e);
            throw e;
        }
    }

    private void discard(Path temp, RuntimeException failure) {
        try {
            fileStore.secureDelete(temp);
        } catch (FileStoreException e) {
            failure.addSuppressed(e);
        }
    }
}
