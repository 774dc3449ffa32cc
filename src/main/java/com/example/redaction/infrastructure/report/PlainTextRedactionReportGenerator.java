package com.example.redaction.infrastructure.report;

import com.example.redaction.domain.model.AcceptedRedactionSet;
import com.example.redaction.domain.model.RedactionKind;
import com.example.redaction.domain.model.RedactionRequest;
import com.example.redaction.infrastructure.exception.FileStoreException;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * Default audit report: timestamp, both files with their SHA-256 digests, and one line per accepted
 * redaction. The redacted literals themselves are never written, only their length.
 */
@Component
public class PlainTextRedactionReportGenerator implements RedactionReportGenerator {

    private static final int BUFFER_SIZE = 8192;

    private final Clock clock;

    public PlainTextRedactionReportGenerator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String createReport(Path originalPath, Path redactedPath, AcceptedRedactionSet redactions) {
        StringBuilder report = new StringBuilder();
        report.append("Redaction report").append('\n');
        report.append("Generated: ").append(DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock))).append('\n');
        report.append('\n');
        report.append("Original: ").append(originalPath.getFileName()).append('\n');
        report.append("  SHA-256: ").append(sha256(originalPath)).append('\n');
        report.append("Redacted: ").append(redactedPath.getFileName()).append('\n');
        report.append("  SHA-256: ").append(sha256(redactedPath)).append('\n');
        report.append('\n');

        Map<RedactionKind, Integer> perKind = new EnumMap<>(RedactionKind.class);
        for (RedactionRequest request : redactions) {
            perKind.merge(request.kind(), 1, Integer::sum);
        }
        report.append("Redactions: ").append(redactions.size()).append('\n');
        perKind.forEach((kind, count) -> report.append("  ").append(kind).append(": ").append(count).append('\n'));
        report.append('\n');

        int index = 1;
        for (RedactionRequest request : redactions) {
            report.append(index++).append(". ")
                    .append(request.kind())
                    .append(" | confidence ").append(request.confidence())
                    .append(" | ").append(request.text().length()).append(" characters");
            if (!request.reason().isBlank()) {
                report.append(" | reason: ").append(request.reason());
            }
            report.append('\n');
        }
        report.append('\n').append("Status: VERIFIED").append('\n');
        return report.toString();
    }

    static String sha256(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (IOException e) {
            throw new FileStoreException("Unable to hash " + file, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
