package com.example.redaction.infrastructure.report;

import com.example.redaction.domain.model.AcceptedRedactionSet;

import java.nio.file.Path;

/**
 * Produces the human-readable audit record of a verified redaction.
 */
public interface RedactionReportGenerator {

    /**
     * @param originalPath input document
     * @param redactedPath published, verified output
     * @param redactions   accepted set that was applied
     * @return report text
     */
    String createReport(Path originalPath, Path redactedPath, AcceptedRedactionSet redactions);
}
