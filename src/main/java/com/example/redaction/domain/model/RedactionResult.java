package com.example.redaction.domain.model;

import java.nio.file.Path;

/**
 * Successful, verified redaction: where the artifact was published and the audit report describing it.
 */
public record RedactionResult(Path outputPath, RedactedArtifact artifact, String report) {
}
