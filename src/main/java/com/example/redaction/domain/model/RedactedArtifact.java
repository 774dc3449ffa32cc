package com.example.redaction.domain.model;

import java.util.Arrays;

/**
 * Redacted output bytes together with the accepted set that produced them and their verification verdict.
 */
public record RedactedArtifact(byte[] content, FormatKind format, AcceptedRedactionSet redactions, VerificationVerdict verdict) {

    public RedactedArtifact {
        content = Arrays.copyOf(content, content.length);
    }

    @Override
    public byte[] content() {
        return Arrays.copyOf(content, content.length);
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RedactedArtifact artifact)) {
            return false;
        }
        return Arrays.equals(content, artifact.content)
                && format == artifact.format
                && redactions.equals(artifact.redactions)
                && verdict.equals(artifact.verdict);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(content);
        result = 31 * result + format.hashCode();
        result = 31 * result + redactions.hashCode();
        return 31 * result + verdict.hashCode();
    }

    @Override
    public String toString() {
        return "RedactedArtifact[" + format + ", " + content.length + " bytes, " + verdict.status() + "]";
    }
}
