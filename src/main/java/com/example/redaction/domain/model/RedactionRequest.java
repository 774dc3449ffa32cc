package com.example.redaction.domain.model;

import com.example.redaction.domain.exception.InvalidRedactionRequestException;

import java.util.Objects;

/**
 * A literal the operator (or a suggestion provider) wants removed from a document.
 * Two requests are equal when they carry the same text and kind; confidence and reason are
 * opaque metadata that the engine never uses to make decisions.
 */
public record RedactionRequest(String text, RedactionKind kind, int confidence, String reason) {

    public RedactionRequest {
        if (text == null || text.isBlank()) {
            throw new InvalidRedactionRequestException("Redaction text must not be blank.");
        }
        if (kind == null) {
            throw new InvalidRedactionRequestException("Redaction kind is required.");
        }
        if (confidence < 0 || confidence > 100) {
            throw new InvalidRedactionRequestException("Confidence must be between 0 and 100 but was " + confidence + ".");
        }
        reason = reason == null ? "" : reason;
    }

    /**
     * Shortcut for a manually entered redaction.
     */
    public static RedactionRequest of(String text, RedactionKind kind) {
        return new RedactionRequest(text, kind, 100, "");
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RedactionRequest request)) {
            return false;
        }
        return text.equals(request.text) && kind == request.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, kind);
    }
}
