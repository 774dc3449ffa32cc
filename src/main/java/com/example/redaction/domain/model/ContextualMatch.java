package com.example.redaction.domain.model;

import com.example.redaction.domain.exception.InvalidRedactionRequestException;

/**
 * A textually different but related occurrence proposed for a seed redaction, e.g. {@code "Mr. Smith"}
 * for {@code "Bob Smith"}. It only becomes a redaction once the operator accepts it.
 */
public record ContextualMatch(String text, int confidence, String reason) {

    public ContextualMatch {
        if (text == null || text.isBlank()) {
            throw new InvalidRedactionRequestException("Contextual match text must not be blank.");
        }
        if (confidence < 0 || confidence > 100) {
            throw new InvalidRedactionRequestException("Confidence must be between 0 and 100 but was " + confidence + ".");
        }
        reason = reason == null ? "" : reason;
    }
}
