package com.example.redaction.domain.model;

import com.example.redaction.domain.exception.InvalidRedactionRequestException;

import java.util.Locale;

/**
 * Category attached to a redaction request.
 */
public enum RedactionKind {
    PII,
    CREDENTIALS,
    FINANCIAL,
    CUSTOM;

	/**
	 * Parses a wire value such as {@code "pii"} or {@code " Financial "}.
	 *
	 * @param rawValue value supplied by a caller or a suggestion provider
	 * @return matching kind
	 * @throws InvalidRedactionRequestException when the value is blank or unknown
	 */
    public static RedactionKind fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new InvalidRedactionRequestException("Redaction kind is required.");
        }
        try {
            return RedactionKind.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidRedactionRequestException("Unknown redaction kind: " + rawValue);
        }
    }
}
