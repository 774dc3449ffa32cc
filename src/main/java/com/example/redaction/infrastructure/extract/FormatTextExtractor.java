package com.example.redaction.infrastructure.extract;

import com.example.redaction.domain.model.FormatKind;

/**
 * Format-specific adapter that turns document bytes into the flat text used for matching and verification.
 * Implementations must be pure: the same bytes always yield the same text.
 */
public interface FormatTextExtractor {

    FormatKind format();

    /**
     * @param content  document bytes; never modified
     * @param fileName logical name used in error messages
     * @return flat text of the document
     * @throws com.example.redaction.infrastructure.exception.DocumentExtractionException when the bytes cannot be parsed
     */
    String extract(byte[] content, String fileName);

    /**
     * Everything a reader of the bytes could recover as text, used to verify a redacted artifact.
     * Formats whose containers hold text outside the flat reading order override this.
     *
     * @param content  document bytes; never modified
     * @param fileName logical name used in error messages
     * @return recoverable text, a superset of {@link #extract(byte[], String)}
     */
    default String recoverableText(byte[] content, String fileName) {
        return extract(content, fileName);
    }
}
