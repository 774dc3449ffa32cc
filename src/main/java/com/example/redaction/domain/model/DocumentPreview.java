package com.example.redaction.domain.model;

/**
 * Flat text view of a document shown to the operator before any redaction is accepted.
 * {@code layout} is only populated for PDFs.
 */
public record DocumentPreview(String fileName, FormatKind format, String text, DocumentLayout layout) {
}
