package com.example.redaction.domain.exception;

/**
 * Raised when an upload is missing or has no content.
 */
public class DocumentFileRequiredException extends DocumentInputException {

    public DocumentFileRequiredException() {
        super("Please upload a PDF, Word or text document.");
    }
}
