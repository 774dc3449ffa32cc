package com.example.redaction.domain.exception;

/**
 * Raised when a caller attempts to process a null {@link java.nio.file.Path}.
 * Keeps the domain layer strict about explicit file references.
 */
public class DocumentPathRequiredException extends DocumentInputException {

	/**
	 * Creates the exception with a predefined error message.
	 */
    public DocumentPathRequiredException() {
        super("Document path is required.");
    }
}
