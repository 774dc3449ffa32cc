package com.example.redaction.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals a document could not be parsed into text.
 * Fatal for the whole document: matching without text is meaningless.
 */
public class DocumentExtractionException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level parser exception
	 */
    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
