package com.example.redaction.domain.exception;

/**
 * Raised when a file is neither a PDF, a Word document nor plain text according to its content and name.
 * Unknown types are rejected rather than guessed.
 */
public class UnsupportedDocumentTypeException extends DocumentInputException {

	/**
	 * @param fileName  original file name supplied by the client
	 * @param mediaType media type detected from the content, may be {@code null}
	 */
    public UnsupportedDocumentTypeException(String fileName, String mediaType) {
        super("Unsupported document type" + (mediaType != null ? " (" + mediaType + ")" : "")
                + (fileName != null ? ": " + fileName : "."));
    }
}
