package com.example.redaction.domain.exception;

/**
 * Raised when a document exceeds the configured size ceiling.
 */
public class DocumentTooLargeException extends DocumentInputException {

    private final long sizeBytes;
    private final long limitBytes;

	/**
	 * @param fileName   offending file
	 * @param sizeBytes  actual size of the file
	 * @param limitBytes configured ceiling
	 */
    public DocumentTooLargeException(String fileName, long sizeBytes, long limitBytes) {
        super(String.format("Document %s is %d bytes, which exceeds the %d byte limit.", fileName, sizeBytes, limitBytes));
        this.sizeBytes = sizeBytes;
        this.limitBytes = limitBytes;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }
}
