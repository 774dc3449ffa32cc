package com.example.redaction.infrastructure.exception;

/**
 * Signals that a single PDF page could not be analyzed. Callers degrade the page to an empty layout.
 */
public class LayoutAnalysisException extends InfrastructureException {

    private final int pageIndex;

    public LayoutAnalysisException(int pageIndex, String message, Throwable cause) {
        super(message, cause);
        this.pageIndex = pageIndex;
    }

    public int getPageIndex() {
        return pageIndex;
    }
}
