package com.example.redaction.domain.model;

/**
 * Document formats the engine knows how to extract, redact and verify.
 */
public enum FormatKind {
    PDF,
    DOCX,
    TEXT;

    /**
     * @return file suffix used for temp files and download names
     */
    public String defaultExtension() {
        return switch (this) {
            case PDF -> ".pdf";
            case DOCX -> ".docx";
            case TEXT -> ".txt";
        };
    }
}
