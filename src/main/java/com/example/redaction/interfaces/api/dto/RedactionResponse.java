package com.example.redaction.interfaces.api.dto;

import com.example.redaction.domain.model.RedactionResult;

/**
 * Result of a verified redaction; {@code content} is serialized as base64.
 */
public record RedactionResponse(
        String fileName,
        String format,
        byte[] content,
        String verification,
        int redactionCount,
        String report
) {
    public static RedactionResponse from(String fileName, RedactionResult result) {
        return new RedactionResponse(
                fileName,
                result.artifact().format().name(),
                result.artifact().content(),
                result.artifact().verdict().status().name(),
                result.artifact().redactions().size(),
                result.report()
        );
    }
}
