package com.example.redaction.interfaces.api.dto;

import com.example.redaction.domain.model.RedactionKind;
import com.example.redaction.domain.model.RedactionRequest;

/**
 * Wire form of a redaction request; {@code kind} is parsed case-insensitively and a missing confidence
 * means a manual entry (100).
 */
public record RedactionRequestDto(String text, String kind, Integer confidence, String reason) {

    public static RedactionRequestDto from(RedactionRequest request) {
        return new RedactionRequestDto(request.text(), request.kind().name(), request.confidence(), request.reason());
    }

    public RedactionRequest toDomain() {
        return new RedactionRequest(text, RedactionKind.fromString(kind), confidence == null ? 100 : confidence, reason);
    }
}
