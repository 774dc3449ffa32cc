package com.example.redaction.interfaces.api.dto;

/**
 * Body of a contextual match search.
 */
public record ContextualMatchRequest(String documentText, String seedText, String kind) {
}
