package com.example.redaction.application.match;

import com.example.redaction.domain.exception.InvalidRedactionRequestException;
import com.example.redaction.domain.model.AcceptedRedactionSet;
import com.example.redaction.domain.model.ContextualMatch;
import com.example.redaction.domain.model.Occurrence;
import com.example.redaction.domain.model.RedactionKind;
import com.example.redaction.domain.model.RedactionRequest;
import com.example.redaction.domain.service.OccurrenceFinder;
import com.example.redaction.infrastructure.suggest.SuggestionProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds where accepted redactions occur in flat text and brokers candidate and contextual suggestions.
 */
@Service
public class MatchResolver {

    private static final Logger log = LoggerFactory.getLogger(MatchResolver.class);

    private final SuggestionProvider suggestionProvider;

    public MatchResolver(SuggestionProvider suggestionProvider) {
        this.suggestionProvider = suggestionProvider;
    }

    /**
     * Exact, case-sensitive, non-overlapping occurrences of the request's text, left to right.
     */
    public List<Occurrence> resolve(String flatText, RedactionRequest request) {
        return OccurrenceFinder.findAll(flatText, request.text());
    }

    /**
     * Disjoint spans covered by any accepted literal, longest literals first, in ascending order.
     */
    public List<Occurrence> resolveAll(String flatText, AcceptedRedactionSet accepted) {
        return OccurrenceFinder.findAll(flatText, accepted.texts());
    }

    /**
     * Asks the suggestion provider for spellings related to {@code seedText}. The proposals are returned
     * for review only; the seed itself and duplicate texts are dropped (the most confident one wins).
     */
    public List<ContextualMatch> findContextual(String flatText, String seedText, RedactionKind kind) {
        if (seedText == null || seedText.isBlank()) {
            throw new InvalidRedactionRequestException("Seed text must not be blank.");
        }
        if (kind == null) {
            throw new InvalidRedactionRequestException("Redaction kind is required.");
        }
        Map<String, ContextualMatch> unique = new LinkedHashMap<>();
        for (ContextualMatch match : suggestionProvider.findContextual(flatText, seedText, kind)) {
            if (match.text().equals(seedText)) {
                continue;
            }
            unique.merge(match.text(), match,
                    (existing, candidate) -> candidate.confidence() > existing.confidence() ? candidate : existing);
        }
        log.debug("Contextual search produced {} proposal(s)", unique.size());
        return new ArrayList<>(unique.values());
    }

    /**
     * @param sensitivity 0..100
     * @throws InvalidRedactionRequestException when the sensitivity is out of range
     */
    public List<RedactionRequest> suggest(String flatText, int sensitivity) {
        if (sensitivity < 0 || sensitivity > 100) {
            throw new InvalidRedactionRequestException("Sensitivity must be between 0 and 100 but was " + sensitivity + ".");
        }
        List<RedactionRequest> suggestions = suggestionProvider.suggest(flatText, sensitivity);
        log.info("Suggestion provider returned {} candidate(s) at sensitivity {}", suggestions.size(), sensitivity);
        return suggestions;
    }
}
