package com.example.redaction.infrastructure.suggest;

import com.example.redaction.domain.model.ContextualMatch;
import com.example.redaction.domain.model.RedactionKind;
import com.example.redaction.domain.model.RedactionRequest;

import java.util.List;

/**
 * Source of redaction candidates. Confidence and reason of its results are passed through untouched;
 * nothing it returns is redacted until the operator accepts it.
 */
public interface SuggestionProvider {

    /**
     * @param documentText flat document text
     * @param sensitivity  0 (only the most certain findings) to 100 (everything plausible)
     * @return candidate redactions
     */
    List<RedactionRequest> suggest(String documentText, int sensitivity);

    /**
     * @param documentText flat document text
     * @param seedText     literal the operator already chose
     * @param kind         kind of the seed
     * @return related spellings of the seed found in the text
     */
    List<ContextualMatch> findContextual(String documentText, String seedText, RedactionKind kind);
}
