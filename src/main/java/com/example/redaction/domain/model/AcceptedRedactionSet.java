package com.example.redaction.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, de-duplicated set of redactions the operator accepted.
 * Instances are immutable: every accept or remove returns a new set, so the value passed to the engine
 * is exactly what the operator saw.
 */
public final class AcceptedRedactionSet implements Iterable<RedactionRequest> {

    private static final AcceptedRedactionSet EMPTY = new AcceptedRedactionSet(new LinkedHashSet<>());

    private final Set<RedactionRequest> requests;

    private AcceptedRedactionSet(LinkedHashSet<RedactionRequest> requests) {
        this.requests = Collections.unmodifiableSet(requests);
    }

    public static AcceptedRedactionSet empty() {
        return EMPTY;
    }

    /**
     * Builds a set from requests in the given order; duplicates on (text, kind) keep their first position.
     */
    public static AcceptedRedactionSet of(Collection<RedactionRequest> requests) {
        AcceptedRedactionSet set = EMPTY;
        for (RedactionRequest request : requests) {
            set = set.accept(request);
        }
        return set;
    }

    public static AcceptedRedactionSet of(RedactionRequest... requests) {
        return of(List.of(requests));
    }

    /**
     * @param request request the operator accepted
     * @return a new set containing the request, or this set when it is already present
     */
    public AcceptedRedactionSet accept(RedactionRequest request) {
        Objects.requireNonNull(request, "request");
        if (requests.contains(request)) {
            return this;
        }
        LinkedHashSet<RedactionRequest> copy = new LinkedHashSet<>(requests);
        copy.add(request);
        return new AcceptedRedactionSet(copy);
    }

    /**
     * Accepts a contextual proposal made for {@code seed}. The kind is inherited from the seed, and the
     * seed's reason wins over the proposal's when the operator gave one.
     *
     * @param match proposal confirmed by the operator
     * @param seed  request the proposal was generated for
     * @return a new set containing the converted request
     */
    public AcceptedRedactionSet acceptContextual(ContextualMatch match, RedactionRequest seed) {
        Objects.requireNonNull(match, "match");
        Objects.requireNonNull(seed, "seed");
        String reason = seed.reason().isBlank() ? match.reason() : seed.reason();
        return accept(new RedactionRequest(match.text(), seed.kind(), match.confidence(), reason));
    }

    public AcceptedRedactionSet remove(RedactionRequest request) {
        if (!requests.contains(request)) {
            return this;
        }
        LinkedHashSet<RedactionRequest> copy = new LinkedHashSet<>(requests);
        copy.remove(request);
        return new AcceptedRedactionSet(copy);
    }

    public boolean contains(RedactionRequest request) {
        return requests.contains(request);
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }

    public int size() {
        return requests.size();
    }

    public List<RedactionRequest> asList() {
        return List.copyOf(requests);
    }

    /**
     * @return distinct literal texts in acceptance order (two kinds may share one literal)
     */
    public List<String> texts() {
        LinkedHashSet<String> texts = new LinkedHashSet<>();
        for (RedactionRequest request : requests) {
            texts.add(request.text());
        }
        return new ArrayList<>(texts);
    }

    @Override
    public Iterator<RedactionRequest> iterator() {
        return requests.iterator();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AcceptedRedactionSet set)) {
            return false;
        }
        return asList().equals(set.asList());
    }

    @Override
    public int hashCode() {
        return asList().hashCode();
    }

    @Override
    public String toString() {
        return "AcceptedRedactionSet[" + requests.size() + " redactions]";
    }
}
