package com.example.redaction.domain.model;

import com.example.redaction.domain.exception.InvalidRedactionRequestException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the immutable accepted redaction set and its request values.
 */
class AcceptedRedactionSetTest {

    @Test
    void acceptReturnsNewSetAndLeavesOriginalUntouched() {
        AcceptedRedactionSet empty = AcceptedRedactionSet.empty();

        AcceptedRedactionSet one = empty.accept(RedactionRequest.of("Jane Roe", RedactionKind.PII));

        assertThat(empty.isEmpty()).isTrue();
        assertThat(one.size()).isEqualTo(1);
    }

    @Test
    void duplicatesOnTextAndKindAreIgnored() {
        AcceptedRedactionSet set = AcceptedRedactionSet.of(
                new RedactionRequest("Jane Roe", RedactionKind.PII, 90, "name"),
                new RedactionRequest("Jane Roe", RedactionKind.PII, 40, "other"),
                RedactionRequest.of("Jane Roe", RedactionKind.CUSTOM)
        );

        assertThat(set.size()).isEqualTo(2);
        assertThat(set.asList().get(0).confidence()).isEqualTo(90);
        assertThat(set.texts()).containsExactly("Jane Roe");
    }

    @Test
    void contextualMatchInheritsSeedKindAndReason() {
        RedactionRequest seed = new RedactionRequest("Bob Smith", RedactionKind.PII, 100, "client name");
        ContextualMatch match = new ContextualMatch("Mr. Smith", 85, "Honorific with the same surname");

        AcceptedRedactionSet set = AcceptedRedactionSet.of(seed).acceptContextual(match, seed);

        RedactionRequest accepted = set.asList().get(1);
        assertThat(accepted.text()).isEqualTo("Mr. Smith");
        assertThat(accepted.kind()).isEqualTo(RedactionKind.PII);
        assertThat(accepted.confidence()).isEqualTo(85);
        assertThat(accepted.reason()).isEqualTo("client name");
    }

    @Test
    void contextualMatchKeepsItsReasonWhenSeedHasNone() {
        RedactionRequest seed = RedactionRequest.of("Bob Smith", RedactionKind.PII);
        ContextualMatch match = new ContextualMatch("B. Smith", 80, "Initial with the same surname");

        RedactionRequest accepted = AcceptedRedactionSet.empty().acceptContextual(match, seed).asList().get(0);

        assertThat(accepted.reason()).isEqualTo("Initial with the same surname");
    }

    @Test
    void removeDropsTheEntry() {
        RedactionRequest request = RedactionRequest.of("secret", RedactionKind.CREDENTIALS);
        AcceptedRedactionSet set = AcceptedRedactionSet.of(request);

        assertThat(set.remove(request).contains(request)).isFalse();
        assertThat(set.contains(request)).isTrue();
    }

    @Test
    void invalidRequestsAreRejected() {
        assertThrows(InvalidRedactionRequestException.class, () -> RedactionRequest.of("", RedactionKind.PII));
        assertThrows(InvalidRedactionRequestException.class, () -> RedactionRequest.of("  ", RedactionKind.PII));
        assertThrows(InvalidRedactionRequestException.class,
                () -> new RedactionRequest("x", RedactionKind.PII, 101, null));
        assertThrows(InvalidRedactionRequestException.class, () -> RedactionKind.fromString("secretive"));
        assertThat(RedactionKind.fromString(" financial ")).isEqualTo(RedactionKind.FINANCIAL);
    }
}
