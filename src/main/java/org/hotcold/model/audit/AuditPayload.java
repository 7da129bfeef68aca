package org.hotcold.model.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Event-specific body of an audit entry. Each variant serializes to compact JSON with
 * its fields in declaration order; that text is what the entry hash covers.
 * Wei amounts and distances are strings, digit counts are numbers.
 */
public sealed interface AuditPayload {

    @JsonIgnore
    AuditEntryType type();

    @JsonPropertyOrder({"commitmentHash", "baseBuyIn"})
    record RoundStart(String commitmentHash, String baseBuyIn) implements AuditPayload {
        @Override public AuditEntryType type() { return AuditEntryType.ROUND_START; }
    }

    @JsonPropertyOrder({"player", "guessHash", "buyInPaid"})
    record Guess(String player, String guessHash, String buyInPaid) implements AuditPayload {
        @Override public AuditEntryType type() { return AuditEntryType.GUESS; }
    }

    @JsonPropertyOrder({"player", "digitsInPlace", "digitsCorrect", "numericDistance"})
    record Hint(String player, int digitsInPlace, int digitsCorrect, String numericDistance) implements AuditPayload {
        @Override public AuditEntryType type() { return AuditEntryType.HINT; }
    }

    @JsonPropertyOrder({"newTier", "newBuyIn"})
    record PriceChange(String newTier, String newBuyIn) implements AuditPayload {
        @Override public AuditEntryType type() { return AuditEntryType.PRICE_CHANGE; }
    }

    record Winner(String winner) implements AuditPayload {
        @Override public AuditEntryType type() { return AuditEntryType.WINNER; }
    }
}
