package org.hotcold.model.audit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditEntryType {
    ROUND_START("ROUND_START"),
    GUESS("GUESS"),
    HINT("HINT"),
    PRICE_CHANGE("PRICE_CHANGE"),
    WINNER("WINNER");

    private final String tag;

    AuditEntryType(String tag) { this.tag = tag; }

    /** Text tag fed into the entry hash. */
    @JsonValue
    public String tag() { return tag; }
}
