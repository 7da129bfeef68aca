package org.hotcold.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoundStatus {
    ACTIVE("active"),
    COMPLETED("completed");

    private final String tag;

    RoundStatus(String tag) { this.tag = tag; }

    @JsonValue
    public String tag() { return tag; }
}
