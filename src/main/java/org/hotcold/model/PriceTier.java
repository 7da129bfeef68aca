package org.hotcold.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pricing brackets. The severity rank is the escalation order and is independent
 * of the distance thresholds configured for each tier.
 */
public enum PriceTier {
    BASE("base", 0),
    WARM("warm", 1),
    HOT("hot", 2),
    SCORCHING("scorching", 3);

    private final String tag;
    private final int severity;

    PriceTier(String tag, int severity) {
        this.tag = tag;
        this.severity = severity;
    }

    @JsonValue
    public String tag() { return tag; }

    public int severity() { return severity; }

    public boolean isMoreSevereThan(PriceTier other) {
        return severity > other.severity;
    }
}
