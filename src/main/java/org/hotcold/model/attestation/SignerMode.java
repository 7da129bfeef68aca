package org.hotcold.model.attestation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignerMode {
    TEE("tee"),
    SIMULATION("simulation");

    private final String tag;

    SignerMode(String tag) { this.tag = tag; }

    @JsonValue
    public String tag() { return tag; }
}
