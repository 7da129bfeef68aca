package org.hotcold.model.attestation;

public record SignedStartRound(String roundId,
                               String commitmentHash,
                               String baseBuyIn,
                               long nonce,
                               String signature) {}
