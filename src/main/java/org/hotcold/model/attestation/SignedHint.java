package org.hotcold.model.attestation;

public record SignedHint(String roundId,
                         String player,
                         int digitsCorrect,
                         int digitsInPlace,
                         String numericDistance,
                         long nonce,
                         String signature) {}
