package org.hotcold.model.attestation;

public record SignedWinnerDeclaration(String roundId, String winner, long nonce, String signature) {}
