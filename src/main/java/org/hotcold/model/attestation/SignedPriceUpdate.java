package org.hotcold.model.attestation;

public record SignedPriceUpdate(String roundId, String newBuyIn, long nonce, String signature) {}
