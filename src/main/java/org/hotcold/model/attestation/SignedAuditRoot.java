package org.hotcold.model.attestation;

/** Anchors a round's audit Merkle root on chain. */
public record SignedAuditRoot(String roundId,
                              String merkleRoot,
                              long entryCount,
                              long nonce,
                              String signature) {}
