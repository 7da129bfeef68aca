package org.hotcold.model.audit;

/**
 * One link of a round's hash chain. {@code hash} is a pure function of the other fields.
 */
public record AuditEntry(long index,
                         AuditEntryType type,
                         String roundId,
                         String data,
                         long timestamp,
                         String previousHash,
                         String hash) {}
