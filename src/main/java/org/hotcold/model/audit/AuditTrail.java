package org.hotcold.model.audit;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only entries of one round plus the cached Merkle root ({@code null} = stale).
 * Callers synchronize on the trail instance.
 */
public class AuditTrail {
    @Getter
    private final String roundId;
    private final List<AuditEntry> entries = new ArrayList<>();
    private String merkleRoot;

    public AuditTrail(String roundId) {
        this.roundId = roundId;
    }

    public void add(AuditEntry entry) {
        entries.add(entry);
        merkleRoot = null; // invalide le cache
    }

    public int size() { return entries.size(); }

    public AuditEntry last() { return entries.isEmpty() ? null : entries.get(entries.size() - 1); }

    public List<AuditEntry> snapshot() { return List.copyOf(entries); }

    public String cachedMerkleRoot() { return merkleRoot; }

    public void cacheMerkleRoot(String root) { this.merkleRoot = root; }
}
