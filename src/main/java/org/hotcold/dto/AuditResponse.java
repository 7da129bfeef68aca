package org.hotcold.dto;

import org.hotcold.model.attestation.SignedAuditRoot;
import org.hotcold.model.audit.AuditEntry;

import java.util.List;

public class AuditResponse {
    public List<AuditEntry> entries;
    public String merkleRoot;
    public SignedAuditRoot signedMerkleRoot;

    public AuditResponse() {}

    public AuditResponse(List<AuditEntry> entries, String merkleRoot, SignedAuditRoot signedMerkleRoot) {
        this.entries = entries;
        this.merkleRoot = merkleRoot;
        this.signedMerkleRoot = signedMerkleRoot;
    }
}
