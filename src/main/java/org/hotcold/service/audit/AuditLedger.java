package org.hotcold.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.hotcold.crypto.Hashes;
import org.hotcold.crypto.PackedEncoder;
import org.hotcold.exception.IntegrityViolationException;
import org.hotcold.model.audit.AuditEntry;
import org.hotcold.model.audit.AuditEntryType;
import org.hotcold.model.audit.AuditPayload;
import org.hotcold.model.audit.AuditTrail;
import org.hotcold.repo.AuditRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hash-chained, Merkle-rootable audit log, one trail per round.
 *
 * <p>Entry hash = keccak256(abi.encodePacked(uint256 index, string type, string roundId,
 * string data, uint256 timestamp, bytes32 previousHash)) where {@code data} is the compact
 * JSON of the payload. The first entry links to {@link Hashes#ZERO_HASH}.
 *
 * <p>Merkle root: leaf hashes padded with the zero hash to the next power of two, then
 * reduced pairwise with keccak256(left ‖ right). An empty trail has the zero hash as root.
 */
@Slf4j
@Service
public class AuditLedger {

    private final AuditRepository repository;
    private final Clock clock;
    private final ObjectMapper json = new ObjectMapper();

    public AuditLedger(AuditRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public AuditEntry append(String roundId, AuditPayload payload) {
        AuditTrail trail = repository.trailFor(roundId);
        String data = serialize(payload);
        synchronized (trail) {
            AuditEntry last = trail.last();
            long index = trail.size();
            String previousHash = last == null ? Hashes.ZERO_HASH : last.hash();
            long timestamp = clock.millis();
            String hash = entryHash(index, payload.type(), roundId, data, timestamp, previousHash);

            AuditEntry entry = new AuditEntry(index, payload.type(), roundId, data, timestamp, previousHash, hash);
            trail.add(entry);
            log.debug("Audit {} #{} for round {}", payload.type().tag(), index, roundId);
            return entry;
        }
    }

    public List<AuditEntry> trail(String roundId) {
        return repository.find(roundId).map(t -> {
            synchronized (t) { return t.snapshot(); }
        }).orElse(List.of());
    }

    public int entryCount(String roundId) {
        return repository.find(roundId).map(t -> {
            synchronized (t) { return t.size(); }
        }).orElse(0);
    }

    public String merkleRoot(String roundId) {
        AuditTrail trail = repository.find(roundId).orElse(null);
        if (trail == null) return Hashes.ZERO_HASH;
        synchronized (trail) {
            String cached = trail.cachedMerkleRoot();
            if (cached != null) return cached;
            String root = merkleRoot(trail.snapshot().stream().map(AuditEntry::hash).toList());
            trail.cacheMerkleRoot(root);
            return root;
        }
    }

    public boolean verifyChain(String roundId) {
        return verifyChain(trail(roundId));
    }

    public void requireIntact(String roundId) {
        if (!verifyChain(roundId)) {
            log.error("Audit chain of round {} failed verification", roundId);
            throw new IntegrityViolationException(roundId);
        }
    }

    /** Checks index sequence, round id, linkage and recomputed hashes. Read-only. */
    public static boolean verifyChain(List<AuditEntry> entries) {
        String expectedPrevious = Hashes.ZERO_HASH;
        String roundId = entries.isEmpty() ? null : entries.get(0).roundId();
        for (int i = 0; i < entries.size(); i++) {
            AuditEntry e = entries.get(i);
            if (e.index() != i) return false;
            if (!Objects.equals(e.roundId(), roundId)) return false;
            if (!expectedPrevious.equalsIgnoreCase(e.previousHash())) return false;
            String recomputed;
            try {
                recomputed = entryHash(e.index(), e.type(), e.roundId(), e.data(), e.timestamp(), e.previousHash());
            } catch (IllegalArgumentException malformed) {
                return false;
            }
            if (!recomputed.equalsIgnoreCase(e.hash())) return false;
            expectedPrevious = e.hash();
        }
        return true;
    }

    public static String merkleRoot(List<String> leafHashes) {
        if (leafHashes.isEmpty()) return Hashes.ZERO_HASH;

        List<String> level = new ArrayList<>(leafHashes);
        while (Integer.bitCount(level.size()) != 1) level.add(Hashes.ZERO_HASH);

        while (level.size() > 1) {
            List<String> next = new ArrayList<>(level.size() / 2);
            for (int i = 0; i < level.size(); i += 2) {
                next.add(Hashes.hashPair(level.get(i), level.get(i + 1)));
            }
            level = next;
        }
        return level.get(0);
    }

    public static String entryHash(long index, AuditEntryType type, String roundId, String data,
                                   long timestamp, String previousHash) {
        return PackedEncoder.create()
                .uint256(index)
                .string(type.tag())
                .string(roundId)
                .string(data)
                .uint256(timestamp)
                .bytes32(previousHash)
                .keccakHex();
    }

    private String serialize(AuditPayload payload) {
        try {
            return json.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize audit payload " + payload.type(), e);
        }
    }
}
