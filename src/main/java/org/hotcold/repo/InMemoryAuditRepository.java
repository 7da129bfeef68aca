package org.hotcold.repo;

import org.hotcold.model.audit.AuditTrail;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryAuditRepository implements AuditRepository {

    private final Map<String, AuditTrail> trails = new ConcurrentHashMap<>();

    @Override
    public AuditTrail trailFor(String roundId) {
        return trails.computeIfAbsent(roundId, AuditTrail::new);
    }

    @Override
    public Optional<AuditTrail> find(String roundId) {
        if (roundId == null) return Optional.empty();
        return Optional.ofNullable(trails.get(roundId));
    }
}
