package org.hotcold.repo;

import org.hotcold.model.audit.AuditTrail;

import java.util.Optional;

public interface AuditRepository {

    /** Returns the trail of the round, creating an empty one on first use. */
    AuditTrail trailFor(String roundId);

    Optional<AuditTrail> find(String roundId);
}
