package org.hotcold.repo;

import org.hotcold.model.Round;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Volatile store: rounds are lost on restart. */
@Repository
public class InMemoryRoundRepository implements RoundRepository {

    private final Map<String, Round> rounds = new ConcurrentHashMap<>();

    @Override
    public Round save(Round round) {
        rounds.put(round.getId(), round);
        return round;
    }

    @Override
    public Optional<Round> findById(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(rounds.get(id));
    }

    @Override
    public Collection<Round> findAll() { return List.copyOf(rounds.values()); }
}
