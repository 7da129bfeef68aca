package org.hotcold.repo;

import org.hotcold.model.Round;

import java.util.Collection;
import java.util.Optional;

public interface RoundRepository {

    Round save(Round round);

    Optional<Round> findById(String id);

    Collection<Round> findAll();
}
