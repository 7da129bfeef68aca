package org.hotcold.service.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LocksTest {

    @Test
    void of_sameRound_shouldReturnSameMonitor() {
        Locks locks = new Locks();

        assertThat(locks.of("a")).isSameAs(locks.of("a"));
    }

    @Test
    void of_differentRounds_shouldNeverShareMonitor() {
        Locks locks = new Locks();

        assertThat(locks.of("a")).isNotSameAs(locks.of("b"));
    }
}
