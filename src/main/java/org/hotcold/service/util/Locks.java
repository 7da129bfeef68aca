package org.hotcold.service.util;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One monitor per round. Two rounds never share a monitor, so their guesses run in parallel.
 */
@Component
public class Locks {
    private final Map<String, Object> monitors = new ConcurrentHashMap<>();

    public Object of(String roundId) {
        return monitors.computeIfAbsent(roundId, id -> new Object());
    }
}
