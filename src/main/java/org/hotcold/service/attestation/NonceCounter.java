package org.hotcold.service.attestation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide nonce source shared by every round and message kind.
 * Values are handed out once, in strictly increasing order, without gaps.
 *
 * <p>A new counter restarts at its configured initial value; an external verifier that
 * remembers consumed nonces will reject anything issued below its high-water mark, so
 * after a restart the counter must be seeded past it.
 */
public class NonceCounter {

    private final AtomicLong next;

    public NonceCounter(long initial) {
        if (initial < 0) throw new IllegalArgumentException("initial nonce must be >= 0");
        this.next = new AtomicLong(initial);
    }

    public long next() { return next.getAndIncrement(); }

    /** Value the next call to {@link #next()} will return. */
    public long peek() { return next.get(); }
}
