package org.hotcold.model;

import lombok.Getter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One game round. Mutated only by RoundService while it holds the round lock.
 */
@Getter
public class Round {
    private final String id;
    private final String commitmentHash;
    private final String sealedTarget; // jamais exposé
    private final String salt;
    private final BigInteger baseBuyIn;
    private final long startTimestamp;

    private BigInteger currentBuyIn;
    private PriceTier currentTier = PriceTier.BASE;
    private BigInteger pool = BigInteger.ZERO;
    private RoundStatus status = RoundStatus.ACTIVE;
    private String winner;
    private Long endTimestamp;

    private final List<GuessRecord> guesses = new ArrayList<>();

    public Round(String id, String commitmentHash, String sealedTarget, String salt,
                 BigInteger baseBuyIn, long startTimestamp) {
        this.id = id;
        this.commitmentHash = commitmentHash;
        this.sealedTarget = sealedTarget;
        this.salt = salt;
        this.baseBuyIn = baseBuyIn;
        this.currentBuyIn = baseBuyIn;
        this.startTimestamp = startTimestamp;
    }

    public List<GuessRecord> getGuesses() { return Collections.unmodifiableList(guesses); }

    public int guessCount() { return guesses.size(); }

    public boolean isActive() { return status == RoundStatus.ACTIVE; }

    public void recordGuess(GuessRecord record) {
        guesses.add(record);
        pool = pool.add(record.buyInPaid());
    }

    /** One-way latch: a less or equally severe tier is ignored. */
    public boolean escalate(PriceTier tier, BigInteger buyIn) {
        if (!tier.isMoreSevereThan(currentTier)) return false;
        currentTier = tier;
        if (buyIn.compareTo(currentBuyIn) > 0) currentBuyIn = buyIn;
        return true;
    }

    public void complete(String winner, long endTimestamp) {
        if (status == RoundStatus.COMPLETED) {
            throw new IllegalStateException("Round " + id + " already completed");
        }
        this.status = RoundStatus.COMPLETED;
        this.winner = winner;
        this.endTimestamp = endTimestamp;
    }
}
