package org.hotcold.service.pricing;

import lombok.RequiredArgsConstructor;
import org.hotcold.model.PriceTier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Maps guess distance to a price tier and buy-in. Escalation compares severity ranks,
 * never raw thresholds, so a round's price can only go up.
 */
@Service
@RequiredArgsConstructor
public class PricingService {

    private final PricingConfig config;

    public PriceTier tierFor(long distance) {
        for (TierDefinition t : config.tiersByDistance()) {
            if (distance <= t.maxDistance()) return t.tier();
        }
        return PriceTier.BASE;
    }

    public long multiplier(PriceTier tier) {
        for (TierDefinition t : config.tiersByDistance()) {
            if (t.tier() == tier) return t.multiplier();
        }
        return 1L;
    }

    public BigInteger buyInFor(BigInteger baseBuyIn, long distance) {
        return baseBuyIn.multiply(BigInteger.valueOf(multiplier(tierFor(distance))));
    }

    public boolean shouldEscalate(PriceTier currentTier, long newDistance) {
        return tierFor(newDistance).isMoreSevereThan(currentTier);
    }

    /** Highest buy-in a round started at {@code baseBuyIn} can ever reach. */
    public BigInteger ceilingFor(BigInteger baseBuyIn) {
        return baseBuyIn.multiply(BigInteger.valueOf(config.maxMultiplier()));
    }

    public BigInteger defaultBaseBuyIn() { return config.defaultBaseBuyIn(); }
}
