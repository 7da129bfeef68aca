package org.hotcold.service.pricing;

import org.hotcold.model.PriceTier;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable tier table. Tiers are held sorted ascending by maxDistance so the
 * tightest bracket is matched first.
 */
public final class PricingConfig {

    private final BigInteger defaultBaseBuyIn;
    private final List<TierDefinition> tiers;

    public PricingConfig(BigInteger defaultBaseBuyIn, List<TierDefinition> tiers) {
        if (defaultBaseBuyIn == null || defaultBaseBuyIn.signum() <= 0) {
            throw new IllegalArgumentException("base buy-in must be positive");
        }
        if (tiers == null || tiers.isEmpty()) throw new IllegalArgumentException("at least one tier is required");
        for (TierDefinition t : tiers) {
            if (t.maxDistance() < 0) throw new IllegalArgumentException("negative maxDistance for " + t.tier());
            if (t.multiplier() < 1) throw new IllegalArgumentException("multiplier must be >= 1 for " + t.tier());
        }
        if (tiers.stream().map(TierDefinition::tier).distinct().count() != tiers.size()) {
            throw new IllegalArgumentException("duplicate tier in pricing config");
        }
        // escalade = buy-in jamais en baisse : multiplicateurs croissants avec la sévérité
        List<TierDefinition> bySeverity = tiers.stream()
                .sorted(Comparator.comparingInt(t -> t.tier().severity()))
                .toList();
        for (int i = 1; i < bySeverity.size(); i++) {
            TierDefinition looser = bySeverity.get(i - 1);
            TierDefinition tighter = bySeverity.get(i);
            if (tighter.multiplier() < looser.multiplier()) {
                throw new IllegalArgumentException("multiplier of " + tighter.tier() + " (" + tighter.multiplier()
                        + ") is below " + looser.tier() + " (" + looser.multiplier() + ")");
            }
        }
        this.defaultBaseBuyIn = defaultBaseBuyIn;
        this.tiers = tiers.stream().sorted(Comparator.comparingLong(TierDefinition::maxDistance)).toList();
    }

    /** BASE ≤ 999999999999 ×1, WARM ≤ 1000 ×2, HOT ≤ 100 ×5, SCORCHING ≤ 10 ×10, base 0.01 ETH. */
    public static PricingConfig defaults() {
        return new PricingConfig(new BigInteger("10000000000000000"), List.of(
                new TierDefinition(PriceTier.BASE, 999_999_999_999L, 1),
                new TierDefinition(PriceTier.WARM, 1_000L, 2),
                new TierDefinition(PriceTier.HOT, 100L, 5),
                new TierDefinition(PriceTier.SCORCHING, 10L, 10)));
    }

    public BigInteger defaultBaseBuyIn() { return defaultBaseBuyIn; }

    public List<TierDefinition> tiersByDistance() { return tiers; }

    /** Largest multiplier of the table; never below 1. */
    public long maxMultiplier() {
        return tiers.stream().mapToLong(TierDefinition::multiplier).max().orElse(1L);
    }
}
