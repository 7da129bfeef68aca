package org.hotcold.service.pricing;

import org.hotcold.model.PriceTier;

/**
 * @param maxDistance inclusive upper bound on the numeric distance
 */
public record TierDefinition(PriceTier tier, long maxDistance, long multiplier) {}
