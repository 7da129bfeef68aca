package org.hotcold.model;

/**
 * Result of scoring one guess against the round target.
 *
 * @param digitsInPlace   digits matching in value and position (bulls)
 * @param digitsCorrect   digits present elsewhere in the target (cows)
 * @param numericDistance |target - guess| as base-10 integers
 * @param exactMatch      true iff all twelve digits are in place
 * @param priceTier       tier the distance falls into
 */
public record Hint(int digitsInPlace,
                   int digitsCorrect,
                   long numericDistance,
                   boolean exactMatch,
                   PriceTier priceTier) {}
