package org.hotcold.config;

import lombok.extern.slf4j.Slf4j;
import org.hotcold.model.PriceTier;
import org.hotcold.service.attestation.NonceCounter;
import org.hotcold.service.pricing.PricingConfig;
import org.hotcold.service.pricing.TierDefinition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * Pricing table, nonce counter and clock, from application.properties
 * ({@code enclave.pricing.*}, {@code enclave.nonce.*}).
 */
@Slf4j
@Configuration
public class EnclaveConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PricingConfig pricingConfig(
            @Value("${enclave.pricing.base-buy-in:10000000000000000}") BigInteger baseBuyIn,
            @Value("${enclave.pricing.base.max-distance:999999999999}") long baseMax,
            @Value("${enclave.pricing.base.multiplier:1}") long baseMultiplier,
            @Value("${enclave.pricing.warm.max-distance:1000}") long warmMax,
            @Value("${enclave.pricing.warm.multiplier:2}") long warmMultiplier,
            @Value("${enclave.pricing.hot.max-distance:100}") long hotMax,
            @Value("${enclave.pricing.hot.multiplier:5}") long hotMultiplier,
            @Value("${enclave.pricing.scorching.max-distance:10}") long scorchingMax,
            @Value("${enclave.pricing.scorching.multiplier:10}") long scorchingMultiplier) {
        return new PricingConfig(baseBuyIn, List.of(
                new TierDefinition(PriceTier.BASE, baseMax, baseMultiplier),
                new TierDefinition(PriceTier.WARM, warmMax, warmMultiplier),
                new TierDefinition(PriceTier.HOT, hotMax, hotMultiplier),
                new TierDefinition(PriceTier.SCORCHING, scorchingMax, scorchingMultiplier)));
    }

    @Bean
    public NonceCounter nonceCounter(@Value("${enclave.nonce.initial:0}") long initial) {
        if (initial > 0) {
            log.warn("Nonce counter resumes at {}; make sure it is above the verifier's last consumed nonce", initial);
        }
        return new NonceCounter(initial);
    }
}
