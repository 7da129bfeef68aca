package org.hotcold.service.target;

import org.hotcold.crypto.PackedEncoder;
import org.hotcold.service.scoring.ScoringEngine;
import org.springframework.stereotype.Component;
import org.web3j.utils.Numeric;

import java.security.SecureRandom;

/**
 * Draws round targets and commits to them.
 *
 * <p>Commitment = keccak256(abi.encodePacked(string secret, string roundId, bytes32 salt)),
 * the secret as its zero-padded 12-digit text. The verifier recomputes it at reveal time,
 * so field order and encoding are fixed.
 */
@Component
public class TargetGenerator {

    private static final long TARGET_SPACE = 1_000_000_000_000L;
    private static final int SALT_BYTES = 32;

    private final SecureRandom random;

    public TargetGenerator() {
        this(new SecureRandom());
    }

    TargetGenerator(SecureRandom random) {
        this.random = random;
    }

    public Target newRound(String roundId) {
        long value = random.nextLong(TARGET_SPACE);
        String secret = String.format("%0" + ScoringEngine.WIDTH + "d", value);

        byte[] saltBytes = new byte[SALT_BYTES];
        random.nextBytes(saltBytes);
        String salt = Numeric.toHexString(saltBytes);

        return new Target(secret, salt, commitment(secret, roundId, salt));
    }

    public static String commitment(String secret, String roundId, String salt) {
        return PackedEncoder.create()
                .string(secret)
                .string(roundId)
                .bytes32(salt)
                .keccakHex();
    }
}
