package org.hotcold.service.target;

import org.hotcold.crypto.PackedEncoder;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TargetGeneratorTest {

    private final TargetGenerator generator = new TargetGenerator();

    @Test
    void newRound_shouldDrawTwelveDigitSecretAnd32ByteSalt() {
        for (int i = 0; i < 200; i++) {
            Target t = generator.newRound("round-" + i);

            assertThat(t.secret()).matches("^\\d{12}$");
            assertThat(t.salt()).matches("^0x[0-9a-f]{64}$");
            assertThat(t.commitmentHash()).matches("^0x[0-9a-f]{64}$");
        }
    }

    @Test
    void newRound_shouldNotRepeatSecretsOrSalts() {
        Set<String> secrets = new HashSet<>();
        Set<String> salts = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            Target t = generator.newRound("r");
            secrets.add(t.secret());
            salts.add(t.salt());
        }

        assertThat(secrets).hasSizeGreaterThan(95);
        assertThat(salts).hasSize(100);
    }

    @Test
    void commitment_shouldBindSecretRoundAndSalt() {
        Target t = generator.newRound("round-a");

        String expected = PackedEncoder.create().string(t.secret()).string("round-a").bytes32(t.salt()).keccakHex();
        assertThat(t.commitmentHash()).isEqualTo(expected);
        assertThat(TargetGenerator.commitment(t.secret(), "round-b", t.salt())).isNotEqualTo(t.commitmentHash());
    }

    @Test
    void commitment_leadingZeros_shouldChangeHash() {
        String salt = "0x" + "11".repeat(32);

        assertThat(TargetGenerator.commitment("000000000042", "r", salt))
                .isNotEqualTo(TargetGenerator.commitment("42", "r", salt));
    }

    @Test
    void toString_shouldNotLeakSecret() {
        Target t = generator.newRound("r");

        assertThat(t.toString()).doesNotContain(t.secret()).doesNotContain(t.salt());
    }
}
