package org.hotcold.crypto;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PackedEncoderTest {

    @Test
    void keccak_emptyInput_shouldMatchKnownDigest() {
        assertThat(PackedEncoder.create().keccakHex())
                .isEqualTo("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");
    }

    @Test
    void uint256_shouldBeLeftPaddedTo32Bytes() {
        byte[] raw = PackedEncoder.create().uint256(1L).toBytes();

        assertThat(raw).hasSize(32);
        assertThat(raw[31]).isEqualTo((byte) 1);
        assertThat(PackedEncoder.create().uint256(1L).keccakHex())
                .isEqualTo("0xb10e2d527612073b26eecdfd717e6a320cf44b4afac2b0732d9fcbe2b7fa0cf6");
    }

    @Test
    void mixedFields_shouldConcatenateWithoutPadding() {
        byte[] raw = PackedEncoder.create()
                .string("ab")
                .address("0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266")
                .uint8(7)
                .bytes32(Hashes.ZERO_HASH)
                .toBytes();

        assertThat(raw).hasSize(2 + 20 + 1 + 32);
        assertThat(raw[0]).isEqualTo((byte) 'a');
        assertThat(raw[2]).isEqualTo((byte) 0xf3);
        assertThat(raw[22]).isEqualTo((byte) 7);
    }

    @Test
    void outOfRangeValues_shouldBeRejected() {
        assertThatThrownBy(() -> PackedEncoder.create().uint8(256)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PackedEncoder.create().uint256(BigInteger.ONE.negate()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PackedEncoder.create().uint256(BigInteger.TWO.pow(256)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PackedEncoder.create().bytes32("0x1234")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PackedEncoder.create().address("0x1234")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hashPair_shouldBeOrderSensitive() {
        String a = Hashes.keccakHex("a");
        String b = Hashes.keccakHex("b");

        assertThat(Hashes.hashPair(a, b)).isNotEqualTo(Hashes.hashPair(b, a));
        assertThat(Hashes.hashPair(a, b)).isEqualTo(Hashes.hashPair(a, b));
    }
}
