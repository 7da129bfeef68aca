package org.hotcold.crypto;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Non-standard packed ABI encoding ({@code abi.encodePacked}), the form the on-chain
 * verifier hashes: strings as raw UTF-8, static types left-padded to their width,
 * addresses as 20 raw bytes.
 */
public final class PackedEncoder {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private PackedEncoder() {}

    public static PackedEncoder create() { return new PackedEncoder(); }

    public PackedEncoder string(String value) {
        out.writeBytes(value.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public PackedEncoder bytes32(String hex) {
        byte[] raw = Numeric.hexStringToByteArray(hex);
        if (raw.length != 32) throw new IllegalArgumentException("bytes32 expects 32 bytes, got " + raw.length);
        out.writeBytes(raw);
        return this;
    }

    public PackedEncoder bytes32(byte[] raw) {
        if (raw.length != 32) throw new IllegalArgumentException("bytes32 expects 32 bytes, got " + raw.length);
        out.writeBytes(raw);
        return this;
    }

    public PackedEncoder address(String hex) {
        byte[] raw = Numeric.hexStringToByteArray(hex);
        if (raw.length != 20) throw new IllegalArgumentException("address expects 20 bytes, got " + raw.length);
        out.writeBytes(raw);
        return this;
    }

    public PackedEncoder uint8(int value) {
        if (value < 0 || value > 0xff) throw new IllegalArgumentException("uint8 out of range: " + value);
        out.write(value);
        return this;
    }

    public PackedEncoder uint256(BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("uint256 out of range: " + value);
        }
        out.writeBytes(Numeric.toBytesPadded(value, 32));
        return this;
    }

    public PackedEncoder uint256(long value) {
        return uint256(BigInteger.valueOf(value));
    }

    public byte[] toBytes() { return out.toByteArray(); }

    public byte[] keccak() { return Hash.sha3(toBytes()); }

    public String keccakHex() { return Numeric.toHexString(keccak()); }
}
