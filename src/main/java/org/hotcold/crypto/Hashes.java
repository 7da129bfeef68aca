package org.hotcold.crypto;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;

public final class Hashes {

    /** 32 zero bytes: genesis previousHash and Merkle padding leaf. */
    public static final String ZERO_HASH = "0x" + "0".repeat(64);

    private Hashes() {}

    public static String keccakHex(byte[] data) {
        return Numeric.toHexString(Hash.sha3(data));
    }

    public static String keccakHex(String utf8) {
        return keccakHex(utf8.getBytes(StandardCharsets.UTF_8));
    }

    /** keccak256(left ‖ right) over two 32-byte values. */
    public static String hashPair(String left, String right) {
        return PackedEncoder.create().bytes32(left).bytes32(right).keccakHex();
    }
}
