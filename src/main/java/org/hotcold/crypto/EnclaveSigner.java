package org.hotcold.crypto;

import org.hotcold.model.attestation.SignerIdentity;

/**
 * Opaque signing capability of the enclave.
 */
public interface EnclaveSigner {

    SignerIdentity identity();

    /**
     * Signs a 32-byte message digest as an Ethereum personal message (EIP-191).
     *
     * @return {@code 0x}-prefixed r ‖ s ‖ v, 65 bytes
     */
    String signDigest(byte[] digest);
}
