package org.hotcold.model.attestation;

/** Public identity of the enclave signer: checksummed address, uncompressed public key, mode. */
public record SignerIdentity(String address, String publicKey, SignerMode mode) {}
