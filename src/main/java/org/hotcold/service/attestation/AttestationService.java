package org.hotcold.service.attestation;

import lombok.extern.slf4j.Slf4j;
import org.hotcold.crypto.EnclaveSigner;
import org.hotcold.crypto.PackedEncoder;
import org.hotcold.exception.SignerUnavailableException;
import org.hotcold.model.attestation.SignedAuditRoot;
import org.hotcold.model.attestation.SignedHint;
import org.hotcold.model.attestation.SignedPriceUpdate;
import org.hotcold.model.attestation.SignedStartRound;
import org.hotcold.model.attestation.SignedWinnerDeclaration;
import org.hotcold.model.attestation.SignerIdentity;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Builds the canonical message of each attested action, binds a fresh nonce to it and
 * has the enclave key sign it. Message hash = keccak256(abi.encodePacked(fields..., nonce)),
 * signed as an Ethereum personal message.
 */
@Slf4j
@Service
public class AttestationService {

    private final EnclaveSigner signer;
    private final NonceCounter nonces;

    public AttestationService(EnclaveSigner signer, NonceCounter nonces) {
        this.signer = signer;
        this.nonces = nonces;
    }

    public SignerIdentity identity() {
        return requireSigner().identity();
    }

    public SignedStartRound signStartRound(String roundId, String commitmentHash, BigInteger baseBuyIn) {
        Signature sig = sign(PackedEncoder.create()
                .string(roundId)
                .bytes32(commitmentHash)
                .uint256(baseBuyIn));
        return new SignedStartRound(roundId, commitmentHash, baseBuyIn.toString(), sig.nonce(), sig.value());
    }

    public SignedHint signHint(String roundId, String player, int digitsCorrect, int digitsInPlace,
                               long numericDistance) {
        Signature sig = sign(PackedEncoder.create()
                .string(roundId)
                .address(player)
                .uint8(digitsCorrect)
                .uint8(digitsInPlace)
                .uint256(numericDistance));
        return new SignedHint(roundId, player, digitsCorrect, digitsInPlace,
                Long.toString(numericDistance), sig.nonce(), sig.value());
    }

    public SignedPriceUpdate signPriceUpdate(String roundId, BigInteger newBuyIn) {
        Signature sig = sign(PackedEncoder.create()
                .string(roundId)
                .uint256(newBuyIn));
        return new SignedPriceUpdate(roundId, newBuyIn.toString(), sig.nonce(), sig.value());
    }

    public SignedWinnerDeclaration signWinner(String roundId, String winner) {
        Signature sig = sign(PackedEncoder.create()
                .string(roundId)
                .address(winner));
        return new SignedWinnerDeclaration(roundId, winner, sig.nonce(), sig.value());
    }

    public SignedAuditRoot signAuditRoot(String roundId, String merkleRoot, long entryCount) {
        Signature sig = sign(PackedEncoder.create()
                .string(roundId)
                .bytes32(merkleRoot)
                .uint256(entryCount));
        return new SignedAuditRoot(roundId, merkleRoot, entryCount, sig.nonce(), sig.value());
    }

    /** Fields are encoded before the nonce is drawn, so a malformed field never burns one. */
    private Signature sign(PackedEncoder fields) {
        EnclaveSigner s = requireSigner();
        long nonce = nonces.next();
        byte[] digest = fields.uint256(nonce).keccak();
        log.debug("Signing message with nonce {}", nonce);
        return new Signature(nonce, s.signDigest(digest));
    }

    private record Signature(long nonce, String value) {}

    private EnclaveSigner requireSigner() {
        if (signer == null) throw new SignerUnavailableException("Enclave signer is not initialized");
        return signer;
    }
}
