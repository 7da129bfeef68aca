package org.hotcold.crypto;

import org.hotcold.exception.SignerUnavailableException;
import org.hotcold.model.attestation.SignerIdentity;
import org.hotcold.model.attestation.SignerMode;
import org.web3j.crypto.Bip32ECKeyPair;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.MnemonicUtils;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;

import static org.web3j.crypto.Bip32ECKeyPair.HARDENED_BIT;

/**
 * secp256k1 signer backed by web3j. TEE mode derives the key from the enclave mnemonic
 * on the standard Ethereum path m/44'/60'/0'/0/0; simulation mode takes a raw dev key.
 */
public class Web3jEnclaveSigner implements EnclaveSigner {

    private static final int[] ETH_DERIVATION_PATH = {44 | HARDENED_BIT, 60 | HARDENED_BIT, HARDENED_BIT, 0, 0};

    private final ECKeyPair keyPair;
    private final SignerIdentity identity;

    public Web3jEnclaveSigner(ECKeyPair keyPair, SignerMode mode) {
        this.keyPair = keyPair;
        String address = Keys.toChecksumAddress(Keys.getAddress(keyPair));
        String publicKey = "0x04" + Numeric.toHexStringNoPrefixZeroPadded(keyPair.getPublicKey(), 128);
        this.identity = new SignerIdentity(address, publicKey, mode);
    }

    public static Web3jEnclaveSigner fromPrivateKey(String privateKeyHex) {
        try {
            return new Web3jEnclaveSigner(Credentials.create(privateKeyHex).getEcKeyPair(), SignerMode.SIMULATION);
        } catch (RuntimeException e) {
            throw new SignerUnavailableException("Invalid dev private key", e);
        }
    }

    public static Web3jEnclaveSigner fromMnemonic(String mnemonic) {
        if (!MnemonicUtils.validateMnemonic(mnemonic)) {
            throw new SignerUnavailableException("Invalid enclave mnemonic");
        }
        byte[] seed = MnemonicUtils.generateSeed(mnemonic, "");
        Bip32ECKeyPair master = Bip32ECKeyPair.generateKeyPair(seed);
        Bip32ECKeyPair derived = Bip32ECKeyPair.deriveKeyPair(master, ETH_DERIVATION_PATH);
        return new Web3jEnclaveSigner(derived, SignerMode.TEE);
    }

    @Override
    public SignerIdentity identity() { return identity; }

    @Override
    public String signDigest(byte[] digest) {
        Sign.SignatureData sig = Sign.signPrefixedMessage(digest, keyPair);
        ByteArrayOutputStream out = new ByteArrayOutputStream(65);
        out.writeBytes(sig.getR());
        out.writeBytes(sig.getS());
        out.writeBytes(sig.getV());
        return Numeric.toHexString(out.toByteArray());
    }
}
