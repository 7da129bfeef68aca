package org.hotcold.crypto;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.web3j.utils.Numeric;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * Seals round secrets at rest with AES-256-GCM. Format: {@code ivHex:ciphertextHex}.
 */
@Service
public class SealService {

    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public SealService(@Value("${enclave.seal-key:0000000000000000000000000000000000000000000000000000000000000000}") String keyHex) {
        byte[] raw = Numeric.hexStringToByteArray(keyHex);
        if (raw.length != 32) throw new IllegalArgumentException("enclave.seal-key must be 32 bytes of hex");
        this.key = new SecretKeySpec(raw, "AES");
    }

    public String seal(String plaintext) {
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] enc = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return Numeric.toHexStringNoPrefix(iv) + ":" + Numeric.toHexStringNoPrefix(enc);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Sealing failed", e);
        }
    }

    public String unseal(String sealed) {
        int sep = sealed.indexOf(':');
        if (sep <= 0) throw new IllegalArgumentException("Malformed sealed value");
        byte[] iv = Numeric.hexStringToByteArray(sealed.substring(0, sep));
        byte[] enc = Numeric.hexStringToByteArray(sealed.substring(sep + 1));
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            return new String(cipher.doFinal(enc), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unsealing failed", e);
        }
    }
}
