package org.hotcold.config;

import lombok.extern.slf4j.Slf4j;
import org.hotcold.crypto.EnclaveSigner;
import org.hotcold.crypto.Web3jEnclaveSigner;
import org.hotcold.exception.SignerUnavailableException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Trust anchor bootstrap. A mnemonic selects TEE mode, a raw dev key selects simulation
 * mode; with neither the application refuses to start.
 */
@Slf4j
@Configuration
public class SignerConfig {

    @Bean
    public EnclaveSigner enclaveSigner(@Value("${enclave.signer.mnemonic:}") String mnemonic,
                                       @Value("${enclave.signer.dev-private-key:}") String devPrivateKey) {
        EnclaveSigner signer;
        if (!mnemonic.isBlank()) {
            signer = Web3jEnclaveSigner.fromMnemonic(mnemonic.trim());
        } else if (!devPrivateKey.isBlank()) {
            signer = Web3jEnclaveSigner.fromPrivateKey(devPrivateKey.trim());
        } else {
            throw new SignerUnavailableException(
                    "No signer configured. Set enclave.signer.mnemonic (TEE) or enclave.signer.dev-private-key (simulation)");
        }
        log.info("Enclave initialized in {} mode, address {}", signer.identity().mode().tag(), signer.identity().address());
        return signer;
    }
}
