package org.hotcold.service.target;

/**
 * Freshly drawn secret with its salt and binding commitment. Never leaves the enclave.
 */
public record Target(String secret, String salt, String commitmentHash) {

    @Override
    public String toString() {
        return "Target[commitmentHash=" + commitmentHash + "]";
    }
}
