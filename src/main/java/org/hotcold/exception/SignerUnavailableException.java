package org.hotcold.exception;

public class SignerUnavailableException extends EnclaveException {

    public SignerUnavailableException(String message) {
        super(ErrorCode.SIGNER_UNAVAILABLE, message);
    }

    public SignerUnavailableException(String message, Throwable cause) {
        super(ErrorCode.SIGNER_UNAVAILABLE, message, cause);
    }
}
