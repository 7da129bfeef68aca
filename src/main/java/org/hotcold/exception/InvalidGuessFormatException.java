package org.hotcold.exception;

import java.util.Map;

/** Malformed guess or player identity. */
public class InvalidGuessFormatException extends EnclaveException {

    public InvalidGuessFormatException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidGuessFormatException(String message, String field) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of("field", field));
    }
}
