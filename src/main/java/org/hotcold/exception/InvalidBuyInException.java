package org.hotcold.exception;

import java.util.Map;

/** Buy-in amount out of range (negative, zero base, or beyond uint256 once escalated). */
public class InvalidBuyInException extends EnclaveException {

    public InvalidBuyInException(String message, String field) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of("field", field));
    }
}
