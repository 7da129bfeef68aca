package org.hotcold.exception;

import java.util.Map;

public class RoundNotFoundException extends EnclaveException {

    public RoundNotFoundException(String roundId) {
        super(ErrorCode.NOT_FOUND, "Round not found: " + roundId, Map.of("roundId", String.valueOf(roundId)));
    }
}
