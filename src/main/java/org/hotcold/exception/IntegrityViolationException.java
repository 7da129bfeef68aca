package org.hotcold.exception;

import java.util.Map;

public class IntegrityViolationException extends EnclaveException {

    public IntegrityViolationException(String roundId) {
        super(ErrorCode.INTEGRITY_VIOLATION, "Audit chain verification failed for round " + roundId,
                Map.of("roundId", roundId));
    }
}
