package org.hotcold.exception;

import org.hotcold.model.RoundStatus;

import java.util.Map;

public class RoundNotActiveException extends EnclaveException {

    public RoundNotActiveException(String roundId, RoundStatus status) {
        super(ErrorCode.INVALID_STATE, "Round is not active: " + roundId,
                Map.of("roundId", roundId, "status", status.tag()));
    }
}
