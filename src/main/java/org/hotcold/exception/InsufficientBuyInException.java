package org.hotcold.exception;

import java.math.BigInteger;
import java.util.Map;

public class InsufficientBuyInException extends EnclaveException {

    public InsufficientBuyInException(String roundId, BigInteger paid, BigInteger required) {
        super(ErrorCode.INSUFFICIENT_PAYMENT, "Insufficient buy-in",
                Map.of("roundId", roundId, "paid", paid.toString(), "required", required.toString()));
    }
}
