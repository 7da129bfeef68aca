package org.hotcold.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    INSUFFICIENT_PAYMENT("INSUFFICIENT_PAYMENT", 402),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_STATE("INVALID_STATE", 409),
    INTEGRITY_VIOLATION("INTEGRITY_VIOLATION", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    SIGNER_UNAVAILABLE("SIGNER_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
