package com.zookies.zkbackend.exception;

import lombok.Getter;

/**
 * Failure taxonomy shared by signing, storage and proof generation.
 * <p>
 * {@code retryable} failures are infrastructure problems: the same call may succeed later.
 * {@code neutralOutcome} failures are expected answers ("not yet qualified") and should be
 * rendered as a fallback state rather than as an error.
 */
@Getter
public enum ErrorCode {

    VALIDATION_ERROR(false, false),
    CRYPTOGRAPHY_ERROR(false, false),
    DATABASE_ERROR(true, false),
    DUPLICATE_ERROR(false, false),

    INVALID_PARAMETERS(false, false),
    NO_VALID_ATTESTATIONS(false, true),
    INSUFFICIENT_THRESHOLD(false, true),
    CIRCUIT_FILES_NOT_FOUND(true, false),
    BACKEND_TIMEOUT(true, false),
    BACKEND_FAILURE(false, false);

    private final boolean retryable;
    private final boolean neutralOutcome;

    ErrorCode(boolean retryable, boolean neutralOutcome) {
        this.retryable = retryable;
        this.neutralOutcome = neutralOutcome;
    }

}
