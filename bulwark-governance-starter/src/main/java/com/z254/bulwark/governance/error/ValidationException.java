package com.z254.bulwark.governance.error;

import lombok.Getter;

/**
 * Raised for malformed input. Never retried internally.
 */
@Getter
public class ValidationException extends GovernanceException {

    private final Reason reason;

    public ValidationException(Reason reason, String message) {
        super(reason.name() + ": " + message);
        this.reason = reason;
    }

    public enum Reason {
        INVALID_DIMENSION,
        DIMENSION_MISMATCH,
        INVALID_BASIS,
        MALFORMED_RECORD
    }
}
