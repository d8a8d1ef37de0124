package com.z254.bulwark.governance.error;

/**
 * Base type for every failure raised by the governance layer.
 */
public abstract class GovernanceException extends RuntimeException {

    protected GovernanceException(String message) {
        super(message);
    }

    protected GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
