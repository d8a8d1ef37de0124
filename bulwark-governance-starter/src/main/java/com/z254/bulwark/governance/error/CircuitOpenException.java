package com.z254.bulwark.governance.error;

import lombok.Getter;

/**
 * Admission was denied because the circuit for the key is open.
 */
@Getter
public class CircuitOpenException extends GovernanceException {

    private final String operation;
    private final String identity;
    private final long retryAfter;

    public CircuitOpenException(String operation, String identity, long retryAfter) {
        super("Circuit open for " + operation + " by " + identity + ", retry after " + retryAfter + "s");
        this.operation = operation;
        this.identity = identity;
        this.retryAfter = retryAfter;
    }
}
