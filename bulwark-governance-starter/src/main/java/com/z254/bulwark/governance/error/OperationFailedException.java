package com.z254.bulwark.governance.error;

import lombok.Getter;

/**
 * Wraps a failure of governed work after admission bookkeeping and threat analysis ran.
 */
@Getter
public class OperationFailedException extends GovernanceException {

    private final String operation;
    private final String threatRecordId;

    public OperationFailedException(String operation, String threatRecordId, Throwable cause) {
        super("Operation " + operation + " failed: " + cause.getMessage(), cause);
        this.operation = operation;
        this.threatRecordId = threatRecordId;
    }
}
