package com.z254.bulwark.governance.error;

/**
 * Raised when a recomputed fingerprint does not match the stored one.
 * Signals corrupted or tampered data.
 */
public class IntegrityException extends GovernanceException {

    public IntegrityException(String message) {
        super(message);
    }
}
