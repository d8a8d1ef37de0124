package com.z254.bulwark.governance.admission;

/**
 * Why an admission check was refused.
 */
public enum DenialReason {
    NONE,
    RATE_LIMITED,
    CIRCUIT_OPEN
}
