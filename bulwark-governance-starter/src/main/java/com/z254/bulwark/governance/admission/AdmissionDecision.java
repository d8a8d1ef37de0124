package com.z254.bulwark.governance.admission;

import lombok.Builder;
import lombok.Value;

/**
 * Result of {@link AdmissionController#checkLimit(String, String, int)}.
 */
@Value
@Builder
public class AdmissionDecision {

    boolean allowed;

    int remaining;

    /** Advisory back-off in seconds; 0 when allowed */
    long retryAfter;

    int limit;

    CircuitState circuitState;

    @Builder.Default
    DenialReason denialReason = DenialReason.NONE;
}
