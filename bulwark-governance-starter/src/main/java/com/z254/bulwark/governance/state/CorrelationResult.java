package com.z254.bulwark.governance.state;

import lombok.Builder;
import lombok.Value;

/**
 * Correlation between two containers, bound to both state hashes.
 */
@Value
@Builder
public class CorrelationResult {
    double correlation;
    String proof;
}
