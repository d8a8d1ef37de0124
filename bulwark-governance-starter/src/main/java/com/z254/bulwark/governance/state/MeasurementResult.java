package com.z254.bulwark.governance.state;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a read-only probabilistic measurement.
 */
@Value
@Builder
public class MeasurementResult {
    int outcome;
    double probability;
    String proof;
}
