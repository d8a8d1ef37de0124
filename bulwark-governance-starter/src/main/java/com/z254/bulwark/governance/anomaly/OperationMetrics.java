package com.z254.bulwark.governance.anomaly;

import lombok.Value;

/**
 * Observed outcome of one operation.
 */
@Value(staticConstructor = "of")
public class OperationMetrics {
    long durationMillis;
    double errorRate;
}
