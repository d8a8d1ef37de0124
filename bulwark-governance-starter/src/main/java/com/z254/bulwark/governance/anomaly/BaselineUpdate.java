package com.z254.bulwark.governance.anomaly;

import lombok.Builder;
import lombok.Value;

/**
 * Partial baseline; {@code null} fields keep their current value.
 */
@Value
@Builder
public class BaselineUpdate {
    Double avgDuration;
    Double maxDuration;
    Double errorRate;

    boolean isEmpty() {
        return avgDuration == null && maxDuration == null && errorRate == null;
    }

    boolean isValid() {
        return validValue(avgDuration) && validValue(maxDuration) && validValue(errorRate);
    }

    private static boolean validValue(Double value) {
        return value == null || (Double.isFinite(value) && value >= 0);
    }
}
