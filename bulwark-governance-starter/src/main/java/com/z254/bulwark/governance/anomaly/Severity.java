package com.z254.bulwark.governance.anomaly;

/**
 * Threat severity derived from the composite score.
 */
public enum Severity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Severity fromScore(double composite) {
        if (composite >= 0.9) {
            return CRITICAL;
        }
        if (composite >= 0.7) {
            return HIGH;
        }
        if (composite >= 0.5) {
            return MEDIUM;
        }
        if (composite >= 0.3) {
            return LOW;
        }
        return INFO;
    }
}
