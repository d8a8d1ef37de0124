package com.z254.bulwark.governance.anomaly;

import java.util.List;

/**
 * Incident response steps, executed in declaration order of {@link #forSeverity(Severity)}.
 */
public enum ResponseAction {
    ISOLATE,
    ALERT,
    FULL_AUDIT,
    RATE_LIMIT,
    ENHANCED_MONITOR,
    REVIEW,
    LOG,
    BASELINE_UPDATE;

    public static List<ResponseAction> forSeverity(Severity severity) {
        return switch (severity) {
            case CRITICAL -> List.of(ISOLATE, ALERT, FULL_AUDIT);
            case HIGH -> List.of(RATE_LIMIT, ENHANCED_MONITOR, REVIEW);
            case MEDIUM -> List.of(LOG, BASELINE_UPDATE);
            case LOW, INFO -> List.of();
        };
    }
}
