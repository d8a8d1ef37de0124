package com.z254.bulwark.governance.audit;

/**
 * Event types emitted to the {@link AuditSink}.
 */
public final class AuditEventTypes {

    public static final String PERFORMANCE_METRIC = "performance_metric";
    public static final String THREAT_ANALYSIS = "threat_analysis";
    public static final String INCIDENT_RESPONSE = "incident_response";
    public static final String BASELINE_UPDATED = "baseline_updated";

    private AuditEventTypes() {
    }
}
