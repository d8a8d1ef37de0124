package com.z254.bulwark.governance.anomaly;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable result of analyzing one operation.
 */
@Value
@Builder
public class ThreatRecord {

    String id;

    String operation;

    OperationMetrics metrics;

    ThreatScores scores;

    Severity severity;

    /** Actions taken; empty unless an incident was raised */
    @Singular
    List<ResponseAction> responseActions;

    /** fingerprint(id, metrics, composite, timestamp) */
    String proof;

    long timestamp;

    public boolean isIncident() {
        return !responseActions.isEmpty();
    }

    /**
     * Flat view for the audit trail.
     */
    public Map<String, Object> toAuditDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("threatId", id);
        details.put("operation", operation);
        details.put("duration", metrics.getDurationMillis());
        details.put("errorRate", metrics.getErrorRate());
        details.put("anomalyScore", scores.getAnomaly());
        details.put("behavioralScore", scores.getBehavioral());
        details.put("contextualScore", scores.getContextual());
        details.put("compositeScore", scores.getComposite());
        details.put("severity", severity.name());
        details.put("responseActions", responseActions.stream().map(Enum::name).collect(Collectors.toList()));
        details.put("proof", proof);
        details.put("timestamp", timestamp);
        return details;
    }
}
