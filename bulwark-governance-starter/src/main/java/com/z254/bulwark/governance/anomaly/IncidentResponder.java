package com.z254.bulwark.governance.anomaly;

import com.z254.bulwark.governance.audit.AuditEventTypes;
import com.z254.bulwark.governance.audit.AuditPublisher;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes the response actions of an incident one after another. Each action is
 * recorded on the audit trail.
 */
@Slf4j
public class IncidentResponder {

    private final AuditPublisher auditPublisher;

    public IncidentResponder(AuditPublisher auditPublisher) {
        this.auditPublisher = auditPublisher;
    }

    public void respond(String incidentId, ThreatRecord record) {
        int step = 0;
        for (ResponseAction action : record.getResponseActions()) {
            step++;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("incidentId", incidentId);
            details.put("threatId", record.getId());
            details.put("operation", record.getOperation());
            details.put("severity", record.getSeverity().name());
            details.put("action", action.name());
            details.put("step", step);

            switch (action) {
                case ISOLATE, ALERT -> log.error("Incident {} response {}: operation={}, composite={}",
                        incidentId, action, record.getOperation(), record.getScores().getComposite());
                case FULL_AUDIT, RATE_LIMIT, ENHANCED_MONITOR, REVIEW -> log.warn("Incident {} response {}: operation={}",
                        incidentId, action, record.getOperation());
                default -> log.info("Incident {} response {}: operation={}",
                        incidentId, action, record.getOperation());
            }
            auditPublisher.publish(AuditEventTypes.INCIDENT_RESPONSE, details);
        }
    }
}
