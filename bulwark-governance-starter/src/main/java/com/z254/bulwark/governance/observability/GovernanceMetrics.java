package com.z254.bulwark.governance.observability;

import com.z254.bulwark.governance.admission.AdmissionDecision;
import com.z254.bulwark.governance.anomaly.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for the governance gateway.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Admission decisions (allowed, denied by reason)</li>
 *     <li>Circuit transitions</li>
 *     <li>Threat analysis and incidents</li>
 *     <li>Governed operation latency</li>
 *     <li>Audit sink delivery failures</li>
 * </ul>
 */
public class GovernanceMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter admissionsAllowed;
    @Getter
    private final Counter circuitsOpened;
    @Getter
    private final Counter incidents;
    @Getter
    private final Counter auditSinkFailures;

    private final Map<String, Counter> deniedByReason = new ConcurrentHashMap<>();
    private final Map<Severity, Counter> threatsBySeverity = new ConcurrentHashMap<>();
    private final Timer successTimer;
    private final Timer failureTimer;

    public GovernanceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.admissionsAllowed = Counter.builder("bulwark.admission.allowed")
                .description("Requests admitted")
                .register(meterRegistry);
        this.circuitsOpened = Counter.builder("bulwark.circuit.opened")
                .description("Circuit trips to OPEN")
                .register(meterRegistry);
        this.incidents = Counter.builder("bulwark.incidents")
                .description("Incidents raised by threat analysis")
                .register(meterRegistry);
        this.auditSinkFailures = Counter.builder("bulwark.audit.sink.failures")
                .description("Audit events that could not be delivered")
                .register(meterRegistry);
        this.successTimer = Timer.builder("bulwark.operation.duration")
                .description("Governed operation duration")
                .tag("outcome", "success")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.failureTimer = Timer.builder("bulwark.operation.duration")
                .description("Governed operation duration")
                .tag("outcome", "failure")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    // ========== Admission ==========

    public void recordAdmission(AdmissionDecision decision) {
        if (decision.isAllowed()) {
            admissionsAllowed.increment();
            return;
        }
        deniedByReason.computeIfAbsent(decision.getDenialReason().name(), reason ->
                Counter.builder("bulwark.admission.denied")
                        .description("Requests denied")
                        .tag("reason", reason)
                        .register(meterRegistry))
                .increment();
    }

    public void recordCircuitOpened() {
        circuitsOpened.increment();
    }

    // ========== Threat analysis ==========

    public void recordThreat(Severity severity) {
        threatsBySeverity.computeIfAbsent(severity, s ->
                Counter.builder("bulwark.threat.analyzed")
                        .description("Threat records produced")
                        .tag("severity", s.name())
                        .register(meterRegistry))
                .increment();
    }

    public void recordIncident() {
        incidents.increment();
    }

    // ========== Operations ==========

    public void recordOperation(Duration duration, boolean success) {
        (success ? successTimer : failureTimer).record(duration);
    }

    public void recordAuditSinkFailure() {
        auditSinkFailures.increment();
    }
}
