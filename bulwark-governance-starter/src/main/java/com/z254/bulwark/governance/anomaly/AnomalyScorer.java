package com.z254.bulwark.governance.anomaly;

import com.z254.bulwark.governance.audit.AuditEventTypes;
import com.z254.bulwark.governance.audit.AuditPublisher;
import com.z254.bulwark.governance.config.BulwarkGovernanceProperties;
import com.z254.bulwark.governance.observability.GovernanceMetrics;
import com.z254.bulwark.governance.state.Fingerprints;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Composite threat scoring.
 * <p>
 * Three independent signals are computed per operation:
 * <ul>
 *     <li>anomaly: a keyed pseudo-random baseline in [0, 0.3) raised by slow or failing calls</li>
 *     <li>behavioral: deviation from the operation's {@link BehavioralBaseline}</li>
 *     <li>contextual: caller-supplied risk flags and time of day</li>
 * </ul>
 * The composite is the strongest single signal, not an average. A composite above the
 * incident threshold raises an incident and runs the severity's response actions.
 */
@Slf4j
public class AnomalyScorer {

    static final double RANDOM_BASELINE_SPAN = 0.3;
    static final long SLOW_DURATION_MS = 1000;
    static final double HIGH_ERROR_RATE = 0.1;
    static final double NO_BASELINE_SCORE = 0.1;
    static final double HIGH_FREQUENCY = 1000;

    private static final SecureRandom ENTROPY = new SecureRandom();

    private final Map<String, BehavioralBaseline> baselines = new ConcurrentHashMap<>();
    private final AtomicLong incidentCounter = new AtomicLong();
    private final byte[] scoringKey = Fingerprints.newKey(ENTROPY);

    private final BehavioralBaseline defaultBaseline;
    private final double incidentThreshold;
    private final AuditPublisher auditPublisher;
    private final IncidentResponder incidentResponder;
    private final GovernanceMetrics metrics;
    private final Clock clock;

    public AnomalyScorer(BulwarkGovernanceProperties properties,
                         AuditPublisher auditPublisher,
                         IncidentResponder incidentResponder,
                         GovernanceMetrics metrics,
                         Clock clock) {
        var anomaly = properties.getAnomaly();
        this.defaultBaseline = anomaly.getDefaultBaseline().toBuilder().build();
        this.incidentThreshold = anomaly.getIncidentThreshold();
        this.auditPublisher = auditPublisher;
        this.incidentResponder = incidentResponder;
        this.metrics = metrics;
        this.clock = clock;

        anomaly.getBaselines().forEach((operation, baseline) ->
                baselines.put(operation, baseline.toBuilder().build()));
    }

    /**
     * Score an operation outcome and, above the incident threshold, respond to it.
     */
    public ThreatRecord analyze(String operation, OperationMetrics operationMetrics, Map<String, Object> context) {
        long now = clock.millis();
        ThreatContext threatContext = ThreatContext.from(context);

        double anomaly = anomalyScore(operation, operationMetrics, now);
        double behavioral = behavioralScore(operation, operationMetrics, threatContext);
        double contextual = contextualScore(threatContext, now);
        double composite = Math.max(anomaly, Math.max(behavioral, contextual));
        Severity severity = Severity.fromScore(composite);

        String id = UUID.randomUUID().toString();
        List<ResponseAction> actions = composite > incidentThreshold
                ? ResponseAction.forSeverity(severity)
                : List.of();

        ThreatRecord record = ThreatRecord.builder()
                .id(id)
                .operation(operation)
                .metrics(operationMetrics)
                .scores(ThreatScores.builder()
                        .anomaly(anomaly)
                        .behavioral(behavioral)
                        .contextual(contextual)
                        .composite(composite)
                        .build())
                .severity(severity)
                .responseActions(actions)
                .proof(Fingerprints.fingerprint(id, operationMetrics.getDurationMillis(),
                        operationMetrics.getErrorRate(), composite, now))
                .timestamp(now)
                .build();

        metrics.recordThreat(severity);
        auditPublisher.publish(AuditEventTypes.THREAT_ANALYSIS, record.toAuditDetails());

        if (record.isIncident()) {
            long sequence = incidentCounter.incrementAndGet();
            String incidentId = "INC-" + sequence;
            metrics.recordIncident();
            log.warn("Incident {} raised: operation={}, severity={}, composite={}",
                    incidentId, operation, severity, composite);
            incidentResponder.respond(incidentId, record);
        } else if (log.isDebugEnabled()) {
            log.debug("Threat analyzed: operation={}, severity={}, composite={}", operation, severity, composite);
        }
        return record;
    }

    double anomalyScore(String operation, OperationMetrics operationMetrics, long now) {
        double score = Fingerprints.keyedUniform(scoringKey, operation,
                operationMetrics.getDurationMillis(), operationMetrics.getErrorRate(), now) * RANDOM_BASELINE_SPAN;
        if (operationMetrics.getDurationMillis() > SLOW_DURATION_MS) {
            score += 0.4;
        }
        if (operationMetrics.getErrorRate() > HIGH_ERROR_RATE) {
            score += 0.3;
        }
        return clamp(score);
    }

    double behavioralScore(String operation, OperationMetrics operationMetrics, ThreatContext context) {
        BehavioralBaseline baseline = baselines.get(operation);
        if (baseline == null) {
            return NO_BASELINE_SCORE;
        }
        double score = 0.0;
        long duration = operationMetrics.getDurationMillis();
        if (duration > 2 * baseline.getMaxDuration()) {
            score += 0.4;
        } else if (duration > baseline.getMaxDuration()) {
            score += 0.2;
        }
        double errorRate = operationMetrics.getErrorRate();
        if (errorRate > 5 * baseline.getErrorRate()) {
            score += 0.4;
        } else if (errorRate > 2 * baseline.getErrorRate()) {
            score += 0.2;
        }
        if (context.getFrequency() > HIGH_FREQUENCY) {
            score += 0.2;
        }
        return clamp(score);
    }

    double contextualScore(ThreatContext context, long now) {
        double score = 0.0;
        if (context.isSuspiciousIp()) {
            score += 0.3;
        }
        int hour = Instant.ofEpochMilli(now).atZone(clock.getZone()).getHour();
        if (hour < 6 || hour > 22) {
            score += 0.2;
        }
        if (context.isUnusualLocation()) {
            score += 0.3;
        }
        if (context.isRapidSuccession()) {
            score += 0.2;
        }
        return clamp(score);
    }

    // === Administration ===

    /**
     * Merge a partial baseline into the operation's baseline, creating it from the
     * configured default if absent.
     *
     * @return false if the operation is blank or the update is empty or has negative values
     */
    public boolean updateBaseline(String operation, BaselineUpdate update) {
        if (operation == null || operation.isBlank() || update == null || update.isEmpty() || !update.isValid()) {
            log.warn("Rejected baseline update for operation {}", operation);
            return false;
        }
        BehavioralBaseline merged = baselines.compute(operation, (op, existing) -> {
            BehavioralBaseline.BehavioralBaselineBuilder builder =
                    (existing != null ? existing : defaultBaseline).toBuilder();
            if (update.getAvgDuration() != null) {
                builder.avgDuration(update.getAvgDuration());
            }
            if (update.getMaxDuration() != null) {
                builder.maxDuration(update.getMaxDuration());
            }
            if (update.getErrorRate() != null) {
                builder.errorRate(update.getErrorRate());
            }
            return builder.build();
        });

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("avgDuration", merged.getAvgDuration());
        details.put("maxDuration", merged.getMaxDuration());
        details.put("errorRate", merged.getErrorRate());
        auditPublisher.publish(AuditEventTypes.BASELINE_UPDATED, details);
        log.info("Baseline updated: operation={}, baseline={}", operation, merged);
        return true;
    }

    public Optional<BehavioralBaseline> getBaseline(String operation) {
        return Optional.ofNullable(baselines.get(operation)).map(b -> b.toBuilder().build());
    }

    public long incidentCount() {
        return incidentCounter.get();
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
