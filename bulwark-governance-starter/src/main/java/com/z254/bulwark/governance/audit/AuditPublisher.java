package com.z254.bulwark.governance.audit;

import com.z254.bulwark.governance.observability.GovernanceMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Best-effort front for an {@link AuditSink}: delivery failures are logged and counted,
 * never thrown to the caller.
 */
@Slf4j
public class AuditPublisher {

    private final AuditSink sink;
    private final GovernanceMetrics metrics;

    public AuditPublisher(AuditSink sink, GovernanceMetrics metrics) {
        this.sink = sink;
        this.metrics = metrics;
    }

    /**
     * @return the record ID, or empty if the sink failed
     */
    public Optional<String> publish(String eventType, Map<String, Object> details) {
        try {
            return Optional.ofNullable(sink.appendEvent(eventType, details));
        } catch (RuntimeException e) {
            metrics.recordAuditSinkFailure();
            log.warn("Audit sink rejected {} event: {}", eventType, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
