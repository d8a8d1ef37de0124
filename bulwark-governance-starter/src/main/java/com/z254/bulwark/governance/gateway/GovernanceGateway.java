package com.z254.bulwark.governance.gateway;

import com.z254.bulwark.governance.admission.AdmissionController;
import com.z254.bulwark.governance.admission.AdmissionDecision;
import com.z254.bulwark.governance.admission.AdmissionKey;
import com.z254.bulwark.governance.admission.DenialReason;
import com.z254.bulwark.governance.anomaly.AnomalyScorer;
import com.z254.bulwark.governance.anomaly.OperationMetrics;
import com.z254.bulwark.governance.anomaly.ThreatRecord;
import com.z254.bulwark.governance.audit.AuditEventTypes;
import com.z254.bulwark.governance.audit.AuditPublisher;
import com.z254.bulwark.governance.error.CircuitOpenException;
import com.z254.bulwark.governance.error.OperationFailedException;
import com.z254.bulwark.governance.error.RateLimitExceededException;
import com.z254.bulwark.governance.observability.GovernanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs arbitrary work under admission control, threat analysis and audit.
 * <p>
 * Per call:
 * <ol>
 *     <li>admission check; a denial raises {@link RateLimitExceededException} or
 *         {@link CircuitOpenException} without running the work</li>
 *     <li>the work runs and is timed</li>
 *     <li>success or failure is recorded on the key's circuit and analyzed</li>
 *     <li>a failure is re-raised as {@link OperationFailedException}; an {@link Error} is
 *         rethrown as is, and an interrupted work restores the thread's interrupt flag</li>
 *     <li>a performance event is always sent to the audit sink, best effort</li>
 * </ol>
 * The gateway owns the periodic window-trimming task: {@link #start()} schedules it and
 * {@link #close()} cancels it.
 */
@Slf4j
public class GovernanceGateway implements AutoCloseable {

    public static final String MDC_OPERATION = "operation";
    public static final String MDC_IDENTITY = "identity";
    public static final String MDC_CORRELATION_ID = "correlationId";

    private final AdmissionController admissionController;
    private final AnomalyScorer anomalyScorer;
    private final AuditPublisher auditPublisher;
    private final GovernanceMetrics metrics;
    private final Duration trimInterval;

    private ScheduledExecutorService maintenanceExecutor;
    private ScheduledFuture<?> trimTask;

    public GovernanceGateway(AdmissionController admissionController,
                             AnomalyScorer anomalyScorer,
                             AuditPublisher auditPublisher,
                             GovernanceMetrics metrics,
                             Duration trimInterval) {
        this.admissionController = admissionController;
        this.anomalyScorer = anomalyScorer;
        this.auditPublisher = auditPublisher;
        this.metrics = metrics;
        this.trimInterval = trimInterval;
    }

    /**
     * Execute {@code work} for {@code identity} under the governance of {@code operation}.
     *
     * @throws RateLimitExceededException if the key's window is full
     * @throws CircuitOpenException       if the key's circuit is open
     * @throws OperationFailedException   if the work itself failed
     */
    public <T> T executeGoverned(String operation, String identity, GovernedWork<T> work, Map<String, Object> context) {
        AdmissionKey key = AdmissionKey.of(operation, identity);
        AdmissionDecision decision = admissionController.checkLimit(operation, identity);
        if (!decision.isAllowed()) {
            if (decision.getDenialReason() == DenialReason.CIRCUIT_OPEN) {
                throw new CircuitOpenException(operation, identity, decision.getRetryAfter());
            }
            throw new RateLimitExceededException(operation, identity, decision.getRetryAfter());
        }

        String correlationId = context != null && context.get(MDC_CORRELATION_ID) != null
                ? context.get(MDC_CORRELATION_ID).toString()
                : UUID.randomUUID().toString();
        MDC.put(MDC_OPERATION, operation);
        MDC.put(MDC_IDENTITY, identity);
        MDC.put(MDC_CORRELATION_ID, correlationId);

        long started = System.nanoTime();
        boolean success = false;
        Duration duration = Duration.ZERO;
        try {
            T result;
            try {
                result = work.execute();
            } catch (Throwable t) {
                if (t instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                duration = Duration.ofNanos(System.nanoTime() - started);
                admissionController.recordFailure(key);
                ThreatRecord threat = anomalyScorer.analyze(operation,
                        OperationMetrics.of(duration.toMillis(), 1.0), context);
                log.warn("Governed operation failed: operation={}, identity={}, duration={}ms, severity={}",
                        operation, identity, duration.toMillis(), threat.getSeverity());
                if (t instanceof Error) {
                    throw (Error) t;
                }
                throw new OperationFailedException(operation, threat.getId(), t);
            }
            duration = Duration.ofNanos(System.nanoTime() - started);
            success = true;
            admissionController.recordSuccess(key);
            anomalyScorer.analyze(operation, OperationMetrics.of(duration.toMillis(), 0.0), context);
            return result;
        } finally {
            if (!success && duration.isZero()) {
                duration = Duration.ofNanos(System.nanoTime() - started);
            }
            metrics.recordOperation(duration, success);
            publishPerformance(operation, duration, success);
            MDC.remove(MDC_OPERATION);
            MDC.remove(MDC_IDENTITY);
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    /**
     * Convenience overload without context.
     */
    public <T> T executeGoverned(String operation, String identity, GovernedWork<T> work) {
        return executeGoverned(operation, identity, work, Map.of());
    }

    private void publishPerformance(String operation, Duration duration, boolean success) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        details.put("duration", duration.toMillis());
        details.put("success", success);
        auditPublisher.publish(AuditEventTypes.PERFORMANCE_METRIC, details);
    }

    // === Lifecycle ===

    /**
     * Schedule the periodic window trim. Idempotent.
     */
    public synchronized void start() {
        if (trimTask != null) {
            return;
        }
        maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "bulwark-governance-maintenance");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = trimInterval.toMillis();
        trimTask = maintenanceExecutor.scheduleAtFixedRate(this::trimWindows, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Governance gateway started: trimInterval={}", trimInterval);
    }

    public synchronized boolean isRunning() {
        return trimTask != null && !trimTask.isCancelled();
    }

    /**
     * Cancel background tasks. The gateway keeps serving calls afterwards.
     */
    @Override
    public synchronized void close() {
        if (trimTask == null) {
            return;
        }
        trimTask.cancel(false);
        maintenanceExecutor.shutdownNow();
        trimTask = null;
        maintenanceExecutor = null;
        log.info("Governance gateway stopped");
    }

    void trimWindows() {
        try {
            admissionController.trimAll();
        } catch (RuntimeException e) {
            // an exception would cancel the periodic task
            log.error("Window trim failed", e);
        }
    }
}
