package com.z254.bulwark.governance.admission;

import com.z254.bulwark.governance.config.BulwarkGovernanceProperties;
import com.z254.bulwark.governance.observability.GovernanceMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Sliding-window admission control with an adaptive per-operation limit and a
 * per-key circuit breaker.
 * <p>
 * Mutations of a key's window and circuit are serialized on that key's
 * {@link KeyState}; different keys proceed in parallel. Every decision is synchronous
 * and bounded; {@code retryAfter} is advisory.
 */
@Slf4j
public class AdmissionController {

    private final AdmissionStore store;
    private final GovernanceMetrics metrics;
    private final Clock clock;

    private final long windowMillis;
    private final int defaultLimit;
    private final AdaptiveLimit fixedDefault;
    private final int failureThreshold;
    private final long initialTimeoutMillis;
    private final long maxTimeoutMillis;

    public AdmissionController(AdmissionStore store,
                               BulwarkGovernanceProperties properties,
                               GovernanceMetrics metrics,
                               Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;

        var admission = properties.getAdmission();
        var circuit = properties.getCircuit();
        this.windowMillis = admission.getWindow().toMillis();
        this.defaultLimit = admission.getDefaultLimit();
        this.failureThreshold = circuit.getFailureThreshold();
        this.initialTimeoutMillis = circuit.getInitialTimeout().toMillis();
        this.maxTimeoutMillis = circuit.getMaxTimeout().toMillis();

        long now = clock.millis();
        this.fixedDefault = AdaptiveLimit.fixed(defaultLimit, now);
        for (Map.Entry<String, LimitPolicy> entry : admission.getOperations().entrySet()) {
            store.putLimit(entry.getKey(), AdaptiveLimit.of(entry.getValue(), now));
        }
    }

    /**
     * Check a single-unit request.
     */
    public AdmissionDecision checkLimit(String operation, String identity) {
        return checkLimit(operation, identity, 1);
    }

    /**
     * Check whether {@code cost} more requests fit in the key's window, consuming them if so.
     */
    public AdmissionDecision checkLimit(String operation, String identity, int cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must not be negative: " + cost);
        }
        AdmissionKey key = AdmissionKey.of(operation, identity);
        long now = clock.millis();
        AdaptiveLimit limit = store.findLimit(operation).orElse(fixedDefault);

        AdmissionDecision decision = withState(key, state -> {
            state.trim(now - windowMillis);
            return evaluate(key, state, limit, cost, now);
        });

        metrics.recordAdmission(decision);
        if (!decision.isAllowed()) {
            log.debug("Admission denied: key={}, reason={}, retryAfter={}s",
                    key, decision.getDenialReason(), decision.getRetryAfter());
        }
        return decision;
    }

    private AdmissionDecision evaluate(AdmissionKey key, KeyState state, AdaptiveLimit limit, int cost, long now) {
        if (state.getCircuitState() == CircuitState.OPEN) {
            long reopensAt = state.getTrippedAt() + state.getTimeoutMillis();
            if (now < reopensAt) {
                return AdmissionDecision.builder()
                        .allowed(false)
                        .remaining(0)
                        .retryAfter(secondsUntil(reopensAt, now))
                        .limit(limit.currentLimit())
                        .circuitState(CircuitState.OPEN)
                        .denialReason(DenialReason.CIRCUIT_OPEN)
                        .build();
            }
            state.setCircuitState(CircuitState.HALF_OPEN);
            log.info("Circuit half-open: key={}", key);
        }

        if (cost > limit.currentLimit() || (long) state.size() + cost > limit.getCurrent()) {
            registerFailure(key, state, now);
            Long oldest = state.oldest();
            long resetAt = (oldest != null ? oldest : now) + windowMillis;
            return AdmissionDecision.builder()
                    .allowed(false)
                    .remaining(0)
                    .retryAfter(Math.max(1, secondsUntil(resetAt, now)))
                    .limit(limit.currentLimit())
                    .circuitState(state.getCircuitState())
                    .denialReason(DenialReason.RATE_LIMITED)
                    .build();
        }

        state.append(now, cost);
        limit.adjust(state.size(), now);
        return AdmissionDecision.builder()
                .allowed(true)
                .remaining(Math.max(0, limit.currentLimit() - state.size()))
                .retryAfter(0)
                .limit(limit.currentLimit())
                .circuitState(state.getCircuitState())
                .build();
    }

    // === Circuit breaker ===

    public void recordFailure(AdmissionKey key) {
        withState(key, state -> {
            registerFailure(key, state, clock.millis());
            return null;
        });
    }

    public void recordSuccess(AdmissionKey key) {
        withState(key, state -> {
            if (state.getCircuitState() == CircuitState.HALF_OPEN) {
                state.setCircuitState(CircuitState.CLOSED);
                state.setFailureCount(0);
                state.setTimeoutMillis(0);
                log.info("Circuit closed: key={}", key);
            } else {
                state.setFailureCount(Math.max(0, state.getFailureCount() - 1));
            }
            return null;
        });
    }

    // Runs under the key's lock, retrying if the store dropped the state in between.
    private <R> R withState(AdmissionKey key, Function<KeyState, R> action) {
        while (true) {
            KeyState state = store.getOrCreate(key);
            synchronized (state) {
                if (!state.isRetired()) {
                    return action.apply(state);
                }
            }
        }
    }

    // Caller holds the key lock.
    private void registerFailure(AdmissionKey key, KeyState state, long now) {
        state.setFailureCount(state.getFailureCount() + 1);
        boolean trip = switch (state.getCircuitState()) {
            case CLOSED -> state.getFailureCount() >= failureThreshold;
            case HALF_OPEN -> true;
            case OPEN -> false;
        };
        if (!trip) {
            return;
        }
        long previous = state.getTimeoutMillis();
        long timeout = previous == 0 ? initialTimeoutMillis : Math.min(previous * 2, maxTimeoutMillis);
        state.setCircuitState(CircuitState.OPEN);
        state.setTrippedAt(now);
        state.setTimeoutMillis(timeout);
        metrics.recordCircuitOpened();
        log.warn("Circuit opened: key={}, failures={}, timeout={}ms", key, state.getFailureCount(), timeout);
    }

    // === Administration and inspection ===

    /**
     * Install or replace the adaptive policy for an operation.
     */
    public void registerPolicy(String operation, LimitPolicy policy) {
        store.putLimit(operation, AdaptiveLimit.of(policy, clock.millis()));
        log.info("Limit policy registered: operation={}, base={}, burst={}",
                operation, policy.getBase(), policy.getBurst());
    }

    public CircuitState circuitState(AdmissionKey key) {
        return store.find(key)
                .map(state -> {
                    synchronized (state) {
                        return state.getCircuitState();
                    }
                })
                .orElse(CircuitState.CLOSED);
    }

    public int failureCount(AdmissionKey key) {
        return store.find(key)
                .map(state -> {
                    synchronized (state) {
                        return state.getFailureCount();
                    }
                })
                .orElse(0);
    }

    /**
     * Current limit of the operation, or the default limit if it has never been seen.
     */
    public double currentLimit(String operation) {
        return store.findLimit(operation)
                .map(AdaptiveLimit::getCurrent)
                .orElse((double) defaultLimit);
    }

    /**
     * Trim every window and drop keys left with nothing to remember. Invoked periodically
     * so idle callers do not pin memory.
     *
     * @return number of keys dropped
     */
    public int trimAll() {
        long cutoff = clock.millis() - windowMillis;
        int removed = store.removeIf((key, state) -> {
            synchronized (state) {
                state.trim(cutoff);
                return state.isIdle();
            }
        });
        if (removed > 0) {
            log.debug("Dropped {} idle admission keys", removed);
        }
        return removed;
    }

    public int openCircuitCount() {
        AtomicInteger open = new AtomicInteger();
        store.forEach((key, state) -> {
            synchronized (state) {
                if (state.getCircuitState() == CircuitState.OPEN) {
                    open.incrementAndGet();
                }
            }
        });
        return open.get();
    }

    public int trackedKeyCount() {
        return store.size();
    }

    private static long secondsUntil(long deadline, long now) {
        return (long) Math.ceil((deadline - now) / 1000.0);
    }
}
