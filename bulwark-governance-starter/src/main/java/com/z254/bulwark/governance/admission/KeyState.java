package com.z254.bulwark.governance.admission;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding window and circuit for one {@link AdmissionKey}.
 * <p>
 * Not thread-safe on its own: callers synchronize on the instance, which acts as the
 * per-key lock. A state removed from its store is retired; holders of a retired state
 * must look the key up again.
 */
public final class KeyState {

    private final Deque<Long> window = new ArrayDeque<>();

    private CircuitState circuitState = CircuitState.CLOSED;
    private int failureCount;
    private long trippedAt;
    private long timeoutMillis;

    private volatile boolean retired;

    /**
     * Drops timestamps at or before {@code cutoff}.
     */
    void trim(long cutoff) {
        while (!window.isEmpty() && window.peekFirst() <= cutoff) {
            window.pollFirst();
        }
    }

    void append(long timestamp, int cost) {
        for (int i = 0; i < cost; i++) {
            window.addLast(timestamp);
        }
    }

    /**
     * Nothing worth keeping: closed circuit, no failures and an empty window.
     */
    boolean isIdle() {
        return circuitState == CircuitState.CLOSED && failureCount == 0 && window.isEmpty();
    }

    void retire() {
        retired = true;
    }

    boolean isRetired() {
        return retired;
    }

    int size() {
        return window.size();
    }

    Long oldest() {
        return window.peekFirst();
    }

    CircuitState getCircuitState() {
        return circuitState;
    }

    void setCircuitState(CircuitState circuitState) {
        this.circuitState = circuitState;
    }

    int getFailureCount() {
        return failureCount;
    }

    void setFailureCount(int failureCount) {
        this.failureCount = failureCount;
    }

    long getTrippedAt() {
        return trippedAt;
    }

    void setTrippedAt(long trippedAt) {
        this.trippedAt = trippedAt;
    }

    long getTimeoutMillis() {
        return timeoutMillis;
    }

    void setTimeoutMillis(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }
}
