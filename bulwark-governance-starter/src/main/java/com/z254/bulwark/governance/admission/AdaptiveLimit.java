package com.z254.bulwark.governance.admission;

import lombok.Getter;

/**
 * Per-operation request limit that shrinks under sustained pressure and recovers when idle.
 * <p>
 * Updates are advisory and tolerate concurrent writers; the last writer wins.
 */
public class AdaptiveLimit {

    static final double HIGH_USAGE_RATIO = 0.8;
    static final double LOW_USAGE_RATIO = 0.3;
    static final double SHRINK_FACTOR = 0.95;
    static final double FLOOR_FRACTION = 0.5;
    static final long MIN_UPDATE_INTERVAL_MS = 1000;

    @Getter
    private final int base;
    @Getter
    private final int burst;
    @Getter
    private final double recoveryRate;
    private final boolean adaptive;

    private volatile double current;
    private volatile long lastUpdate;

    private AdaptiveLimit(int base, int burst, double recoveryRate, boolean adaptive, long now) {
        this.base = base;
        this.burst = burst;
        this.recoveryRate = recoveryRate;
        this.adaptive = adaptive;
        this.current = base;
        this.lastUpdate = now;
    }

    public static AdaptiveLimit of(LimitPolicy policy, long now) {
        return new AdaptiveLimit(policy.getBase(), policy.getBurst(), policy.getRecoveryRate(), true, now);
    }

    /**
     * Limit that never adapts, used for operations without a policy.
     */
    public static AdaptiveLimit fixed(int limit, long now) {
        return new AdaptiveLimit(limit, 0, 0.0, false, now);
    }

    /**
     * Re-evaluates the limit against the observed window size. No-op within one second
     * of the previous update.
     */
    public void adjust(int windowSize, long now) {
        if (!adaptive) {
            return;
        }
        long elapsed = now - lastUpdate;
        if (elapsed < MIN_UPDATE_INTERVAL_MS) {
            return;
        }
        double limit = current;
        double usageRatio = windowSize / limit;
        if (usageRatio > HIGH_USAGE_RATIO) {
            current = Math.max(FLOOR_FRACTION * base, limit * SHRINK_FACTOR);
        } else if (usageRatio < LOW_USAGE_RATIO) {
            double recovered = limit + base * recoveryRate * (elapsed / 1000.0);
            current = Math.min(base + burst, recovered);
        }
        lastUpdate = now;
    }

    public double getCurrent() {
        return current;
    }

    /** Whole-request view of {@link #getCurrent()}. */
    public int currentLimit() {
        return (int) Math.floor(current);
    }

    public long getLastUpdate() {
        return lastUpdate;
    }

    public boolean isAdaptive() {
        return adaptive;
    }
}
