package com.z254.bulwark.governance.config;

import com.z254.bulwark.governance.admission.LimitPolicy;
import com.z254.bulwark.governance.anomaly.BehavioralBaseline;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for BULWARK governance.
 * <p>
 * Prefix: {@code bulwark.governance}
 * <p>
 * Example configuration:
 * <pre>
 * bulwark:
 *   governance:
 *     enabled: true
 *     admission:
 *       window: 60s
 *       default-limit: 1000
 *       max-keys: 10000
 *       operations:
 *         resource-allocation:
 *           base: 50
 *           burst: 25
 *           recovery-rate: 0.1
 *     circuit:
 *       failure-threshold: 5
 *       initial-timeout: 30s
 *       max-timeout: 300s
 *     anomaly:
 *       incident-threshold: 0.7
 *       baselines:
 *         resource-allocation:
 *           avg-duration: 120
 *           max-duration: 800
 *           error-rate: 0.02
 *     maintenance:
 *       trim-interval: 10s
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "bulwark.governance")
public class BulwarkGovernanceProperties {

    /**
     * Whether the governance gateway is enabled (default: true).
     */
    private boolean enabled = true;

    @Valid
    private final Admission admission = new Admission();

    @Valid
    private final Circuit circuit = new Circuit();

    @Valid
    private final Anomaly anomaly = new Anomaly();

    @Valid
    private final Maintenance maintenance = new Maintenance();

    @Valid
    private final Health health = new Health();

    /**
     * Sliding-window admission control.
     */
    @Data
    public static class Admission {
        /** Length of the sliding window */
        @NotNull
        @DurationMin(millis = 1)
        private Duration window = Duration.ofSeconds(60);

        /** Fixed limit for operations without a policy */
        @Positive
        private int defaultLimit = 1000;

        /** Tracked operation/identity keys before the least recently used is evicted */
        @Min(1)
        private int maxKeys = 10_000;

        /** Adaptive policies keyed by operation name */
        @Valid
        private Map<String, LimitPolicy> operations = new HashMap<>();
    }

    /**
     * Per-key circuit breaker.
     */
    @Data
    public static class Circuit {
        @Min(1)
        private int failureThreshold = 5;

        @NotNull
        @DurationMin(millis = 1)
        private Duration initialTimeout = Duration.ofSeconds(30);

        @NotNull
        @DurationMin(millis = 1)
        private Duration maxTimeout = Duration.ofSeconds(300);
    }

    /**
     * Threat scoring and incident response.
     */
    @Data
    public static class Anomaly {
        /** Composite score above which an incident is raised */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double incidentThreshold = 0.7;

        /** Starting point for baselines created through partial updates */
        @Valid
        @NotNull
        private BehavioralBaseline defaultBaseline = BehavioralBaseline.builder()
                .avgDuration(100)
                .maxDuration(1000)
                .errorRate(0.01)
                .build();

        /** Baselines keyed by operation name */
        @Valid
        private Map<String, BehavioralBaseline> baselines = new HashMap<>();
    }

    /**
     * Gateway-owned background tasks.
     */
    @Data
    public static class Maintenance {
        private boolean enabled = true;

        @NotNull
        @DurationMin(millis = 1)
        private Duration trimInterval = Duration.ofSeconds(10);
    }

    @Data
    public static class Health {
        /** Open circuits above which the gateway reports OUT_OF_SERVICE */
        @Min(0)
        @Max(1_000_000)
        private int maxOpenCircuits = 100;
    }
}
