package com.z254.bulwark.governance.anomaly;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Expected performance envelope of one operation type.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BehavioralBaseline {

    /** Mean duration in milliseconds */
    @PositiveOrZero
    private double avgDuration;

    /** Longest expected duration in milliseconds */
    @PositiveOrZero
    private double maxDuration;

    /** Expected fraction of failed calls, 0.0 to 1.0 */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double errorRate;
}
