package com.z254.bulwark.governance.admission;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Adaptive limit parameters for one operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LimitPolicy {

    /** Requests per window under normal load */
    @Min(1)
    private int base;

    /** Headroom above base the limit may grow into */
    @PositiveOrZero
    private int burst;

    /** Fraction of base recovered per second while usage is low */
    @Builder.Default
    @PositiveOrZero
    private double recoveryRate = 0.1;
}
