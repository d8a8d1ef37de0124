package com.z254.bulwark.governance.anomaly;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Typed view of the free-form context map passed with a governed call.
 * <p>
 * Recognized keys: {@code suspiciousIp}, {@code unusualLocation}, {@code rapidSuccession}
 * (booleans or "true"/"false") and {@code frequency} (number of calls per window).
 * Unknown keys are ignored.
 */
@Value
@Builder
public class ThreatContext {

    public static final String SUSPICIOUS_IP = "suspiciousIp";
    public static final String UNUSUAL_LOCATION = "unusualLocation";
    public static final String RAPID_SUCCESSION = "rapidSuccession";
    public static final String FREQUENCY = "frequency";

    boolean suspiciousIp;
    boolean unusualLocation;
    boolean rapidSuccession;
    double frequency;

    public static ThreatContext from(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return ThreatContext.builder().build();
        }
        return ThreatContext.builder()
                .suspiciousIp(flag(context.get(SUSPICIOUS_IP)))
                .unusualLocation(flag(context.get(UNUSUAL_LOCATION)))
                .rapidSuccession(flag(context.get(RAPID_SUCCESSION)))
                .frequency(number(context.get(FREQUENCY)))
                .build();
    }

    private static boolean flag(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private static double number(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }
}
