package com.z254.bulwark.governance.anomaly;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ThreatScores {
    double anomaly;
    double behavioral;
    double contextual;
    double composite;
}
