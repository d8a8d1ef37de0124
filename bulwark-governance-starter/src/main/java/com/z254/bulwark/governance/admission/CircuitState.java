package com.z254.bulwark.governance.admission;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
