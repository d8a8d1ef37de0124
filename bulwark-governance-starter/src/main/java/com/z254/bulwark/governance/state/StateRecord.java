package com.z254.bulwark.governance.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Serialized form of a {@link StateContainer}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StateRecord {

    private int dimension;

    private List<Amplitude> amplitudes;

    /** fingerprint(amplitudes, timestamp) */
    private String stateHash;

    /** fingerprint(stateHash, timestamp) */
    private String proof;

    /** Epoch millis of the last evolution */
    private long timestamp;
}
