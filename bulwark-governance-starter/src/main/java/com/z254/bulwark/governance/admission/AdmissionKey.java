package com.z254.bulwark.governance.admission;

import lombok.NonNull;
import lombok.Value;

/**
 * Composite key identifying one caller of one operation.
 */
@Value(staticConstructor = "of")
public class AdmissionKey {
    @NonNull
    String operation;
    @NonNull
    String identity;

    @Override
    public String toString() {
        return operation + ":" + identity;
    }
}
