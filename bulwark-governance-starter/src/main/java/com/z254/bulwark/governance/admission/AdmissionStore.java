package com.z254.bulwark.governance.admission;

import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * Holds per-key windows and circuits and per-operation limits.
 * <p>
 * Implementations may drop keys at any time (capacity eviction, idle cleanup); a dropped
 * {@link KeyState} must be {@linkplain KeyState#retire() retired} first.
 */
public interface AdmissionStore {

    /**
     * State for the key, created on first use.
     */
    KeyState getOrCreate(AdmissionKey key);

    Optional<KeyState> find(AdmissionKey key);

    /**
     * Visit every tracked key.
     */
    void forEach(BiConsumer<AdmissionKey, KeyState> action);

    /**
     * Drop and retire every key matching {@code condition}.
     *
     * @return number of keys removed
     */
    int removeIf(BiPredicate<AdmissionKey, KeyState> condition);

    int size();

    Optional<AdaptiveLimit> findLimit(String operation);

    void putLimit(String operation, AdaptiveLimit limit);
}
