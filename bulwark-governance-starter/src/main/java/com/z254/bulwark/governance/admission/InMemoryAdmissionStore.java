package com.z254.bulwark.governance.admission;

import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * Single-instance store bounded to {@code maxKeys} tracked keys. Once full, the least
 * recently used key is evicted.
 */
@Slf4j
public class InMemoryAdmissionStore implements AdmissionStore {

    public static final int DEFAULT_MAX_KEYS = 10_000;

    private final int maxKeys;
    private final LinkedHashMap<AdmissionKey, KeyState> keys;
    private final Map<String, AdaptiveLimit> limits = new ConcurrentHashMap<>();

    public InMemoryAdmissionStore() {
        this(DEFAULT_MAX_KEYS);
    }

    public InMemoryAdmissionStore(int maxKeys) {
        if (maxKeys < 1) {
            throw new IllegalArgumentException("maxKeys must be positive: " + maxKeys);
        }
        this.maxKeys = maxKeys;
        this.keys = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<AdmissionKey, KeyState> eldest) {
                if (size() <= InMemoryAdmissionStore.this.maxKeys) {
                    return false;
                }
                eldest.getValue().retire();
                log.debug("Evicted least recently used admission key {}", eldest.getKey());
                return true;
            }
        };
    }

    @Override
    public KeyState getOrCreate(AdmissionKey key) {
        synchronized (keys) {
            return keys.computeIfAbsent(key, k -> new KeyState());
        }
    }

    @Override
    public Optional<KeyState> find(AdmissionKey key) {
        synchronized (keys) {
            return Optional.ofNullable(keys.get(key));
        }
    }

    @Override
    public void forEach(BiConsumer<AdmissionKey, KeyState> action) {
        synchronized (keys) {
            keys.forEach(action);
        }
    }

    @Override
    public int removeIf(BiPredicate<AdmissionKey, KeyState> condition) {
        int removed = 0;
        synchronized (keys) {
            Iterator<Map.Entry<AdmissionKey, KeyState>> it = keys.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<AdmissionKey, KeyState> entry = it.next();
                if (condition.test(entry.getKey(), entry.getValue())) {
                    entry.getValue().retire();
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    @Override
    public int size() {
        synchronized (keys) {
            return keys.size();
        }
    }

    public int getMaxKeys() {
        return maxKeys;
    }

    @Override
    public Optional<AdaptiveLimit> findLimit(String operation) {
        return Optional.ofNullable(limits.get(operation));
    }

    @Override
    public void putLimit(String operation, AdaptiveLimit limit) {
        limits.put(operation, limit);
    }
}
