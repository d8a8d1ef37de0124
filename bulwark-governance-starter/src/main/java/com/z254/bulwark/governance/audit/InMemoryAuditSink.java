package com.z254.bulwark.governance.audit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Bounded in-memory audit trail. Appends are atomic; the oldest events are dropped
 * once {@code capacity} is reached.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEvent> events = new ArrayList<>();
    private final int capacity;
    private final Clock clock;

    public InMemoryAuditSink(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    @Override
    public synchronized String appendEvent(String eventType, Map<String, Object> details) {
        AuditEvent event = AuditEvent.builder()
                .id(UUID.randomUUID().toString())
                .eventType(eventType)
                .details(details != null ? Collections.unmodifiableMap(new HashMap<>(details)) : Map.of())
                .timestamp(clock.instant())
                .build();
        if (events.size() >= capacity) {
            events.remove(0);
        }
        events.add(event);
        return event.getId();
    }

    public synchronized List<AuditEvent> getEvents() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public synchronized List<AuditEvent> getEvents(String eventType) {
        return events.stream()
                .filter(event -> event.getEventType().equals(eventType))
                .collect(Collectors.toList());
    }

    public synchronized int size() {
        return events.size();
    }
}
