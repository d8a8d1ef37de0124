package com.z254.bulwark.governance.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Event held by {@link InMemoryAuditSink}.
 */
@Value
@Builder
public class AuditEvent {
    String id;
    String eventType;
    Map<String, Object> details;
    Instant timestamp;
}
