package com.z254.bulwark.governance.audit;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Default sink that writes audit events to the log. Used until a durable trail is wired up.
 */
@Slf4j
public class LoggingAuditSink implements AuditSink {

    private final String serviceName;

    public LoggingAuditSink(String serviceName) {
        this.serviceName = serviceName != null ? serviceName : "unknown";
    }

    @Override
    public String appendEvent(String eventType, Map<String, Object> details) {
        String recordId = "audit-" + UUID.randomUUID();
        Map<String, Object> sorted = details != null ? new TreeMap<>(details) : Map.of();
        log.info("AUDIT {} | service={} id={} data={}", eventType, serviceName, recordId, sorted);
        return recordId;
    }
}
