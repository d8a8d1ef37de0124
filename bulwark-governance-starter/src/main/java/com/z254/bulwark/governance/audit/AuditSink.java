package com.z254.bulwark.governance.audit;

import java.util.Map;

/**
 * External append-only audit trail. The gateway needs nothing beyond this single call.
 */
public interface AuditSink {

    /**
     * Append an event and return its record ID.
     */
    String appendEvent(String eventType, Map<String, Object> details);
}
