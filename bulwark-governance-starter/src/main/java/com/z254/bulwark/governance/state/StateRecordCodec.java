package com.z254.bulwark.governance.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.bulwark.governance.error.ValidationException;
import com.z254.bulwark.governance.error.ValidationException.Reason;

import java.time.Clock;

/**
 * JSON (de)serialization of {@link StateContainer} records.
 */
public class StateRecordCodec {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StateRecordCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        this.clock = clock;
    }

    public String toJson(StateContainer container) {
        try {
            return objectMapper.writeValueAsString(container.toRecord());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state record", e);
        }
    }

    /**
     * Parses and verifies a serialized container.
     *
     * @throws ValidationException on unparseable or malformed input
     * @throws com.z254.bulwark.governance.error.IntegrityException on fingerprint mismatch
     */
    public StateContainer fromJson(String json) {
        StateRecord record;
        try {
            record = objectMapper.readValue(json, StateRecord.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException(Reason.MALFORMED_RECORD, e.getOriginalMessage());
        }
        return StateContainer.fromRecord(record, clock);
    }
}
