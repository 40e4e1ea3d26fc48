package com.example.shifthybrid.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a generation run, as seen by audit sinks.
 */
public record AuditEvent(String runId, String snapshotVersion, String stage, String detail,
                         Map<String, Object> data, Instant occurredAt) {

    public AuditEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static AuditEvent of(String runId, String snapshotVersion, String stage, String detail,
                                Map<String, Object> data) {
        return new AuditEvent(runId, snapshotVersion, stage, detail, data, Instant.now());
    }
}
