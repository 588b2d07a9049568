package com.tessera.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle notification published on the {@link EventBus} for in-process observers
 * such as metrics.
 *
 * @param eventType e.g. "execution.submitted", "changes.applied", "sandbox.session.opened"
 * @param scopeId   command session or sandbox session the event belongs to
 * @param subjectId execution id or sandbox session id, nullable
 * @param payload   event details
 * @param timestamp when the event occurred
 */
public record TesseraEvent(
    String eventType,
    String scopeId,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static TesseraEvent of(String eventType, String scopeId, String subjectId, Map<String, Object> payload) {
        return new TesseraEvent(eventType, scopeId, subjectId, Map.copyOf(payload), Instant.now());
    }
}
