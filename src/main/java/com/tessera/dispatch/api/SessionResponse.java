package com.tessera.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tessera.core.engine.CommandSession;

/**
 * JSON view of a command session.
 */
public record SessionResponse(
    @JsonProperty("session_id") String sessionId,
    String workspace,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("in_flight") String inFlight
) {
    static SessionResponse from(CommandSession session) {
        return new SessionResponse(
                session.getId(),
                session.getWorkspace().root().toString(),
                session.getCreatedAt().toString(),
                session.inFlight().map(e -> e.getId()).orElse(null));
    }
}
