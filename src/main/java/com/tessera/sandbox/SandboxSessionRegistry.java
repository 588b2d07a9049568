package com.tessera.sandbox;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table of live sandbox sessions. It is the only owner of session
 * handles; everything left in it is closed on shutdown.
 */
@Component
public class SandboxSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SandboxSessionRegistry.class);

    private final Map<String, SandboxSession> sessions = new ConcurrentHashMap<>();

    void register(SandboxSession session) {
        if (sessions.putIfAbsent(session.getSessionId(), session) != null) {
            throw new IllegalStateException("Duplicate sandbox session id " + session.getSessionId());
        }
    }

    public Optional<SandboxSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws SessionException with kind NOT_FOUND for unknown ids
     */
    public SandboxSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionException(SessionException.Kind.NOT_FOUND,
                sessionId, "No sandbox session " + sessionId));
    }

    Optional<SandboxSession> remove(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    /** Live sessions, oldest first. */
    public List<SandboxSession> all() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(SandboxSession::getCreatedAt))
                .toList();
    }

    public List<SandboxSession> forTarget(String targetId) {
        return all().stream().filter(s -> s.getTargetId().equals(targetId)).toList();
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        if (!sessions.isEmpty()) {
            log.info("Closing {} sandbox session(s)", sessions.size());
        }
        for (String id : List.copyOf(sessions.keySet())) {
            remove(id).ifPresent(SandboxSession::close);
        }
    }
}
