package com.tessera.sandbox;

import com.tessera.core.events.EventBus;
import com.tessera.core.events.TesseraEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Creates, drives and tears down interactive shell sessions in sandbox targets.
 * <p>
 * Sessions live in the {@link SandboxSessionRegistry}. A periodic sweep closes
 * sessions that have been idle past the configured timeout, closes sessions whose
 * shell has ended once their output is drained, and discards output nobody came
 * back for.
 */
@Service
public class SandboxSessionBridge {

    private static final Logger log = LoggerFactory.getLogger(SandboxSessionBridge.class);

    private final SandboxProvider provider;
    private final SandboxSessionRegistry registry;
    private final SandboxProperties properties;
    private final EventBus eventBus;
    private final Clock clock;
    private ScheduledExecutorService reaper;

    @Autowired
    public SandboxSessionBridge(SandboxProvider provider, SandboxSessionRegistry registry,
                                SandboxProperties properties, EventBus eventBus) {
        this(provider, registry, properties, eventBus, Clock.systemUTC());
    }

    public SandboxSessionBridge(SandboxProvider provider, SandboxSessionRegistry registry,
                                SandboxProperties properties, EventBus eventBus, Clock clock) {
        this.provider = provider;
        this.registry = registry;
        this.properties = properties;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        int interval = properties.getReapIntervalSeconds();
        if (interval <= 0) {
            return;
        }
        reaper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tessera-sandbox-reaper");
            t.setDaemon(true);
            return t;
        });
        reaper.scheduleWithFixedDelay(() -> {
            try {
                sweep();
            } catch (RuntimeException e) {
                log.warn("Sandbox session sweep failed: {}", e.getMessage(), e);
            }
        }, interval, interval, TimeUnit.SECONDS);
    }

    @PreDestroy
    public void stop() {
        if (reaper != null) {
            reaper.shutdownNow();
        }
    }

    public String providerName() {
        return provider.name();
    }

    public String createSession(String targetId) {
        return createSession(targetId, TerminalSize.DEFAULT);
    }

    /**
     * Opens a shell in the target and registers a session for it.
     *
     * @return the new session id
     * @throws SessionException with kind TARGET_UNAVAILABLE if the target cannot be reached
     */
    public String createSession(String targetId, TerminalSize size) {
        if (!provider.isAvailable(targetId)) {
            throw new SessionException(SessionException.Kind.TARGET_UNAVAILABLE, targetId,
                    "Sandbox target " + targetId + " is not available");
        }
        String sessionId = "sbx-" + UUID.randomUUID().toString().substring(0, 8);
        var buffer = new SessionOutputBuffer(properties.getOutputBufferChunks(),
                Duration.ofSeconds(properties.getOutputRetentionSeconds()),
                Duration.ofMillis(properties.getOutputStallMillis()), clock);
        var session = new SandboxSession(sessionId, targetId, size, buffer, clock);

        ShellChannel channel;
        try {
            channel = provider.openShell(targetId, size, session.sink());
        } catch (SessionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SessionException(SessionException.Kind.TARGET_UNAVAILABLE, targetId,
                    "Cannot open a shell in " + targetId + ": " + e.getMessage(), e);
        }
        session.bind(channel);
        registry.register(session);
        log.info("Opened sandbox session {} on {} ({}, {})", sessionId, targetId, provider.name(), size);
        eventBus.publish(TesseraEvent.of("sandbox.session.opened", sessionId, sessionId,
                Map.of("targetId", targetId, "provider", provider.name(), "size", size.toString())));
        return sessionId;
    }

    /**
     * Writes raw bytes to the session's shell. Concurrent sends to one session are serialized.
     *
     * @throws SessionException NOT_FOUND for unknown ids, IO_FAILURE if the shell is gone
     */
    public void sendInput(String sessionId, byte[] data) {
        SandboxSession session = registry.require(sessionId);
        try {
            session.sendInput(data);
        } catch (IOException e) {
            log.warn("Input to sandbox session {} failed: {}", sessionId, e.getMessage());
            closeSession(sessionId);
            throw new SessionException(SessionException.Kind.IO_FAILURE, sessionId,
                    "Shell of session " + sessionId + " is gone: " + e.getMessage(), e);
        }
    }

    /**
     * Sends a signal to the session's shell. Unknown names are treated as INT.
     *
     * @throws SessionException NOT_FOUND for unknown ids, IO_FAILURE if the shell is gone
     */
    public ShellSignal signal(String sessionId, String name) {
        SandboxSession session = registry.require(sessionId);
        ShellSignal signal = ShellSignal.parse(name);
        try {
            session.signal(signal);
        } catch (IOException e) {
            log.warn("Signal {} to sandbox session {} failed: {}", signal, sessionId, e.getMessage());
            throw new SessionException(SessionException.Kind.IO_FAILURE, sessionId,
                    "Cannot signal session " + sessionId + ": " + e.getMessage(), e);
        }
        log.info("Sent SIG{} to sandbox session {}", signal, sessionId);
        return signal;
    }

    /**
     * Attaches the single output consumer of a session.
     *
     * @throws SessionException      NOT_FOUND for unknown ids
     * @throws IllegalStateException if another consumer is attached
     */
    public SessionOutput output(String sessionId) {
        return registry.require(sessionId).attachOutput();
    }

    /** Advisory and idempotent. */
    public void resize(String sessionId, int cols, int rows) {
        SandboxSession session = registry.require(sessionId);
        if (session.resize(new TerminalSize(cols, rows))) {
            log.debug("Resized sandbox session {} to {}x{}", sessionId, cols, rows);
        }
    }

    /** Releases a session. Unknown or already closed ids are ignored. */
    public void closeSession(String sessionId) {
        registry.remove(sessionId).ifPresent(session -> {
            session.close();
            log.info("Closed sandbox session {}", sessionId);
            eventBus.publishFinal(TesseraEvent.of("sandbox.session.closed", sessionId, sessionId,
                    Map.of("targetId", session.getTargetId())));
        });
    }

    public int closeSessionsForTarget(String targetId) {
        List<SandboxSession> sessions = registry.forTarget(targetId);
        sessions.forEach(s -> closeSession(s.getSessionId()));
        return sessions.size();
    }

    public List<SandboxSession> sessions() {
        return registry.all();
    }

    public String provisionTarget(Path workspace) {
        String targetId = provider.createTarget(workspace);
        log.info("Provisioned sandbox target {} for {}", targetId, workspace);
        return targetId;
    }

    public void destroyTarget(String targetId) {
        int closed = closeSessionsForTarget(targetId);
        provider.destroyTarget(targetId);
        log.info("Destroyed sandbox target {} ({} session(s) closed)", targetId, closed);
    }

    /**
     * One reaper pass.
     *
     * @return the number of sessions closed
     */
    int sweep() {
        Duration idleTimeout = Duration.ofSeconds(properties.getIdleTimeoutSeconds());
        Duration retention = Duration.ofSeconds(properties.getOutputRetentionSeconds());
        int closed = 0;
        for (SandboxSession session : registry.all()) {
            SessionOutputBuffer buffer = session.outputBuffer();
            int discarded = buffer.discardExpired();
            if (discarded > 0) {
                log.debug("Discarded {} unread chunk(s) of sandbox session {}", discarded, session.getSessionId());
            }
            boolean drained = session.isShellEnded()
                    && (buffer.isExhausted() || (!buffer.isAttached() && session.isIdle(retention)));
            if (drained || session.isIdle(idleTimeout)) {
                log.info("Reaping sandbox session {} ({})", session.getSessionId(), drained ? "shell ended" : "idle");
                closeSession(session.getSessionId());
                closed++;
            }
        }
        return closed;
    }
}
