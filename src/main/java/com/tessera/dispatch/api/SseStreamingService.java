package com.tessera.dispatch.api;

import com.tessera.core.events.EventBus;
import com.tessera.core.events.EventStream;
import com.tessera.core.events.ExecutionEvent;
import com.tessera.core.events.TesseraEvent;
import com.tessera.sandbox.SessionOutput;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bridges engine streams to {@link SseEmitter} instances.
 * <p>
 * Three sources are supported: {@link EventBus} lifecycle notifications for a command
 * session, the typed event stream of one execution, and the raw output of a sandbox
 * session. Stream sources are pumped on a dedicated thread each; the pump stops when the
 * stream ends or the client goes away, and then releases the stream.
 * <p>
 * Heartbeats are sent as SSE comments so idle connections survive proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);

    /** Bus events after which a scope's notification stream has nothing more to say. */
    private static final Set<String> SCOPE_CLOSING_EVENTS = Set.of("session.closed", "sandbox.session.closed");

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final AtomicInteger pumpCounter = new AtomicInteger();
    private final ExecutorService pumpExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-pump-" + pumpCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        pumpExecutor.shutdownNow();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }
        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks clean up
                log.debug("Heartbeat failed for {} (connection likely closed): {}", registration.id, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for {} (emitter not active)", registration.id);
            }
        }
    }

    /**
     * Streams lifecycle notifications of one command session or sandbox session.
     */
    public SseEmitter createEmitter(String scopeId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventBus.Subscription subscription = eventBus.subscribe(scopeId, event -> sendBusEvent(emitter, event));
        register(scopeId, emitter, subscription::unsubscribe);
        sendConnected(emitter, scopeId);
        log.info("SSE emitter created for scope {} (timeout={}ms)", scopeId, timeoutMs);
        return emitter;
    }

    /**
     * Streams the events of one execution, ending with its terminal event. The stream is
     * closed when the emitter finishes, so the execution can be subscribed to again.
     */
    public SseEmitter streamExecution(String executionId, EventStream events) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        AtomicBoolean active = new AtomicBoolean(true);
        EmitterRegistration registration = register(executionId, emitter, () -> active.set(false));
        sendConnected(emitter, executionId);
        pumpExecutor.execute(() -> {
            try (events) {
                while (active.get() && !events.isFinished()) {
                    Optional<ExecutionEvent> next = events.poll(POLL_INTERVAL);
                    if (next.isPresent()) {
                        ExecutionEvent event = next.get();
                        emitter.send(SseEmitter.event()
                                .id(Long.toString(event.sequence()))
                                .name(event.type())
                                .data(event, MediaType.APPLICATION_JSON));
                    }
                }
                emitter.complete();
            } catch (IOException | IllegalStateException e) {
                log.debug("Execution stream for {} ended early: {}", executionId, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                emitter.complete();
            } finally {
                cleanup(registration);
            }
        });
        log.info("SSE emitter created for execution {} (timeout={}ms)", executionId, timeoutMs);
        return emitter;
    }

    /**
     * Streams a sandbox session's output as base64 "output" events, then a "closed" event
     * when the shell has ended and everything buffered was sent.
     */
    public SseEmitter streamOutput(String sessionId, SessionOutput output) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        AtomicBoolean active = new AtomicBoolean(true);
        EmitterRegistration registration = register(sessionId, emitter, () -> active.set(false));
        sendConnected(emitter, sessionId);
        pumpExecutor.execute(() -> {
            try (output) {
                while (active.get() && !output.isFinished()) {
                    Optional<byte[]> chunk = output.poll(POLL_INTERVAL);
                    if (chunk.isPresent()) {
                        emitter.send(SseEmitter.event()
                                .name("output")
                                .data(Map.of("data", Base64.getEncoder().encodeToString(chunk.get())),
                                        MediaType.APPLICATION_JSON));
                    }
                }
                if (active.get()) {
                    emitter.send(SseEmitter.event().name("closed").data(Map.of("sessionId", sessionId),
                            MediaType.APPLICATION_JSON));
                }
                emitter.complete();
            } catch (IOException | IllegalStateException e) {
                log.debug("Output stream for {} ended early: {}", sessionId, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                emitter.complete();
            } finally {
                cleanup(registration);
            }
        });
        log.info("SSE output emitter created for sandbox session {}", sessionId);
        return emitter;
    }

    /**
     * Returns the number of currently active SSE emitters.
     */
    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private EmitterRegistration register(String id, SseEmitter emitter, Runnable release) {
        var registration = new EmitterRegistration(id, emitter, release);
        activeRegistrations.add(registration);
        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for {}", id);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {}", id);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", id, ex.getMessage());
            cleanup(registration);
        });
        return registration;
    }

    private void sendConnected(SseEmitter emitter, String id) {
        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial heartbeat for {}: {}", id, e.getMessage());
        }
    }

    private void sendBusEvent(SseEmitter emitter, TesseraEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("scopeId", event.scopeId());
            if (event.subjectId() != null) {
                data.put("subjectId", event.subjectId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
            if (SCOPE_CLOSING_EVENTS.contains(event.eventType())) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for {}: {}", event.eventType(), event.scopeId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.release.run();
            log.debug("Cleaned up SSE registration for {}", registration.id);
        }
    }

    private record EmitterRegistration(String id, SseEmitter emitter, Runnable release) {}
}
