package com.tessera.core.engine;

import com.tessera.core.backend.BackendStream;
import com.tessera.core.backend.PromptRenderer;
import com.tessera.core.backend.ReasoningBackend;
import com.tessera.core.command.CommandHistory;
import com.tessera.core.command.CommandParser;
import com.tessera.core.context.ExecutionContextBuilder;
import com.tessera.core.events.EventBus;
import com.tessera.core.events.TesseraEvent;
import com.tessera.core.model.PriorDecision;
import com.tessera.core.model.Selection;
import com.tessera.core.workspace.Workspace;
import com.tessera.core.workspace.WorkspaceProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns command sessions and the threads executions run on.
 * <p>
 * Each execution runs on the run pool. Blocking reads of the backend's first
 * chunk go to the io pool so they can be bounded by a timeout, and backend
 * teardown after a cancel goes to the teardown pool so that {@code cancel}
 * never blocks its caller.
 */
@Service
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final AtomicInteger EXECUTION_COUNTER = new AtomicInteger(0);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final CommandParser parser;
    private final ExecutionContextBuilder contextBuilder;
    private final ReasoningBackend backend;
    private final PromptRenderer promptRenderer;
    private final EngineProperties properties;
    private final WorkspaceProperties workspaceProperties;
    private final EventBus eventBus;
    private final Clock clock;

    private final ExecutorService runExecutor = Executors.newCachedThreadPool(daemon("tessera-run"));
    private final ExecutorService ioExecutor = Executors.newCachedThreadPool(daemon("tessera-io"));
    private final ExecutorService teardownExecutor = Executors.newCachedThreadPool(daemon("tessera-teardown"));

    private final Map<Path, Workspace> workspaces = new ConcurrentHashMap<>();
    private final Map<String, CommandSession> sessions = new ConcurrentHashMap<>();

    @Autowired
    public ExecutionEngine(CommandParser parser, ExecutionContextBuilder contextBuilder, ReasoningBackend backend,
                           PromptRenderer promptRenderer, EngineProperties properties,
                           WorkspaceProperties workspaceProperties, EventBus eventBus) {
        this(parser, contextBuilder, backend, promptRenderer, properties, workspaceProperties, eventBus,
                Clock.systemUTC());
    }

    public ExecutionEngine(CommandParser parser, ExecutionContextBuilder contextBuilder, ReasoningBackend backend,
                           PromptRenderer promptRenderer, EngineProperties properties,
                           WorkspaceProperties workspaceProperties, EventBus eventBus, Clock clock) {
        this.parser = parser;
        this.contextBuilder = contextBuilder;
        this.backend = backend;
        this.promptRenderer = promptRenderer;
        this.properties = properties;
        this.workspaceProperties = workspaceProperties;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Opens a command session over a workspace directory. Sessions on the same
     * root share one workspace, and with it one change ledger.
     *
     * @throws IllegalArgumentException if the root is not a directory
     */
    public CommandSession openSession(Path workspaceRoot) {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Workspace root is not a directory: " + root);
        }
        Workspace workspace = workspaces.computeIfAbsent(root, r -> new Workspace(r, workspaceProperties));
        String sessionId = "ses-" + SESSION_COUNTER.incrementAndGet();
        var session = new CommandSession(sessionId, this, workspace,
                new CommandHistory(properties.getHistorySize()));
        sessions.put(sessionId, session);
        log.info("Opened session {} on {}", sessionId, root);
        eventBus.publish(TesseraEvent.of("session.opened", sessionId, null, Map.of("workspace", root.toString())));
        return session;
    }

    public Optional<CommandSession> findSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public CommandSession session(String sessionId) {
        return findSession(sessionId)
                .orElseThrow(() -> new NoSuchElementException("No session " + sessionId));
    }

    public List<CommandSession> sessions() {
        return List.copyOf(sessions.values());
    }

    /** Closes a session, cancelling whatever it still has in flight. No-op for unknown ids. */
    public void closeSession(String sessionId) {
        CommandSession session = sessions.get(sessionId);
        if (session != null) {
            session.close();
        }
    }

    void unregister(CommandSession session) {
        sessions.remove(session.getId(), session);
        log.info("Closed session {}", session.getId());
        eventBus.publishFinal(TesseraEvent.of("session.closed", session.getId(), null,
                Map.of("executions", session.executions().size())));
    }

    void dispatch(CommandSession session, Execution execution, Selection selection, List<PriorDecision> priorDecisions) {
        publish("execution.submitted", session, execution, Map.of(
                "verb", execution.getCommand().verb(),
                "mentions", execution.getCommand().mentionedFiles().size()));
        Future<?> future = runExecutor.submit(new ExecutionRunner(this, session, execution, selection, priorDecisions));
        execution.setRunFuture(future);
    }

    /**
     * Stops a cancelled execution's run and releases its backend stream. Never blocks:
     * the stream is closed on the teardown pool.
     */
    void teardown(Execution execution) {
        Future<?> future = execution.getRunFuture();
        if (future != null) {
            future.cancel(true);
        }
        BackendStream stream = execution.detachBackend();
        if (stream != null) {
            teardownExecutor.execute(() -> {
                try {
                    stream.close();
                    log.debug("Closed backend stream of {}", execution.getId());
                } catch (RuntimeException e) {
                    log.warn("Failed to close backend stream of {}: {}", execution.getId(), e.getMessage(), e);
                }
            });
        }
    }

    void onRunFinished(CommandSession session, Execution execution) {
        if (!announceIfFinished(session, execution)) {
            log.debug("Execution {} is {} after streaming", execution.getId(), execution.getStatus());
        }
    }

    /** Publishes {@code execution.finished} once per execution, when it is terminal. */
    boolean announceIfFinished(CommandSession session, Execution execution) {
        if (!execution.markAnnounced()) {
            return false;
        }
        var payload = new HashMap<String, Object>();
        payload.put("status", execution.getStatus().name());
        payload.put("verb", execution.getCommand().verb());
        payload.put("changes", execution.getChanges().size());
        payload.put("truncated", execution.isTruncated());
        if (execution.getFinishedAt() != null) {
            payload.put("durationMs", Duration.between(execution.getStartedAt(), execution.getFinishedAt()).toMillis());
        }
        if (execution.getFailure() != null) {
            payload.put("errorKind", execution.getFailure().kind().name());
        }
        publish("execution.finished", session, execution, payload);
        return true;
    }

    void publish(String eventType, CommandSession session, Execution execution, Map<String, Object> payload) {
        eventBus.publish(TesseraEvent.of(eventType, session.getId(),
                execution != null ? execution.getId() : null, payload));
    }

    /**
     * Generates an execution id in the format exe-NNNN-xxxxxx.
     */
    String nextExecutionId() {
        byte[] suffix = new byte[3];
        RANDOM.nextBytes(suffix);
        return String.format("exe-%04d-%s", EXECUTION_COUNTER.incrementAndGet(), HexFormat.of().formatHex(suffix));
    }

    CommandParser parser() { return parser; }
    ExecutionContextBuilder contextBuilder() { return contextBuilder; }
    ReasoningBackend backend() { return backend; }
    PromptRenderer promptRenderer() { return promptRenderer; }
    EngineProperties properties() { return properties; }
    ExecutorService ioExecutor() { return ioExecutor; }
    Clock clock() { return clock; }

    @PreDestroy
    public void shutdown() {
        sessions.values().forEach(CommandSession::close);
        runExecutor.shutdownNow();
        ioExecutor.shutdownNow();
        teardownExecutor.shutdown();
        try {
            if (!teardownExecutor.awaitTermination(properties.getTeardownTimeoutSeconds(), TimeUnit.SECONDS)) {
                log.warn("Backend teardown still running after {}s", properties.getTeardownTimeoutSeconds());
                teardownExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            teardownExecutor.shutdownNow();
        }
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
