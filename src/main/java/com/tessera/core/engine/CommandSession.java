package com.tessera.core.engine;

import com.tessera.core.command.CommandHistory;
import com.tessera.core.command.ParseException;
import com.tessera.core.command.ParsedCommand;
import com.tessera.core.command.Suggestion;
import com.tessera.core.command.ValidationResult;
import com.tessera.core.events.EventStream;
import com.tessera.core.logging.MdcContext;
import com.tessera.core.model.Change;
import com.tessera.core.model.Decision;
import com.tessera.core.model.PriorDecision;
import com.tessera.core.model.Selection;
import com.tessera.core.workspace.ApplyException;
import com.tessera.core.workspace.ApplyResult;
import com.tessera.core.workspace.RevertResult;
import com.tessera.core.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A user's command scope over one workspace. At most one execution per session
 * is queued or running at a time; a submit while one is in flight is refused.
 * <p>
 * Instances are created by {@link ExecutionEngine#openSession}.
 */
public class CommandSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CommandSession.class);

    private final String id;
    private final ExecutionEngine engine;
    private final Workspace workspace;
    private final CommandHistory history;
    private final Instant createdAt;
    private final Map<String, Execution> executions = new LinkedHashMap<>();
    private final List<PriorDecision> priorDecisions = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    CommandSession(String id, ExecutionEngine engine, Workspace workspace, CommandHistory history) {
        this.id = id;
        this.engine = engine;
        this.workspace = workspace;
        this.history = history;
        this.createdAt = engine.clock().instant();
    }

    public String getId() { return id; }
    public Workspace getWorkspace() { return workspace; }
    public Instant getCreatedAt() { return createdAt; }
    public boolean isClosed() { return closed; }

    public String submit(String rawInput) {
        return submit(rawInput, Selection.none());
    }

    /**
     * Parses, validates and starts a command.
     *
     * @return the new execution's id
     * @throws ParseException if the input is not a valid command; nothing is created
     * @throws BusyException  if another execution in this session is queued or running
     */
    public String submit(String rawInput, Selection selection) {
        ensureOpen();
        ParsedCommand command = engine.parser().parse(rawInput);
        ValidationResult result = engine.parser().validate(command);
        if (result instanceof ValidationResult.Invalid invalid) {
            log.debug("Rejected input in {}: {}", id, invalid.message());
            throw new ParseException(invalid);
        }

        Execution execution;
        synchronized (executions) {
            Optional<Execution> running = inFlight();
            if (running.isPresent()) {
                throw new BusyException(running.get().getId());
            }
            execution = new Execution(engine.nextExecutionId(), id, command,
                    engine.properties().getEventBufferCapacity(), engine.clock());
            executions.put(execution.getId(), execution);
        }
        history.add(rawInput);
        MdcContext.setExecution(id, execution.getId());
        try {
            log.info("Submitted {} in session {}: /{}", execution.getId(), id, command.verb());
        } finally {
            MdcContext.clear();
        }
        engine.dispatch(this, execution, selection == null ? Selection.none() : selection, List.copyOf(priorDecisions));
        return execution.getId();
    }

    /**
     * Requests cancellation. Idempotent and non-blocking. A cancel that arrives while
     * changes are being written takes effect only if the write is refused.
     *
     * @return false if the execution had already finished
     */
    public boolean cancel(String executionId) {
        Execution execution = execution(executionId);
        Execution.CancelOutcome outcome = execution.cancel();
        switch (outcome) {
            case CANCELLED -> {
                log.info("Cancelled {}", executionId);
                engine.teardown(execution);
                engine.announceIfFinished(this, execution);
                return true;
            }
            case DEFERRED -> {
                log.info("Cancel of {} deferred until its commit finishes", executionId);
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    /**
     * Records the user's decision on one proposed change.
     *
     * @throws IllegalStateException if the execution is not awaiting decisions
     */
    public void decide(String executionId, String changeId, Decision decision) {
        Execution execution = execution(executionId);
        execution.decide(changeId, decision);
        Change change = execution.getChange(changeId);
        priorDecisions.removeIf(d -> d.executionId().equals(executionId) && d.changeId().equals(changeId));
        priorDecisions.add(new PriorDecision(executionId, changeId, change.getFilePath(), change.getStatus()));
        MdcContext.setChange(executionId, changeId);
        try {
            log.debug("{} on {} is now {}", changeId, change.getFilePath(), change.getStatus());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Applies the accepted and edited changes of an execution.
     *
     * @throws IllegalStateException if the execution is not awaiting decisions or a change is undecided
     * @throws ApplyException        if the workspace refused the batch; the execution can be re-decided
     */
    public ApplyResult commit(String executionId) {
        Execution execution = execution(executionId);
        List<Change> toApply = execution.beginCommit();
        MdcContext.setExecution(id, executionId);
        try {
            ApplyResult result;
            try {
                result = workspace.applier().applyChanges(toApply);
            } catch (RuntimeException e) {
                execution.finishCommit(false);
                log.warn("Commit of {} refused: {}", executionId, e.getMessage());
                engine.announceIfFinished(this, execution);
                throw e;
            }
            execution.finishCommit(true);
            log.info("Committed {}: {} file(s) written", executionId, result.writtenPaths().size());
            if (!result.isEmpty()) {
                engine.publish("changes.applied", this, execution, Map.of(
                        "paths", result.writtenPaths(),
                        "ledgerIds", result.ledgerIds()));
            }
            engine.announceIfFinished(this, execution);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Attaches the single consumer of an execution's events.
     *
     * @throws IllegalStateException if another consumer is attached
     */
    public EventStream subscribe(String executionId) {
        return execution(executionId).subscribe();
    }

    /** Restores the workspace to its state before the given ledger entries were applied. */
    public RevertResult revert(List<String> ledgerIds) {
        RevertResult result = workspace.applier().revertChanges(ledgerIds);
        log.info("Reverted {} ledger entr{} in session {}", ledgerIds.size(), ledgerIds.size() == 1 ? "y" : "ies", id);
        engine.publish("changes.reverted", this, null, Map.of(
                "ledgerIds", List.copyOf(ledgerIds),
                "restored", result.restoredPaths(),
                "deleted", result.deletedPaths()));
        return result;
    }

    public Execution execution(String executionId) {
        return findExecution(executionId)
                .orElseThrow(() -> new NoSuchElementException("No execution " + executionId + " in session " + id));
    }

    public Optional<Execution> findExecution(String executionId) {
        synchronized (executions) {
            return Optional.ofNullable(executions.get(executionId));
        }
    }

    /** All executions of this session, oldest first. */
    public List<Execution> executions() {
        synchronized (executions) {
            return new ArrayList<>(executions.values());
        }
    }

    public Optional<Execution> inFlight() {
        synchronized (executions) {
            return executions.values().stream()
                    .filter(e -> e.getStatus().occupiesSlot())
                    .findFirst();
        }
    }

    public CommandHistory history() {
        return history;
    }

    public List<Suggestion> suggestions(String partial) {
        return engine.parser().suggestions(partial, history.recent());
    }

    public List<PriorDecision> priorDecisions() {
        return List.copyOf(priorDecisions);
    }

    /** Cancels every unfinished execution and detaches the session from the engine. Idempotent. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Execution execution : executions()) {
            if (!execution.getStatus().isTerminal()) {
                cancel(execution.getId());
            }
        }
        engine.unregister(this);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Session " + id + " is closed");
        }
    }
}
