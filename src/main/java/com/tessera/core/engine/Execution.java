package com.tessera.core.engine;

import com.tessera.core.backend.BackendStream;
import com.tessera.core.command.ParsedCommand;
import com.tessera.core.events.EventChannel;
import com.tessera.core.events.EventStream;
import com.tessera.core.events.ExecutionEvent;
import com.tessera.core.model.Change;
import com.tessera.core.model.ChangeStatus;
import com.tessera.core.model.ChangeView;
import com.tessera.core.model.Decision;
import com.tessera.core.model.ErrorKind;
import com.tessera.core.model.ExecutionContext;
import com.tessera.core.model.ExecutionFailure;
import com.tessera.core.model.ExecutionStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;

/**
 * One run of one command: its lifecycle, stream buffer, proposed changes and event log.
 * <p>
 * All state changes go through this object's monitor so that a status change and the
 * terminal event that announces it happen together.
 */
public class Execution {

    enum CancelOutcome { CANCELLED, DEFERRED, ALREADY_FINISHED }

    private final String id;
    private final String sessionId;
    private final ParsedCommand command;
    private final Clock clock;
    private final Instant startedAt;
    private final EventChannel channel;
    private final List<ExecutionEvent> eventLog = new CopyOnWriteArrayList<>();
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private final List<Change> changes = new ArrayList<>();
    private final StringBuilder streamBuffer = new StringBuilder();

    private ExecutionStatus status = ExecutionStatus.QUEUED;
    private ExecutionContext context;
    private ExecutionFailure failure;
    private Instant finishedAt;
    private boolean truncated;
    private boolean cancelRequested;
    private boolean announced;
    private Future<?> runFuture;
    private BackendStream backendStream;

    Execution(String id, String sessionId, ParsedCommand command, int eventCapacity, Clock clock) {
        this.id = id;
        this.sessionId = sessionId;
        this.command = command;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.channel = new EventChannel(id, eventCapacity, eventLog::add);
    }

    public String getId() { return id; }
    public String getSessionId() { return sessionId; }
    public ParsedCommand getCommand() { return command; }
    public Instant getStartedAt() { return startedAt; }

    public synchronized ExecutionStatus getStatus() { return status; }
    public synchronized ExecutionContext getContext() { return context; }
    public synchronized ExecutionFailure getFailure() { return failure; }
    public synchronized Instant getFinishedAt() { return finishedAt; }
    public synchronized boolean isTruncated() { return truncated; }
    public synchronized String getStreamBuffer() { return streamBuffer.toString(); }
    public synchronized List<Change> getChanges() { return List.copyOf(changes); }

    public List<String> getWarnings() { return List.copyOf(warnings); }

    /** Every event emitted so far, in order, including ones not yet consumed. */
    public List<ExecutionEvent> getEventLog() { return List.copyOf(eventLog); }

    public synchronized Change getChange(String changeId) {
        return changes.stream()
                .filter(c -> c.getId().equals(changeId))
                .findFirst()
                .orElseThrow(() -> new NoSuchElementException("No change " + changeId + " in execution " + id));
    }

    EventStream subscribe() {
        return channel.attach();
    }

    synchronized boolean transition(ExecutionStatus from, ExecutionStatus to) {
        if (status != from || !status.canTransitionTo(to)) {
            return false;
        }
        status = to;
        if (to.isTerminal()) {
            finishedAt = clock.instant();
        }
        return true;
    }

    /**
     * Leaves QUEUED for RUNNING and records the Started event in the same step, so a
     * concurrent cancel either sees a queued execution or one whose log already
     * begins with Started.
     *
     * @return false if the execution was cancelled before it could start
     */
    synchronized boolean start() {
        if (!transition(ExecutionStatus.QUEUED, ExecutionStatus.RUNNING)) {
            return false;
        }
        recordStarted();
        return true;
    }

    private void recordStarted() {
        channel.tryEmit(seq -> new ExecutionEvent.Started(id, seq, clock.instant(), command.verb(), command.argument()));
    }

    /**
     * Emits a non-terminal event, blocking while the channel is full.
     *
     * @return false once the execution has been terminated
     */
    boolean emit(ExecutionEvent.Factory factory) throws InterruptedException {
        return channel.emit(factory);
    }

    synchronized void setContext(ExecutionContext context) {
        this.context = context;
        this.warnings.addAll(context.warnings());
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }

    synchronized boolean appendStream(String text) {
        if (status != ExecutionStatus.RUNNING) {
            return false;
        }
        streamBuffer.append(text);
        return true;
    }

    synchronized boolean addChange(Change change) {
        if (status != ExecutionStatus.RUNNING) {
            return false;
        }
        changes.add(change);
        return true;
    }

    synchronized int changeCount() {
        return changes.size();
    }

    /** Ends a successful run: COMPLETED without changes, AWAITING_DECISION with. */
    synchronized boolean completeRun(boolean truncatedOutput) {
        if (status != ExecutionStatus.RUNNING) {
            return false;
        }
        truncated = truncatedOutput;
        if (changes.isEmpty()) {
            status = ExecutionStatus.COMPLETED;
            finishedAt = clock.instant();
        } else {
            status = ExecutionStatus.AWAITING_DECISION;
        }
        int count = changes.size();
        channel.terminate(seq -> new ExecutionEvent.Completed(id, seq, clock.instant(), count, truncatedOutput));
        return true;
    }

    synchronized boolean fail(ErrorKind kind, String reason) {
        if (status.isTerminal() || !status.canTransitionTo(ExecutionStatus.FAILED)) {
            return false;
        }
        if (status == ExecutionStatus.QUEUED) {
            recordStarted();
        }
        status = ExecutionStatus.FAILED;
        failure = new ExecutionFailure(kind, reason);
        finishedAt = clock.instant();
        channel.terminate(seq -> new ExecutionEvent.Error(id, seq, clock.instant(), kind, reason));
        return true;
    }

    synchronized CancelOutcome cancel() {
        if (status.isTerminal()) {
            return CancelOutcome.ALREADY_FINISHED;
        }
        if (status == ExecutionStatus.COMMITTING) {
            cancelRequested = true;
            return CancelOutcome.DEFERRED;
        }
        if (status == ExecutionStatus.QUEUED) {
            recordStarted();
        }
        status = ExecutionStatus.CANCELLED;
        finishedAt = clock.instant();
        channel.terminate(seq -> new ExecutionEvent.Cancelled(id, seq, clock.instant()));
        return CancelOutcome.CANCELLED;
    }

    synchronized void decide(String changeId, Decision decision) {
        if (status != ExecutionStatus.AWAITING_DECISION) {
            throw new IllegalStateException("Execution " + id + " is " + status + ", decisions need AWAITING_DECISION");
        }
        Change change = getChange(changeId);
        if (decision instanceof Decision.Edit edit) {
            change.edit(edit.newContent());
        } else if (decision instanceof Decision.Reject) {
            change.reject();
        } else {
            change.accept();
        }
    }

    /**
     * Moves to COMMITTING and returns the changes to apply.
     *
     * @throws IllegalStateException if not awaiting decisions or a change is still PENDING
     */
    synchronized List<Change> beginCommit() {
        if (status != ExecutionStatus.AWAITING_DECISION) {
            throw new IllegalStateException("Execution " + id + " is " + status + ", commit needs AWAITING_DECISION");
        }
        List<String> pending = changes.stream()
                .filter(c -> c.getStatus() == ChangeStatus.PENDING)
                .map(Change::getId)
                .toList();
        if (!pending.isEmpty()) {
            throw new IllegalStateException("Undecided change(s) in " + id + ": " + String.join(", ", pending));
        }
        status = ExecutionStatus.COMMITTING;
        return changes.stream().filter(c -> c.getStatus().isApplicable()).toList();
    }

    /**
     * Leaves COMMITTING. A successful apply completes the execution even if a cancel
     * arrived meanwhile; a refused one returns to AWAITING_DECISION, or to CANCELLED
     * when a cancel is pending.
     */
    synchronized void finishCommit(boolean applied) {
        if (status != ExecutionStatus.COMMITTING) {
            return;
        }
        if (applied) {
            status = ExecutionStatus.COMPLETED;
            finishedAt = clock.instant();
        } else if (cancelRequested) {
            status = ExecutionStatus.CANCELLED;
            finishedAt = clock.instant();
        } else {
            status = ExecutionStatus.AWAITING_DECISION;
        }
    }

    synchronized void setRunFuture(Future<?> runFuture) {
        this.runFuture = runFuture;
    }

    synchronized Future<?> getRunFuture() {
        return runFuture;
    }

    /** Registers the live backend stream; refused once the run has ended. */
    synchronized boolean attachBackend(BackendStream stream) {
        if (status != ExecutionStatus.RUNNING) {
            return false;
        }
        this.backendStream = stream;
        return true;
    }

    synchronized BackendStream detachBackend() {
        BackendStream stream = backendStream;
        backendStream = null;
        return stream;
    }

    /** True exactly once, the first time it is called after the execution became terminal. */
    synchronized boolean markAnnounced() {
        if (!status.isTerminal() || announced) {
            return false;
        }
        announced = true;
        return true;
    }

    public synchronized ExecutionSnapshot snapshot() {
        List<ChangeView> views = changes.stream().map(Change::view).toList();
        return new ExecutionSnapshot(id, sessionId, command.verb(), command.rawInput(), status,
                startedAt, finishedAt, truncated, failure, List.copyOf(warnings), views,
                streamBuffer.toString());
    }
}
