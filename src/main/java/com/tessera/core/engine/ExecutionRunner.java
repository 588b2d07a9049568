package com.tessera.core.engine;

import com.tessera.core.backend.BackendChunk;
import com.tessera.core.backend.BackendException;
import com.tessera.core.backend.BackendStream;
import com.tessera.core.command.CommandRegistry;
import com.tessera.core.command.ParsedCommand;
import com.tessera.core.context.ContextBuildException;
import com.tessera.core.events.ExecutionEvent;
import com.tessera.core.logging.MdcContext;
import com.tessera.core.model.Change;
import com.tessera.core.model.ErrorKind;
import com.tessera.core.model.ExecutionContext;
import com.tessera.core.model.FileContent;
import com.tessera.core.model.PriorDecision;
import com.tessera.core.model.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one execution from QUEUED to its post-stream state: context, backend
 * stream, change extraction, terminal event.
 */
class ExecutionRunner implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRunner.class);

    private final ExecutionEngine engine;
    private final CommandSession session;
    private final Execution execution;
    private final Selection selection;
    private final List<PriorDecision> priorDecisions;
    private final Clock clock;

    ExecutionRunner(ExecutionEngine engine, CommandSession session, Execution execution,
                    Selection selection, List<PriorDecision> priorDecisions) {
        this.engine = engine;
        this.session = session;
        this.execution = execution;
        this.selection = selection;
        this.priorDecisions = priorDecisions;
        this.clock = engine.clock();
    }

    @Override
    public void run() {
        String id = execution.getId();
        MdcContext.setExecution(session.getId(), id);
        try {
            if (!execution.start()) {
                log.debug("Execution {} was cancelled before it started", id);
                return;
            }
            ParsedCommand command = execution.getCommand();
            log.info("Execution {} started: /{}", id, command.verb());

            if (CommandRegistry.HELP.equals(command.verb())) {
                String help = engine.parser().registry().helpText();
                execution.appendStream(help);
                emit(seq -> new ExecutionEvent.Thinking(id, seq, clock.instant(), help));
                execution.completeRun(false);
                return;
            }

            ExecutionContext context = buildContext(command);
            streamResponse(context);
        } catch (Abandoned e) {
            log.debug("Execution {} stopped after it was terminated", id);
        } catch (StepFailure e) {
            failWith(e.kind, e.getMessage(), null);
        } catch (ContextBuildException e) {
            failWith(e.getKind().toErrorKind(), e.getMessage(), null);
        } catch (BackendException e) {
            failWith(e.getKind().toErrorKind(), e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failWith(ErrorKind.INTERNAL, "Execution interrupted", null);
        } catch (RuntimeException e) {
            failWith(ErrorKind.INTERNAL, "Unexpected error: " + e.getMessage(), e);
        } finally {
            BackendStream stream = execution.detachBackend();
            if (stream != null) {
                closeQuietly(stream);
            }
            engine.onRunFinished(session, execution);
            MdcContext.clear();
        }
    }

    private ExecutionContext buildContext(ParsedCommand command) throws InterruptedException {
        String id = execution.getId();
        int fileCount = command.mentionedFiles().size() + selection.pinnedFiles().size();
        emit(seq -> new ExecutionEvent.Progress(id, seq, clock.instant(), "context",
                "Gathering context (" + fileCount + " file(s))"));

        int timeout = engine.properties().getContextTimeoutSeconds();
        CompletableFuture<ExecutionContext> future = engine.contextBuilder()
                .build(command, selection, session.getWorkspace().files(), priorDecisions);
        ExecutionContext context;
        try {
            context = future.get(timeout, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StepFailure(ErrorKind.TIMEOUT, "Building context took longer than " + timeout + "s");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ContextBuildException cbe) {
                throw cbe;
            }
            if (cause instanceof CancellationException) {
                throw new Abandoned();
            }
            throw new StepFailure(ErrorKind.INTERNAL, "Context building failed: "
                    + (cause != null ? cause.getMessage() : e.getMessage()));
        }

        execution.setContext(context);
        for (FileContent file : context.fileContents()) {
            emit(seq -> new ExecutionEvent.FileRead(id, seq, clock.instant(), file.path(), file.sizeBytes()));
        }
        for (String warning : context.warnings()) {
            log.warn("Context warning for {}: {}", id, warning);
            emit(seq -> new ExecutionEvent.Progress(id, seq, clock.instant(), "warning", warning));
        }
        return context;
    }

    private void streamResponse(ExecutionContext context) throws InterruptedException {
        String id = execution.getId();
        ParsedCommand command = context.activeCommand();
        emit(seq -> new ExecutionEvent.Progress(id, seq, clock.instant(), "backend", "Waiting for reasoning backend"));

        String systemPrompt = engine.promptRenderer().systemPrompt(command.verb());
        BackendStream stream = engine.backend().stream(systemPrompt, context, userRequest(command));
        if (!execution.attachBackend(stream)) {
            closeQuietly(stream);
            throw new Abandoned();
        }

        boolean more = awaitFirstChunk(stream);
        var extractor = new ChangeExtractor();
        var factory = new ChangeFactory(session.getWorkspace().files(), this::warn);
        boolean sawEnd = false;

        while (more) {
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            BackendChunk chunk = stream.next();
            switch (chunk.kind()) {
                case END -> sawEnd = true;
                case TEXT -> {
                    if (!execution.appendStream(chunk.payload())) {
                        throw new Abandoned();
                    }
                    handle(extractor.accept(chunk.payload()), factory);
                }
                case CODE_BLOCK, DIFF_BLOCK -> {
                    boolean diff = chunk.kind() == BackendChunk.Kind.DIFF_BLOCK;
                    if (!execution.appendStream(fenced(chunk, diff))) {
                        throw new Abandoned();
                    }
                    propose(new ChangeExtractor.Block(chunk.filePath(), chunk.payload(), diff, "", true), factory);
                }
            }
            more = !sawEnd && stream.hasNext();
        }

        ChangeExtractor.Result tail = extractor.finish();
        handle(tail.items(), factory);
        boolean truncated = !sawEnd || tail.truncated();
        if (truncated) {
            warn("Response was cut off before it finished; the last proposal may be incomplete");
        }
        if (execution.completeRun(truncated)) {
            log.info("Execution {} streamed {} change(s){}", id, execution.changeCount(), truncated ? " (truncated)" : "");
        }
    }

    private boolean awaitFirstChunk(BackendStream stream) throws InterruptedException {
        int timeout = engine.properties().getBackendConnectTimeoutSeconds();
        Future<Boolean> first = engine.ioExecutor().submit(stream::hasNext);
        try {
            return first.get(timeout, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            first.cancel(true);
            throw new StepFailure(ErrorKind.TIMEOUT, "No response from reasoning backend within " + timeout + "s");
        } catch (InterruptedException e) {
            first.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendException be) {
                throw be;
            }
            throw new BackendException(BackendException.Kind.PROTOCOL_ERROR,
                    "Reasoning backend failed: " + (cause != null ? cause.getMessage() : e.getMessage()), cause);
        }
    }

    private void handle(List<ChangeExtractor.Extracted> items, ChangeFactory factory) throws InterruptedException {
        String id = execution.getId();
        for (ChangeExtractor.Extracted item : items) {
            if (item instanceof ChangeExtractor.Prose prose) {
                emit(seq -> new ExecutionEvent.Thinking(id, seq, clock.instant(), prose.text()));
            } else if (item instanceof ChangeExtractor.Block block) {
                propose(block, factory);
            }
        }
    }

    private void propose(ChangeExtractor.Block block, ChangeFactory factory) throws InterruptedException {
        String id = execution.getId();
        String changeId = "C" + (execution.changeCount() + 1);
        Optional<Change> change = factory.create(id, changeId, block);
        if (change.isEmpty()) {
            return;
        }
        if (!execution.addChange(change.get())) {
            throw new Abandoned();
        }
        MdcContext.setChange(id, changeId);
        log.debug("Proposed {} for {}", changeId, change.get().getFilePath());
        MdcContext.clearChange();
        var view = change.get().view();
        emit(seq -> new ExecutionEvent.CodeChangeProposed(id, seq, clock.instant(), view));
    }

    private void warn(String message) {
        execution.addWarning(message);
        log.warn("{}: {}", execution.getId(), message);
        try {
            emit(seq -> new ExecutionEvent.Progress(execution.getId(), seq, clock.instant(), "warning", message));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Abandoned();
        }
    }

    private void emit(ExecutionEvent.Factory factory) throws InterruptedException {
        if (!execution.emit(factory)) {
            throw new Abandoned();
        }
    }

    private void failWith(ErrorKind kind, String reason, Throwable cause) {
        if (execution.fail(kind, reason)) {
            if (cause != null && kind == ErrorKind.INTERNAL) {
                log.error("Execution {} failed: {}", execution.getId(), reason, cause);
            } else {
                log.warn("Execution {} failed ({}): {}", execution.getId(), kind, reason);
            }
        } else {
            log.debug("Execution {} already {} when {} arrived: {}",
                    execution.getId(), execution.getStatus(), kind, reason);
        }
    }

    private static String userRequest(ParsedCommand command) {
        if (!command.argument().isBlank()) {
            return command.argument();
        }
        return "(see the mentioned files: " + String.join(", ", command.mentionedFiles()) + ")";
    }

    private static String fenced(BackendChunk chunk, boolean diff) {
        String body = chunk.payload().endsWith("\n") ? chunk.payload() : chunk.payload() + "\n";
        return "```" + (diff ? "diff " : "") + chunk.filePath() + "\n" + body + "```\n";
    }

    private static void closeQuietly(BackendStream stream) {
        try {
            stream.close();
        } catch (RuntimeException e) {
            log.debug("Backend stream close failed: {}", e.getMessage());
        }
    }

    /** The execution was terminated elsewhere (cancel); stop without touching its state. */
    private static final class Abandoned extends RuntimeException {
        Abandoned() {
            super(null, null, false, false);
        }
    }

    private static final class StepFailure extends RuntimeException {
        private final ErrorKind kind;

        StepFailure(ErrorKind kind, String message) {
            super(message);
            this.kind = kind;
        }
    }
}
