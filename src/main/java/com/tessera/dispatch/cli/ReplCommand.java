package com.tessera.dispatch.cli;

import com.tessera.core.command.ParseException;
import com.tessera.core.command.Suggestion;
import com.tessera.core.engine.BusyException;
import com.tessera.core.engine.CommandSession;
import com.tessera.core.engine.Execution;
import com.tessera.core.engine.ExecutionEngine;
import com.tessera.core.events.EventStream;
import com.tessera.core.model.Change;
import com.tessera.core.model.ChangeStatus;
import com.tessera.core.model.Decision;
import com.tessera.core.model.ExecutionStatus;
import com.tessera.core.vcs.VersionControlSync;
import com.tessera.core.workspace.ApplyException;
import com.tessera.core.workspace.ApplyResult;
import com.tessera.core.workspace.RevertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;

/**
 * CLI command: tessera repl
 * <p>
 * Interactive session over one workspace. Slash commands and plain questions are
 * submitted to the engine and stream in the background; colon commands review,
 * apply and revert the proposed changes.
 */
@Command(name = "repl", mixinStandardHelpOptions = true, description = "Start an interactive session")
@Component
public class ReplCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplCommand.class);

    private static final String HELP = """
            /<command> [args] [@file ...]   run a command (type /help for the list)
            <question>                      ask a question
            :changes                        list changes of the last execution
            :diff [id]                      show diffs
            :accept <id|all>                accept a change
            :reject <id|all>                reject a change
            :edit <id> <file>               replace a change's content with a file's content
            :commit [message]               apply accepted changes
            :revert [ledger-id ...]         undo the last commit, or the given entries
            :cancel                         cancel the running execution
            :status                         state of the last execution
            :history                        previous inputs
            :suggest <prefix>               completions for a partial input
            :quit                           leave""";

    @Option(names = {"--workspace", "-w"}, description = "Workspace root", defaultValue = ".")
    private Path workspace;

    private final ExecutionEngine engine;
    private final VersionControlSync vcsSync;

    public ReplCommand(ExecutionEngine engine, VersionControlSync vcsSync) {
        this.engine = engine;
        this.vcsSync = vcsSync;
    }

    @Override
    public Integer call() throws IOException {
        ConsoleOutput.printBanner();
        CommandSession session;
        try {
            session = engine.openSession(workspace);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ConsoleOutput.info("Workspace " + session.getWorkspace().root() + ". Type :help for commands.");
        try (session) {
            loop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), new ReplState(session));
        }
        return 0;
    }

    void loop(BufferedReader in, ReplState state) throws IOException {
        prompt();
        String line;
        while ((line = in.readLine()) != null) {
            if (!handle(line.strip(), state)) {
                break;
            }
            prompt();
        }
    }

    /**
     * Handles one input line.
     *
     * @return false when the user asked to leave
     */
    boolean handle(String line, ReplState state) {
        if (line.isEmpty()) {
            return true;
        }
        if (!line.startsWith(":")) {
            submit(line, state);
            return true;
        }

        String[] parts = line.substring(1).split("\\s+", 3);
        String verb = parts[0];
        String arg = parts.length > 1 ? parts[1] : "";
        String rest = parts.length > 2 ? parts[2] : "";
        try {
            switch (verb) {
                case "quit", "q", "exit" -> {
                    return false;
                }
                case "help" -> System.out.println(HELP);
                case "history" -> history(state);
                case "suggest" -> suggest(state, line.substring(1 + verb.length()).strip());
                case "changes" -> changes(state);
                case "diff" -> diff(state, arg);
                case "accept" -> decideAll(state, arg, Decision.ACCEPT);
                case "reject" -> decideAll(state, arg, Decision.REJECT);
                case "edit" -> edit(state, arg, rest);
                case "commit" -> commit(state, line.substring(1 + verb.length()).strip());
                case "revert" -> revert(state, line.substring(1 + verb.length()).strip());
                case "cancel" -> cancel(state);
                case "status" -> status(state);
                default -> ConsoleOutput.error("Unknown command :" + verb + " (try :help)");
            }
        } catch (NoSuchElementException | IllegalStateException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
        } catch (ApplyException e) {
            ConsoleOutput.error(e.getKind() + ": " + e.getMessage());
        }
        return true;
    }

    private void submit(String line, ReplState state) {
        String executionId;
        try {
            executionId = state.session.submit(line);
        } catch (ParseException e) {
            ConsoleOutput.error("Invalid command (" + e.getReason() + "): " + e.getMessage());
            return;
        } catch (BusyException e) {
            ConsoleOutput.error(e.getMessage() + "; use :cancel first");
            return;
        }
        state.lastExecutionId = executionId;
        EventStream events = state.session.subscribe(executionId);
        Thread printer = new Thread(() -> {
            try (events) {
                while (events.hasNext()) {
                    ConsoleOutput.event(events.next());
                }
            } catch (RuntimeException e) {
                log.warn("Event printer for {} stopped: {}", executionId, e.getMessage(), e);
            }
        }, "tessera-repl-" + executionId);
        printer.setDaemon(true);
        state.printer = printer;
        printer.start();
    }

    private void history(ReplState state) {
        List<String> entries = state.session.history().entries();
        for (int i = 0; i < entries.size(); i++) {
            System.out.printf("%4d  %s%n", i + 1, entries.get(i));
        }
    }

    private void suggest(ReplState state, String partial) {
        for (Suggestion s : state.session.suggestions(partial)) {
            System.out.printf("  %-24s %s%n", s.text(), s.description());
        }
    }

    private void changes(ReplState state) {
        Execution execution = last(state);
        if (execution.getChanges().isEmpty()) {
            ConsoleOutput.info("No changes in " + execution.getId());
        }
        execution.getChanges().forEach(c -> ConsoleOutput.change(c.view()));
    }

    private void diff(ReplState state, String changeId) {
        Execution execution = last(state);
        if (changeId.isEmpty()) {
            for (Change change : execution.getChanges()) {
                ConsoleOutput.change(change.view());
                ConsoleOutput.diff(change.view());
            }
        } else {
            Change change = execution.getChange(changeId);
            ConsoleOutput.change(change.view());
            ConsoleOutput.diff(change.view());
        }
    }

    private void decideAll(ReplState state, String target, Decision decision) {
        if (target.isEmpty()) {
            throw new IllegalArgumentException("Name a change id or 'all'");
        }
        Execution execution = last(state);
        List<Change> changes = "all".equals(target)
                ? execution.getChanges()
                : List.of(execution.getChange(target));
        for (Change change : changes) {
            state.session.decide(execution.getId(), change.getId(), decision);
            ConsoleOutput.change(change.view());
        }
    }

    private void edit(ReplState state, String changeId, String file) {
        if (changeId.isEmpty() || file.isEmpty()) {
            throw new IllegalArgumentException("Usage: :edit <id> <file>");
        }
        String content;
        try {
            content = Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read " + file + ": " + e.getMessage());
        }
        Execution execution = last(state);
        state.session.decide(execution.getId(), changeId, new Decision.Edit(content));
        ConsoleOutput.change(execution.getChange(changeId).view());
    }

    private void commit(ReplState state, String message) {
        Execution execution = last(state);
        long pending = execution.getChanges().stream().filter(c -> c.getStatus() == ChangeStatus.PENDING).count();
        if (pending > 0) {
            ConsoleOutput.warn(pending + " change(s) still undecided; use :accept or :reject first");
            return;
        }
        ApplyResult result = state.session.commit(execution.getId());
        if (result.isEmpty()) {
            ConsoleOutput.info("Nothing accepted; nothing written");
            return;
        }
        state.lastApply = result;
        result.writtenPaths().forEach(p -> ConsoleOutput.success("wrote " + p));
        vcsSync.afterApply(state.session.getWorkspace().root(), result,
                        execution.getCommand().rawInput(), message.isEmpty() ? null : message)
                .ifPresent(commit -> ConsoleOutput.success("git commit " + commit));
    }

    private void revert(ReplState state, String ids) {
        List<String> ledgerIds;
        if (!ids.isEmpty()) {
            ledgerIds = Arrays.asList(ids.split("\\s+"));
        } else if (state.lastApply != null) {
            ledgerIds = state.lastApply.revertHandle().ledgerIds();
        } else {
            throw new IllegalStateException("Nothing committed in this session yet");
        }
        RevertResult result = state.session.revert(ledgerIds);
        result.restoredPaths().forEach(p -> ConsoleOutput.success("restored " + p));
        result.deletedPaths().forEach(p -> ConsoleOutput.success("deleted " + p));
        if (ids.isEmpty()) {
            state.lastApply = null;
        }
        vcsSync.afterRevert(state.session.getWorkspace().root(), result)
                .ifPresent(commit -> ConsoleOutput.success("git commit " + commit));
    }

    private void cancel(ReplState state) {
        var running = state.session.inFlight();
        if (running.isEmpty()) {
            Execution execution = last(state);
            if (execution.getStatus() == ExecutionStatus.AWAITING_DECISION) {
                state.session.cancel(execution.getId());
                ConsoleOutput.info("Discarded the pending changes of " + execution.getId());
                return;
            }
            ConsoleOutput.info("Nothing is running");
            return;
        }
        state.session.cancel(running.get().getId());
    }

    private void status(ReplState state) {
        var snapshot = last(state).snapshot();
        ConsoleOutput.info(snapshot.executionId() + " /" + snapshot.verb() + ": " + snapshot.status()
                + (snapshot.truncated() ? " (truncated)" : "")
                + ", " + snapshot.changes().size() + " change(s)");
        if (snapshot.failure() != null) {
            ConsoleOutput.error(snapshot.failure().kind() + ": " + snapshot.failure().reason());
        }
        snapshot.warnings().forEach(ConsoleOutput::warn);
    }

    private static Execution last(ReplState state) {
        if (state.lastExecutionId == null) {
            throw new IllegalStateException("No command has been run yet");
        }
        return state.session.execution(state.lastExecutionId);
    }

    private static void prompt() {
        System.out.print("tessera> ");
        System.out.flush();
    }

    /** Per-session REPL state. */
    static final class ReplState {
        final CommandSession session;
        volatile String lastExecutionId;
        volatile ApplyResult lastApply;
        volatile Thread printer;

        ReplState(CommandSession session) {
            this.session = session;
        }

        /** Waits for the background event printer of the last submit to finish. */
        void awaitStreaming(long millis) throws InterruptedException {
            Thread current = printer;
            if (current != null) {
                current.join(millis);
            }
        }
    }
}
