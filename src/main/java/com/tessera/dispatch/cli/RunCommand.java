package com.tessera.dispatch.cli;

import com.tessera.core.command.ParseException;
import com.tessera.core.engine.BusyException;
import com.tessera.core.engine.CommandSession;
import com.tessera.core.engine.Execution;
import com.tessera.core.engine.ExecutionEngine;
import com.tessera.core.events.EventStream;
import com.tessera.core.model.Change;
import com.tessera.core.model.Decision;
import com.tessera.core.model.Selection;
import com.tessera.core.vcs.VersionControlSync;
import com.tessera.core.workspace.ApplyException;
import com.tessera.core.workspace.ApplyResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: tessera run "&lt;input&gt;"
 * <p>
 * Submits one command, streams its events and, with {@code --accept-all}, applies
 * every proposed change. Exit code 0 on success, 1 on failure, 2 for invalid input,
 * 130 when cancelled.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run one command and stream its output")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Command input, e.g. \"/implement add retries @src/http.ts\"")
    private String input;

    @Option(names = {"--workspace", "-w"}, description = "Workspace root", defaultValue = ".")
    private Path workspace;

    @Option(names = {"--file", "-f"}, description = "Pin a file into the context (repeatable)")
    private List<String> pinned = new ArrayList<>();

    @Option(names = "--accept-all", description = "Accept and apply every proposed change")
    private boolean acceptAll;

    @Option(names = "--commit-message", description = "Git commit message when git sync is enabled")
    private String commitMessage;

    @Option(names = "--diff", description = "Print a diff for each proposed change")
    private boolean showDiff;

    private final ExecutionEngine engine;
    private final VersionControlSync vcsSync;

    public RunCommand(ExecutionEngine engine, VersionControlSync vcsSync) {
        this.engine = engine;
        this.vcsSync = vcsSync;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        CommandSession session;
        try {
            session = engine.openSession(workspace);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        try (session) {
            String executionId;
            try {
                executionId = session.submit(input, Selection.of(pinned.toArray(String[]::new)));
            } catch (ParseException e) {
                ConsoleOutput.error("Invalid command (" + e.getReason() + "): " + e.getMessage());
                return 2;
            } catch (BusyException e) {
                ConsoleOutput.error(e.getMessage());
                return 1;
            }

            try (EventStream events = session.subscribe(executionId)) {
                while (events.hasNext()) {
                    ConsoleOutput.event(events.next());
                }
            }

            Execution execution = session.execution(executionId);
            return switch (execution.getStatus()) {
                case FAILED -> 1;
                case CANCELLED -> 130;
                case AWAITING_DECISION -> decide(session, execution);
                default -> 0;
            };
        }
    }

    private int decide(CommandSession session, Execution execution) {
        if (showDiff) {
            for (Change change : execution.getChanges()) {
                ConsoleOutput.change(change.view());
                ConsoleOutput.diff(change.view());
            }
        }
        if (!acceptAll) {
            ConsoleOutput.info("Changes were not applied. Re-run with --accept-all, or review them in `tessera repl`.");
            return 0;
        }

        for (Change change : execution.getChanges()) {
            session.decide(execution.getId(), change.getId(), Decision.ACCEPT);
        }
        try {
            ApplyResult result = session.commit(execution.getId());
            result.writtenPaths().forEach(p -> ConsoleOutput.success("wrote " + p));
            vcsSync.afterApply(session.getWorkspace().root(), result, input, commitMessage)
                    .ifPresent(commit -> ConsoleOutput.success("git commit " + commit));
            return 0;
        } catch (ApplyException e) {
            ConsoleOutput.error(e.getKind() + ": " + e.getMessage());
            return 1;
        }
    }
}
