package com.tessera.dispatch.cli;

import com.tessera.core.command.ParseException;
import com.tessera.core.command.ParsedCommand;
import com.tessera.core.command.ValidationFailure;
import com.tessera.core.command.ValidationResult;
import com.tessera.core.engine.BusyException;
import com.tessera.core.engine.CommandSession;
import com.tessera.core.engine.Execution;
import com.tessera.core.engine.ExecutionEngine;
import com.tessera.core.events.EventChannel;
import com.tessera.core.events.ExecutionEvent;
import com.tessera.core.model.Change;
import com.tessera.core.model.ChangeKind;
import com.tessera.core.model.Decision;
import com.tessera.core.model.ExecutionStatus;
import com.tessera.core.vcs.VersionControlSync;
import com.tessera.core.workspace.ApplyException;
import com.tessera.core.workspace.ApplyResult;
import com.tessera.core.workspace.RevertResult;
import com.tessera.core.workspace.Workspace;
import com.tessera.core.workspace.WorkspaceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the REPL's line handling, with the session and git sync mocked.
 */
class ReplCommandTest {

    private static final String EXEC = "exe-0001-abcdef";

    @TempDir
    Path root;

    private CommandSession session;
    private VersionControlSync vcsSync;
    private ReplCommand repl;
    private ReplCommand.ReplState state;

    private Execution execution;
    private Change c1;
    private Change c2;

    @BeforeEach
    void setUp() {
        session = mock(CommandSession.class);
        when(session.getWorkspace()).thenReturn(new Workspace(root, new WorkspaceProperties()));
        vcsSync = mock(VersionControlSync.class);
        when(vcsSync.afterApply(any(), any(), any(), any())).thenReturn(Optional.empty());
        when(vcsSync.afterRevert(any(), any())).thenReturn(Optional.empty());
        repl = new ReplCommand(mock(ExecutionEngine.class), vcsSync);
        state = new ReplCommand.ReplState(session);

        c1 = new Change("C1", EXEC, "src/A.java", "a\n", true, "A\n", 1, 1, "Update A", ChangeKind.FULL_CONTENT);
        c2 = new Change("C2", EXEC, "src/B.java", "", false, "B\n", 1, 1, "Create B", ChangeKind.FULL_CONTENT);
        execution = mock(Execution.class);
        when(execution.getId()).thenReturn(EXEC);
        when(execution.getChanges()).thenReturn(List.of(c1, c2));
        when(execution.getChange("C1")).thenReturn(c1);
        when(execution.getChange("C2")).thenReturn(c2);
        when(execution.getCommand()).thenReturn(
                new ParsedCommand("implement", "x", Map.of(), List.of(), "/implement x"));
        when(session.execution(EXEC)).thenReturn(execution);
    }

    @Test
    @DisplayName(":quit ends the loop; blank lines and unknown colon commands do not")
    void quit() {
        assertTrue(repl.handle("", state));
        assertTrue(repl.handle(":frobnicate", state));
        assertTrue(repl.handle(":help", state));
        assertFalse(repl.handle(":quit", state));
        assertFalse(repl.handle(":q", state));
    }

    // ── submitting ───────────────────────────────────────────────────

    @Nested
    @DisplayName("submitting")
    class Submitting {

        @Test
        @DisplayName("plain input is submitted and its events are printed until the end")
        void submitAndStream() throws Exception {
            EventChannel channel = new EventChannel(EXEC, 16, e -> { });
            channel.emit(seq -> new ExecutionEvent.Thinking(EXEC, seq, Instant.now(), "Looking at A"));
            channel.terminate(seq -> new ExecutionEvent.Completed(EXEC, seq, Instant.now(), 0, false));
            when(session.submit("why is A slow?")).thenReturn(EXEC);
            when(session.subscribe(EXEC)).thenReturn(channel.attach());

            assertTrue(repl.handle("why is A slow?", state));
            state.awaitStreaming(5_000);

            assertEquals(EXEC, state.lastExecutionId);
            assertFalse(state.printer.isAlive());
        }

        @Test
        @DisplayName("invalid input is reported and leaves no last execution")
        void invalidInput() {
            when(session.submit(anyString())).thenThrow(new ParseException(
                    new ValidationResult.Invalid(ValidationFailure.UNKNOWN_VERB, "Unknown command /frob")));

            assertTrue(repl.handle("/frob", state));

            assertNull(state.lastExecutionId);
            verify(session, never()).subscribe(anyString());
        }

        @Test
        @DisplayName("a busy session is reported")
        void busy() {
            when(session.submit(anyString())).thenThrow(new BusyException(EXEC));

            assertTrue(repl.handle("/explain", state));

            assertNull(state.lastExecutionId);
        }
    }

    // ── reviewing ────────────────────────────────────────────────────

    @Nested
    @DisplayName("reviewing changes")
    class Reviewing {

        @BeforeEach
        void lastExecution() {
            state.lastExecutionId = EXEC;
        }

        @Test
        @DisplayName(":accept all decides every change")
        void acceptAll() {
            repl.handle(":accept all", state);

            verify(session).decide(EXEC, "C1", Decision.ACCEPT);
            verify(session).decide(EXEC, "C2", Decision.ACCEPT);
        }

        @Test
        @DisplayName(":reject names one change")
        void rejectOne() {
            repl.handle(":reject C2", state);

            verify(session).decide(EXEC, "C2", Decision.REJECT);
            verify(session, never()).decide(eq(EXEC), eq("C1"), any());
        }

        @Test
        @DisplayName(":accept without a target is refused")
        void acceptWithoutTarget() {
            assertTrue(repl.handle(":accept", state));
            verify(session, never()).decide(anyString(), anyString(), any());
        }

        @Test
        @DisplayName(":edit reads the replacement from a file")
        void edit() throws Exception {
            Path replacement = Files.writeString(root.resolve("mine.txt"), "mine\n");

            repl.handle(":edit C1 " + replacement, state);

            verify(session).decide(EXEC, "C1", new Decision.Edit("mine\n"));
        }

        @Test
        @DisplayName(":changes, :diff and :status only read state")
        void readOnly() {
            assertTrue(repl.handle(":changes", state));
            assertTrue(repl.handle(":diff", state));
            assertTrue(repl.handle(":diff C1", state));
            verify(session, never()).decide(anyString(), anyString(), any());
            verify(session, never()).commit(anyString());
        }

        @Test
        @DisplayName("review commands before any submit are reported, not thrown")
        void nothingRunYet() {
            state.lastExecutionId = null;

            assertTrue(repl.handle(":changes", state));
            assertTrue(repl.handle(":commit", state));
            verify(session, never()).commit(anyString());
        }
    }

    // ── commit and revert ────────────────────────────────────────────

    @Nested
    @DisplayName("commit and revert")
    class CommitAndRevert {

        private final ApplyResult applied = new ApplyResult(List.of("src/A.java"), List.of(EXEC + "/C1"),
                new ApplyResult.RevertHandle(List.of(EXEC + "/C1")));

        @BeforeEach
        void lastExecution() {
            state.lastExecutionId = EXEC;
        }

        @Test
        @DisplayName(":commit with undecided changes writes nothing")
        void undecided() {
            repl.handle(":commit", state);

            verify(session, never()).commit(anyString());
        }

        @Test
        @DisplayName(":commit applies and passes the message to git sync")
        void commit() {
            c1.accept();
            c2.reject();
            when(session.commit(EXEC)).thenReturn(applied);

            repl.handle(":commit Fix A", state);

            assertSame(applied, state.lastApply);
            verify(vcsSync).afterApply(root.toAbsolutePath().normalize(), applied, "/implement x", "Fix A");
        }

        @Test
        @DisplayName("a refused commit is reported and nothing is remembered")
        void refused() {
            c1.accept();
            c2.accept();
            when(session.commit(EXEC)).thenThrow(
                    new ApplyException(ApplyException.Kind.STALE_CHANGE, "C1", "src/A.java changed"));

            assertTrue(repl.handle(":commit", state));

            assertNull(state.lastApply);
            verify(vcsSync, never()).afterApply(any(), any(), any(), any());
        }

        @Test
        @DisplayName(":revert without ids undoes the last commit")
        void revertLast() {
            state.lastApply = applied;
            when(session.revert(List.of(EXEC + "/C1"))).thenReturn(new RevertResult(List.of("src/A.java"), List.of()));

            repl.handle(":revert", state);

            verify(session).revert(List.of(EXEC + "/C1"));
            assertNull(state.lastApply);
        }

        @Test
        @DisplayName(":revert with ids undoes exactly those")
        void revertGiven() {
            when(session.revert(any())).thenReturn(new RevertResult(List.of(), List.of("src/B.java")));

            repl.handle(":revert exe-1/C1 exe-2/C3", state);

            verify(session).revert(List.of("exe-1/C1", "exe-2/C3"));
        }

        @Test
        @DisplayName(":revert with nothing committed is refused")
        void revertNothing() {
            assertTrue(repl.handle(":revert", state));
            verify(session, never()).revert(any());
        }
    }

    // ── cancel ───────────────────────────────────────────────────────

    @Test
    @DisplayName(":cancel targets the in-flight execution")
    void cancelRunning() {
        when(session.inFlight()).thenReturn(Optional.of(execution));

        repl.handle(":cancel", state);

        verify(session).cancel(EXEC);
    }

    @Test
    @DisplayName(":cancel discards changes awaiting a decision")
    void cancelAwaiting() {
        state.lastExecutionId = EXEC;
        when(session.inFlight()).thenReturn(Optional.empty());
        when(execution.getStatus()).thenReturn(ExecutionStatus.AWAITING_DECISION);

        repl.handle(":cancel", state);

        verify(session).cancel(EXEC);
    }
}
