package com.tessera.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.core.command.CommandHistory;
import com.tessera.core.command.ParseException;
import com.tessera.core.command.ParsedCommand;
import com.tessera.core.command.ValidationFailure;
import com.tessera.core.command.ValidationResult;
import com.tessera.core.engine.BusyException;
import com.tessera.core.engine.CommandSession;
import com.tessera.core.engine.Execution;
import com.tessera.core.engine.ExecutionEngine;
import com.tessera.core.engine.ExecutionSnapshot;
import com.tessera.core.model.Change;
import com.tessera.core.model.ChangeKind;
import com.tessera.core.model.Decision;
import com.tessera.core.model.ExecutionStatus;
import com.tessera.core.model.Selection;
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
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SessionControllerTest {

    private static final Path ROOT = Path.of("/work/app");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ExecutionEngine engine;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    @MockitoBean
    private VersionControlSync vcsSync;

    private CommandSession session;
    private Execution execution;

    @BeforeEach
    void setUp() {
        session = mock(CommandSession.class);
        when(session.getId()).thenReturn("ses-1");
        when(session.getWorkspace()).thenReturn(new Workspace(ROOT, new WorkspaceProperties()));
        when(session.getCreatedAt()).thenReturn(Instant.parse("2026-01-01T10:00:00Z"));
        when(engine.session(anyString())).thenAnswer(inv -> {
            throw new NoSuchElementException("No session " + inv.getArgument(0));
        });
        doReturn(session).when(engine).session("ses-1");

        execution = mock(Execution.class);
        when(execution.getId()).thenReturn("exe-0001-abcdef");
        when(session.execution("exe-0001-abcdef")).thenReturn(execution);
    }

    // ── sessions ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("sessions")
    class Sessions {

        @Test
        @DisplayName("POST /sessions opens a session and returns 201")
        void open() throws Exception {
            when(engine.openSession(Path.of("/work/app"))).thenReturn(session);

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"workspace\": \"/work/app\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.session_id").value("ses-1"))
                    .andExpect(jsonPath("$.workspace").value(ROOT.toString()))
                    .andExpect(jsonPath("$.created_at").value("2026-01-01T10:00:00Z"));
        }

        @Test
        @DisplayName("POST /sessions without a body uses the current directory")
        void openDefault() throws Exception {
            when(engine.openSession(Path.of("."))).thenReturn(session);

            mockMvc.perform(post("/api/v1/sessions"))
                    .andExpect(status().isCreated());
            verify(engine).openSession(Path.of("."));
        }

        @Test
        @DisplayName("a workspace that is not a directory is 400")
        void openInvalid() throws Exception {
            when(engine.openSession(any())).thenThrow(new IllegalArgumentException("Workspace root is not a directory"));

            mockMvc.perform(post("/api/v1/sessions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"workspace\": \"/nope\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
        }

        @Test
        @DisplayName("GET /sessions/{sid} for an unknown id is 404")
        void unknownSession() throws Exception {
            mockMvc.perform(get("/api/v1/sessions/ses-9"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.kind").value("NOT_FOUND"))
                    .andExpect(jsonPath("$.error").value(containsString("ses-9")));
        }

        @Test
        @DisplayName("DELETE /sessions/{sid} closes the session")
        void close() throws Exception {
            mockMvc.perform(delete("/api/v1/sessions/ses-1"))
                    .andExpect(status().isNoContent());
            verify(engine).closeSession("ses-1");
        }

        @Test
        @DisplayName("GET /sessions/{sid}/history lists previous inputs")
        void history() throws Exception {
            var history = new CommandHistory(10);
            history.add("/help");
            history.add("/debug NPE");
            when(session.history()).thenReturn(history);

            mockMvc.perform(get("/api/v1/sessions/ses-1/history"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(2)))
                    .andExpect(jsonPath("$[1]").value("/debug NPE"));
        }
    }

    // ── executions ───────────────────────────────────────────────────

    @Nested
    @DisplayName("executions")
    class Executions {

        @Test
        @DisplayName("POST /executions submits and returns 202 with the id")
        void submit() throws Exception {
            when(session.submit(eq("/implement retries"), any(Selection.class))).thenReturn("exe-0001-abcdef");
            when(execution.getStatus()).thenReturn(ExecutionStatus.QUEUED);

            mockMvc.perform(post("/api/v1/sessions/ses-1/executions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"input\": \"/implement retries\", \"pinned_files\": [\"src/Client.java\"]}"))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.execution_id").value("exe-0001-abcdef"))
                    .andExpect(jsonPath("$.status").value("QUEUED"));

            verify(session).submit("/implement retries", new Selection(List.of("src/Client.java")));
        }

        @Test
        @DisplayName("invalid input is 400 with the validation reason")
        void submitInvalid() throws Exception {
            when(session.submit(anyString(), any(Selection.class))).thenThrow(new ParseException(
                    new ValidationResult.Invalid(ValidationFailure.UNKNOWN_VERB, "Unknown command /frob")));

            mockMvc.perform(post("/api/v1/sessions/ses-1/executions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"input\": \"/frob\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("UNKNOWN_VERB"));
        }

        @Test
        @DisplayName("a submit while busy is 409 BUSY")
        void submitBusy() throws Exception {
            when(session.submit(anyString(), any(Selection.class))).thenThrow(new BusyException("exe-0001-abcdef"));

            mockMvc.perform(post("/api/v1/sessions/ses-1/executions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"input\": \"hello\"}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.kind").value("BUSY"));
        }

        @Test
        @DisplayName("a missing input is 400")
        void submitWithoutInput() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/ses-1/executions")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
        }

        @Test
        @DisplayName("GET /executions/{eid} returns the snapshot")
        void snapshot() throws Exception {
            when(execution.snapshot()).thenReturn(new ExecutionSnapshot("exe-0001-abcdef", "ses-1", "ask",
                    "why?", ExecutionStatus.COMPLETED, Instant.parse("2026-01-01T10:00:00Z"),
                    Instant.parse("2026-01-01T10:00:05Z"), false, null, List.of(), List.of(), "Because."));

            mockMvc.perform(get("/api/v1/sessions/ses-1/executions/exe-0001-abcdef"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.executionId").value("exe-0001-abcdef"))
                    .andExpect(jsonPath("$.status").value("COMPLETED"))
                    .andExpect(jsonPath("$.output").value("Because."));
        }

        @Test
        @DisplayName("an unknown execution is 404")
        void unknownExecution() throws Exception {
            when(session.execution("exe-9")).thenThrow(new NoSuchElementException("No execution exe-9"));

            mockMvc.perform(get("/api/v1/sessions/ses-1/executions/exe-9"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("POST /cancel reports whether the cancel took effect")
        void cancel() throws Exception {
            when(session.cancel("exe-0001-abcdef")).thenReturn(true);
            when(execution.getStatus()).thenReturn(ExecutionStatus.CANCELLED);

            mockMvc.perform(post("/api/v1/sessions/ses-1/executions/exe-0001-abcdef/cancel"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.cancelled").value(true))
                    .andExpect(jsonPath("$.status").value("CANCELLED"));
        }

        @Test
        @DisplayName("a second event consumer is 409")
        void secondConsumer() throws Exception {
            when(session.subscribe("exe-0001-abcdef"))
                    .thenThrow(new IllegalStateException("Execution already has a consumer"));

            mockMvc.perform(get("/api/v1/sessions/ses-1/executions/exe-0001-abcdef/events"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.kind").value("INVALID_STATE"));
        }
    }

    // ── decisions, commit, revert ────────────────────────────────────

    @Nested
    @DisplayName("decisions and commit")
    class DecisionsAndCommit {

        private Change change;

        @BeforeEach
        void setUpChange() {
            change = new Change("C1", "exe-0001-abcdef", "src/A.java", "old\n", true, "new\n",
                    1, 1, "Update src/A.java", ChangeKind.FULL_CONTENT);
            when(execution.getChange("C1")).thenReturn(change);
        }

        @Test
        @DisplayName("accept records the decision and returns the change")
        void accept() throws Exception {
            doAnswer(inv -> {
                change.accept();
                return null;
            }).when(session).decide("exe-0001-abcdef", "C1", Decision.ACCEPT);

            mockMvc.perform(post("/api/v1/sessions/ses-1/executions/exe-0001-abcdef/changes/C1/decision")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"decision\": \"accept\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value("C1"))
                    .andExpect(jsonPath("$.status").value("ACCEPTED"));
        }

        @Test
        @DisplayName("edit passes the new content")
        void edit() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/ses-1/executions/exe-0001-abcdef/changes/C1/decision")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"decision\": \"edit\", \"content\": \"mine\\n\"}"))
                    .andExpect(status().isOk());

            verify(session).decide("exe-0001-abcdef", "C1", new Decision.Edit("mine\n"));
        }

        @Test
        @DisplayName("edit without content and unknown decisions are 400")
        void invalidDecision() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/ses-1/executions/exe-0001-abcdef/changes/C1/decision")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"decision\": \"edit\"}"))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(post("/api/v1/sessions/ses-1/executions/exe-0001-abcdef/changes/C1/decision")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"decision\": \"maybe\"}"))
                    .andExpect(status().isBadRequest());
            verify(session, never()).decide(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("commit returns written paths, ledger ids and the git commit")
        void commit() throws Exception {
            var result = new ApplyResult(List.of("src/A.java"), List.of("exe-0001-abcdef/C1"),
                    new ApplyResult.RevertHandle(List.of("exe-0001-abcdef/C1")));
            when(session.commit("exe-0001-abcdef")).thenReturn(result);
            when(execution.getStatus()).thenReturn(ExecutionStatus.COMPLETED);
            when(execution.getCommand()).thenReturn(
                    new ParsedCommand("implement", "x", Map.of(), List.of(), "/implement x"));
            when(vcsSync.afterApply(eq(ROOT), eq(result), eq("/implement x"), eq("Fix A")))
                    .thenReturn(Optional.of("abc123"));

            mockMvc.perform(post("/api/v1/sessions/ses-1/executions/exe-0001-abcdef/commit")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new CommitRequest("Fix A"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("COMPLETED"))
                    .andExpect(jsonPath("$.written[0]").value("src/A.java"))
                    .andExpect(jsonPath("$.ledger_ids[0]").value("exe-0001-abcdef/C1"))
                    .andExpect(jsonPath("$.vcs_commit").value("abc123"));
        }

        @Test
        @DisplayName("a stale commit is 409 STALE_CHANGE")
        void staleCommit() throws Exception {
            when(session.commit("exe-0001-abcdef"))
                    .thenThrow(new ApplyException(ApplyException.Kind.STALE_CHANGE, "C1", "src/A.java changed"));

            mockMvc.perform(post("/api/v1/sessions/ses-1/executions/exe-0001-abcdef/commit"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.kind").value("STALE_CHANGE"));
            verify(vcsSync, never()).afterApply(any(), any(), any(), any());
        }

        @Test
        @DisplayName("revert restores the given ledger entries")
        void revert() throws Exception {
            when(session.revert(List.of("exe-0001-abcdef/C1")))
                    .thenReturn(new RevertResult(List.of("src/A.java"), List.of()));
            when(vcsSync.afterRevert(eq(ROOT), any())).thenReturn(Optional.empty());

            mockMvc.perform(post("/api/v1/sessions/ses-1/revert")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"ledger_ids\": [\"exe-0001-abcdef/C1\"]}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.restored[0]").value("src/A.java"))
                    .andExpect(jsonPath("$.deleted", hasSize(0)))
                    .andExpect(jsonPath("$.vcs_commit").doesNotExist());
        }

        @Test
        @DisplayName("revert without ledger ids is 400")
        void revertWithoutIds() throws Exception {
            mockMvc.perform(post("/api/v1/sessions/ses-1/revert")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest());
            verify(session, never()).revert(any());
        }

        @Test
        @DisplayName("reverting twice is 409 ALREADY_REVERTED")
        void revertTwice() throws Exception {
            when(session.revert(any())).thenThrow(new ApplyException(ApplyException.Kind.ALREADY_REVERTED,
                    "exe-0001-abcdef/C1", "already reverted"));

            mockMvc.perform(post("/api/v1/sessions/ses-1/revert")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"ledger_ids\": [\"exe-0001-abcdef/C1\"]}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.kind").value("ALREADY_REVERTED"));
        }
    }
}
