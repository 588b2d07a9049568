package com.tessera.dispatch.api;

import com.tessera.core.command.Suggestion;
import com.tessera.core.engine.CommandSession;
import com.tessera.core.engine.Execution;
import com.tessera.core.engine.ExecutionEngine;
import com.tessera.core.engine.ExecutionSnapshot;
import com.tessera.core.model.Change;
import com.tessera.core.model.ChangeView;
import com.tessera.core.model.Decision;
import com.tessera.core.model.Selection;
import com.tessera.core.vcs.VersionControlSync;
import com.tessera.core.workspace.ApplyResult;
import com.tessera.core.workspace.RevertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for command sessions and the executions they run.
 */
@RestController
@RequestMapping("/api/v1/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final ExecutionEngine engine;
    private final SseStreamingService sseStreamingService;
    private final VersionControlSync vcsSync;

    public SessionController(ExecutionEngine engine, SseStreamingService sseStreamingService,
                             VersionControlSync vcsSync) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
        this.vcsSync = vcsSync;
    }

    /**
     * POST /api/v1/sessions: Open a session over a workspace directory.
     */
    @PostMapping
    public ResponseEntity<SessionResponse> openSession(@RequestBody(required = false) OpenSessionRequest request) {
        String workspace = request != null && request.workspace() != null && !request.workspace().isBlank()
                ? request.workspace()
                : ".";
        CommandSession session = engine.openSession(Path.of(workspace));
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.from(session));
    }

    @GetMapping
    public List<SessionResponse> listSessions() {
        return engine.sessions().stream().map(SessionResponse::from).toList();
    }

    @GetMapping("/{sid}")
    public SessionResponse getSession(@PathVariable String sid) {
        return SessionResponse.from(engine.session(sid));
    }

    /**
     * DELETE /api/v1/sessions/{sid}: Close a session, cancelling anything unfinished.
     */
    @DeleteMapping("/{sid}")
    public ResponseEntity<Void> closeSession(@PathVariable String sid) {
        engine.session(sid);
        engine.closeSession(sid);
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /api/v1/sessions/{sid}/events: SSE stream of session lifecycle notifications.
     */
    @GetMapping(value = "/{sid}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter sessionEvents(@PathVariable String sid) {
        engine.session(sid);
        return sseStreamingService.createEmitter(sid);
    }

    @GetMapping("/{sid}/history")
    public List<String> history(@PathVariable String sid) {
        return engine.session(sid).history().entries();
    }

    @GetMapping("/{sid}/suggestions")
    public List<Suggestion> suggestions(@PathVariable String sid, @RequestParam(defaultValue = "") String partial) {
        return engine.session(sid).suggestions(partial);
    }

    /**
     * POST /api/v1/sessions/{sid}/executions: Submit a command. Runs asynchronously.
     */
    @PostMapping("/{sid}/executions")
    public ResponseEntity<Map<String, String>> submit(@PathVariable String sid, @RequestBody SubmitRequest request) {
        CommandSession session = engine.session(sid);
        if (request.input() == null) {
            throw new IllegalArgumentException("input is required");
        }
        Selection selection = request.pinnedFiles() != null
                ? new Selection(request.pinnedFiles())
                : Selection.none();
        String executionId = session.submit(request.input(), selection);
        log.info("Accepted execution {} in session {}", executionId, sid);
        return ResponseEntity.accepted().body(Map.of(
                "execution_id", executionId,
                "status", session.execution(executionId).getStatus().name()));
    }

    @GetMapping("/{sid}/executions")
    public List<ExecutionSnapshot> listExecutions(@PathVariable String sid) {
        return engine.session(sid).executions().stream().map(Execution::snapshot).toList();
    }

    @GetMapping("/{sid}/executions/{eid}")
    public ExecutionSnapshot getExecution(@PathVariable String sid, @PathVariable String eid) {
        return engine.session(sid).execution(eid).snapshot();
    }

    /**
     * GET /api/v1/sessions/{sid}/executions/{eid}/events: SSE stream of the execution's events.
     * Only one consumer at a time; a second one gets 409.
     */
    @GetMapping(value = "/{sid}/executions/{eid}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter executionEvents(@PathVariable String sid, @PathVariable String eid) {
        CommandSession session = engine.session(sid);
        return sseStreamingService.streamExecution(eid, session.subscribe(eid));
    }

    /**
     * POST /api/v1/sessions/{sid}/executions/{eid}/cancel: Request cancellation.
     */
    @PostMapping("/{sid}/executions/{eid}/cancel")
    public Map<String, Object> cancel(@PathVariable String sid, @PathVariable String eid) {
        CommandSession session = engine.session(sid);
        boolean accepted = session.cancel(eid);
        log.info("Cancel of {} requested (accepted={})", eid, accepted);
        return Map.of(
                "execution_id", eid,
                "cancelled", accepted,
                "status", session.execution(eid).getStatus().name());
    }

    /**
     * POST /api/v1/sessions/{sid}/executions/{eid}/changes/{cid}/decision: accept, reject or edit a change.
     */
    @PostMapping("/{sid}/executions/{eid}/changes/{cid}/decision")
    public ChangeView decide(@PathVariable String sid, @PathVariable String eid, @PathVariable String cid,
                             @RequestBody DecisionRequest request) {
        CommandSession session = engine.session(sid);
        session.decide(eid, cid, toDecision(request));
        Change change = session.execution(eid).getChange(cid);
        return change.view();
    }

    /**
     * POST /api/v1/sessions/{sid}/executions/{eid}/commit: Apply the accepted changes.
     */
    @PostMapping("/{sid}/executions/{eid}/commit")
    public Map<String, Object> commit(@PathVariable String sid, @PathVariable String eid,
                                      @RequestBody(required = false) CommitRequest request) {
        CommandSession session = engine.session(sid);
        ApplyResult result = session.commit(eid);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("execution_id", eid);
        body.put("status", session.execution(eid).getStatus().name());
        body.put("written", result.writtenPaths());
        body.put("ledger_ids", result.ledgerIds());
        vcsSync.afterApply(session.getWorkspace().root(), result,
                        session.execution(eid).getCommand().rawInput(),
                        request != null ? request.message() : null)
                .ifPresent(commit -> body.put("vcs_commit", commit));
        return body;
    }

    /**
     * POST /api/v1/sessions/{sid}/revert: Undo applied ledger entries.
     */
    @PostMapping("/{sid}/revert")
    public Map<String, Object> revert(@PathVariable String sid, @RequestBody RevertRequest request) {
        if (request.ledgerIds() == null || request.ledgerIds().isEmpty()) {
            throw new IllegalArgumentException("ledger_ids is required");
        }
        CommandSession session = engine.session(sid);
        RevertResult result = session.revert(request.ledgerIds());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("restored", result.restoredPaths());
        body.put("deleted", result.deletedPaths());
        vcsSync.afterRevert(session.getWorkspace().root(), result)
                .ifPresent(commit -> body.put("vcs_commit", commit));
        return body;
    }

    private static Decision toDecision(DecisionRequest request) {
        String decision = request.decision() == null ? "" : request.decision().toLowerCase();
        return switch (decision) {
            case "accept" -> Decision.ACCEPT;
            case "reject" -> Decision.REJECT;
            case "edit" -> {
                if (request.content() == null) {
                    throw new IllegalArgumentException("content is required for edit");
                }
                yield new Decision.Edit(request.content());
            }
            default -> throw new IllegalArgumentException(
                    "Unknown decision '" + request.decision() + "'; use accept, reject or edit");
        };
    }
}
