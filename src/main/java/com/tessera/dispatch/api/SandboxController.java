package com.tessera.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tessera.sandbox.SandboxSession;
import com.tessera.sandbox.SandboxSessionBridge;
import com.tessera.sandbox.ShellSignal;
import com.tessera.sandbox.TerminalSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * REST controller for sandbox targets and the interactive shell sessions opened in them.
 */
@RestController
@RequestMapping("/api/v1/sandbox")
public class SandboxController {

    private static final Logger log = LoggerFactory.getLogger(SandboxController.class);

    private final SandboxSessionBridge bridge;
    private final SseStreamingService sseStreamingService;

    public SandboxController(SandboxSessionBridge bridge, SseStreamingService sseStreamingService) {
        this.bridge = bridge;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/sandbox/targets: Provision a target with the workspace mounted.
     */
    @PostMapping("/targets")
    public ResponseEntity<Map<String, String>> provisionTarget(@RequestBody OpenSessionRequest request) {
        String workspace = request.workspace() != null && !request.workspace().isBlank() ? request.workspace() : ".";
        String targetId = bridge.provisionTarget(Path.of(workspace).toAbsolutePath().normalize());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "target_id", targetId,
                "provider", bridge.providerName()));
    }

    @DeleteMapping("/targets/{tid}")
    public ResponseEntity<Void> destroyTarget(@PathVariable String tid) {
        bridge.destroyTarget(tid);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/v1/sandbox/sessions: Open a shell in a target.
     */
    @PostMapping("/sessions")
    public ResponseEntity<SandboxSessionResponse> createSession(@RequestBody SandboxSessionRequest request) {
        if (request.targetId() == null || request.targetId().isBlank()) {
            throw new IllegalArgumentException("target_id is required");
        }
        TerminalSize size = request.cols() > 0 && request.rows() > 0
                ? new TerminalSize(request.cols(), request.rows())
                : TerminalSize.DEFAULT;
        String sessionId = bridge.createSession(request.targetId(), size);
        return ResponseEntity.status(HttpStatus.CREATED).body(find(sessionId));
    }

    @GetMapping("/sessions")
    public List<SandboxSessionResponse> listSessions() {
        return bridge.sessions().stream().map(SandboxSessionResponse::from).toList();
    }

    @PostMapping("/sessions/{id}/input")
    public ResponseEntity<Void> input(@PathVariable String id, @RequestBody InputRequest request) {
        byte[] data;
        if (request.base64() != null) {
            data = Base64.getDecoder().decode(request.base64());
        } else if (request.text() != null) {
            data = request.text().getBytes(StandardCharsets.UTF_8);
        } else {
            throw new IllegalArgumentException("text or base64 is required");
        }
        bridge.sendInput(id, data);
        return ResponseEntity.accepted().build();
    }

    /**
     * POST /api/v1/sandbox/sessions/{id}/signal: INT, TERM, KILL or HUP. Defaults to INT.
     */
    @PostMapping("/sessions/{id}/signal")
    public ResponseEntity<Map<String, String>> signal(@PathVariable String id,
                                                      @RequestBody(required = false) SignalRequest request) {
        ShellSignal sent = bridge.signal(id, request == null ? null : request.signal());
        return ResponseEntity.accepted().body(Map.of(
                "session_id", id,
                "signal", "SIG" + sent.name()));
    }

    @PostMapping("/sessions/{id}/resize")
    public SandboxSessionResponse resize(@PathVariable String id, @RequestBody ResizeRequest request) {
        bridge.resize(id, request.cols(), request.rows());
        return find(id);
    }

    /**
     * GET /api/v1/sandbox/sessions/{id}/output: SSE stream of the shell's output.
     */
    @GetMapping(value = "/sessions/{id}/output", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter output(@PathVariable String id) {
        return sseStreamingService.streamOutput(id, bridge.output(id));
    }

    @DeleteMapping("/sessions/{id}")
    public ResponseEntity<Void> closeSession(@PathVariable String id) {
        log.debug("Close requested for sandbox session {}", id);
        bridge.closeSession(id);
        return ResponseEntity.noContent().build();
    }

    private SandboxSessionResponse find(String sessionId) {
        return bridge.sessions().stream()
                .filter(s -> s.getSessionId().equals(sessionId))
                .findFirst()
                .map(SandboxSessionResponse::from)
                .orElseThrow(() -> new NoSuchElementException("No sandbox session " + sessionId));
    }

    /**
     * JSON view of a sandbox session.
     */
    public record SandboxSessionResponse(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("target_id") String targetId,
        int cols,
        int rows,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("last_activity_at") String lastActivityAt,
        @JsonProperty("shell_ended") boolean shellEnded
    ) {
        static SandboxSessionResponse from(SandboxSession session) {
            TerminalSize size = session.getDimensions();
            return new SandboxSessionResponse(session.getSessionId(), session.getTargetId(),
                    size.cols(), size.rows(), session.getCreatedAt().toString(),
                    session.getLastActivityAt().toString(), session.isShellEnded());
        }
    }
}
