package com.tessera.core.health;

import com.tessera.core.backend.ReasoningBackend;
import com.tessera.core.knowledge.KnowledgeProperties;
import com.tessera.core.knowledge.KnowledgeService;
import com.tessera.core.vcs.VcsProperties;
import com.tessera.core.vcs.VersionControlService;
import com.tessera.sandbox.DockerSandboxProvider;
import com.tessera.sandbox.SandboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Component health for the {@code health} command and the REST health endpoint.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ReasoningBackend backend;
    private final KnowledgeService knowledgeService;
    private final KnowledgeProperties knowledgeProperties;
    private final SandboxProvider sandboxProvider;
    private final VersionControlService vcs;
    private final VcsProperties vcsProperties;

    public HealthCheckService(
            @Autowired(required = false) ReasoningBackend backend,
            @Autowired(required = false) KnowledgeService knowledgeService,
            KnowledgeProperties knowledgeProperties,
            @Autowired(required = false) SandboxProvider sandboxProvider,
            @Autowired(required = false) VersionControlService vcs,
            VcsProperties vcsProperties) {
        this.backend = backend;
        this.knowledgeService = knowledgeService;
        this.knowledgeProperties = knowledgeProperties;
        this.sandboxProvider = sandboxProvider;
        this.vcs = vcs;
        this.vcsProperties = vcsProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkBackend());
        results.add(checkKnowledge());
        results.add(checkSandbox());
        results.add(checkGit());
        return results;
    }

    private HealthStatus checkBackend() {
        if (backend == null) {
            return HealthStatus.down(HealthStatus.BACKEND, "No reasoning backend configured", Map.of());
        }
        return HealthStatus.up(HealthStatus.BACKEND, backend.describe(), Map.of());
    }

    private HealthStatus checkKnowledge() {
        if (!knowledgeProperties.isEnabled()) {
            return HealthStatus.up("knowledge", "Disabled; context is built from workspace files only", Map.of());
        }
        String url = String.valueOf(knowledgeProperties.getMcp().getUrl());
        if (knowledgeService == null || !knowledgeService.isAvailable()) {
            return HealthStatus.degraded("knowledge", "Knowledge server not reachable", Map.of("url", url));
        }
        return HealthStatus.up("knowledge", "Knowledge server connected", Map.of("url", url));
    }

    private HealthStatus checkSandbox() {
        if (sandboxProvider == null) {
            return HealthStatus.down("sandbox", "No SandboxProvider configured", Map.of());
        }
        if (sandboxProvider instanceof DockerSandboxProvider docker) {
            try {
                docker.ping();
                return HealthStatus.up("sandbox", "Docker daemon reachable", Map.of("provider", "docker"));
            } catch (Exception e) {
                log.warn("Docker health check failed: {}", e.getMessage());
                return HealthStatus.down("sandbox", "Docker error: " + e.getMessage(), Map.of("provider", "docker"));
            }
        }
        return HealthStatus.up("sandbox", "SandboxProvider available (" + sandboxProvider.name() + ")",
                Map.of("provider", sandboxProvider.name()));
    }

    private HealthStatus checkGit() {
        if (!vcsProperties.isEnabled()) {
            return HealthStatus.up("git", "Git sync disabled", Map.of());
        }
        if (vcs == null) {
            return HealthStatus.down("git", "No VersionControlService", Map.of());
        }
        Path cwd = Path.of("").toAbsolutePath();
        if (vcs.isRepository(cwd)) {
            return HealthStatus.up("git", "git available", Map.of("dir", cwd.toString()));
        }
        return HealthStatus.degraded("git", "Working directory is not a git repository (or git is missing)",
                Map.of("dir", cwd.toString()));
    }
}
