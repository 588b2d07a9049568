package com.tessera.core.vcs;

import com.tessera.core.workspace.ApplyResult;
import com.tessera.core.workspace.RevertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Optional step after an apply or revert: stages the touched files and commits them.
 * Does nothing unless {@code tessera.vcs.enabled} is set and the workspace is a git
 * repository. Failures are logged and reported as an empty result; the applied
 * changes stay on disk either way.
 */
@Service
public class VersionControlSync {

    private static final Logger log = LoggerFactory.getLogger(VersionControlSync.class);

    private final VersionControlService vcs;
    private final VcsProperties properties;

    public VersionControlSync(VersionControlService vcs, VcsProperties properties) {
        this.vcs = vcs;
        this.properties = properties;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    /**
     * @param message commit message, or null to derive one from {@code input}
     * @return the commit id, if a commit was made
     */
    public Optional<String> afterApply(Path workspaceRoot, ApplyResult result, String input, String message) {
        if (result.isEmpty()) {
            return Optional.empty();
        }
        return sync(workspaceRoot, result.writtenPaths(), message != null && !message.isBlank()
                ? message
                : String.format(properties.getMessageTemplate(), input));
    }

    public Optional<String> afterRevert(Path workspaceRoot, RevertResult result) {
        var paths = new ArrayList<String>(result.restoredPaths());
        paths.addAll(result.deletedPaths());
        if (paths.isEmpty()) {
            return Optional.empty();
        }
        return sync(workspaceRoot, paths, "tessera: revert " + String.join(", ", paths));
    }

    private Optional<String> sync(Path workspaceRoot, List<String> paths, String message) {
        if (!properties.isEnabled()) {
            return Optional.empty();
        }
        if (!vcs.isRepository(workspaceRoot)) {
            log.info("Skipping git commit: {} is not a git repository", workspaceRoot);
            return Optional.empty();
        }
        try {
            vcs.stage(workspaceRoot, paths);
            return Optional.of(vcs.commit(workspaceRoot, message));
        } catch (VcsException e) {
            log.warn("Git commit of {} file(s) failed: {}", paths.size(), e.getMessage());
            return Optional.empty();
        }
    }
}
