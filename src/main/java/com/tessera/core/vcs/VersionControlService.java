package com.tessera.core.vcs;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Stages and commits workspace files. Used by the outer layers after changes are
 * applied; the engine itself never calls it.
 */
public interface VersionControlService {

    boolean isRepository(Path workspaceRoot);

    /** Stages the given workspace-relative paths, including deletions. */
    void stage(Path workspaceRoot, List<String> paths);

    /**
     * Commits what is staged.
     *
     * @return the new commit id
     */
    String commit(Path workspaceRoot, String message);

    /** Unified diff of the working tree, optionally limited to one path. */
    String diff(Path workspaceRoot, Optional<String> path);
}
