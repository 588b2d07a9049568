package com.tessera.sandbox;

import java.nio.file.Path;

/**
 * Abstraction over the runtimes shell sessions execute in.
 * Implementations: DockerSandboxProvider (containers), LocalSandboxProvider (host shell).
 */
public interface SandboxProvider {

    /** Short name used in configuration and health output, e.g. "docker". */
    String name();

    /** True if a shell can currently be opened in the target. */
    boolean isAvailable(String targetId);

    /**
     * Starts an interactive shell in the target. Output is pushed to {@code sink}
     * from a provider-owned thread.
     *
     * @throws SessionException with kind TARGET_UNAVAILABLE if the target cannot be reached
     */
    ShellChannel openShell(String targetId, TerminalSize size, OutputSink sink);

    /**
     * Provisions a new target with the workspace available inside it.
     *
     * @return the opaque target id
     */
    String createTarget(Path workspace);

    /** Stops and removes a target. Unknown ids are ignored. */
    void destroyTarget(String targetId);
}
