package com.tessera.core.vcs;

/**
 * A version control command failed or could not be run.
 */
public class VcsException extends RuntimeException {

    private final int exitCode;

    public VcsException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public VcsException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /** Exit code of the failed command, -1 if it never ran. */
    public int getExitCode() {
        return exitCode;
    }
}
