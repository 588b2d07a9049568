package com.tessera.core.workspace;

/**
 * A path that does not stay inside the workspace root.
 */
public class WorkspacePathException extends IllegalArgumentException {

    private final String path;

    public WorkspacePathException(String path, String message) {
        super(message);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
