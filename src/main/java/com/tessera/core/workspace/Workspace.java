package com.tessera.core.workspace;

import java.nio.file.Path;

/**
 * One workspace root with its file queries, ledger and applier. Command sessions
 * opened on the same root share a single instance, so the ledger and the apply
 * lock are workspace-wide.
 */
public class Workspace {

    private final WorkspaceFiles files;
    private final ChangeLedger ledger;
    private final ChangeApplier applier;

    public Workspace(Path root, WorkspaceProperties properties) {
        this.files = new WorkspaceFiles(root, properties);
        this.ledger = new ChangeLedger();
        this.applier = new ChangeApplier(files, ledger);
    }

    public Path root() {
        return files.root();
    }

    public WorkspaceFiles files() {
        return files;
    }

    public ChangeLedger ledger() {
        return ledger;
    }

    public ChangeApplier applier() {
        return applier;
    }
}
