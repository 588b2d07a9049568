package com.tessera.core.workspace;

import java.util.List;

/**
 * Outcome of a successful apply.
 *
 * @param writtenPaths workspace-relative paths written, in apply order
 * @param ledgerIds    ledger ids recorded for the applied changes
 * @param revertHandle handle that undoes this apply
 */
public record ApplyResult(List<String> writtenPaths, List<String> ledgerIds, RevertHandle revertHandle) {

    public ApplyResult {
        writtenPaths = List.copyOf(writtenPaths);
        ledgerIds = List.copyOf(ledgerIds);
    }

    public static ApplyResult empty() {
        return new ApplyResult(List.of(), List.of(), new RevertHandle(List.of()));
    }

    public boolean isEmpty() {
        return writtenPaths.isEmpty();
    }

    public record RevertHandle(List<String> ledgerIds) {
        public RevertHandle {
            ledgerIds = List.copyOf(ledgerIds);
        }
    }
}
