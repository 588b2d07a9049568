package com.tessera.core.workspace;

import com.tessera.core.model.Change;

import java.time.Instant;

/**
 * Record of one applied change with the exact bytes needed to undo it.
 */
public class LedgerEntry {

    private final String ledgerId;
    private final Change change;
    private final String path;
    private final byte[] before;
    private final byte[] after;
    private final Instant appliedAt;
    private final long sequence;
    private volatile Instant revertedAt;

    LedgerEntry(String ledgerId, long sequence, Change change, String path, byte[] before, byte[] after,
                Instant appliedAt) {
        this.sequence = sequence;
        this.ledgerId = ledgerId;
        this.change = change;
        this.path = path;
        this.before = before;
        this.after = after;
        this.appliedAt = appliedAt;
    }

    public String getLedgerId() { return ledgerId; }
    public Change getChange() { return change; }
    public String getPath() { return path; }
    public Instant getAppliedAt() { return appliedAt; }

    /** Position in the ledger's apply order; later applies have larger values. */
    public long getSequence() { return sequence; }
    public Instant getRevertedAt() { return revertedAt; }

    /** Pre-apply content, or null when the apply created the file. */
    byte[] before() { return before; }

    byte[] after() { return after; }

    public boolean isCreatedFile() {
        return before == null;
    }

    public boolean isReverted() {
        return revertedAt != null;
    }

    void markReverted(Instant when) {
        this.revertedAt = when;
    }
}
