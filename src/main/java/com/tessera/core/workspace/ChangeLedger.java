package com.tessera.core.workspace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Workspace-scoped record of applied changes, keyed by {@code executionId/changeId}.
 * Entries outlive the execution that produced them.
 */
public class ChangeLedger {

    private final Map<String, LedgerEntry> entries = new LinkedHashMap<>();
    private long lastSequence;

    public static String ledgerId(String executionId, String changeId) {
        return executionId + "/" + changeId;
    }

    synchronized long nextSequence() {
        return ++lastSequence;
    }

    synchronized void record(LedgerEntry entry) {
        entries.put(entry.getLedgerId(), entry);
    }

    public synchronized Optional<LedgerEntry> find(String ledgerId) {
        return Optional.ofNullable(entries.get(ledgerId));
    }

    public synchronized List<LedgerEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    public synchronized List<LedgerEntry> entriesFor(String executionId) {
        return entries.values().stream()
                .filter(e -> e.getChange().getExecutionId().equals(executionId))
                .toList();
    }
}
