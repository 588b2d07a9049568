package com.tessera.core.workspace;

import com.tessera.core.model.Change;
import com.tessera.core.model.ChangeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes decided changes to the workspace, all or nothing.
 * <p>
 * An apply is checked completely before the first byte is written: every change must
 * be ACCEPTED or MODIFIED, stay inside the workspace and still match the file content
 * it was proposed against. Writes go through a temp file and an atomic move; if one
 * fails, files already written in the batch are restored from their snapshots and
 * created files and directories are removed again.
 */
public class ChangeApplier {

    private static final Logger log = LoggerFactory.getLogger(ChangeApplier.class);

    private final WorkspaceFiles files;
    private final ChangeLedger ledger;
    private final Clock clock;

    public ChangeApplier(WorkspaceFiles files, ChangeLedger ledger) {
        this(files, ledger, Clock.systemUTC());
    }

    public ChangeApplier(WorkspaceFiles files, ChangeLedger ledger, Clock clock) {
        this.files = files;
        this.ledger = ledger;
        this.clock = clock;
    }

    public ChangeLedger ledger() {
        return ledger;
    }

    public synchronized ApplyResult applyChanges(List<Change> changes) {
        if (changes == null || changes.isEmpty()) {
            return ApplyResult.empty();
        }

        for (Change change : changes) {
            if (!change.getStatus().isApplicable()) {
                throw new ApplyException(ApplyException.Kind.INVALID_CHANGE_STATE, change.getId(),
                        "Change " + change.getId() + " is " + change.getStatus() + ", expected ACCEPTED or MODIFIED");
            }
        }

        var plan = new ArrayList<PlannedWrite>(changes.size());
        Set<Path> targets = new HashSet<>();
        for (Change change : changes) {
            Path target = resolveTarget(change);
            if (!targets.add(target)) {
                throw new ApplyException(ApplyException.Kind.INVALID_CHANGE_STATE, change.getId(),
                        "More than one change in the batch targets " + change.getFilePath());
            }
            byte[] current;
            try {
                current = readIfExists(target);
            } catch (IOException e) {
                throw new ApplyException(ApplyException.Kind.IO_FAILURE, change.getId(),
                        "Cannot read " + change.getFilePath() + ": " + e.getMessage(), e);
            }
            if (isStale(change, current)) {
                throw new ApplyException(ApplyException.Kind.STALE_CHANGE, change.getId(),
                        change.getFilePath() + " changed since change " + change.getId() + " was proposed");
            }
            plan.add(new PlannedWrite(change, target, current,
                    change.effectiveContent().getBytes(StandardCharsets.UTF_8)));
        }

        var written = new ArrayList<PlannedWrite>();
        var createdDirs = new ArrayList<Path>();
        for (PlannedWrite write : plan) {
            try {
                createdDirs.addAll(createMissingParents(write.target()));
                writeAtomically(write.target(), write.after());
                written.add(write);
            } catch (IOException e) {
                log.warn("Write of {} failed, rolling back {} file(s)", write.change().getFilePath(), written.size(), e);
                rollbackWrites(written, createdDirs);
                throw new ApplyException(ApplyException.Kind.IO_FAILURE, write.change().getId(),
                        "Failed to write " + write.change().getFilePath() + ": " + e.getMessage(), e);
            }
        }

        Instant now = clock.instant();
        var paths = new ArrayList<String>();
        var ledgerIds = new ArrayList<String>();
        for (PlannedWrite write : plan) {
            Change change = write.change();
            String ledgerId = ChangeLedger.ledgerId(change.getExecutionId(), change.getId());
            String path = files.relativize(write.target());
            change.markApplied();
            ledger.record(new LedgerEntry(ledgerId, ledger.nextSequence(), change, path,
                    write.before(), write.after(), now));
            paths.add(path);
            ledgerIds.add(ledgerId);
        }
        log.info("Applied {} change(s): {}", plan.size(), paths);
        return new ApplyResult(paths, ledgerIds, new ApplyResult.RevertHandle(ledgerIds));
    }

    public RevertResult revert(ApplyResult.RevertHandle handle) {
        return revertChanges(handle.ledgerIds());
    }

    /**
     * Restores the pre-apply bytes of the given ledger entries, newest first. The whole
     * batch is checked before anything is written.
     */
    public synchronized RevertResult revertChanges(List<String> ledgerIds) {
        if (ledgerIds == null || ledgerIds.isEmpty()) {
            return new RevertResult(List.of(), List.of());
        }

        var entries = new ArrayList<LedgerEntry>();
        for (String id : new LinkedHashSet<>(ledgerIds)) {
            LedgerEntry entry = ledger.find(id).orElseThrow(() -> new ApplyException(
                    ApplyException.Kind.NOT_APPLIED, id, "No applied change " + id));
            if (entry.isReverted()) {
                throw new ApplyException(ApplyException.Kind.ALREADY_REVERTED, id, "Change " + id + " was already reverted");
            }
            if (entry.getChange().getStatus() != ChangeStatus.APPLIED) {
                throw new ApplyException(ApplyException.Kind.NOT_APPLIED, id,
                        "Change " + id + " is " + entry.getChange().getStatus());
            }
            entries.add(entry);
        }
        entries.sort(Comparator.comparingLong(LedgerEntry::getSequence).reversed());

        var undone = new ArrayList<Snapshot>();
        for (LedgerEntry entry : entries) {
            Path target = files.resolve(entry.getPath());
            try {
                byte[] current = readIfExists(target);
                if (entry.isCreatedFile()) {
                    Files.deleteIfExists(target);
                } else {
                    createMissingParents(target);
                    writeAtomically(target, entry.before());
                }
                undone.add(new Snapshot(target, current));
            } catch (IOException e) {
                log.warn("Revert of {} failed, restoring {} file(s)", entry.getPath(), undone.size(), e);
                for (int i = undone.size() - 1; i >= 0; i--) {
                    restore(undone.get(i).path(), undone.get(i).content());
                }
                throw new ApplyException(ApplyException.Kind.IO_FAILURE, entry.getLedgerId(),
                        "Failed to revert " + entry.getPath() + ": " + e.getMessage(), e);
            }
        }

        Instant now = clock.instant();
        var restored = new ArrayList<String>();
        var deleted = new ArrayList<String>();
        for (LedgerEntry entry : entries) {
            entry.markReverted(now);
            entry.getChange().markReverted();
            (entry.isCreatedFile() ? deleted : restored).add(entry.getPath());
        }
        log.info("Reverted {} change(s)", entries.size());
        return new RevertResult(restored, deleted);
    }

    private Path resolveTarget(Change change) {
        Path target;
        try {
            target = files.resolve(change.getFilePath());
        } catch (WorkspacePathException e) {
            throw new ApplyException(ApplyException.Kind.INVALID_CHANGE_STATE, change.getId(), e.getMessage());
        }
        if (files.isWriteDenied(files.relativize(target))) {
            throw new ApplyException(ApplyException.Kind.INVALID_CHANGE_STATE, change.getId(),
                    change.getFilePath() + " is write-protected");
        }
        if (Files.isDirectory(target)) {
            throw new ApplyException(ApplyException.Kind.INVALID_CHANGE_STATE, change.getId(),
                    change.getFilePath() + " is a directory");
        }
        return target;
    }

    private static boolean isStale(Change change, byte[] current) {
        if (!change.isOriginalExisted()) {
            return current != null;
        }
        if (current == null) {
            return true;
        }
        return !change.matchesOriginal(current);
    }

    private void rollbackWrites(List<PlannedWrite> written, List<Path> createdDirs) {
        for (int i = written.size() - 1; i >= 0; i--) {
            restore(written.get(i).target(), written.get(i).before());
        }
        for (int i = createdDirs.size() - 1; i >= 0; i--) {
            try {
                Files.deleteIfExists(createdDirs.get(i));
            } catch (DirectoryNotEmptyException e) {
                log.debug("Leaving non-empty directory {}", createdDirs.get(i));
            } catch (IOException e) {
                log.error("Could not remove directory {} during rollback", createdDirs.get(i), e);
            }
        }
    }

    private void restore(Path target, byte[] content) {
        try {
            if (content == null) {
                Files.deleteIfExists(target);
            } else {
                writeAtomically(target, content);
            }
        } catch (IOException e) {
            log.error("Rollback of {} failed; file may need manual repair", target, e);
        }
    }

    /** Creates the missing parent directories of {@code target}, returned outermost first. */
    private static List<Path> createMissingParents(Path target) throws IOException {
        var missing = new ArrayList<Path>();
        Path dir = target.getParent();
        while (dir != null && !Files.exists(dir)) {
            missing.add(0, dir);
            dir = dir.getParent();
        }
        for (Path d : missing) {
            Files.createDirectory(d);
        }
        return missing;
    }

    static void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), ".tessera-", ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static byte[] readIfExists(Path target) throws IOException {
        return Files.isRegularFile(target) ? Files.readAllBytes(target) : null;
    }

    private record PlannedWrite(Change change, Path target, byte[] before, byte[] after) {}

    private record Snapshot(Path path, byte[] content) {}
}
