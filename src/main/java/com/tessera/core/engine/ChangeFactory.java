package com.tessera.core.engine;

import com.github.difflib.patch.PatchFailedException;
import com.tessera.core.model.Change;
import com.tessera.core.model.ChangeKind;
import com.tessera.core.workspace.DiffRenderer;
import com.tessera.core.workspace.WorkspaceFiles;
import com.tessera.core.workspace.WorkspacePathException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Turns an extracted block into a {@link Change} against the current workspace content.
 * Proposals that cannot become a change are reported through the warning sink.
 */
class ChangeFactory {

    private final WorkspaceFiles files;
    private final Consumer<String> warnings;

    ChangeFactory(WorkspaceFiles files, Consumer<String> warnings) {
        this.files = files;
        this.warnings = warnings;
    }

    Optional<Change> create(String executionId, String changeId, ChangeExtractor.Block block) {
        String path;
        try {
            path = files.normalize(block.path());
        } catch (WorkspacePathException e) {
            warnings.accept("Ignored proposal for " + block.path() + ": " + e.getMessage());
            return Optional.empty();
        }
        if (files.isWriteDenied(path)) {
            warnings.accept("Ignored proposal for " + path + ": path is write-protected");
            return Optional.empty();
        }

        Path target = files.resolve(path);
        if (Files.isDirectory(target)) {
            warnings.accept("Ignored proposal for " + path + ": it is a directory");
            return Optional.empty();
        }
        boolean existed = Files.isRegularFile(target);
        byte[] originalBytes;
        try {
            originalBytes = existed ? Files.readAllBytes(target) : new byte[0];
        } catch (IOException e) {
            warnings.accept("Ignored proposal for " + path + ": cannot read current content (" + e.getMessage() + ")");
            return Optional.empty();
        }
        String original = new String(originalBytes, StandardCharsets.UTF_8);
        if (!Arrays.equals(original.getBytes(StandardCharsets.UTF_8), originalBytes)) {
            warnings.accept(path + " is not valid UTF-8; applying the change rewrites it as UTF-8");
        }

        String modified;
        if (block.diff()) {
            try {
                modified = DiffRenderer.applyPatch(path, original, block.body());
            } catch (PatchFailedException | RuntimeException e) {
                warnings.accept("Diff for " + path + " does not apply: " + e.getMessage());
                return Optional.empty();
            }
        } else {
            modified = block.body();
        }
        if (existed && modified.equals(original)) {
            warnings.accept("Proposal for " + path + " leaves the file unchanged");
            return Optional.empty();
        }

        int[] lines = DiffRenderer.changedLines(original, modified);
        String description = block.description().isBlank()
                ? (existed ? "Update " : "Create ") + path
                : block.description();
        return Optional.of(new Change(changeId, executionId, path, original, originalBytes, existed, modified,
                lines[0], lines[1], description, block.diff() ? ChangeKind.DIFF : ChangeKind.FULL_CONTENT));
    }
}
