package com.tessera.core.workspace;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import com.github.difflib.patch.PatchFailedException;
import com.tessera.core.model.ChangeView;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Unified diff rendering and patching on top of java-diff-utils.
 */
public final class DiffRenderer {

    private static final int CONTEXT_LINES = 3;

    private DiffRenderer() {}

    public static String render(ChangeView change) {
        String target = change.userContent() != null ? change.userContent() : change.modified();
        return render(change.filePath(), change.original(), target);
    }

    public static String render(String path, String original, String modified) {
        List<String> source = lines(original);
        Patch<String> patch = DiffUtils.diff(source, lines(modified));
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> diff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + path, "b/" + path, source, patch, CONTEXT_LINES);
        return String.join("\n", diff) + "\n";
    }

    /**
     * Applies a unified diff to {@code original}. File headers are optional.
     *
     * @throws PatchFailedException if a hunk does not match the original
     */
    public static String applyPatch(String path, String original, String unifiedDiff) throws PatchFailedException {
        var diffLines = new ArrayList<>(Arrays.asList(unifiedDiff.split("\r?\n", -1)));
        while (!diffLines.isEmpty() && diffLines.get(diffLines.size() - 1).isEmpty()) {
            diffLines.remove(diffLines.size() - 1);
        }
        if (diffLines.stream().noneMatch(l -> l.startsWith("+++"))) {
            diffLines.add(0, "+++ b/" + path);
            diffLines.add(0, "--- a/" + path);
        }
        Patch<String> patch = UnifiedDiffUtils.parseUnifiedDiff(diffLines);
        if (patch.getDeltas().isEmpty()) {
            throw new PatchFailedException("Diff for " + path + " contains no hunks");
        }
        List<String> patched = DiffUtils.patch(lines(original), patch);
        String joined = String.join("\n", patched);
        boolean trailingNewline = original.isEmpty() ? !patched.isEmpty() : original.endsWith("\n");
        return trailingNewline && !joined.isEmpty() ? joined + "\n" : joined;
    }

    /**
     * First and last changed line of {@code original}, 1-based. Both are 0 when
     * nothing changed.
     */
    public static int[] changedLines(String original, String modified) {
        Patch<String> patch = DiffUtils.diff(lines(original), lines(modified));
        List<AbstractDelta<String>> deltas = patch.getDeltas();
        if (deltas.isEmpty()) {
            return new int[] {0, 0};
        }
        var first = deltas.get(0).getSource();
        var last = deltas.get(deltas.size() - 1).getSource();
        int start = first.getPosition() + 1;
        int end = Math.max(start, last.getPosition() + last.size());
        return new int[] {start, end};
    }

    static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return new ArrayList<>(Arrays.asList(body.split("\r?\n", -1)));
    }
}
