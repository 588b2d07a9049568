package com.tessera.core.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Incremental parser that splits streamed markdown into prose and fenced blocks.
 * <p>
 * Text may arrive in arbitrary fragments; a fence is recognized once its whole line
 * is available. A block whose info string names a path becomes a {@link Block} as
 * soon as its closing fence arrives:
 * <pre>
 * ```ts src/auth/jwt.ts        full content
 * ```java path=src/Foo.java    full content
 * ```diff src/auth/jwt.ts      unified diff
 * </pre>
 * Blocks without a path are code samples and are passed through as prose.
 * Not thread-safe; one instance per execution.
 */
public class ChangeExtractor {

    private static final int MAX_DESCRIPTION = 200;

    public sealed interface Extracted permits Prose, Block {}

    public record Prose(String text) implements Extracted {}

    /**
     * @param complete false when the stream ended before the closing fence
     */
    public record Block(String path, String body, boolean diff, String description, boolean complete)
            implements Extracted {}

    public record Result(List<Extracted> items, boolean truncated) {}

    private final StringBuilder pendingLine = new StringBuilder();
    private final StringBuilder blockBody = new StringBuilder();
    private final StringBuilder rawBlock = new StringBuilder();
    private final StringBuilder currentProse = new StringBuilder();

    private boolean proseLine;
    private boolean inBlock;
    private int fenceLength;
    private String blockPath;
    private boolean blockDiff;
    private String blockDescription = "";
    private String lastProseLine = "";

    public List<Extracted> accept(String text) {
        var out = new ArrayList<Extracted>();
        var prose = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (proseLine) {
                prose.append(c);
                trackProse(c);
                if (c == '\n') {
                    proseLine = false;
                }
                continue;
            }
            if (c == '\n') {
                handleLine(pendingLine.toString(), out, prose);
                pendingLine.setLength(0);
                continue;
            }
            pendingLine.append(c);
            if (!inBlock && !couldStartFence(pendingLine)) {
                // cannot become a fence: stream it out now
                prose.append(pendingLine);
                for (int j = 0; j < pendingLine.length(); j++) {
                    trackProse(pendingLine.charAt(j));
                }
                pendingLine.setLength(0);
                proseLine = true;
            }
        }
        flushProse(prose, out);
        return out;
    }

    /** Flushes buffered input. Call once, after the last chunk. */
    public Result finish() {
        var out = new ArrayList<Extracted>();
        var prose = new StringBuilder();
        if (!pendingLine.isEmpty()) {
            String last = pendingLine.toString();
            pendingLine.setLength(0);
            if (inBlock && isClosingFence(last)) {
                handleLine(last, out, prose);
            } else if (inBlock) {
                blockBody.append(last);
                rawBlock.append(last);
            } else {
                prose.append(last);
            }
        }
        flushProse(prose, out);

        boolean truncated = false;
        if (inBlock) {
            truncated = true;
            if (blockPath != null) {
                out.add(new Block(blockPath, blockBody.toString(), blockDiff, blockDescription, false));
            } else {
                out.add(new Prose(rawBlock.toString()));
            }
            resetBlock();
        }
        proseLine = false;
        return new Result(out, truncated);
    }

    private void handleLine(String line, List<Extracted> out, StringBuilder prose) {
        if (inBlock) {
            if (isClosingFence(line)) {
                if (blockPath != null) {
                    flushProse(prose, out);
                    out.add(new Block(blockPath, blockBody.toString(), blockDiff, blockDescription, true));
                } else {
                    rawBlock.append(line).append('\n');
                    prose.append(rawBlock);
                }
                resetBlock();
            } else {
                blockBody.append(line).append('\n');
                rawBlock.append(line).append('\n');
            }
            return;
        }

        String stripped = line.strip();
        int ticks = leadingBackticks(stripped);
        if (ticks >= 3) {
            inBlock = true;
            fenceLength = ticks;
            parseInfo(stripped.substring(ticks).strip());
            blockDescription = lastProseLine;
            rawBlock.append(line).append('\n');
            return;
        }
        prose.append(line).append('\n');
        for (int i = 0; i < line.length(); i++) {
            trackProse(line.charAt(i));
        }
        trackProse('\n');
    }

    private void parseInfo(String info) {
        blockPath = null;
        blockDiff = false;
        if (info.isEmpty()) {
            return;
        }
        String[] tokens = info.split("\\s+");
        String language = tokens[0];
        String path = null;

        int colon = language.indexOf(':');
        if (colon > 0) {
            path = language.substring(colon + 1);
            language = language.substring(0, colon);
        }
        for (int i = 1; i < tokens.length && path == null; i++) {
            String token = tokens[i];
            if (token.startsWith("path=")) {
                path = token.substring(5);
            } else if (!token.contains("=")) {
                path = token;
            }
        }
        if (path == null && looksLikePath(language)) {
            path = language;
            language = "";
        }

        String lang = language.toLowerCase(Locale.ROOT);
        blockDiff = lang.equals("diff") || lang.equals("patch");
        if (path != null) {
            path = path.replace("\"", "").replace("'", "");
            blockPath = path.isBlank() ? null : path;
        }
    }

    private boolean isClosingFence(String line) {
        String stripped = line.strip();
        int ticks = leadingBackticks(stripped);
        return ticks >= fenceLength && ticks == stripped.length();
    }

    private boolean couldStartFence(CharSequence partial) {
        for (int i = 0; i < partial.length(); i++) {
            char c = partial.charAt(i);
            if (c == '`') {
                return true;
            }
            if (!Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    private void trackProse(char c) {
        if (c == '\n') {
            String line = currentProse.toString().strip();
            if (!line.isEmpty()) {
                lastProseLine = line.length() > MAX_DESCRIPTION ? line.substring(0, MAX_DESCRIPTION) : line;
            }
            currentProse.setLength(0);
        } else {
            currentProse.append(c);
        }
    }

    private static int leadingBackticks(String s) {
        int n = 0;
        while (n < s.length() && s.charAt(n) == '`') {
            n++;
        }
        return n;
    }

    private static boolean looksLikePath(String token) {
        return token.contains("/") || (token.contains(".") && !token.startsWith(".") && !token.endsWith("."));
    }

    private void flushProse(StringBuilder prose, List<Extracted> out) {
        if (!prose.isEmpty()) {
            out.add(new Prose(prose.toString()));
            prose.setLength(0);
        }
    }

    private void resetBlock() {
        inBlock = false;
        fenceLength = 0;
        blockPath = null;
        blockDiff = false;
        blockDescription = "";
        blockBody.setLength(0);
        rawBlock.setLength(0);
    }
}
