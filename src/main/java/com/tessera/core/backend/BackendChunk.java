package com.tessera.core.backend;

/**
 * One unit of a streamed backend response.
 *
 * @param kind     chunk type
 * @param payload  text, block body or diff; empty for END
 * @param filePath target path for CODE_BLOCK and DIFF_BLOCK, else null
 */
public record BackendChunk(Kind kind, String payload, String filePath) {

    public enum Kind { TEXT, CODE_BLOCK, DIFF_BLOCK, END }

    private static final BackendChunk END = new BackendChunk(Kind.END, "", null);

    public static BackendChunk text(String text) {
        return new BackendChunk(Kind.TEXT, text, null);
    }

    public static BackendChunk codeBlock(String filePath, String content) {
        return new BackendChunk(Kind.CODE_BLOCK, content, filePath);
    }

    public static BackendChunk diffBlock(String filePath, String diff) {
        return new BackendChunk(Kind.DIFF_BLOCK, diff, filePath);
    }

    public static BackendChunk end() {
        return END;
    }
}
