package com.tessera.sandbox;

/**
 * Terminal dimensions in character cells.
 */
public record TerminalSize(int cols, int rows) {

    public static final TerminalSize DEFAULT = new TerminalSize(80, 24);

    public TerminalSize {
        if (cols < 1 || rows < 1) {
            throw new IllegalArgumentException("Terminal size must be positive: " + cols + "x" + rows);
        }
    }

    @Override
    public String toString() {
        return cols + "x" + rows;
    }
}
