package com.tessera.core.command;

/**
 * A completion candidate for partially typed input.
 *
 * @param text        full replacement text, e.g. {@code /implement}
 * @param description help line for commands, empty for history entries
 * @param source      where the candidate came from
 */
public record Suggestion(String text, String description, Source source) {

    public enum Source { COMMAND, HISTORY }
}
