package com.tessera.core.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured form of one line of user input.
 *
 * @param verb           canonical lower-case verb, empty when the input had none
 * @param argument       free text with flags and mentions removed, whitespace-normalized
 * @param flags          flags in order of appearance
 * @param mentionedFiles {@code @path} mentions, unresolved, in order, without duplicates
 * @param rawInput       the exact text that was parsed
 */
public record ParsedCommand(
        String verb,
        String argument,
        Map<String, FlagValue> flags,
        List<String> mentionedFiles,
        String rawInput
) {
    public ParsedCommand {
        flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
        mentionedFiles = List.copyOf(mentionedFiles);
    }

    public boolean hasFlag(String name) {
        return flags.containsKey(name);
    }

    public Optional<String> flagText(String name) {
        return flags.get(name) instanceof FlagValue.Text text
                ? Optional.of(text.value())
                : Optional.empty();
    }
}
