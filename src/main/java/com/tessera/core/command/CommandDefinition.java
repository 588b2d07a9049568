package com.tessera.core.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static declaration of one slash command.
 *
 * @param name             canonical verb
 * @param aliases          alternative verbs resolving to {@code name}
 * @param description      one-line help text
 * @param usage            example invocation
 * @param argumentRequired whether free text or a file mention must follow the verb
 * @param flags            declared flags mapped to whether they take a value
 */
public record CommandDefinition(
        String name,
        List<String> aliases,
        String description,
        String usage,
        boolean argumentRequired,
        Map<String, Boolean> flags
) {
    public CommandDefinition {
        aliases = List.copyOf(aliases);
        flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public boolean answersTo(String verb) {
        return name.equals(verb) || aliases.contains(verb);
    }
}
