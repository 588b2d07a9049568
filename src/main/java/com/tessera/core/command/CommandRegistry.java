package com.tessera.core.command;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered table of the slash commands the engine understands.
 * <p>
 * Declaration order matters: it breaks ties when ranking suggestions and is the
 * order of the help listing.
 */
@Component
public class CommandRegistry {

    public static final String ASK = "ask";
    public static final String HELP = "help";

    private final List<CommandDefinition> definitions;

    public CommandRegistry() {
        this(defaultDefinitions());
    }

    public CommandRegistry(List<CommandDefinition> definitions) {
        this.definitions = List.copyOf(definitions);
    }

    public List<CommandDefinition> definitions() {
        return definitions;
    }

    public Optional<CommandDefinition> find(String verb) {
        if (verb == null || verb.isEmpty()) {
            return Optional.empty();
        }
        return definitions.stream().filter(d -> d.answersTo(verb)).findFirst();
    }

    /** Maps an alias to its canonical verb; unknown verbs are returned unchanged. */
    public String canonical(String verb) {
        return find(verb).map(CommandDefinition::name).orElse(verb);
    }

    public int indexOf(String name) {
        for (int i = 0; i < definitions.size(); i++) {
            if (definitions.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public String helpText() {
        var sb = new StringBuilder("Available commands:\n");
        for (CommandDefinition d : definitions) {
            sb.append(String.format("  /%-10s %s%n", d.name(), d.description()));
            if (!d.aliases().isEmpty()) {
                sb.append(String.format("  %-11s aliases: /%s%n", "", String.join(", /", d.aliases())));
            }
            sb.append(String.format("  %-11s usage: %s%n", "", d.usage()));
        }
        sb.append("\nMention files with @path or @\"path with spaces\". Text without a leading slash is sent to /ask.");
        return sb.toString();
    }

    static List<CommandDefinition> defaultDefinitions() {
        return List.of(
                new CommandDefinition("implement", List.of("impl"),
                        "Implement a feature or change",
                        "/implement add refresh token support @src/auth/jwt.ts",
                        true, flags("dry-run", false, "model", true)),
                new CommandDefinition("debug", List.of(),
                        "Diagnose and fix a problem",
                        "/debug NullPointerException on login @src/auth/Login.java",
                        true, flags("trace", true)),
                new CommandDefinition("review", List.of(),
                        "Review code and propose improvements",
                        "/review @src/api/routes.ts",
                        true, flags("strict", false)),
                new CommandDefinition("spec", List.of(),
                        "Draft a specification for a feature",
                        "/spec user profile page",
                        true, flags()),
                new CommandDefinition("plan", List.of(),
                        "Produce an implementation plan",
                        "/plan migrate storage to postgres",
                        true, flags()),
                new CommandDefinition("tasks", List.of(),
                        "Break work down into tasks",
                        "/tasks --status=open",
                        false, flags("status", true)),
                new CommandDefinition(ASK, List.of(),
                        "Ask a question about the code",
                        "/ask how does session expiry work?",
                        true, flags()),
                new CommandDefinition(HELP, List.of("?"),
                        "Show available commands",
                        "/help",
                        false, flags())
        );
    }

    private static Map<String, Boolean> flags(Object... nameAndTakesValue) {
        var map = new LinkedHashMap<String, Boolean>();
        for (int i = 0; i < nameAndTakesValue.length; i += 2) {
            map.put((String) nameAndTakesValue[i], (Boolean) nameAndTakesValue[i + 1]);
        }
        return map;
    }
}
