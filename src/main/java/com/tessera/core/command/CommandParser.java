package com.tessera.core.command;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw user input into a {@link ParsedCommand}, validates it against the
 * {@link CommandRegistry} and ranks completion candidates.
 * <p>
 * Parsing is total: every string, including blank and garbled input, yields a
 * command. Problems are reported by {@link #validate(ParsedCommand)}.
 */
@Service
public class CommandParser {

    private static final int SCORE_VERB_PREFIX = 0;
    private static final int SCORE_ALIAS_PREFIX = 1;
    private static final int SCORE_SUBSTRING = 2;
    private static final int SCORE_HISTORY = 3;

    private final CommandRegistry registry;

    public CommandParser(CommandRegistry registry) {
        this.registry = registry;
    }

    public CommandRegistry registry() {
        return registry;
    }

    public ParsedCommand parse(String rawInput) {
        String input = rawInput == null ? "" : rawInput;
        List<String> tokens = tokenize(input);
        if (tokens.isEmpty()) {
            return new ParsedCommand("", "", Map.of(), List.of(), input);
        }

        String verb;
        int start;
        if (tokens.get(0).startsWith("/")) {
            verb = registry.canonical(tokens.get(0).substring(1).toLowerCase(Locale.ROOT));
            start = 1;
        } else {
            verb = CommandRegistry.ASK;
            start = 0;
        }

        var flags = new LinkedHashMap<String, FlagValue>();
        var mentions = new LinkedHashSet<String>();
        var words = new ArrayList<String>();

        for (String token : tokens.subList(start, tokens.size())) {
            if (token.startsWith("--")) {
                parseFlag(token, flags);
            } else if (token.length() > 1 && token.startsWith("@")) {
                String path = unquote(token.substring(1));
                if (path.isBlank()) {
                    words.add(token);
                } else {
                    mentions.add(path);
                }
            } else {
                words.add(token);
            }
        }

        return new ParsedCommand(verb, String.join(" ", words), flags, new ArrayList<>(mentions), input);
    }

    public ValidationResult validate(ParsedCommand command) {
        for (FlagValue value : command.flags().values()) {
            if (value instanceof FlagValue.Malformed malformed) {
                return new ValidationResult.Invalid(ValidationFailure.MALFORMED_FLAG,
                        "Malformed flag '" + malformed.token() + "'");
            }
        }

        if (command.verb().isEmpty()) {
            return new ValidationResult.Invalid(ValidationFailure.UNKNOWN_VERB, "No command given");
        }
        var definition = registry.find(command.verb()).orElse(null);
        if (definition == null) {
            return new ValidationResult.Invalid(ValidationFailure.UNKNOWN_VERB,
                    "Unknown command '/" + command.verb() + "'");
        }

        if (definition.argumentRequired()
                && command.argument().isBlank()
                && command.mentionedFiles().isEmpty()) {
            return new ValidationResult.Invalid(ValidationFailure.MISSING_ARGUMENT,
                    "/" + definition.name() + " needs a description or a file mention");
        }

        for (var entry : command.flags().entrySet()) {
            Boolean takesValue = definition.flags().get(entry.getKey());
            if (takesValue == null) {
                continue;
            }
            if (takesValue && entry.getValue() instanceof FlagValue.Switch) {
                return new ValidationResult.Invalid(ValidationFailure.MALFORMED_FLAG,
                        "Flag '--" + entry.getKey() + "' needs a value (--" + entry.getKey() + "=...)");
            }
            if (!takesValue && entry.getValue() instanceof FlagValue.Text) {
                return new ValidationResult.Invalid(ValidationFailure.MALFORMED_FLAG,
                        "Flag '--" + entry.getKey() + "' does not take a value");
            }
        }
        return ValidationResult.VALID;
    }

    /**
     * Ranks completion candidates for {@code partial}: verb prefix, then alias prefix,
     * then verb substring, then history entries starting with the partial. Ties keep
     * registry order, then lexicographic order.
     */
    public List<Suggestion> suggestions(String partial, List<String> recentHistory) {
        String typed = partial == null ? "" : partial.strip();
        String needle = (typed.startsWith("/") ? typed.substring(1) : typed).toLowerCase(Locale.ROOT);

        var ranked = new ArrayList<Ranked>();
        List<CommandDefinition> definitions = registry.definitions();
        for (int i = 0; i < definitions.size(); i++) {
            CommandDefinition d = definitions.get(i);
            int score;
            if (d.name().startsWith(needle)) {
                score = SCORE_VERB_PREFIX;
            } else if (d.aliases().stream().anyMatch(a -> a.startsWith(needle))) {
                score = SCORE_ALIAS_PREFIX;
            } else if (d.name().contains(needle)) {
                score = SCORE_SUBSTRING;
            } else {
                continue;
            }
            ranked.add(new Ranked(score, i,
                    new Suggestion("/" + d.name(), d.description(), Suggestion.Source.COMMAND)));
        }

        if (!typed.isEmpty() && recentHistory != null) {
            String prefix = typed.toLowerCase(Locale.ROOT);
            for (String entry : new LinkedHashSet<>(recentHistory)) {
                if (entry.toLowerCase(Locale.ROOT).startsWith(prefix) && !entry.equals(typed)) {
                    ranked.add(new Ranked(SCORE_HISTORY, Integer.MAX_VALUE,
                            new Suggestion(entry, "", Suggestion.Source.HISTORY)));
                }
            }
        }

        return ranked.stream()
                .sorted(Comparator.comparingInt(Ranked::score)
                        .thenComparingInt(Ranked::order)
                        .thenComparing(r -> r.suggestion().text()))
                .map(Ranked::suggestion)
                .toList();
    }

    private static void parseFlag(String token, Map<String, FlagValue> flags) {
        String body = token.substring(2);
        int eq = body.indexOf('=');
        String name = eq < 0 ? body : body.substring(0, eq);
        if (name.isEmpty()) {
            flags.put(token, new FlagValue.Malformed(token));
        } else if (eq < 0) {
            flags.put(name, FlagValue.SWITCH);
        } else {
            flags.put(name, new FlagValue.Text(unquote(body.substring(eq + 1))));
        }
    }

    /** Splits on whitespace outside double quotes. Quotes stay in the token. */
    static List<String> tokenize(String input) {
        var tokens = new ArrayList<String>();
        var current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
                current.append(c);
            } else if (Character.isWhitespace(c) && !inQuotes) {
                if (!current.isEmpty()) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (!current.isEmpty()) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static String unquote(String text) {
        return text.replace("\"", "");
    }

    private record Ranked(int score, int order, Suggestion suggestion) {}
}
