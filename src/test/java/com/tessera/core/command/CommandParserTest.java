package com.tessera.core.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CommandParser}.
 */
class CommandParserTest {

    private CommandParser parser;

    @BeforeEach
    void setUp() {
        parser = new CommandParser(new CommandRegistry());
    }

    // -- parse -----------------------------------------------------------------

    @Nested
    @DisplayName("parse")
    class ParseTests {

        @Test
        @DisplayName("splits verb, argument, flags and mentions")
        void splitsAllParts() {
            ParsedCommand command = parser.parse("/implement add retry logic @src/net/Client.java --dry-run");

            assertEquals("implement", command.verb());
            assertEquals("add retry logic", command.argument());
            assertEquals(List.of("src/net/Client.java"), command.mentionedFiles());
            assertInstanceOf(FlagValue.Switch.class, command.flags().get("dry-run"));
            assertEquals("/implement add retry logic @src/net/Client.java --dry-run", command.rawInput());
        }

        @Test
        @DisplayName("text without a slash is an ask")
        void plainTextIsAsk() {
            ParsedCommand command = parser.parse("how does session expiry work?");

            assertEquals(CommandRegistry.ASK, command.verb());
            assertEquals("how does session expiry work?", command.argument());
        }

        @Test
        @DisplayName("aliases resolve to the canonical verb")
        void resolvesAliases() {
            assertEquals("implement", parser.parse("/impl something").verb());
            assertEquals("help", parser.parse("/?").verb());
        }

        @Test
        @DisplayName("verbs are case-insensitive")
        void verbCaseInsensitive() {
            assertEquals("review", parser.parse("/REVIEW @a.ts").verb());
        }

        @Test
        @DisplayName("flag with value keeps the text after '='")
        void flagWithValue() {
            ParsedCommand command = parser.parse("/implement x --model=\"gpt 4o\"");

            assertEquals("gpt 4o", command.flagText("model").orElseThrow());
        }

        @Test
        @DisplayName("quoted mentions may contain spaces")
        void quotedMention() {
            ParsedCommand command = parser.parse("/review @\"docs/design notes.md\" please");

            assertEquals(List.of("docs/design notes.md"), command.mentionedFiles());
            assertEquals("please", command.argument());
        }

        @Test
        @DisplayName("repeated mentions are kept once in order")
        void deduplicatesMentions() {
            ParsedCommand command = parser.parse("/review @b.ts @a.ts @b.ts");

            assertEquals(List.of("b.ts", "a.ts"), command.mentionedFiles());
        }

        @Test
        @DisplayName("a lone '@' stays in the argument")
        void loneAtIsText() {
            ParsedCommand command = parser.parse("/ask what does @ mean");

            assertEquals("what does @ mean", command.argument());
            assertTrue(command.mentionedFiles().isEmpty());
        }

        @Test
        @DisplayName("blank input yields an empty command")
        void blankInput() {
            ParsedCommand command = parser.parse("   ");

            assertEquals("", command.verb());
            assertEquals("", command.argument());
            assertTrue(command.flags().isEmpty());
        }

        @Test
        @DisplayName("null input is treated as empty")
        void nullInput() {
            assertEquals("", parser.parse(null).verb());
        }
    }

    // -- validate --------------------------------------------------------------

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("accepts a well-formed command")
        void acceptsValid() {
            assertTrue(parser.validate(parser.parse("/debug NPE on login")).isValid());
        }

        @Test
        @DisplayName("accepts a mention instead of an argument")
        void mentionSatisfiesArgument() {
            assertTrue(parser.validate(parser.parse("/review @src/api/routes.ts")).isValid());
        }

        @Test
        @DisplayName("rejects empty input as UNKNOWN_VERB")
        void rejectsEmpty() {
            assertFailure(ValidationFailure.UNKNOWN_VERB, "");
        }

        @Test
        @DisplayName("rejects an unknown verb")
        void rejectsUnknownVerb() {
            var result = assertFailure(ValidationFailure.UNKNOWN_VERB, "/deploy now");
            assertTrue(result.message().contains("/deploy"));
        }

        @Test
        @DisplayName("rejects a command that needs an argument")
        void rejectsMissingArgument() {
            assertFailure(ValidationFailure.MISSING_ARGUMENT, "/implement");
        }

        @Test
        @DisplayName("commands without required argument validate bare")
        void bareTasksIsValid() {
            assertTrue(parser.validate(parser.parse("/tasks")).isValid());
            assertTrue(parser.validate(parser.parse("/help")).isValid());
        }

        @Test
        @DisplayName("rejects a nameless flag")
        void rejectsNamelessFlag() {
            assertFailure(ValidationFailure.MALFORMED_FLAG, "/implement x --");
        }

        @Test
        @DisplayName("rejects a value flag used as a switch")
        void rejectsValueFlagWithoutValue() {
            assertFailure(ValidationFailure.MALFORMED_FLAG, "/implement x --model");
        }

        @Test
        @DisplayName("rejects a switch given a value")
        void rejectsSwitchWithValue() {
            assertFailure(ValidationFailure.MALFORMED_FLAG, "/implement x --dry-run=yes");
        }

        @Test
        @DisplayName("undeclared flags are accepted")
        void acceptsUndeclaredFlag() {
            assertTrue(parser.validate(parser.parse("/implement x --verbose")).isValid());
        }

        private ValidationResult.Invalid assertFailure(ValidationFailure expected, String input) {
            ValidationResult result = parser.validate(parser.parse(input));
            var invalid = assertInstanceOf(ValidationResult.Invalid.class, result);
            assertEquals(expected, invalid.reason());
            return invalid;
        }
    }

    // -- suggestions -----------------------------------------------------------

    @Nested
    @DisplayName("suggestions")
    class SuggestionTests {

        @Test
        @DisplayName("empty input lists every command in registry order")
        void emptyListsAll() {
            List<Suggestion> suggestions = parser.suggestions("", List.of("/review @a.ts"));

            assertEquals(new CommandRegistry().definitions().size(), suggestions.size());
            assertEquals("/implement", suggestions.get(0).text());
            assertTrue(suggestions.stream().allMatch(s -> s.source() == Suggestion.Source.COMMAND));
        }

        @Test
        @DisplayName("verb prefix ranks before substring matches")
        void prefixBeforeSubstring() {
            List<String> texts = parser.suggestions("/i", List.of()).stream().map(Suggestion::text).toList();

            assertEquals(List.of("/implement", "/review"), texts);
        }

        @Test
        @DisplayName("alias prefix matches its command")
        void aliasPrefix() {
            List<Suggestion> suggestions = parser.suggestions("?", List.of());

            assertEquals(1, suggestions.size());
            assertEquals("/help", suggestions.get(0).text());
        }

        @Test
        @DisplayName("history entries follow commands, deduplicated")
        void historyAfterCommands() {
            List<Suggestion> suggestions = parser.suggestions("/imp",
                    List.of("/implement retry", "/implement x", "/implement retry", "/review y"));

            assertEquals(List.of("/implement", "/implement retry", "/implement x"),
                    suggestions.stream().map(Suggestion::text).toList());
            assertEquals(Suggestion.Source.HISTORY, suggestions.get(1).source());
        }

        @Test
        @DisplayName("no match yields an empty list")
        void noMatch() {
            assertTrue(parser.suggestions("/zzz", List.of()).isEmpty());
        }
    }
}
