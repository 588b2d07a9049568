package com.tessera.dispatch.cli;

import com.tessera.core.events.ExecutionEvent;
import com.tessera.core.model.ChangeView;
import com.tessera.core.workspace.DiffRenderer;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Tessera CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TESSERA v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TESSERA]|@ " + escape(message)));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + escape(message)));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + escape(message)));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + escape(message)));
    }

    public static void sandbox(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + escape(message)));
    }

    public static void change(ChangeView change) {
        String lines = change.startLine() > 0 ? " (lines " + change.startLine() + "-" + change.endLine() + ")" : "";
        String symbol = change.originalExisted() ? "~" : "+";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) " + symbol + "|@ @|bold " + change.id() + "|@ " + escape(change.filePath())
                        + escape(lines) + " @|faint [" + change.status() + "]|@ " + escape(change.description())));
    }

    public static void diff(ChangeView change) {
        String text = DiffRenderer.render(change);
        if (text.isEmpty()) {
            System.out.println("    (no textual difference)");
            return;
        }
        for (String line : text.split("\n", -1)) {
            String color = line.startsWith("+++") || line.startsWith("---") ? "bold"
                    : line.startsWith("+") ? "fg(green)"
                    : line.startsWith("-") ? "fg(red)"
                    : line.startsWith("@@") ? "fg(cyan)"
                    : null;
            System.out.println(color == null
                    ? line
                    : CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + escape(line) + "|@"));
        }
    }

    /** Renders one execution event; thinking text is printed as it streams. */
    public static void event(ExecutionEvent event) {
        if (event instanceof ExecutionEvent.Started started) {
            info("/" + started.verb() + " " + started.argument() + "  (" + started.executionId() + ")");
        } else if (event instanceof ExecutionEvent.Progress progress) {
            if ("warning".equals(progress.stage())) {
                warn(progress.message());
            } else {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "@|faint [" + escape(progress.stage()) + "] " + escape(progress.message()) + "|@"));
            }
        } else if (event instanceof ExecutionEvent.FileRead read) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|faint   read " + escape(read.path()) + " (" + read.bytes() + " bytes)|@"));
        } else if (event instanceof ExecutionEvent.Thinking thinking) {
            System.out.print(thinking.text());
            System.out.flush();
        } else if (event instanceof ExecutionEvent.CodeChangeProposed proposed) {
            System.out.println();
            change(proposed.change());
        } else if (event instanceof ExecutionEvent.Completed completed) {
            System.out.println();
            rule();
            String summary = completed.changeCount() == 0
                    ? "Done, no changes proposed"
                    : completed.changeCount() + " change" + (completed.changeCount() != 1 ? "s" : "") + " awaiting decision";
            if (completed.truncated()) {
                warn(summary + " (response was truncated)");
            } else {
                success(summary);
            }
        } else if (event instanceof ExecutionEvent.Cancelled) {
            System.out.println();
            warn("Cancelled");
        } else if (event instanceof ExecutionEvent.Error failure) {
            System.out.println();
            error(failure.kind() + ": " + failure.message());
        }
    }

    public static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String escape(String text) {
        // picocli markup uses @| ... |@; keep user text from being parsed as markup
        return text == null ? "" : text.replace("@|", "@ |").replace("|@", "| @");
    }
}
