package com.tessera.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Root of the picocli tree. Without a subcommand it prints usage and a hint for
 * the most common entry point.
 */
@Command(
        name = "tessera",
        mixinStandardHelpOptions = true,
        version = "Tessera 0.1.0",
        description = "Slash-command code assistant with reviewable, revertible changes",
        subcommands = {
                RunCommand.class,
                ReplCommand.class,
                FilesCommand.class,
                SandboxCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TesseraCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
        ConsoleOutput.info("Start with: tessera repl -w <workspace>");
    }
}
