package com.tessera.dispatch.cli;

import com.tessera.TesseraApplication;
import com.tessera.core.command.ParseException;
import com.tessera.core.engine.BusyException;
import com.tessera.core.vcs.VcsException;
import com.tessera.core.workspace.ApplyException;
import com.tessera.sandbox.SessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring context and reports its exit code.
 * Engine exceptions that escape a command are printed as one error line with exit
 * code 2; anything else keeps picocli's default handling.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final TesseraCommand tesseraCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TesseraCommand tesseraCommand, IFactory factory) {
        this.tesseraCommand = tesseraCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (TesseraApplication.isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(tesseraCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler(CliRunner::handleEngineException)
                .execute(args);
    }

    static int handleEngineException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult)
            throws Exception {
        String message;
        if (e instanceof ParseException parse) {
            message = "Invalid command (" + parse.getReason() + "): " + parse.getMessage();
        } else if (e instanceof ApplyException apply) {
            message = apply.getKind() + ": " + apply.getMessage();
        } else if (e instanceof SessionException session) {
            message = "Sandbox " + session.getKind() + ": " + session.getMessage();
        } else if (e instanceof BusyException || e instanceof VcsException) {
            message = e.getMessage();
        } else {
            throw e;
        }
        log.debug("{} failed", commandLine.getCommandName(), e);
        ConsoleOutput.error(message);
        return 2;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
