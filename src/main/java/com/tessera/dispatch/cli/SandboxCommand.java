package com.tessera.dispatch.cli;

import com.tessera.sandbox.SandboxSessionBridge;
import com.tessera.sandbox.SessionException;
import com.tessera.sandbox.SessionOutput;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: tessera sandbox exec "&lt;shell command&gt;"
 * <p>
 * Runs one command through a sandbox session and prints its output. Without
 * {@code --target} a target is provisioned for the workspace and destroyed afterwards.
 */
@Command(name = "sandbox", mixinStandardHelpOptions = true, description = "Run a shell command in a sandbox")
@Component
public class SandboxCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Action: exec")
    private String action;

    @Parameters(index = "1", description = "Shell command to run")
    private String command;

    @Option(names = {"--target", "-t"}, description = "Existing sandbox target id")
    private String target;

    @Option(names = {"--workspace", "-w"}, description = "Workspace to provision a target for", defaultValue = ".")
    private Path workspace;

    @Option(names = "--timeout", description = "Seconds to wait for the command", defaultValue = "120")
    private int timeoutSeconds;

    private final SandboxSessionBridge bridge;

    public SandboxCommand(SandboxSessionBridge bridge) {
        this.bridge = bridge;
    }

    @Override
    public Integer call() {
        if (!"exec".equals(action)) {
            ConsoleOutput.error("Unknown action '" + action + "'. Use exec.");
            return 2;
        }

        boolean provisioned = target == null;
        String targetId;
        try {
            targetId = provisioned ? bridge.provisionTarget(workspace) : target;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Cannot provision a sandbox: " + e.getMessage());
            return 1;
        }

        String sessionId = null;
        try {
            sessionId = bridge.createSession(targetId);
            ConsoleOutput.sandbox("session " + sessionId + " on " + targetId + " (" + bridge.providerName() + ")");
            try (SessionOutput output = bridge.output(sessionId)) {
                bridge.sendInput(sessionId, (command + "\nexit\n").getBytes(StandardCharsets.UTF_8));
                return drain(output) ? 0 : 1;
            }
        } catch (SessionException e) {
            ConsoleOutput.error(e.getKind() + ": " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted");
            return 130;
        } finally {
            if (sessionId != null) {
                bridge.closeSession(sessionId);
            }
            if (provisioned) {
                bridge.destroyTarget(targetId);
            }
        }
    }

    /** @return false if the timeout elapsed before the shell exited */
    private boolean drain(SessionOutput output) throws InterruptedException {
        Instant deadline = Instant.now().plusSeconds(timeoutSeconds);
        while (!output.isFinished()) {
            Duration left = Duration.between(Instant.now(), deadline);
            if (left.isNegative() || left.isZero()) {
                ConsoleOutput.error("Timed out after " + timeoutSeconds + "s");
                return false;
            }
            Optional<byte[]> chunk = output.poll(left);
            chunk.ifPresent(bytes -> {
                System.out.print(new String(bytes, StandardCharsets.UTF_8));
                System.out.flush();
            });
        }
        return true;
    }
}
