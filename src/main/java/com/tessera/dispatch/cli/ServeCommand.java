package com.tessera.dispatch.cli;

import com.tessera.sandbox.SandboxProperties;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: tessera serve
 * <p>
 * {@link com.tessera.TesseraApplication} starts the servlet container when
 * {@code serve} is the first argument and {@link CliRunner} does not run picocli
 * then, so this command only prints where the API listens once the port is bound.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Serve command sessions and sandbox sessions over REST and SSE")
@Component
public class ServeCommand implements Runnable {

    private final SandboxProperties sandboxProperties;

    public ServeCommand(SandboxProperties sandboxProperties) {
        this.sandboxProperties = sandboxProperties;
    }

    @Override
    public void run() {
        ConsoleOutput.warn("'serve' must be the first argument: tessera serve");
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String base = "http://localhost:" + port + "/api/v1";
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Listening on port " + port + " (sandbox provider: " + sandboxProperties.getProvider() + ")");
        System.out.println();
        System.out.println("  Sessions:   " + base + "/sessions");
        System.out.println("  Workspace:  " + base + "/sessions/{sid}/workspace");
        System.out.println("  Sandbox:    " + base + "/sandbox/sessions");
        System.out.println("  Health:     " + base + "/health");
        System.out.println();
    }
}
