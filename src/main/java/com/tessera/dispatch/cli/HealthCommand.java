package com.tessera.dispatch.cli;

import com.tessera.core.health.HealthCheckService;
import com.tessera.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: tessera health
 * <p>
 * Exit code 0 when everything is up, 1 when an optional component is degraded,
 * 2 when no execution can run.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check backend, knowledge, sandbox and git")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = String.format("%-10s %s", check.component(), check.detail());
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            check.metadata().forEach((key, value) -> ConsoleOutput.info("           " + key + "=" + value));
        }

        ConsoleOutput.rule();
        return switch (HealthStatus.overall(checks)) {
            case UP -> {
                ConsoleOutput.success("Ready");
                yield 0;
            }
            case DEGRADED -> {
                ConsoleOutput.warn("Ready; some features are unavailable");
                yield 1;
            }
            case DOWN -> {
                ConsoleOutput.error("Not ready: no reasoning backend");
                yield 2;
            }
        };
    }
}
