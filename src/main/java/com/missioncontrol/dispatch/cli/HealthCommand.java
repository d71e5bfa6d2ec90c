package com.missioncontrol.dispatch.cli;

import com.missioncontrol.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: mission-control health
 * <p>
 * Runs every component check and exits non-zero when any component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check component health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean anyDown = false;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
            }
        }

        System.out.println(ConsoleOutput.RULE);
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        ConsoleOutput.success("Overall: operational");
        return 0;
    }
}
