package com.missioncontrol.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command: routes to serve, health and plans.
 */
@Command(
        name = "mission-control",
        mixinStandardHelpOptions = true,
        version = "Mission Control 0.1.0",
        description = "Task dashboard core: plan approval and realtime sync",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                PlansCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MissionControlCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // Usage through the live command line so subcommands come from the same factory
        spec.commandLine().usage(System.out);
    }
}
