package com.missioncontrol.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands command-line arguments to picocli and keeps its exit code for Spring Boot.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final MissionControlCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(MissionControlCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // In serve mode the servlet container owns the process; picocli would return at once.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
