package com.warehousebot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Warehousebot.
 * Routes to subcommands: simulate, plan, health.
 */
@Command(
        name = "warehousebot",
        mixinStandardHelpOptions = true,
        version = "Warehousebot 0.1.0",
        description = "Warehouse robot path planning and task scheduling simulator",
        subcommands = {
                SimulateCommand.class,
                PlanCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WarehousebotCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
