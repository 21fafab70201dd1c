package com.warehousebot.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command; an exception escaping a
 * command is reported on the console and logged, not printed as a stack trace.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final WarehousebotCommand warehousebotCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WarehousebotCommand warehousebotCommand, IFactory factory) {
        this.warehousebotCommand = warehousebotCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(warehousebotCommand, factory)
                .setExecutionExceptionHandler(CliRunner::handleExecutionException);
    }

    static int handleExecutionException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        log.debug("Command '{}' failed", commandLine.getCommandName(), e);
        ConsoleOutput.error(commandLine.getCommandName() + " failed: " + e.getMessage());
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
