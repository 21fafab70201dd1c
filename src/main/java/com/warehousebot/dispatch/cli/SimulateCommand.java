package com.warehousebot.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warehousebot.core.engine.SimulationEngine;
import com.warehousebot.core.engine.SimulationProperties;
import com.warehousebot.core.events.EventBus;
import com.warehousebot.core.model.SimulationReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: warehousebot simulate [--seed N] [--tasks N] [--watch [--events TYPE,...]] [--json]
 * <p>
 * Generates a seeded warehouse and task list, runs the robot through every task and prints the
 * resulting statistics.
 */
@Command(name = "simulate", mixinStandardHelpOptions = true, description = "Run a seeded warehouse simulation")
@Component
public class SimulateCommand implements Callable<Integer> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Option(names = {"--seed", "-s"}, description = "Random seed (default: warehousebot.simulation.seed)")
    private Long seed;

    @Option(names = {"--tasks", "-n"}, description = "Number of tasks to generate (default: warehousebot.simulation.task-count)")
    private Integer tasks;

    @Option(names = {"--watch", "-w"}, description = "Print run events as they happen")
    private boolean watch;

    @Option(names = {"--events"}, split = ",", paramLabel = "TYPE",
            description = "With --watch, only print these event types (e.g. task.canceled,path.fallback)")
    private Set<String> events;

    @Option(names = {"--json"}, description = "Print the report as JSON instead of a table")
    private boolean json;

    private final SimulationEngine engine;
    private final SimulationProperties properties;
    private final EventBus eventBus;

    public SimulateCommand(SimulationEngine engine, SimulationProperties properties, EventBus eventBus) {
        this.engine = engine;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        long runSeed = seed != null ? seed : properties.getSeed();
        int taskCount = tasks != null ? tasks : properties.getTaskCount();
        if (taskCount < 0) {
            ConsoleOutput.error("Task count must not be negative: " + taskCount);
            return 2;
        }

        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Simulating " + taskCount + " tasks with seed " + runSeed + "...");
        }

        String runId = engine.generateRunId();
        EventBus.Subscription subscription = watch && !json
                ? eventBus.subscribe(runId, events != null ? events : Set.of(), event -> ConsoleOutput.watchEvent(event.eventType(),
                        (event.taskId() != null ? event.taskId() + " " : "") + event.payload()))
                : null;

        SimulationReport report;
        try {
            report = engine.runSimulation(runId, runSeed, taskCount);
        } catch (Exception e) {
            ConsoleOutput.error("Simulation failed: " + e.getMessage());
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        if (json) {
            try {
                System.out.println(OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not serialize report: " + e.getOriginalMessage());
                return 1;
            }
            return 0;
        }

        ConsoleOutput.report(report);
        if (report.statistics().canceledCount() > 0) {
            ConsoleOutput.warn(report.statistics().canceledCount() + " task(s) could not be reached");
        }
        return 0;
    }
}
