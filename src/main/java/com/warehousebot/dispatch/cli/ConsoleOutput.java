package com.warehousebot.dispatch.cli;

import com.warehousebot.core.model.SchedulerStatistics;
import com.warehousebot.core.model.SimulationReport;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Warehousebot CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WAREHOUSEBOT v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WAREHOUSEBOT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void report(SimulationReport r) {
        SchedulerStatistics s = r.statistics();
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Run " + r.runId() + "|@ (seed " + r.seed() + ")"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: " + r.tasksGenerated() + " generated, " + r.tasksAdmitted() + " admitted, "
                + "@|fg(green) " + s.completedCount() + " completed|@"
                + (s.canceledCount() > 0 ? ", @|fg(red) " + s.canceledCount() + " canceled|@" : "")
                + (s.pendingCount() > 0 ? ", " + s.pendingCount() + " pending" : "")));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Planning: " + r.dispatches() + " dispatches, " + r.replans() + " replans"
                + (r.pathFallbacks() > 0 ? ", @|fg(yellow) " + r.pathFallbacks() + " direct-line fallbacks|@" : "")));
        System.out.println(String.format(
                "  Robot: %.1f m travelled, battery %.0f%%", r.distanceTravelled(), r.batteryPercent()));
        System.out.println(String.format(
                "  Timing: avg service %.3fs, avg wait %.3fs, %.1f tasks/s",
                s.avgCompletionSeconds(), s.avgWaitSeconds(), s.throughput()));
        System.out.println("  Duration: " + formatDuration(r.durationMs()));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "run.started" -> "@|fg(cyan) [RUN]|@";
            case "task.dispatched", "task.completed" -> "@|fg(blue) [TASK]|@";
            case "task.canceled" -> "@|fg(red) [TASK]|@";
            case "path.planned" -> "@|fg(magenta) [PATH]|@";
            case "path.fallback" -> "@|fg(yellow) [PATH]|@";
            case "scheduler.replanned" -> "@|bold,fg(yellow) [REPLAN]|@";
            case "run.finished" -> "@|fg(green),bold [COMPLETE]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
