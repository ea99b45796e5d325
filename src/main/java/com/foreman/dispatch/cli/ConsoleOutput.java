package com.foreman.dispatch.cli;

import com.foreman.core.events.ForemanEvent;
import com.foreman.core.model.FinalReport;
import com.foreman.core.model.RunStatus;
import com.foreman.core.model.TaskReport;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.model.ValidationWarning;
import picocli.CommandLine;

import java.time.Duration;

/**
 * ANSI-colored terminal output utilities for the Foreman CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(ansi("@|bold,fg(yellow) FOREMAN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(ansi("@|fg(cyan) [FOREMAN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(ansi("@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(ansi("@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(ansi("@|fg(red) x|@ " + message));
    }

    /** One line of live progress for a scheduler event. */
    public static void event(ForemanEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.created", "run.started" -> "@|fg(cyan) [RUN]|@";
            case "task.ready" -> "@|fg(white) [READY]|@";
            case "task.started" -> "@|fg(blue) [START]|@";
            case "task.completed" -> "@|fg(green) [DONE]|@";
            case "task.retrying" -> "@|fg(yellow) [RETRY]|@";
            case "task.failed" -> "@|fg(red),bold [FAILED]|@";
            case "task.blocked" -> "@|fg(red) [BLOCKED]|@";
            case "task.cancelled" -> "@|fg(magenta) [CANCELLED]|@";
            case "scheduler.deadlock_broken" -> "@|fg(yellow),bold [DEADLOCK]|@";
            case "run.stalled" -> "@|fg(red),bold [STALLED]|@";
            case "run.completed" -> "@|bold [FINISHED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? "task " + event.taskId() + " " : "";
        System.out.println(ansi(prefix + " " + subject + event.payload()));
    }

    public static void report(FinalReport report) {
        System.out.println();
        System.out.println("RUN " + report.runId());
        System.out.printf("  %-6s %-12s %-18s %-12s %-7s %s%n", "ID", "OWNER", "PHASE", "STATUS", "RETRIES", "DETAIL");
        System.out.println("  " + "-".repeat(80));
        for (TaskReport task : report.tasks()) {
            String detail = task.error() != null ? task.error() : (task.result() != null ? task.result() : "");
            System.out.println(ansi(String.format("  %-6s %-12s %-18s ", task.taskId(), task.owner(),
                    task.phase() != null ? task.phase() : "-")
                    + colored(task.status()) + String.format(" %-7d %s", task.retryCount(), truncate(detail, 60))));
        }

        if (!report.warnings().isEmpty()) {
            System.out.println();
            warn("Warnings (" + report.warnings().size() + "):");
            for (ValidationWarning w : report.warnings()) {
                warn("  " + w);
            }
        }

        System.out.println("──────────────────────────────────");
        System.out.println(ansi("  Tasks: @|fg(green) " + report.count(TaskStatus.COMPLETED) + " completed|@, "
                + "@|fg(red) " + report.count(TaskStatus.FAILED) + " failed|@, "
                + "@|fg(red) " + report.count(TaskStatus.BLOCKED) + " blocked|@"
                + (report.count(TaskStatus.CANCELLED) > 0
                        ? ", @|fg(magenta) " + report.count(TaskStatus.CANCELLED) + " cancelled|@" : "")
                + " of " + report.totalTasks()));
        System.out.println("  Passes: " + report.passes() + ", duration: " + formatDuration(report.elapsed()));
        RunStatus status = report.status();
        if (status == RunStatus.COMPLETED) {
            success("Run " + report.runId() + " COMPLETED");
        } else {
            error("Run " + report.runId() + " " + status);
        }
    }

    static String formatDuration(Duration duration) {
        long ms = duration.toMillis();
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }

    private static String colored(TaskStatus status) {
        String padded = String.format("%-12s", status.name());
        return switch (status) {
            case COMPLETED -> "@|fg(green) " + padded + "|@";
            case FAILED, BLOCKED -> "@|fg(red) " + padded + "|@";
            case CANCELLED -> "@|fg(magenta) " + padded + "|@";
            default -> padded;
        };
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String ansi(String markup) {
        return CommandLine.Help.Ansi.AUTO.string(markup);
    }
}
