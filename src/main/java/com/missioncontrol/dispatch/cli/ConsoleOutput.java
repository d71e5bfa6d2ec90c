package com.missioncontrol.dispatch.cli;

import com.missioncontrol.core.model.Plan;
import com.missioncontrol.core.model.Task;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Mission Control CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(magenta) MISSION CONTROL v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MC]|@ " + message));
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

    public static void plan(Plan plan) {
        Task parent = plan.parent();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + parent.title() + "|@ " + approval(parent) + " @|faint " + parent.id() + "|@"));
        System.out.println("  agent: " + orDash(parent.agentId()) + "  workspace: " + parent.workspaceId()
                + "  priority: " + parent.priority().wireValue());
        for (Task subtask : plan.subtasks()) {
            System.out.printf("  %2d. %-40s %s%n", subtask.sortOrder() + 1, truncate(subtask.title(), 40),
                    subtask.status().wireValue());
        }
    }

    private static String approval(Task task) {
        if (task.approvalStatus() == null) {
            return "";
        }
        String color = switch (task.approvalStatus()) {
            case PENDING -> "fg(yellow)";
            case APPROVED -> "fg(green)";
            case REJECTED -> "fg(red)";
        };
        return "@|" + color + " [" + task.approvalStatus().wireValue() + "]|@";
    }

    private static String orDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
