package com.automaker.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Automaker CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AUTOMAKER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AUTOMAKER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void serverUnavailable(int port) {
        error("Cannot connect to Automaker server at localhost:" + port);
        info("Start the server first: automaker serve");
    }

    public static void watchEvent(String eventType, String data) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefixFor(eventType) + " " + data));
    }

    static String prefixFor(String eventType) {
        return switch (eventType) {
            case "auto_mode_started", "auto_mode_stopped", "auto_mode_idle" -> "@|fg(cyan) [LOOP]|@";
            case "auto_mode_paused_failures" -> "@|fg(red),bold [PAUSED]|@";
            case "auto_mode_feature_start", "auto_mode_feature_complete" -> "@|fg(green),bold [FEATURE]|@";
            case "auto_mode_error" -> "@|fg(red),bold [ERROR]|@";
            case "planning_started", "plan_approval_required", "plan_approved", "plan_rejected",
                 "plan_auto_approved", "plan_revision_requested" -> "@|bold,fg(yellow) [PLAN]|@";
            case "auto_mode_task_started", "auto_mode_task_complete", "auto_mode_phase_complete" -> "@|fg(blue) [TASK]|@";
            case "pipeline_step_started", "pipeline_step_complete" -> "@|fg(magenta) [PIPELINE]|@";
            case "auto_mode_tool" -> "@|fg(white) [TOOL]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
    }
}
