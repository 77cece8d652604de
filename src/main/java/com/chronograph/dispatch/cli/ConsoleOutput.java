package com.chronograph.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Chronograph CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CHRONOGRAPH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CHRONOGRAPH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void card(String agentId, String agentType, String state, String phase, String message) {
        String color = switch (state) {
            case "completed" -> "fg(green)";
            case "failed" -> "fg(red)";
            case "orphaned" -> "fg(magenta)";
            case "running" -> "fg(blue)";
            default -> "fg(white)";
        };
        // Pad before colouring so the escape codes do not break the columns.
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-20s %-16s @|%s %-10s|@ %-8s %s",
                agentId, agentType, color, state, phase, message)));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "agent_start" -> "@|fg(blue) [START]|@";
            case "agent_stop" -> "@|fg(green) [STOP]|@";
            case "tool_use" -> "@|fg(white) [TOOL]|@";
            case "interaction" -> "@|fg(cyan) [INTERACTION]|@";
            case "phase_transition" -> "@|bold,fg(yellow) [PHASE]|@";
            case "error" -> "@|fg(red),bold [ERROR]|@";
            case "gap" -> "@|fg(magenta),bold [GAP]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }
}
