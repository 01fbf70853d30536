package com.ambient.dispatch.cli;

import picocli.CommandLine;

/**
 * Terminal output for the ambient CLI and the mode startup banners.
 */
public final class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
    }

    public static void printBanner() {
        println("@|bold,fg(cyan) AMBIENT v0.1.0|@");
        System.out.println(RULE);
    }

    public static void info(String message) {
        println("@|fg(cyan) [AMBIENT]|@ " + message);
    }

    public static void error(String message) {
        println("@|fg(red) x|@ " + message);
    }

    /** One catalog row: the persona key, then its display name and role. */
    public static void persona(String persona, String name, String role) {
        println("  @|fg(blue) " + persona + "|@ " + name + " (" + role + ")");
    }

    /**
     * Banner for a long-running mode. A {@code {port}} placeholder in an endpoint line is
     * replaced with the bound port.
     */
    public static void modeStarted(String what, int port, String... endpoints) {
        printBanner();
        info(what + " running on port " + port);
        System.out.println();
        for (String endpoint : endpoints) {
            System.out.println("  " + endpoint.replace("{port}", String.valueOf(port)));
        }
        System.out.println();
        info("Press Ctrl+C to stop.");
    }

    private static void println(String markup) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(markup));
    }
}
