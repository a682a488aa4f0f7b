package de.bsommerfeld.cortx.supervisor.command;

import java.util.List;

/**
 * Wraps free-form command strings into the platform shell, so services and
 * project scripts can use pipes, globs and {@code &&} like in a terminal.
 */
public final class CommandLines {

    private CommandLines() {
    }

    /**
     * Returns {@code sh -c <commandLine>} on macOS/Linux and
     * {@code cmd /C <commandLine>} on Windows.
     */
    public static CommandLine shell(String commandLine) {
        return shell(commandLine, isWindows());
    }

    static CommandLine shell(String commandLine, boolean windows) {
        if (windows) {
            return new CommandLine("cmd", List.of("/C", commandLine));
        }
        return new CommandLine("sh", List.of("-c", commandLine));
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().contains("win");
    }
}
