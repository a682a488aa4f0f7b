package de.bsommerfeld.cortx.app;

import de.bsommerfeld.cortx.supervisor.ExecutionMode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line of {@link CortxMain}.
 */
record CortxOptions(ExecutionMode mode, boolean stopOnFailure, Path workingDirectory, List<String> commands) {

    static final String USAGE = "Usage: cortx [--parallel] [--stop-on-failure] [--cwd <dir>] [--] <command>...";

    CortxOptions {
        commands = List.copyOf(commands);
    }

    /**
     * @throws IllegalArgumentException on unknown options, a missing
     *                                  {@code --cwd} value or no commands
     */
    static CortxOptions parse(String[] args) {
        ExecutionMode mode = ExecutionMode.SEQUENTIAL;
        boolean stopOnFailure = false;
        Path workingDirectory = Path.of(System.getProperty("user.dir"));
        List<String> commands = new ArrayList<>();

        boolean optionsDone = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (optionsDone || !arg.startsWith("--")) {
                commands.add(arg);
                continue;
            }
            if (arg.equals("--parallel")) {
                mode = ExecutionMode.PARALLEL;
            } else if (arg.equals("--stop-on-failure")) {
                stopOnFailure = true;
            } else if (arg.equals("--cwd")) {
                if (i + 1 >= args.length)
                    throw new IllegalArgumentException("--cwd needs a directory");
                workingDirectory = Path.of(args[++i]);
            } else if (arg.equals("--")) {
                optionsDone = true;
            } else {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (commands.isEmpty())
            throw new IllegalArgumentException("No commands given");
        return new CortxOptions(mode, stopOnFailure, workingDirectory, commands);
    }
}
