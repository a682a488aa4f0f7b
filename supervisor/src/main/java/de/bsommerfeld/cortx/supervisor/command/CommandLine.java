package de.bsommerfeld.cortx.supervisor.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A resolved program plus its arguments, ready to be handed to a
 * {@link ProcessBuilder}.
 */
public record CommandLine(String program, List<String> args) {

    public CommandLine {
        Objects.requireNonNull(program, "program");
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static CommandLine of(String program, String... args) {
        return new CommandLine(program, List.of(args));
    }

    /** Program followed by its arguments. */
    public List<String> toList() {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(program);
        command.addAll(args);
        return command;
    }
}
