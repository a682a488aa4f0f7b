package de.bsommerfeld.cortx.supervisor;

import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import de.bsommerfeld.cortx.supervisor.command.CommandLine;
import de.bsommerfeld.cortx.supervisor.command.CommandLines;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the supervisor needs to start one entity. Instances are
 * immutable; use the {@code with*} methods to derive variants.
 *
 * @param category         namespace of {@code id}
 * @param id               entity id, unique within its category while running
 * @param workingDirectory must exist, otherwise the launch fails
 * @param program          executable name or path
 * @param args             arguments, passed without shell interpretation
 * @param environment      overrides merged over the inherited environment
 * @param metadata         informational, echoed in status events
 */
public record LaunchSpec(ProcessCategory category, String id, Path workingDirectory, String program,
        List<String> args, Map<String, String> environment, ProcessMetadata metadata) {

    public LaunchSpec {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(program, "program");
        if (id.isBlank())
            throw new IllegalArgumentException("Entity id must not be blank");
        if (program.isBlank())
            throw new IllegalArgumentException("Program must not be blank");
        args = args == null ? List.of() : List.copyOf(args);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        metadata = metadata == null ? ProcessMetadata.NONE : metadata;
    }

    public static LaunchSpec of(ProcessCategory category, String id, Path workingDirectory, String program,
            List<String> args) {
        return new LaunchSpec(category, id, workingDirectory, program, args, Map.of(), ProcessMetadata.NONE);
    }

    public static LaunchSpec of(ProcessCategory category, String id, Path workingDirectory, CommandLine command) {
        return of(category, id, workingDirectory, command.program(), command.args());
    }

    /**
     * Runs {@code commandLine} through the platform shell.
     *
     * @see CommandLines#shell(String)
     */
    public static LaunchSpec shell(ProcessCategory category, String id, Path workingDirectory,
            String commandLine) {
        return of(category, id, workingDirectory, CommandLines.shell(commandLine));
    }

    public LaunchSpec withEnvironment(Map<String, String> environment) {
        return new LaunchSpec(category, id, workingDirectory, program, args, environment, metadata);
    }

    public LaunchSpec withMetadata(ProcessMetadata metadata) {
        return new LaunchSpec(category, id, workingDirectory, program, args, environment, metadata);
    }

    /** Program followed by its arguments. */
    public List<String> command() {
        return new CommandLine(program, args).toList();
    }
}
