package de.bsommerfeld.cortx.supervisor.command;

import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.supervisor.LaunchSpec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a {@link ScriptDefinition} plus user-entered parameter values into a
 * concrete {@link CommandLine}.
 *
 * <h3>Resolution steps</h3>
 * <ol>
 * <li>{@value #SCRIPT_FILE_PLACEHOLDER} in the command template is replaced
 * with the script path, if the script has one</li>
 * <li>the template is split on whitespace into program and base
 * arguments</li>
 * <li>parameter values are appended in <em>definition</em> order, not in the
 * order of the value map</li>
 * <li>extra arguments are appended verbatim</li>
 * </ol>
 *
 * <p>
 * The template is not shell-parsed. Quoting inside the template is not
 * supported; values with spaces belong in parameters.
 */
public final class CommandBuilder {

    public static final String SCRIPT_FILE_PLACEHOLDER = "{{SCRIPT_FILE}}";

    private CommandBuilder() {
    }

    /**
     * @return the resolved command, or empty if the template resolves to
     *         nothing
     */
    public static Optional<CommandLine> build(ScriptDefinition script, Map<String, String> values,
            List<String> extraArgs) {
        String template = script.command();
        if (script.scriptPath() != null) {
            template = template.replace(SCRIPT_FILE_PLACEHOLDER, script.scriptPath());
        }

        List<String> tokens = new ArrayList<>(Arrays.asList(template.trim().split("\\s+")));
        tokens.removeIf(String::isEmpty);
        if (tokens.isEmpty())
            return Optional.empty();

        String program = tokens.remove(0);
        List<String> args = new ArrayList<>(tokens);

        for (ScriptParameter parameter : script.parameters()) {
            String value = values.get(parameter.name());
            if (value == null || value.isEmpty())
                continue;
            appendParameter(args, parameter, value);
        }

        if (extraArgs != null)
            args.addAll(extraArgs);

        return Optional.of(new CommandLine(program, args));
    }

    /**
     * Resolves the script and wraps it into a launch specification for the
     * {@link ProcessCategory#GLOBAL_SCRIPT} category. Scripts without a working
     * directory run in {@code defaultWorkingDir}.
     */
    public static Optional<LaunchSpec> toLaunchSpec(ScriptDefinition script, Map<String, String> values,
            List<String> extraArgs, Path defaultWorkingDir) {
        Path workingDir = script.workingDir() != null ? Path.of(script.workingDir()) : defaultWorkingDir;
        return build(script, values, extraArgs)
                .map(command -> LaunchSpec.of(ProcessCategory.GLOBAL_SCRIPT, script.id(), workingDir, command)
                        .withEnvironment(script.envVars()));
    }

    private static void appendParameter(List<String> args, ScriptParameter parameter, String value) {
        String flag = parameter.preferredFlag();

        if (parameter.type() == ScriptParamType.BOOL) {
            if ("true".equals(value) && flag != null)
                args.add(flag);
            return;
        }

        if (flag != null)
            args.add(flag);

        if (parameter.nargs() != null) {
            for (String part : value.trim().split("\\s+")) {
                if (!part.isEmpty())
                    args.add(part);
            }
        } else {
            args.add(stripQuotes(value));
        }
    }

    /** Strips one pair of matching single or double quotes. */
    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
