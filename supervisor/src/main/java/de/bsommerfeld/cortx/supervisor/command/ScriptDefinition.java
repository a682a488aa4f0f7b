package de.bsommerfeld.cortx.supervisor.command;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The parts of a stored script that are needed to run it. Loading and saving
 * scripts is the storage layer's business; this record is what it hands over.
 *
 * @param id          entity id of the script
 * @param command     command template, may contain {@value CommandBuilder#SCRIPT_FILE_PLACEHOLDER}
 * @param scriptPath  file substituted for the placeholder, may be {@code null}
 * @param workingDir  working directory, may be {@code null}
 * @param parameters  parameters in definition order
 * @param envVars     environment overrides
 */
public record ScriptDefinition(String id, String command, String scriptPath, String workingDir,
        List<ScriptParameter> parameters, Map<String, String> envVars) {

    public ScriptDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(command, "command");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        envVars = envVars == null ? Map.of() : Map.copyOf(envVars);
    }

    public static ScriptDefinition of(String id, String command) {
        return new ScriptDefinition(id, command, null, null, List.of(), Map.of());
    }
}
