package de.bsommerfeld.cortx.supervisor.termination;

/**
 * Exit code and captured output of a utility run by a {@link CommandRunner}.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static CommandResult ok(String stdout) {
        return new CommandResult(0, stdout, "");
    }

    public static CommandResult failed(int exitCode, String stderr) {
        return new CommandResult(exitCode, "", stderr);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
