package de.bsommerfeld.cortx.supervisor.termination;

import de.bsommerfeld.cortx.core.util.Pauses;
import de.bsommerfeld.cortx.supervisor.exception.KillFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Uses {@code taskkill /F /T} to end the whole tree. Windows has no graceful
 * equivalent of SIGTERM for console children, so the first attempt is already
 * forceful.
 */
public class WindowsTerminationStrategy implements TerminationStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(WindowsTerminationStrategy.class);

    private final CommandRunner runner;
    private final long escalationDelayMillis;
    private final long retryDelayMillis;

    public WindowsTerminationStrategy(CommandRunner runner, long escalationDelayMillis, long retryDelayMillis) {
        this.runner = runner;
        this.escalationDelayMillis = escalationDelayMillis;
        this.retryDelayMillis = retryDelayMillis;
    }

    @Override
    public void kill(long pid) throws KillFailedException {
        CommandResult result;
        try {
            result = runner.run(taskkill(pid));
        } catch (IOException e) {
            throw new KillFailedException(pid, "could not run taskkill", e);
        }
        if (!result.isSuccess() && !isGone(result)) {
            throw new KillFailedException(pid, "taskkill exited with " + result.exitCode() + ": "
                    + result.stderr().strip());
        }
    }

    @Override
    public void killRobustly(long pid) {
        try {
            kill(pid);
        } catch (KillFailedException e) {
            LOG.warn(e.getMessage());
        }

        Pauses.sleep(escalationDelayMillis);

        if (isAlive(pid)) {
            LOG.warn("PID {} still alive after taskkill, retrying", pid);
            try {
                kill(pid);
            } catch (KillFailedException e) {
                LOG.warn(e.getMessage());
            }
            Pauses.sleep(retryDelayMillis);
        }

        try {
            runner.run(List.of("wmic", "process", "where", "ParentProcessId=" + pid, "delete"));
        } catch (IOException e) {
            LOG.debug("Could not sweep children of PID {}", pid, e);
        }
    }

    /** {@code tasklist} prints the pid in its table only while it exists. */
    private boolean isAlive(long pid) {
        try {
            CommandResult result = runner.run(List.of("tasklist", "/FI", "PID eq " + pid, "/NH"));
            return result.isSuccess() && result.stdout().contains(String.valueOf(pid));
        } catch (IOException e) {
            LOG.debug("Liveness check for PID {} failed", pid, e);
            return false;
        }
    }

    private static List<String> taskkill(long pid) {
        return List.of("taskkill", "/F", "/T", "/PID", String.valueOf(pid));
    }

    private static boolean isGone(CommandResult result) {
        String stderr = result.stderr();
        return stderr.contains("not found") || stderr.contains("No tasks");
    }
}
