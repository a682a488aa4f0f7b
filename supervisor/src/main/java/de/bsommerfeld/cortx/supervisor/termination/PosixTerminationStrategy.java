package de.bsommerfeld.cortx.supervisor.termination;

import de.bsommerfeld.cortx.core.util.Pauses;
import de.bsommerfeld.cortx.supervisor.exception.KillFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Signals the process group led by the target ({@code kill -SIG -<pid>}) and
 * every process of its tree the JVM can see, first with SIGTERM and after a
 * short delay with SIGKILL.
 *
 * <p>
 * The tree is looked up through {@link ProcessHandle}: children started by the
 * JVM share its process group, so the group signal alone only reaches
 * processes that became group leaders themselves. A missing group is reported
 * by {@code kill} as "No such process" and is not an error.
 */
public class PosixTerminationStrategy implements TerminationStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(PosixTerminationStrategy.class);

    private final CommandRunner runner;
    private final long escalationDelayMillis;

    public PosixTerminationStrategy(CommandRunner runner, long escalationDelayMillis) {
        this.runner = runner;
        this.escalationDelayMillis = escalationDelayMillis;
    }

    @Override
    public void kill(long pid) throws KillFailedException {
        List<ProcessHandle> tree = treeOf(pid);

        signalGroup("TERM", pid);
        tree.forEach(ProcessHandle::destroy);

        Pauses.sleep(escalationDelayMillis);

        CommandResult result = signalGroup("KILL", pid);
        tree.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);

        if (!result.isSuccess() && !isGone(result) && isAlive(pid)) {
            throw new KillFailedException(pid, "kill exited with " + result.exitCode() + ": "
                    + result.stderr().strip());
        }
    }

    @Override
    public void killRobustly(long pid) {
        List<ProcessHandle> tree = treeOf(pid);
        try {
            kill(pid);
        } catch (KillFailedException e) {
            LOG.warn(e.getMessage());
        }

        Pauses.sleep(escalationDelayMillis);

        if (isAlive(pid)) {
            LOG.warn("PID {} survived SIGKILL, retrying", pid);
            runQuietly(List.of("kill", "-KILL", String.valueOf(pid)));
        }
        runQuietly(List.of("pkill", "-KILL", "-P", String.valueOf(pid)));

        tree.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
    }

    private CommandResult signalGroup(String signal, long pid) throws KillFailedException {
        try {
            return runner.run(List.of("kill", "-" + signal, "-" + pid));
        } catch (IOException e) {
            throw new KillFailedException(pid, "could not run kill", e);
        }
    }

    /** {@code kill -0} succeeds only while the process exists. */
    private boolean isAlive(long pid) {
        try {
            return runner.run(List.of("kill", "-0", String.valueOf(pid))).isSuccess();
        } catch (IOException e) {
            LOG.debug("Liveness check for PID {} failed", pid, e);
            return false;
        }
    }

    private void runQuietly(List<String> command) {
        try {
            CommandResult result = runner.run(command);
            if (!result.isSuccess() && !result.stderr().isBlank()) {
                LOG.debug("{} exited with {}: {}", command.get(0), result.exitCode(), result.stderr().strip());
            }
        } catch (IOException e) {
            LOG.warn("Could not run {}", command.get(0), e);
        }
    }

    private static boolean isGone(CommandResult result) {
        return result.stderr().contains("No such process");
    }

    /** The process itself followed by every descendant, snapshotted now. */
    private static List<ProcessHandle> treeOf(long pid) {
        return ProcessHandle.of(pid)
                .map(handle -> Stream.concat(Stream.of(handle), handle.descendants()).collect(Collectors.toList()))
                .orElse(List.of());
    }
}
