package de.bsommerfeld.cortx.supervisor.termination;

import de.bsommerfeld.cortx.supervisor.exception.KillFailedException;

/**
 * Platform-specific way of ending a process together with everything it
 * spawned. Exactly one implementation is active per platform, see
 * {@link TerminationStrategies#forCurrentPlatform}.
 */
public interface TerminationStrategy {

    /**
     * Terminates the process tree rooted at {@code pid}, giving it a short
     * chance to exit gracefully first. A process that has already exited is
     * not an error.
     *
     * @throws KillFailedException if the kill utility failed
     */
    void kill(long pid) throws KillFailedException;

    /**
     * Shutdown variant of {@link #kill}: verifies the tree is gone, retries
     * once with force and sweeps remaining children. Never throws; problems
     * are logged.
     */
    void killRobustly(long pid);
}
