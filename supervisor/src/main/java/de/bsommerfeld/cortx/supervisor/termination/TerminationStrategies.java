package de.bsommerfeld.cortx.supervisor.termination;

import de.bsommerfeld.cortx.core.config.SupervisorConfig;

/**
 * Picks the {@link TerminationStrategy} for the running operating system.
 */
public final class TerminationStrategies {

    private TerminationStrategies() {
    }

    public static TerminationStrategy forCurrentPlatform(CommandRunner runner, SupervisorConfig config) {
        return forOs(System.getProperty("os.name", ""), runner, config);
    }

    static TerminationStrategy forOs(String osName, CommandRunner runner, SupervisorConfig config) {
        if (osName.toLowerCase().contains("win")) {
            return new WindowsTerminationStrategy(runner, config.getKillEscalationDelayMillis(),
                    config.getKillRetryDelayMillis());
        }
        return new PosixTerminationStrategy(runner, config.getKillEscalationDelayMillis());
    }
}
