package de.bsommerfeld.cortx.core.domain;

/**
 * Lifecycle of one launch.
 *
 * <p>
 * Services move through {@link #STARTING} → {@link #RUNNING} →
 * {@link #STOPPED}. Scripts skip {@code STARTING} and end in either
 * {@link #COMPLETED} (exit code 0) or {@link #FAILED} (anything else,
 * including a user-initiated stop).
 */
public enum LifecycleState {

    STARTING,
    RUNNING,
    STOPPED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == COMPLETED || this == FAILED;
    }

    /**
     * Terminal state reported when the process ended on its own.
     *
     * @param category category of the entity
     * @param success  {@code true} if the exit code was exactly 0
     */
    public static LifecycleState ofExit(ProcessCategory category, boolean success) {
        if (category.isService())
            return STOPPED;
        return success ? COMPLETED : FAILED;
    }

    /**
     * Terminal state reported when the caller stopped the process. A stop is
     * never reported as a successful completion.
     */
    public static LifecycleState ofStop(ProcessCategory category) {
        return category.isService() ? STOPPED : FAILED;
    }
}
