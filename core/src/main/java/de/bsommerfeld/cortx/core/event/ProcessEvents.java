package de.bsommerfeld.cortx.core.event;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;

/**
 * Process lifecycle events as they travel to presentation layers. The
 * supervisor creates them, a sink adapter delivers each one exactly once.
 * Nothing here is persisted.
 */
public final class ProcessEvents {

    private ProcessEvents() {
    }

    /**
     * Common shape of all process events, so listeners can subscribe once and
     * switch on the concrete record.
     */
    public sealed interface ProcessEvent permits LogEvent, StatusEvent, ExitEvent {

        ProcessCategory category();

        String id();
    }

    /** One complete line read from the process output. */
    public record LogEvent(ProcessCategory category, String id, LogStream stream, String text)
            implements ProcessEvent {
    }

    /**
     * Lifecycle transition. {@code pid} is only set while the process is alive
     * ({@link LifecycleState#RUNNING}).
     */
    public record StatusEvent(ProcessCategory category, String id, LifecycleState state, Long pid,
            ProcessMetadata metadata) implements ProcessEvent {
    }

    /**
     * Natural termination. {@code exitCode} is {@code null} when the exit status
     * could not be read. Processes ended by a signal report 128 plus the signal
     * number on POSIX systems.
     */
    public record ExitEvent(ProcessCategory category, String id, Integer exitCode, boolean success)
            implements ProcessEvent {
    }
}
