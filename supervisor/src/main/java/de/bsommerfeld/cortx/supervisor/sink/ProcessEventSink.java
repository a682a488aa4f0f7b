package de.bsommerfeld.cortx.supervisor.sink;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;

/**
 * Receives log lines and lifecycle transitions from the supervisor.
 *
 * <p>
 * Implementations are called from pump and exit-watch threads concurrently
 * and must be thread-safe. They should return quickly; a slow sink delays the
 * pump that feeds it. Runtime exceptions thrown here are logged by the
 * supervisor and otherwise ignored.
 */
public interface ProcessEventSink {

    void onLog(ProcessCategory category, String id, LogStream stream, String text);

    /**
     * @param pid set only for {@link LifecycleState#RUNNING}
     */
    void onStatus(ProcessCategory category, String id, LifecycleState state, Long pid, ProcessMetadata metadata);

    /**
     * @param exitCode {@code null} if the exit status could not be read
     */
    void onExit(ProcessCategory category, String id, Integer exitCode, boolean success);
}
