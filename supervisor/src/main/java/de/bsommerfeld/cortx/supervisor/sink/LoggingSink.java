package de.bsommerfeld.cortx.supervisor.sink;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to SLF4J. Standard error lines are logged at WARN.
 */
public class LoggingSink implements ProcessEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingSink.class);

    @Override
    public void onLog(ProcessCategory category, String id, LogStream stream, String text) {
        if (stream == LogStream.STDERR) {
            LOG.warn("[{}] {}", id, text);
        } else {
            LOG.info("[{}] {}", id, text);
        }
    }

    @Override
    public void onStatus(ProcessCategory category, String id, LifecycleState state, Long pid,
            ProcessMetadata metadata) {
        if (pid != null) {
            LOG.info("[{}] {} (PID {})", id, state, pid);
        } else {
            LOG.info("[{}] {}", id, state);
        }
    }

    @Override
    public void onExit(ProcessCategory category, String id, Integer exitCode, boolean success) {
        LOG.info("[{}] exited with code {}{}", id, exitCode == null ? "unknown" : exitCode,
                success ? "" : " (failed)");
    }
}
