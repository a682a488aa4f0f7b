package de.bsommerfeld.cortx.supervisor;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import de.bsommerfeld.cortx.supervisor.sink.ProcessEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single exit point from the supervisor to its {@link ProcessEventSink}.
 * Nothing is delivered once shutdown has begun, and a throwing sink is logged
 * and ignored.
 */
final class EventDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(EventDispatcher.class);

    private final ProcessEventSink sink;
    private final AtomicBoolean shutdown;

    EventDispatcher(ProcessEventSink sink, AtomicBoolean shutdown) {
        this.sink = sink;
        this.shutdown = shutdown;
    }

    void log(ProcessCategory category, String id, LogStream stream, String text) {
        if (shutdown.get())
            return;
        try {
            sink.onLog(category, id, stream, text);
        } catch (RuntimeException e) {
            LOG.warn("Sink rejected log line of {} '{}'", category, id, e);
        }
    }

    void status(ProcessCategory category, String id, LifecycleState state, Long pid, ProcessMetadata metadata) {
        if (shutdown.get())
            return;
        try {
            sink.onStatus(category, id, state, pid, metadata);
        } catch (RuntimeException e) {
            LOG.warn("Sink rejected status {} of {} '{}'", state, category, id, e);
        }
    }

    void exit(ProcessCategory category, String id, Integer exitCode, boolean success) {
        if (shutdown.get())
            return;
        try {
            sink.onExit(category, id, exitCode, success);
        } catch (RuntimeException e) {
            LOG.warn("Sink rejected exit of {} '{}'", category, id, e);
        }
    }
}
