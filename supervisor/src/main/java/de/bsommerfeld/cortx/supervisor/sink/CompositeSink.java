package de.bsommerfeld.cortx.supervisor.sink;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Fans each event out to several sinks in order. A failing sink does not
 * prevent delivery to the ones after it.
 */
public class CompositeSink implements ProcessEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(CompositeSink.class);

    private final List<ProcessEventSink> sinks;

    public CompositeSink(List<ProcessEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public static CompositeSink of(ProcessEventSink... sinks) {
        return new CompositeSink(List.of(sinks));
    }

    @Override
    public void onLog(ProcessCategory category, String id, LogStream stream, String text) {
        forEach(sink -> sink.onLog(category, id, stream, text));
    }

    @Override
    public void onStatus(ProcessCategory category, String id, LifecycleState state, Long pid,
            ProcessMetadata metadata) {
        forEach(sink -> sink.onStatus(category, id, state, pid, metadata));
    }

    @Override
    public void onExit(ProcessCategory category, String id, Integer exitCode, boolean success) {
        forEach(sink -> sink.onExit(category, id, exitCode, success));
    }

    private void forEach(Consumer<ProcessEventSink> delivery) {
        for (ProcessEventSink sink : sinks) {
            try {
                delivery.accept(sink);
            } catch (RuntimeException e) {
                LOG.warn("Sink {} failed", sink.getClass().getName(), e);
            }
        }
    }
}
