package de.bsommerfeld.cortx.supervisor.sink;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import de.bsommerfeld.cortx.core.event.ApplicationEventBus;
import de.bsommerfeld.cortx.core.event.ProcessEvents;

/**
 * Republishes supervisor callbacks as {@link ProcessEvents} records on the
 * {@link ApplicationEventBus}, where UI controllers pick them up with
 * {@code @Subscribe}.
 */
@Singleton
public class EventBusSink implements ProcessEventSink {

    private final ApplicationEventBus eventBus;

    @Inject
    public EventBusSink(ApplicationEventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void onLog(ProcessCategory category, String id, LogStream stream, String text) {
        eventBus.post(new ProcessEvents.LogEvent(category, id, stream, text));
    }

    @Override
    public void onStatus(ProcessCategory category, String id, LifecycleState state, Long pid,
            ProcessMetadata metadata) {
        eventBus.post(new ProcessEvents.StatusEvent(category, id, state, pid, metadata));
    }

    @Override
    public void onExit(ProcessCategory category, String id, Integer exitCode, boolean success) {
        eventBus.post(new ProcessEvents.ExitEvent(category, id, exitCode, success));
    }
}
