package de.bsommerfeld.cortx.supervisor.sink;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import de.bsommerfeld.cortx.core.event.ApplicationEventBus;
import de.bsommerfeld.cortx.core.event.ProcessEvents;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

class EventBusSinkTest {

    private final ApplicationEventBus eventBus = mock(ApplicationEventBus.class);
    private final EventBusSink sink = new EventBusSink(eventBus);

    @Test
    void onLog_shouldPostLogEvent() {
        sink.onLog(ProcessCategory.SERVICE, "api", LogStream.STDERR, "warning");

        verify(eventBus).post(new ProcessEvents.LogEvent(ProcessCategory.SERVICE, "api", LogStream.STDERR, "warning"));
    }

    @Test
    void onStatus_shouldPostStatusEventWithMetadata() {
        ProcessMetadata metadata = ProcessMetadata.of("dev", "default");

        sink.onStatus(ProcessCategory.SERVICE, "api", LifecycleState.RUNNING, 7L, metadata);

        verify(eventBus).post(new ProcessEvents.StatusEvent(ProcessCategory.SERVICE, "api", LifecycleState.RUNNING,
                7L, metadata));
    }

    @Test
    void onExit_shouldPostExitEvent() {
        sink.onExit(ProcessCategory.GLOBAL_SCRIPT, "job", null, false);

        verify(eventBus).post(new ProcessEvents.ExitEvent(ProcessCategory.GLOBAL_SCRIPT, "job", null, false));
    }
}
