package de.bsommerfeld.cortx.supervisor.sink;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CompositeSinkTest {

    @Test
    void onStatus_shouldReachEverySink() {
        ProcessEventSink first = mock(ProcessEventSink.class);
        ProcessEventSink second = mock(ProcessEventSink.class);

        CompositeSink.of(first, second).onStatus(ProcessCategory.SERVICE, "api", LifecycleState.STOPPED, null,
                ProcessMetadata.NONE);

        verify(first).onStatus(ProcessCategory.SERVICE, "api", LifecycleState.STOPPED, null, ProcessMetadata.NONE);
        verify(second).onStatus(ProcessCategory.SERVICE, "api", LifecycleState.STOPPED, null, ProcessMetadata.NONE);
    }

    @Test
    void onLog_shouldContinueAfterFailingSink() {
        ProcessEventSink failing = mock(ProcessEventSink.class);
        ProcessEventSink healthy = mock(ProcessEventSink.class);
        doThrow(new IllegalStateException("ui gone")).when(failing).onLog(any(), any(), any(), any());

        assertDoesNotThrow(() -> CompositeSink.of(failing, healthy)
                .onLog(ProcessCategory.GLOBAL_SCRIPT, "job", LogStream.STDOUT, "line"));

        verify(healthy).onLog(ProcessCategory.GLOBAL_SCRIPT, "job", LogStream.STDOUT, "line");
    }

    @Test
    void loggingSink_shouldAcceptEveryEvent() {
        LoggingSink sink = new LoggingSink();

        assertDoesNotThrow(() -> {
            sink.onLog(ProcessCategory.SERVICE, "api", LogStream.STDERR, "oops");
            sink.onStatus(ProcessCategory.SERVICE, "api", LifecycleState.RUNNING, 1L, ProcessMetadata.NONE);
            sink.onExit(ProcessCategory.SERVICE, "api", null, false);
        });
    }
}
