package de.bsommerfeld.cortx.supervisor.sink;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import de.bsommerfeld.cortx.core.event.ProcessEvents.ExitEvent;
import de.bsommerfeld.cortx.core.event.ProcessEvents.LogEvent;
import de.bsommerfeld.cortx.core.event.ProcessEvents.ProcessEvent;
import de.bsommerfeld.cortx.core.event.ProcessEvents.StatusEvent;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.concurrent.ArrayBlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

class ChannelSinkTest {

    @Test
    void events_shouldArriveInOrder() {
        ChannelSink sink = ChannelSink.unbounded();

        sink.onLog(ProcessCategory.PROJECT_SCRIPT, "test", LogStream.STDOUT, "ok");
        sink.onStatus(ProcessCategory.PROJECT_SCRIPT, "test", LifecycleState.COMPLETED, null, ProcessMetadata.NONE);
        sink.onExit(ProcessCategory.PROJECT_SCRIPT, "test", 0, true);

        assertInstanceOf(LogEvent.class, sink.channel().poll());
        assertInstanceOf(StatusEvent.class, sink.channel().poll());
        ExitEvent exit = assertInstanceOf(ExitEvent.class, sink.channel().poll());
        assertEquals(0, exit.exitCode());
        assertTrue(exit.success());
    }

    @Test
    void filter_shouldDropOtherCategories() {
        ChannelSink sink = ChannelSink.unbounded(ProcessCategory.GLOBAL_SCRIPT);

        sink.onLog(ProcessCategory.SERVICE, "api", LogStream.STDOUT, "hidden");
        sink.onLog(ProcessCategory.GLOBAL_SCRIPT, "job", LogStream.STDOUT, "shown");

        assertEquals(1, sink.channel().size());
        assertEquals("job", sink.channel().peek().id());
    }

    @Test
    void fullChannel_shouldDropInsteadOfBlocking() {
        var queue = new ArrayBlockingQueue<ProcessEvent>(1);
        ChannelSink sink = new ChannelSink(queue, EnumSet.allOf(ProcessCategory.class));

        sink.onLog(ProcessCategory.SERVICE, "api", LogStream.STDOUT, "first");
        assertDoesNotThrow(() -> sink.onLog(ProcessCategory.SERVICE, "api", LogStream.STDOUT, "second"));

        assertEquals(1, queue.size());
        assertEquals("first", ((LogEvent) queue.peek()).text());
    }
}
