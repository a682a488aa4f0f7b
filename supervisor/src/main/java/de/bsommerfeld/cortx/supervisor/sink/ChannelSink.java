package de.bsommerfeld.cortx.supervisor.sink;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import de.bsommerfeld.cortx.core.event.ProcessEvents;
import de.bsommerfeld.cortx.core.event.ProcessEvents.ProcessEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Hands events to a consumer loop through a {@link BlockingQueue}, for
 * terminal front ends that render on their own thread.
 *
 * <p>
 * Events of categories outside the accepted set are dropped. The sink never
 * blocks: when a bounded queue is full the event is discarded with a warning.
 */
public class ChannelSink implements ProcessEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelSink.class);

    private final BlockingQueue<ProcessEvent> channel;
    private final Set<ProcessCategory> accepted;

    public ChannelSink(BlockingQueue<ProcessEvent> channel, Set<ProcessCategory> accepted) {
        this.channel = channel;
        this.accepted = accepted.isEmpty() ? EnumSet.noneOf(ProcessCategory.class) : EnumSet.copyOf(accepted);
    }

    /** Unbounded channel accepting every category. */
    public static ChannelSink unbounded() {
        return new ChannelSink(new LinkedBlockingQueue<>(), EnumSet.allOf(ProcessCategory.class));
    }

    /** Unbounded channel that only forwards the given categories. */
    public static ChannelSink unbounded(ProcessCategory first, ProcessCategory... rest) {
        return new ChannelSink(new LinkedBlockingQueue<>(), EnumSet.of(first, rest));
    }

    public BlockingQueue<ProcessEvent> channel() {
        return channel;
    }

    @Override
    public void onLog(ProcessCategory category, String id, LogStream stream, String text) {
        offer(new ProcessEvents.LogEvent(category, id, stream, text));
    }

    @Override
    public void onStatus(ProcessCategory category, String id, LifecycleState state, Long pid,
            ProcessMetadata metadata) {
        offer(new ProcessEvents.StatusEvent(category, id, state, pid, metadata));
    }

    @Override
    public void onExit(ProcessCategory category, String id, Integer exitCode, boolean success) {
        offer(new ProcessEvents.ExitEvent(category, id, exitCode, success));
    }

    private void offer(ProcessEvent event) {
        if (!accepted.contains(event.category()))
            return;
        if (!channel.offer(event)) {
            LOG.warn("Event channel full, dropping {}", event);
        }
    }
}
