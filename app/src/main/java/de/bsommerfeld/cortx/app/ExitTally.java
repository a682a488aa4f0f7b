package de.bsommerfeld.cortx.app;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.cortx.core.event.ProcessEvents;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects the exit results of the commands a CLI run launched.
 */
final class ExitTally {

    private final Map<String, Boolean> results = new ConcurrentHashMap<>();

    @Subscribe
    public void onExit(ProcessEvents.ExitEvent event) {
        results.put(event.id(), event.success());
    }

    boolean hasAll(Collection<String> ids) {
        return results.keySet().containsAll(ids);
    }

    /** {@code true} only if every id exited and did so successfully. */
    boolean allSucceeded(Collection<String> ids) {
        return ids.stream().allMatch(id -> Boolean.TRUE.equals(results.get(id)));
    }
}
