package de.bsommerfeld.cortx.supervisor;

import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.supervisor.exception.AlreadyRunningException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Table of live processes, partitioned by {@link ProcessCategory}.
 *
 * <p>
 * An id is registered in a category if and only if a process for it is
 * believed alive; absence is the single source of truth for "not running".
 * Between the check and the spawn a launch holds a <em>reservation</em> so that
 * two concurrent launches of the same id cannot both pass the check.
 *
 * <p>
 * One lock guards every map. Callers must not invoke event sinks while
 * holding it; no method here calls out.
 */
public final class ProcessRegistry {

    private final Object lock = new Object();
    private final Map<ProcessCategory, Map<String, ManagedProcess>> processes = new EnumMap<>(ProcessCategory.class);
    private final Map<ProcessCategory, Set<String>> reservations = new EnumMap<>(ProcessCategory.class);

    public ProcessRegistry() {
        for (ProcessCategory category : ProcessCategory.values()) {
            processes.put(category, new HashMap<>());
            reservations.put(category, new HashSet<>());
        }
    }

    /**
     * Claims the slot for a launch in progress.
     *
     * @throws AlreadyRunningException if the id is registered or reserved
     */
    public void reserve(ProcessCategory category, String id) throws AlreadyRunningException {
        synchronized (lock) {
            if (processes.get(category).containsKey(id) || !reservations.get(category).add(id)) {
                throw new AlreadyRunningException(category, id);
            }
        }
    }

    /** Gives up a reservation after a failed spawn. */
    public void release(ProcessCategory category, String id) {
        synchronized (lock) {
            reservations.get(category).remove(id);
        }
    }

    /**
     * Registers a spawned process, consuming the reservation for its id if
     * there is one.
     *
     * @throws AlreadyRunningException if another process is registered under
     *                                 the same id
     */
    public void register(ManagedProcess handle) throws AlreadyRunningException {
        synchronized (lock) {
            Map<String, ManagedProcess> byId = processes.get(handle.category());
            if (byId.containsKey(handle.id())) {
                throw new AlreadyRunningException(handle.category(), handle.id());
            }
            reservations.get(handle.category()).remove(handle.id());
            byId.put(handle.id(), handle);
        }
    }

    public Optional<ManagedProcess> remove(ProcessCategory category, String id) {
        synchronized (lock) {
            return Optional.ofNullable(processes.get(category).remove(id));
        }
    }

    /**
     * Removes the entry only if it still maps to this exact handle. An old
     * exit watcher must not evict a newer launch that reused the id.
     *
     * @return {@code true} if this call removed the handle
     */
    public boolean removeIfSame(ManagedProcess handle) {
        synchronized (lock) {
            return processes.get(handle.category()).remove(handle.id(), handle);
        }
    }

    /** {@code true} if the id currently maps to this exact handle. */
    public boolean isRegistered(ManagedProcess handle) {
        synchronized (lock) {
            return processes.get(handle.category()).get(handle.id()) == handle;
        }
    }

    public boolean contains(ProcessCategory category, String id) {
        synchronized (lock) {
            return processes.get(category).containsKey(id);
        }
    }

    /** Sorted snapshot of the registered ids of one category. */
    public List<String> list(ProcessCategory category) {
        synchronized (lock) {
            List<String> ids = new ArrayList<>(processes.get(category).keySet());
            ids.sort(null);
            return ids;
        }
    }

    /** Snapshot of every registered process across all categories. */
    public List<ManagedProcess> snapshot() {
        synchronized (lock) {
            List<ManagedProcess> all = new ArrayList<>();
            processes.values().forEach(byId -> all.addAll(byId.values()));
            return all;
        }
    }

    /** Removes and returns every registered process. Reservations survive. */
    public List<ManagedProcess> drain() {
        synchronized (lock) {
            List<ManagedProcess> all = new ArrayList<>();
            for (Map<String, ManagedProcess> byId : processes.values()) {
                all.addAll(byId.values());
                byId.clear();
            }
            return all;
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return processes.values().stream().allMatch(Map::isEmpty);
        }
    }
}
