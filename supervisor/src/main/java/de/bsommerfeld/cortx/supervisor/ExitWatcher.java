package de.bsommerfeld.cortx.supervisor;

import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.util.Pauses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls one child for natural termination and reports it.
 *
 * <p>
 * The loop ends in one of three ways:
 * <ul>
 * <li><strong>suppressed</strong> when shutdown begins; shutdown kills the
 * child itself and nothing is reported</li>
 * <li><strong>removed</strong> when the registry no longer maps the id to this
 * handle, because a stop already reported it</li>
 * <li><strong>reporting</strong> when the child exited and this watcher won the
 * removal; terminal status and exit events follow</li>
 * </ul>
 * Winning {@link ProcessRegistry#removeIfSame} is what makes the terminal
 * events fire exactly once per launch.
 *
 * <p>
 * The pumps are drained <em>before</em> the entry is removed. Once
 * {@code isRunning} turns false every output line has been delivered, which
 * sequential group runs rely on. The cost is that an exited child whose pipes
 * are held open by a grandchild stays registered for up to the drain timeout.
 */
final class ExitWatcher implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ExitWatcher.class);

    private final ManagedProcess handle;
    private final ProcessRegistry registry;
    private final EventDispatcher events;
    private final AtomicBoolean shutdown;
    private final long pollIntervalMillis;
    private final long drainTimeoutMillis;

    ExitWatcher(ManagedProcess handle, ProcessRegistry registry, EventDispatcher events, AtomicBoolean shutdown,
            long pollIntervalMillis, long drainTimeoutMillis) {
        this.handle = handle;
        this.registry = registry;
        this.events = events;
        this.shutdown = shutdown;
        this.pollIntervalMillis = pollIntervalMillis;
        this.drainTimeoutMillis = drainTimeoutMillis;
    }

    @Override
    public void run() {
        while (!shutdown.get()) {
            if (!Pauses.sleep(pollIntervalMillis))
                return;
            if (!registry.isRegistered(handle))
                return;

            Integer exitCode;
            try {
                if (handle.process().isAlive())
                    continue;
                exitCode = handle.process().exitValue();
            } catch (RuntimeException e) {
                LOG.warn("Could not read exit status of {}, treating it as exited", handle, e);
                exitCode = null;
            }

            report(exitCode);
            return;
        }
    }

    private void report(Integer exitCode) {
        handle.awaitOutputDrained(drainTimeoutMillis);
        if (!registry.removeIfSame(handle))
            return;
        handle.closeOutput();

        boolean success = exitCode != null && exitCode == 0;
        LOG.info("{} exited with code {}", handle, exitCode);
        if (shutdown.get())
            return;

        events.status(handle.category(), handle.id(), LifecycleState.ofExit(handle.category(), success), null,
                handle.metadata());
        events.exit(handle.category(), handle.id(), exitCode, success);
    }
}
