package de.bsommerfeld.cortx.supervisor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cortx.core.config.SupervisorConfig;
import de.bsommerfeld.cortx.core.domain.LifecycleState;
import de.bsommerfeld.cortx.core.domain.LogStream;
import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.util.Pauses;
import de.bsommerfeld.cortx.supervisor.exception.AlreadyRunningException;
import de.bsommerfeld.cortx.supervisor.exception.KillFailedException;
import de.bsommerfeld.cortx.supervisor.exception.NotRunningException;
import de.bsommerfeld.cortx.supervisor.exception.ProcessSupervisionException;
import de.bsommerfeld.cortx.supervisor.exception.SpawnFailedException;
import de.bsommerfeld.cortx.supervisor.sink.ProcessEventSink;
import de.bsommerfeld.cortx.supervisor.termination.TerminationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Launches, watches and stops long-running services and one-shot scripts.
 *
 * <p>
 * Every launched process gets two output pumps and one exit watcher on a
 * shared pool of daemon threads. Lifecycle transitions and output lines are
 * reported to the {@link ProcessEventSink}; the terminal transition of a launch
 * is reported exactly once, either by {@link #stop} or by the exit watcher,
 * whichever removes the registry entry first.
 *
 * <p>
 * After {@link #shutdown()} nothing is reported anymore and new launches are
 * rejected.
 */
@Singleton
public class ProcessSupervisor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final long REAP_TIMEOUT_MILLIS = 5_000;

    private final ProcessRegistry registry = new ProcessRegistry();
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private final EventDispatcher events;
    private final TerminationStrategy termination;
    private final ProcessEnvironment environment;
    private final SupervisorConfig config;
    private final ExecutorService workers = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("cortx-worker-%d").setDaemon(true).build());

    @Inject
    public ProcessSupervisor(ProcessEventSink sink, TerminationStrategy termination, SupervisorConfig config) {
        this.events = new EventDispatcher(sink, shutdown);
        this.termination = termination;
        this.environment = new ProcessEnvironment(config);
        this.config = config;
    }

    // =====================================================================
    // Launch / Stop
    // =====================================================================

    /**
     * Spawns the process described by {@code spec} and starts watching it.
     *
     * @return OS process id of the new process
     * @throws AlreadyRunningException if the (category, id) slot is taken;
     *                                 nothing is spawned
     * @throws SpawnFailedException    if the OS refused to start the process
     *                                 or the supervisor is shut down
     */
    public long launch(LaunchSpec spec) throws AlreadyRunningException, SpawnFailedException {
        ProcessCategory category = spec.category();
        String id = spec.id();
        if (shutdown.get())
            throw new SpawnFailedException(id, "supervisor is shut down");

        registry.reserve(category, id);
        ManagedProcess handle;
        try {
            if (category.isService()) {
                events.status(category, id, LifecycleState.STARTING, null, spec.metadata());
            }
            handle = spawn(spec);
            try {
                registry.register(handle);
            } catch (AlreadyRunningException e) {
                handle.destroyAndWait(REAP_TIMEOUT_MILLIS);
                throw e;
            }
        } finally {
            registry.release(category, id);
        }

        if (shutdown.get()) {
            // Shutdown snapshotted the registry before we registered
            registry.removeIfSame(handle);
            handle.destroyAndWait(REAP_TIMEOUT_MILLIS);
            throw new SpawnFailedException(id, "supervisor is shut down");
        }

        LOG.info("Started {} '{}' (PID {}): {}", category, id, handle.pid(), spec.command());
        events.status(category, id, LifecycleState.RUNNING, handle.pid(), spec.metadata());

        try {
            Process process = handle.process();
            handle.attachPump(workers.submit(new OutputPump(handle, LogStream.STDOUT, process.getInputStream(), events)));
            handle.attachPump(workers.submit(new OutputPump(handle, LogStream.STDERR, process.getErrorStream(), events)));
            workers.submit(new ExitWatcher(handle, registry, events, shutdown, config.getPollIntervalMillis(),
                    config.getOutputDrainTimeoutMillis()));
        } catch (RejectedExecutionException e) {
            registry.removeIfSame(handle);
            handle.destroyAndWait(REAP_TIMEOUT_MILLIS);
            throw new SpawnFailedException(id, "supervisor is shut down", e);
        }
        return handle.pid();
    }

    private ManagedProcess spawn(LaunchSpec spec) throws SpawnFailedException {
        if (!Files.isDirectory(spec.workingDirectory())) {
            throw new SpawnFailedException(spec.id(), "working directory " + spec.workingDirectory() + " does not exist");
        }

        ProcessBuilder pb = new ProcessBuilder(spec.command());
        pb.directory(spec.workingDirectory().toFile());
        environment.apply(pb.environment(), spec.environment());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            LOG.warn("Could not start {} '{}': {}", spec.category(), spec.id(), e.getMessage());
            throw new SpawnFailedException(spec.id(), e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            LOG.debug("Could not close stdin of {}", spec.id(), e);
        }
        return new ManagedProcess(spec.category(), spec.id(), process, spec.metadata());
    }

    /**
     * Stops the entity and its whole process tree. A stop is never reported as
     * a successful completion. Output still buffered in the pipes is delivered
     * before the terminal status, anything after it is dropped.
     *
     * @throws NotRunningException if nothing is registered under the id
     */
    public void stop(ProcessCategory category, String id) throws NotRunningException {
        ManagedProcess handle = registry.remove(category, id)
                .orElseThrow(() -> new NotRunningException(category, id));

        LOG.info("Stopping {}", handle);
        try {
            termination.kill(handle.pid());
        } catch (KillFailedException e) {
            LOG.warn(e.getMessage(), e.getCause());
        }
        handle.destroyAndWait(REAP_TIMEOUT_MILLIS);

        // Lines still buffered in the pipes belong before the terminal status
        handle.awaitOutputDrained(config.getOutputDrainTimeoutMillis());
        handle.closeOutput();
        events.status(category, id, LifecycleState.ofStop(category), null, handle.metadata());
    }

    // =====================================================================
    // Queries
    // =====================================================================

    public boolean isRunning(ProcessCategory category, String id) {
        return registry.contains(category, id);
    }

    /** Sorted ids of the running entities of one category. */
    public List<String> listRunning(ProcessCategory category) {
        return registry.list(category);
    }

    /** {@code true} if anything is running in any category. */
    public boolean hasRunningProcesses() {
        return !registry.isEmpty();
    }

    // =====================================================================
    // Groups
    // =====================================================================

    /**
     * Runs several launches as one unit.
     *
     * <p>
     * In {@link ExecutionMode#SEQUENTIAL} mode each entry must exit before the
     * next one is launched; with {@code stopOnFailure} the first failed launch
     * ends the group. Only launch failures count, a script that exits non-zero
     * does not stop the group. Interrupting the calling thread ends the wait
     * and the group, with the interrupt flag restored.
     *
     * @return one outcome per attempted entry, in order
     */
    public List<LaunchOutcome> runGroup(List<LaunchSpec> specs, ExecutionMode mode, boolean stopOnFailure) {
        List<LaunchOutcome> outcomes = new ArrayList<>(specs.size());
        for (LaunchSpec spec : specs) {
            LaunchOutcome outcome = tryLaunch(spec);
            outcomes.add(outcome);

            if (mode == ExecutionMode.PARALLEL)
                continue;
            if (!outcome.isSuccess()) {
                if (stopOnFailure)
                    break;
                continue;
            }
            if (!awaitExit(spec)) {
                LOG.info("Group run interrupted after '{}'", spec.id());
                break;
            }
        }
        return outcomes;
    }

    private LaunchOutcome tryLaunch(LaunchSpec spec) {
        try {
            return LaunchOutcome.launched(spec.id(), launch(spec));
        } catch (ProcessSupervisionException e) {
            LOG.warn(e.getMessage());
            return LaunchOutcome.failed(spec.id(), e);
        }
    }

    /** @return {@code false} if the wait was interrupted */
    private boolean awaitExit(LaunchSpec spec) {
        while (isRunning(spec.category(), spec.id())) {
            if (!Pauses.sleep(config.getPollIntervalMillis()))
                return false;
        }
        return true;
    }

    // =====================================================================
    // Shutdown
    // =====================================================================

    /**
     * Kills every supervised process tree and stops reporting. Only the first
     * call does anything; later calls return immediately.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true))
            return;

        LOG.info("Shutting down, stopping all services and scripts");
        Pauses.sleep(config.getShutdownGraceMillis());

        List<ManagedProcess> running = registry.snapshot();
        for (ManagedProcess handle : running) {
            LOG.info("Killing {}", handle);
            termination.killRobustly(handle.pid());
        }

        for (ManagedProcess handle : registry.drain()) {
            handle.destroyAndWait(REAP_TIMEOUT_MILLIS);
        }

        // Second pass for grandchildren that were re-parented while the first pass ran
        for (ManagedProcess handle : running) {
            termination.killRobustly(handle.pid());
        }

        workers.shutdownNow();
        LOG.info("All services and scripts stopped");
    }

    @Override
    public void close() {
        shutdown();
    }
}
