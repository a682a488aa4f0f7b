package de.bsommerfeld.cortx.supervisor;

import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One supervised OS process plus its bookkeeping. The supervisor owns the
 * {@link Process} exclusively; nothing outside this package waits on or
 * signals it.
 */
public final class ManagedProcess {

    private static final Logger LOG = LoggerFactory.getLogger(ManagedProcess.class);

    private final ProcessCategory category;
    private final String id;
    private final Process process;
    private final long pid;
    private final ProcessMetadata metadata;
    private final List<Future<?>> pumps = new CopyOnWriteArrayList<>();
    private final Object outputLock = new Object();
    private boolean outputClosed;

    ManagedProcess(ProcessCategory category, String id, Process process, ProcessMetadata metadata) {
        this.category = category;
        this.id = id;
        this.process = process;
        this.pid = process.pid();
        this.metadata = metadata;
    }

    public ProcessCategory category() {
        return category;
    }

    public String id() {
        return id;
    }

    public long pid() {
        return pid;
    }

    public ProcessMetadata metadata() {
        return metadata;
    }

    Process process() {
        return process;
    }

    void attachPump(Future<?> pump) {
        pumps.add(pump);
    }

    /**
     * Waits until both output pumps have hit end-of-stream, at most
     * {@code timeoutMillis} in total. A grandchild that inherited the pipes can
     * keep them open after the child itself exited, hence the bound.
     */
    void awaitOutputDrained(long timeoutMillis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        for (Future<?> pump : pumps) {
            long remaining = deadline - System.nanoTime();
            try {
                pump.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                LOG.debug("Output of {} '{}' still open after exit, not waiting any longer", category, id);
                return;
            } catch (ExecutionException e) {
                LOG.warn("Output pump of {} '{}' failed", category, id, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Runs {@code delivery} unless the output has been closed. Holding the
     * lock during delivery guarantees that no line is delivered once
     * {@link #closeOutput()} has returned.
     */
    void deliverOutput(Runnable delivery) {
        synchronized (outputLock) {
            if (!outputClosed)
                delivery.run();
        }
    }

    /** Discards all further output; called right before the terminal status. */
    void closeOutput() {
        synchronized (outputLock) {
            outputClosed = true;
        }
    }

    /**
     * Forcibly destroys the owned child and reaps it. Used as a fallback after
     * the termination strategy has signalled the whole tree.
     */
    void destroyAndWait(long timeoutMillis) {
        process.destroyForcibly();
        try {
            if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                LOG.warn("{} '{}' (PID {}) did not exit within {} ms after SIGKILL", category, id, pid,
                        timeoutMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return category + " '" + id + "' (PID " + pid + ")";
    }
}
