/**
 * Process supervision engine.
 *
 * <h2>Components</h2>
 * <ul>
 * <li>{@link de.bsommerfeld.cortx.supervisor.ProcessRegistry}: live processes
 * per {@link de.bsommerfeld.cortx.core.domain.ProcessCategory}, each category
 * with its own id namespace</li>
 * <li>{@link de.bsommerfeld.cortx.supervisor.ProcessSupervisor}: launch, stop,
 * group runs and shutdown</li>
 * <li>{@link de.bsommerfeld.cortx.supervisor.termination.TerminationStrategy}:
 * platform-specific process tree kill</li>
 * <li>{@link de.bsommerfeld.cortx.supervisor.sink.ProcessEventSink}: where log
 * lines and lifecycle transitions go</li>
 * </ul>
 *
 * <h2>Threads</h2>
 * Per live process two output pumps and one exit watcher run on the
 * supervisor's worker pool. They share nothing but the registry lock and the
 * shutdown flag. The registry lock is never held while a sink is called.
 *
 * <h2>Known limitation</h2>
 * No timeout applies to a supervised process. A child that never exits runs
 * until it is stopped or the supervisor shuts down.
 */
package de.bsommerfeld.cortx.supervisor;
