package de.bsommerfeld.cortx.supervisor.exception;

/**
 * Thrown by a termination strategy when the kill utility could not be run or
 * reported an error. The supervisor only logs it; a stop still succeeds from
 * the caller's point of view.
 */
public class KillFailedException extends ProcessSupervisionException {

    private final long pid;

    public KillFailedException(long pid, String reason) {
        super(null, "Failed to kill process tree of PID " + pid + ": " + reason);
        this.pid = pid;
    }

    public KillFailedException(long pid, String reason, Throwable cause) {
        super(null, "Failed to kill process tree of PID " + pid + ": " + reason, cause);
        this.pid = pid;
    }

    public long getPid() {
        return pid;
    }
}
