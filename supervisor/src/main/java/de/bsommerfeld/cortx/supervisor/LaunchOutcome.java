package de.bsommerfeld.cortx.supervisor;

import de.bsommerfeld.cortx.supervisor.exception.ProcessSupervisionException;

/**
 * Immediate result of one launch within a group run. Exactly one of
 * {@code pid} and {@code error} is set.
 */
public record LaunchOutcome(String id, Long pid, ProcessSupervisionException error) {

    public static LaunchOutcome launched(String id, long pid) {
        return new LaunchOutcome(id, pid, null);
    }

    public static LaunchOutcome failed(String id, ProcessSupervisionException error) {
        return new LaunchOutcome(id, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
