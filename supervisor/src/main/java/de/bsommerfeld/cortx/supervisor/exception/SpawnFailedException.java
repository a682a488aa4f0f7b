package de.bsommerfeld.cortx.supervisor.exception;

/**
 * Thrown when the OS refused to start the process: program not found,
 * permission denied, bad working directory. The entity is immediately
 * re-launchable afterwards.
 */
public class SpawnFailedException extends ProcessSupervisionException {

    public SpawnFailedException(String entityId, String reason) {
        super(entityId, "Failed to start '" + entityId + "': " + reason);
    }

    public SpawnFailedException(String entityId, String reason, Throwable cause) {
        super(entityId, "Failed to start '" + entityId + "': " + reason, cause);
    }
}
