package de.bsommerfeld.cortx.supervisor.exception;

/**
 * Base of all failures the supervisor reports to its callers.
 */
public class ProcessSupervisionException extends Exception {

    private final String entityId;

    public ProcessSupervisionException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    public ProcessSupervisionException(String entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    /**
     * @return id of the affected entity, or {@code null} if the failure is not
     *         tied to one
     */
    public String getEntityId() {
        return entityId;
    }
}
