package de.bsommerfeld.cortx.supervisor.exception;

import de.bsommerfeld.cortx.core.domain.ProcessCategory;

/**
 * Thrown when a stop targets an entity that is not registered. Callers can
 * treat this as "already stopped".
 */
public class NotRunningException extends ProcessSupervisionException {

    private final ProcessCategory category;

    public NotRunningException(ProcessCategory category, String entityId) {
        super(entityId, category + " '" + entityId + "' is not running");
        this.category = category;
    }

    public ProcessCategory getCategory() {
        return category;
    }
}
