package de.bsommerfeld.cortx.supervisor.exception;

import de.bsommerfeld.cortx.core.domain.ProcessCategory;

/**
 * Thrown when a launch targets a (category, id) slot that is already taken.
 * No process has been spawned when this is thrown.
 */
public class AlreadyRunningException extends ProcessSupervisionException {

    private final ProcessCategory category;

    public AlreadyRunningException(ProcessCategory category, String entityId) {
        super(entityId, category + " '" + entityId + "' is already running");
        this.category = category;
    }

    public ProcessCategory getCategory() {
        return category;
    }
}
