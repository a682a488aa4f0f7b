package de.bsommerfeld.cortx.core.domain;

/**
 * Namespace an entity id belongs to. Every category owns an independent set of
 * ids, so the same id may be running as a service and as a global script at
 * the same time.
 */
public enum ProcessCategory {

    /** Long-running project service, e.g. a dev server. */
    SERVICE,

    /** One-shot script attached to a project. */
    PROJECT_SCRIPT,

    /** One-shot script from the global script library. */
    GLOBAL_SCRIPT;

    public boolean isService() {
        return this == SERVICE;
    }
}
