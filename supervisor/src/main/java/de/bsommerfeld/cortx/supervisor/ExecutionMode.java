package de.bsommerfeld.cortx.supervisor;

/**
 * How {@link ProcessSupervisor#runGroup} schedules its entries.
 */
public enum ExecutionMode {

    /** One after another; each entry must exit before the next is launched. */
    SEQUENTIAL,

    /** All at once, without waiting for any of them. */
    PARALLEL
}
