package de.bsommerfeld.cortx.supervisor.termination;

import java.io.IOException;
import java.util.List;

/**
 * Runs a short-lived OS utility ({@code kill}, {@code taskkill}, ...) and
 * collects its result.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param command program followed by its arguments
     * @throws IOException if the utility cannot be started or does not finish
     *                     in time
     */
    CommandResult run(List<String> command) throws IOException;
}
