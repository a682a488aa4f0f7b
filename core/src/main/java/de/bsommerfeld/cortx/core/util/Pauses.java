package de.bsommerfeld.cortx.core.util;

import java.util.concurrent.TimeUnit;

/**
 * Interrupt-aware sleeping for polling loops and kill escalation delays.
 */
public final class Pauses {

    private Pauses() {
    }

    /**
     * Sleeps for the given duration. An interrupt ends the pause early and is
     * re-asserted on the current thread.
     *
     * @return {@code false} if the pause was interrupted
     */
    public static boolean sleep(long millis) {
        if (millis <= 0)
            return !Thread.currentThread().isInterrupted();
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
