package com.wardensystems.registry;

import java.time.Duration;

/**
 * Opaque handle to the execution unit running one service instance.
 */
public interface ExecutionHandle {

    /**
     * Returns the identifier of this unit; unique for every launch within one supervisor.
     *
     * @return the unit id
     */
    long id();

    /**
     * Returns true while the unit is running and has not been terminated.
     *
     * @return true if alive
     */
    boolean isAlive();

    /**
     * Forcibly terminates the unit. Idempotent.
     */
    void terminate();

    /**
     * Waits for the unit to exit.
     *
     * @param timeout the maximum time to wait
     * @return true if the unit exited within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;
}
