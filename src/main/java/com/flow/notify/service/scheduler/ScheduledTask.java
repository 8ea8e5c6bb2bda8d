package com.flow.notify.service.scheduler;

import java.time.Instant;

/**
 * Handle to a scheduled callback.
 */
public interface ScheduledTask {

    String key();

    Instant fireAt();

    /**
     * Cancels the task. Idempotent; returns false if it already fired or was cancelled.
     */
    boolean cancel();

    boolean isCancelled();
}
