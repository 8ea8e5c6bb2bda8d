package com.flow.notify.service.scheduler;

import java.time.Instant;

/**
 * Process-wide timer facility.
 *
 * Used for escalation level advances, throttle queue drains and delayed
 * releases. Every task is keyed by the id of the state it touches; the task
 * itself must take that key's lock and check that its captured generation is
 * still current, so a late firing is harmless.
 */
public interface Scheduler {

    /**
     * Schedules a task to run at (or shortly after) {@code fireAt}.
     *
     * @param key the incident or bucket id the task belongs to
     * @param fireAt when to run; instants in the past run on the next tick
     * @param task the callback
     * @return a handle that can cancel the task
     */
    ScheduledTask schedule(String key, Instant fireAt, Runnable task);

    /**
     * Gets the number of tasks scheduled but not yet fired or cancelled.
     *
     * @return pending task count
     */
    int pendingCount();
}
