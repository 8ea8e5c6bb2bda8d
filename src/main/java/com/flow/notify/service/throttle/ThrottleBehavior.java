package com.flow.notify.service.throttle;

/**
 * What happens to an event once its scope is over the limit.
 */
public enum ThrottleBehavior {
    /** Reject with no further action. */
    DROP,
    /** Buffer in a bounded FIFO; the oldest entry is evicted on overflow. */
    QUEUE,
    /** Defer until the next eligible time; rejected once the buffer is full. */
    DELAY,
    /** Signal an explicit throttling error to the caller. */
    RAISE_ERROR
}
