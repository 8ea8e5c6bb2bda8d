package com.flow.notify.service.throttle;

/**
 * Unit a rate limit is enforced over.
 */
public enum ThrottleScope {
    GLOBAL,
    PER_CHANNEL;

    public static final String GLOBAL_KEY = "global";
}
