package com.flow.notify.service.throttle;

/**
 * Read-only throttling statistics for one configuration, summed over its scopes.
 */
public record ThrottleStats(
        String configId,
        long totalReceived,
        long totalThrottled,
        long totalPassed,
        long totalReleased,
        long currentWindowCount,
        int queueDepth,
        int scopes
) {
}
