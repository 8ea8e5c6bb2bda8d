package com.flow.notify.service.dedup;

/**
 * Read-only dedup statistics for one configuration.
 *
 * @param configId config id
 * @param totalReceived events evaluated
 * @param totalDeduplicated events suppressed
 * @param totalPassed events passed
 * @param dedupRate suppressed / received, 0 when nothing was received
 * @param trackedFingerprints fingerprints with live window state
 */
public record DedupStats(
        String configId,
        long totalReceived,
        long totalDeduplicated,
        long totalPassed,
        double dedupRate,
        int trackedFingerprints
) {
}
