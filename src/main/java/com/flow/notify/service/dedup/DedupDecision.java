package com.flow.notify.service.dedup;

/**
 * Outcome of a dedup evaluation.
 */
public enum DedupDecision {
    PASS,
    SUPPRESS
}
