package com.flow.notify.service.escalation;

/**
 * Numeric payload attribute whose value above {@code limit} escalates immediately.
 */
public record ThresholdBreach(String metric, double limit) {
}
