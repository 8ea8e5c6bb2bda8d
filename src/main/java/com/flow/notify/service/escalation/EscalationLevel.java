package com.flow.notify.service.escalation;

import java.util.List;

/**
 * One step of an escalation ladder.
 *
 * @param delayMinutes minutes to wait before this level is dispatched
 * @param targets recipients of this level
 * @param repeatCount extra dispatches of this level once it is the last one reached
 * @param repeatIntervalMinutes minutes between repeats; null means {@code delayMinutes}
 */
public record EscalationLevel(int delayMinutes, List<EscalationTarget> targets, int repeatCount,
                              Integer repeatIntervalMinutes) {

    public EscalationLevel {
        targets = targets != null ? List.copyOf(targets) : List.of();
    }

    public EscalationLevel(int delayMinutes, List<EscalationTarget> targets) {
        this(delayMinutes, targets, 0, null);
    }

    public int effectiveRepeatIntervalMinutes() {
        return repeatIntervalMinutes != null ? repeatIntervalMinutes : delayMinutes;
    }
}
