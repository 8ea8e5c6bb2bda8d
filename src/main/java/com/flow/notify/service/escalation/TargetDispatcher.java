package com.flow.notify.service.escalation;

/**
 * Delivers escalation notifications to external targets.
 *
 * Called off the escalator's lock on the dispatch executor. Implementations own
 * their retry policy; a thrown exception is recorded on the incident as a
 * dispatch failure and does not affect the escalation schedule.
 */
public interface TargetDispatcher {

    void dispatch(DispatchRequest request);
}
