package com.flow.notify.service.throttle;

public enum ThrottleOutcome {
    PASS,
    QUEUED,
    DELAYED,
    REJECTED
}
