package com.flow.notify.service.escalation;

public enum TargetType {
    USER,
    TEAM,
    CHANNEL,
    SCHEDULE,
    WEBHOOK,
    EMAIL,
    PHONE,
    CUSTOM
}
