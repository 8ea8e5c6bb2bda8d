package com.flow.notify.service.escalation;

/**
 * Recipient notified when an escalation level is reached.
 *
 * @param type target kind
 * @param identifier user name, channel id, address or URL
 * @param name optional display name
 */
public record EscalationTarget(TargetType type, String identifier, String name) {
}
