package com.flow.notify.service.throttle;

import com.flow.notify.service.model.DeliveryTicket;
import com.flow.notify.service.model.NotificationEvent;

/**
 * Published when a queued or delayed event is released by its bucket.
 *
 * @param event the released event
 * @param fingerprint fingerprint computed at ingest
 * @param configId throttle config that held the event
 * @param channel channel for per-channel scopes, null for global scopes
 * @param ticket ticket of the ingest that produced the event
 */
public record ThrottleReleasedEvent(NotificationEvent event, String fingerprint, String configId, String channel,
                                    DeliveryTicket ticket) {
}
