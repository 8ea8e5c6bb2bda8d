package com.flow.notify.service.engine;

import com.flow.notify.service.model.NotificationEvent;

import java.util.List;

/**
 * Hand-off to the channel senders for events that passed the pipeline.
 *
 * Delivery and its retries belong to the senders.
 */
public interface NotificationSink {

    void deliver(NotificationEvent event, String fingerprint, List<String> channels);
}
