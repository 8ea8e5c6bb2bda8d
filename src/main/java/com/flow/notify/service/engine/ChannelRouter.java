package com.flow.notify.service.engine;

import com.flow.notify.service.model.NotificationEvent;

import java.util.List;

/**
 * Decides which channels an event targets.
 */
public interface ChannelRouter {

    /**
     * @param event the event
     * @return channel names, never empty
     */
    List<String> route(NotificationEvent event);
}
