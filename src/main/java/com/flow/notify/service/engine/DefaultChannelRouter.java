package com.flow.notify.service.engine;

import com.flow.notify.service.config.NotifyConfig;
import com.flow.notify.service.model.NotificationEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes to the event's own channel hint, else to the configured default channels.
 */
@Component
@RequiredArgsConstructor
public class DefaultChannelRouter implements ChannelRouter {

    private final NotifyConfig notifyConfig;

    @Override
    public List<String> route(NotificationEvent event) {
        if (!event.channels().isEmpty()) {
            return event.channels();
        }
        return List.copyOf(notifyConfig.getDefaultChannels());
    }
}
