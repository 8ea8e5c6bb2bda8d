package com.flow.notify.service.engine;

import com.flow.notify.service.model.NotificationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void deliver(NotificationEvent event, String fingerprint, List<String> channels) {
        log.info("Notification delivered: eventType={}, source={}, severity={}, channels={}",
                event.eventType(), event.sourceId(), event.severity(), channels);
    }
}
