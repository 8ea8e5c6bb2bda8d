package com.flow.notify.service.escalation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default dispatcher that only logs the hand-off.
 */
@Slf4j
@Component
public class LoggingTargetDispatcher implements TargetDispatcher {

    @Override
    public void dispatch(DispatchRequest request) {
        EscalationTarget target = request.target();
        log.info("Escalation dispatch: incident={}, level={}, trigger={}, target={}:{}, severity={}",
                request.incidentId(), request.level(), request.trigger(),
                target.type(), target.identifier(), request.severity());
    }
}
