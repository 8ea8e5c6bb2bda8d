package com.flow.notify.service.escalation;

import com.flow.notify.service.engine.NotifyEngineException;

/**
 * Thrown when an incident id is unknown or already archived.
 */
public class IncidentNotFoundException extends NotifyEngineException {

    public IncidentNotFoundException(String incidentId) {
        super("Incident not found: " + incidentId, incidentId, "INCIDENT_NOT_FOUND");
    }
}
