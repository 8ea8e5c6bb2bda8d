package com.flow.notify.service.journal;

import com.flow.notify.service.escalation.IncidentEvent;

/**
 * Append-only audit log of incident history.
 *
 * Appends must not block the caller on I/O.
 */
public interface IncidentJournal {

    /**
     * Appends one history record.
     *
     * @param incidentId the incident the event belongs to
     * @param event the history record
     */
    void append(String incidentId, IncidentEvent event);
}
