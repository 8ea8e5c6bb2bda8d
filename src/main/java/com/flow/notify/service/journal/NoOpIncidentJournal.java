package com.flow.notify.service.journal;

import com.flow.notify.service.escalation.IncidentEvent;

/**
 * Journal used when durable history is disabled; history stays in memory only.
 */
public class NoOpIncidentJournal implements IncidentJournal {

    @Override
    public void append(String incidentId, IncidentEvent event) {
        // in-memory history only
    }
}
