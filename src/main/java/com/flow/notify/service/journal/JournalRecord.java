package com.flow.notify.service.journal;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.flow.notify.service.escalation.IncidentEvent;

/**
 * One line of the JSON lines journal.
 */
record JournalRecord(String incidentId, @JsonUnwrapped IncidentEvent event) {
}
