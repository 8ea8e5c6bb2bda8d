package com.flow.notify.service.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Identity of one ingested event, shared by every copy of it that a throttle
 * defers, so the event counts once toward its incident however many channel
 * deliveries it is split into.
 */
public final class DeliveryTicket {

    private final AtomicBoolean escalated = new AtomicBoolean();

    /**
     * Claims the right to feed the escalator for this event.
     *
     * @return true for the first caller only
     */
    public boolean claimEscalation() {
        return escalated.compareAndSet(false, true);
    }
}
