package com.flagship.custodial_exchange.market.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of order events written to the outbox.
 */
public interface OrderEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    long getOrderId();

    Instant getOccurredAt();

    String getEventType();
}
