package com.flagship.custodial_exchange.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An escrow event waiting in (or already relayed from) the outbox.
 *
 * Written in the same transaction as the state change it describes, so an
 * event exists if and only if the change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Order" or "Lobby"
    String aggregateId;        // order or lobby id
    String eventType;          // e.g. "OrderBought"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
