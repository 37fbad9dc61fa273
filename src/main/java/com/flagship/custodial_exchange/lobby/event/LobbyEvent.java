package com.flagship.custodial_exchange.lobby.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of lobby events written to the outbox.
 */
public interface LobbyEvent {

    UUID getEventId();

    long getLobbyId();

    Instant getOccurredAt();

    String getEventType();
}
