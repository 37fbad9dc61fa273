package com.flagship.custodial_exchange.lobby.event;

import com.flagship.custodial_exchange.lobby.Lobby;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a lobby opens and the creator's stake is escrowed.
 */
@Value
public class LobbyCreatedEvent implements LobbyEvent {
    UUID eventId;
    long lobbyId;
    String creator;
    long startTime;
    long betAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LobbyCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LobbyCreatedEvent fromLobby(Lobby lobby, Instant occurredAt) {
        return new LobbyCreatedEvent(
            UUID.randomUUID(),
            lobby.getId(),
            lobby.getCreator(),
            lobby.getStartTime(),
            lobby.getBetAmount(),
            occurredAt
        );
    }
}
