package com.flagship.custodial_exchange.lobby.event;

import com.flagship.custodial_exchange.lobby.Lobby;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class LobbyUpdatedEvent implements LobbyEvent {
    UUID eventId;
    long lobbyId;
    String creator;
    long previousStartTime;
    long startTime;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LobbyUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LobbyUpdatedEvent fromLobby(Lobby lobby, long previousStartTime, Instant occurredAt) {
        return new LobbyUpdatedEvent(
            UUID.randomUUID(),
            lobby.getId(),
            lobby.getCreator(),
            previousStartTime,
            lobby.getStartTime(),
            occurredAt
        );
    }
}
