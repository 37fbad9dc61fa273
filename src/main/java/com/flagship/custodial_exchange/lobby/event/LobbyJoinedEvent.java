package com.flagship.custodial_exchange.lobby.event;

import com.flagship.custodial_exchange.lobby.Lobby;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class LobbyJoinedEvent implements LobbyEvent {
    UUID eventId;
    long lobbyId;
    String creator;
    String joiner;
    long betAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LobbyJoined";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LobbyJoinedEvent fromLobby(Lobby lobby, Instant occurredAt) {
        return new LobbyJoinedEvent(
            UUID.randomUUID(),
            lobby.getId(),
            lobby.getCreator(),
            lobby.getJoiner(),
            lobby.getBetAmount(),
            occurredAt
        );
    }
}
