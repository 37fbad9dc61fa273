package com.flagship.custodial_exchange.lobby.event;

import com.flagship.custodial_exchange.lobby.Lobby;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the joiner leaves and gets the bet back. The lobby is
 * joinable again afterwards.
 */
@Value
public class LobbyUnjoinedEvent implements LobbyEvent {
    UUID eventId;
    long lobbyId;
    String formerJoiner;
    long refunded;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LobbyUnjoined";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LobbyUnjoinedEvent fromLobby(Lobby lobby, String formerJoiner, Instant occurredAt) {
        return new LobbyUnjoinedEvent(
            UUID.randomUUID(),
            lobby.getId(),
            formerJoiner,
            lobby.getBetAmount(),
            occurredAt
        );
    }
}
