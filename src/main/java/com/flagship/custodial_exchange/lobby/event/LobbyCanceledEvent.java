package com.flagship.custodial_exchange.lobby.event;

import com.flagship.custodial_exchange.lobby.Lobby;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the creator cancels. {@code joiner} is null when nobody had
 * joined, and then only the creator was refunded.
 */
@Value
public class LobbyCanceledEvent implements LobbyEvent {
    UUID eventId;
    long lobbyId;
    String creator;
    String joiner;
    long refundPerParticipant;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LobbyCanceled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LobbyCanceledEvent fromLobby(Lobby lobby, Instant occurredAt) {
        return new LobbyCanceledEvent(
            UUID.randomUUID(),
            lobby.getId(),
            lobby.getCreator(),
            lobby.getJoiner(),
            lobby.getBetAmount(),
            occurredAt
        );
    }
}
