package com.flagship.custodial_exchange.lobby.event;

import com.flagship.custodial_exchange.lobby.BreweryStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ValveToggledEvent implements LobbyEvent {
    UUID eventId;
    long lobbyId;
    String participant;
    boolean valveOpened;
    long mead;
    long checkpointAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ValveToggled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ValveToggledEvent fromStatus(BreweryStatus status, Instant occurredAt) {
        return new ValveToggledEvent(
            UUID.randomUUID(),
            status.getLobbyId(),
            status.getAddress(),
            status.isValveOpened(),
            status.getMead(),
            status.getLastUpdatedAt(),
            occurredAt
        );
    }
}
