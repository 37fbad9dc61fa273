package com.flagship.custodial_exchange.lobby.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.custodial_exchange.lobby.BreweryStatus;
import lombok.Value;

@Value
public class BreweryStatusResponse {

    @JsonProperty("lobby_id")
    long lobbyId;

    @JsonProperty("address")
    String address;

    @JsonProperty("mead")
    long mead;

    @JsonProperty("points")
    long points;

    @JsonProperty("valve_opened")
    boolean valveOpened;

    @JsonProperty("last_updated_at")
    long lastUpdatedAt;

    @JsonProperty("mead_per_second")
    long meadPerSecond;

    public static BreweryStatusResponse from(BreweryStatus status) {
        return new BreweryStatusResponse(
            status.getLobbyId(),
            status.getAddress(),
            status.getMead(),
            status.getPoints(),
            status.isValveOpened(),
            status.getLastUpdatedAt(),
            status.getMeadPerSecond()
        );
    }
}
