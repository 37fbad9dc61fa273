package com.flagship.custodial_exchange.lobby.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

/**
 * Request DTO for opening a lobby. {@code start_time} is in epoch seconds.
 */
@Value
public class CreateLobbyRequest {

    @NotNull(message = "Start time is required")
    @JsonProperty("start_time")
    Long startTime;

    @NotNull(message = "Bet amount is required")
    @PositiveOrZero(message = "Bet amount must not be negative")
    @JsonProperty("bet_amount")
    Long betAmount;
}
