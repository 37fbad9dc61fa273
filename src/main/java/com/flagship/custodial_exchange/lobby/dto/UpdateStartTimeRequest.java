package com.flagship.custodial_exchange.lobby.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdateStartTimeRequest {

    @NotNull(message = "Start time is required")
    @JsonProperty("start_time")
    Long startTime;
}
