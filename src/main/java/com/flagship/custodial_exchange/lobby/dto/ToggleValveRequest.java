package com.flagship.custodial_exchange.lobby.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ToggleValveRequest {

    @NotNull(message = "Desired valve state is required")
    @JsonProperty("open")
    Boolean open;
}
